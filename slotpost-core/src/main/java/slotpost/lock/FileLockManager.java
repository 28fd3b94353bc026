package slotpost.lock;

import com.github.f4b6a3.ulid.UlidCreator;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lock held as a PID file on a local filesystem.
 *
 * <p>Acquisition creates the file atomically ({@code CREATE_NEW}) and writes the
 * holder's token, pid, host and acquisition time. A stale file is reclaimed by
 * atomically renaming it to a tombstone, re-reading the tombstone to confirm the same
 * holder was moved, and then creating a fresh lock file. A file whose content cannot
 * be read is treated as held while it is younger than a short creation grace period.
 *
 * <p>Every process sharing the lock must use the same path on the same host.
 *
 * <p>Exclusion is best-effort under one interleaving: a reclaimer that moves aside a
 * holder it read as stale, while that holder was just replaced by a live one, restores
 * the file; if a third process creates the lock in between, both the restored holder and
 * the new one believe they hold it. The conflict is logged at SEVERE and the live holder
 * finds the lock taken over on release. Use {@code JdbcLockManager} where that matters.
 */
public final class FileLockManager implements LockManager {
    private static final Logger logger = Logger.getLogger(FileLockManager.class.getName());

    private static final int MAX_ATTEMPTS = 3;
    private static final Duration CREATION_GRACE = Duration.ofSeconds(10);

    private final Path lockFile;
    private final LockReclaimPolicy policy;

    public FileLockManager(Path lockFile) {
        this(lockFile, LockReclaimPolicy.defaults());
    }

    public FileLockManager(Path lockFile, LockReclaimPolicy policy) {
        this.lockFile = Objects.requireNonNull(lockFile, "lockFile").toAbsolutePath();
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public Path lockFile() {
        return lockFile;
    }

    @Override
    public LockLease acquire() throws LockHeldException {
        LockOwner holder = null;
        LockOwner reclaimedFrom = null;
        String reclaimReason = null;
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            LockOwner me = LockOwner.current(policy.clock().instant());
            if (tryCreate(me)) {
                if (reclaimReason != null) {
                    policy.reclaimed(reclaimedFrom, me, reclaimReason);
                }
                logger.log(Level.FINE, "Acquired scheduler lock {0}", lockFile);
                return new FileLease(me);
            }

            Optional<LockOwner> current = readOwner(lockFile);
            if (current.isEmpty()) {
                if (!Files.exists(lockFile)) {
                    continue;
                }
                if (isBeingWritten()) {
                    throw new LockHeldException(null);
                }
                if (moveAside(null)) {
                    reclaimedFrom = null;
                    reclaimReason = "unreadable lock file";
                }
                continue;
            }

            holder = current.get();
            Optional<String> reason = policy.staleReason(holder);
            if (reason.isEmpty()) {
                throw new LockHeldException(holder);
            }
            if (moveAside(holder)) {
                reclaimedFrom = holder;
                reclaimReason = reason.get();
            }
        }
        throw new LockHeldException(holder);
    }

    @Override
    public Optional<LockOwner> currentHolder() {
        return readOwner(lockFile);
    }

    private boolean tryCreate(LockOwner owner) {
        Properties props = new Properties();
        props.setProperty("token", owner.token());
        props.setProperty("pid", Long.toString(owner.pid()));
        props.setProperty("host", owner.host());
        props.setProperty("acquiredAt", owner.acquiredAt().toString());
        try {
            Path parent = lockFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(lockFile,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                props.store(out, "slotpost scheduler lock");
            }
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create lock file " + lockFile, e);
        }
    }

    /**
     * Renames the lock file to a private tombstone. Returns {@code false} if the file
     * vanished or turned out to belong to someone other than {@code expected}, in which
     * case it is restored.
     */
    private boolean moveAside(LockOwner expected) {
        Path tombstone = lockFile.resolveSibling(
            lockFile.getFileName() + "." + UlidCreator.getMonotonicUlid() + ".stale");
        try {
            if (expected != null) {
                Optional<LockOwner> current = readOwner(lockFile);
                if (current.isEmpty() || !current.get().token().equals(expected.token())) {
                    return false;
                }
            }
            try {
                Files.move(lockFile, tombstone, StandardCopyOption.ATOMIC_MOVE);
            } catch (NoSuchFileException e) {
                return false;
            }
            Optional<LockOwner> moved = readOwner(tombstone);
            if (expected != null && (moved.isEmpty() || !moved.get().token().equals(expected.token()))) {
                restore(tombstone);
                return false;
            }
            Files.deleteIfExists(tombstone);
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to reclaim lock file " + lockFile, e);
        }
    }

    /**
     * Moves a wrongly reclaimed holder back into place.
     *
     * @return {@code false} if another process created the lock file in the meantime
     */
    boolean restore(Path tombstone) throws IOException {
        try {
            Files.move(tombstone, lockFile, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (FileAlreadyExistsException e) {
            Optional<LockOwner> displaced = readOwner(tombstone);
            Optional<LockOwner> creator = readOwner(lockFile);
            logger.log(Level.SEVERE, "Scheduler lock {0} has two holders: {1} was moved aside and {2}"
                    + " created the lock before it could be restored",
                new Object[]{lockFile, displaced.map(LockOwner::toString).orElse("unknown"),
                    creator.map(LockOwner::toString).orElse("unknown")});
            Files.deleteIfExists(tombstone);
            return false;
        }
    }

    private boolean isBeingWritten() {
        try {
            // mtime is stamped by the OS clock, so it is compared against the OS clock
            Instant modified = Files.getLastModifiedTime(lockFile).toInstant();
            return modified.plus(CREATION_GRACE).isAfter(Instant.now());
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to inspect lock file " + lockFile, e);
        }
    }

    private static Optional<LockOwner> readOwner(Path path) {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read lock file " + path, e);
        }
        String token = props.getProperty("token");
        String pid = props.getProperty("pid");
        String host = props.getProperty("host");
        String acquiredAt = props.getProperty("acquiredAt");
        if (token == null || pid == null || host == null || acquiredAt == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new LockOwner(token, Long.parseLong(pid), host, Instant.parse(acquiredAt)));
        } catch (NumberFormatException | DateTimeParseException e) {
            logger.log(Level.FINE, "Malformed lock file " + path, e);
            return Optional.empty();
        }
    }

    private final class FileLease implements LockLease {
        private final LockOwner owner;
        private final AtomicBoolean released = new AtomicBoolean();

        private FileLease(LockOwner owner) {
            this.owner = owner;
        }

        @Override
        public LockOwner owner() {
            return owner;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                Optional<LockOwner> current = readOwner(lockFile);
                if (current.isPresent() && current.get().token().equals(owner.token())) {
                    Files.deleteIfExists(lockFile);
                    logger.log(Level.FINE, "Released scheduler lock {0}", lockFile);
                } else {
                    logger.log(Level.WARNING, "Scheduler lock {0} was taken over by {1} before release",
                        new Object[]{lockFile, current.map(LockOwner::toString).orElse("nobody")});
                }
            } catch (IOException | UncheckedIOException e) {
                logger.log(Level.SEVERE, "Failed to release scheduler lock " + lockFile, e);
            }
        }
    }
}
