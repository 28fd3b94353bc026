package slotpost.lock;

import com.github.f4b6a3.ulid.UlidCreator;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Identity of a lock holder.
 *
 * @param token      unique per acquisition; release and reclaim compare on it
 * @param pid        operating-system process id of the holder
 * @param host       host name of the holder
 * @param acquiredAt when the lease was taken
 */
public record LockOwner(String token, long pid, String host, Instant acquiredAt) {
    private static final Logger logger = Logger.getLogger(LockOwner.class.getName());
    private static volatile String localHost;

    public LockOwner {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(acquiredAt, "acquiredAt");
    }

    /**
     * A fresh identity for the current process.
     */
    public static LockOwner current(Instant acquiredAt) {
        return new LockOwner(UlidCreator.getMonotonicUlid().toString(),
            ProcessHandle.current().pid(), localHost(), acquiredAt);
    }

    public boolean isLocal() {
        return host.equals(localHost());
    }

    static String localHost() {
        String host = localHost;
        if (host == null) {
            try {
                host = InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                logger.log(Level.FINE, "Cannot resolve local host name, using 'localhost'", e);
                host = "localhost";
            }
            localHost = host;
        }
        return host;
    }

    @Override
    public String toString() {
        return "pid " + pid + "@" + host + " since " + acquiredAt;
    }
}
