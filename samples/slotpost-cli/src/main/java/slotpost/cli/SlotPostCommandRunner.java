package slotpost.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import slotpost.ScheduleStoreException;
import slotpost.SlotPost;
import slotpost.allocate.AllocationResult;
import slotpost.execute.ExecutionOutcome;
import slotpost.execute.ExecutionReport;
import slotpost.execute.PublishAttempt;
import slotpost.health.HealthReport;
import slotpost.lock.LockHeldException;
import slotpost.model.EntryState;
import slotpost.model.ScheduleEntry;
import slotpost.model.ScheduleStatus;
import slotpost.purge.PurgeReport;
import slotpost.spring.boot.SlotPostProperties;

import java.util.List;
import java.util.Optional;

/**
 * Executes one CLI command against the scheduler and records the process exit code.
 *
 * <p>Exit codes: 0 success (including a run skipped because another run holds the lock),
 * 1 store failure or degraded health, 2 usage error.
 */
@Component
public class SlotPostCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  static final int OK = 0;
  static final int FAILURE = 1;
  static final int USAGE = 2;

  private static final Logger log = LoggerFactory.getLogger(SlotPostCommandRunner.class);

  private final SlotPost slotPost;
  private final SlotPostProperties props;
  private volatile int exitCode = OK;

  public SlotPostCommandRunner(SlotPost slotPost, SlotPostProperties props) {
    this.slotPost = slotPost;
    this.props = props;
  }

  @Override
  public void run(ApplicationArguments args) {
    CliCommand command;
    try {
      command = CliCommand.parse(args.getNonOptionArgs(), props.getExecutor().getCatchUpLimit());
    } catch (IllegalArgumentException e) {
      log.error("{}\n{}", e.getMessage(), CliCommand.usage());
      exitCode = USAGE;
      return;
    }
    try {
      exitCode = execute(command);
    } catch (LockHeldException e) {
      log.warn("Another run holds the lock, nothing done: {}", e.getMessage());
      exitCode = OK;
    } catch (ScheduleStoreException e) {
      log.error("Schedule store failure", e);
      exitCode = FAILURE;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  int execute(CliCommand command) throws LockHeldException {
    return switch (command.mode()) {
      case RUN -> report(slotPost.runOnce());
      case CATCH_UP -> report(slotPost.catchUp(command.count()));
      case RECOVER -> report(slotPost.recover());
      case DISCOVER -> discover();
      case STATUS -> status();
      case FAILED -> failed(command.count());
      case REPLAY -> replay(command.entryId());
      case SKIP -> skip(command.entryId());
      case HEALTH -> health(slotPost.health());
      case PURGE -> purge(slotPost.purge());
    };
  }

  private int report(ExecutionReport report) {
    if (report.recovered() > 0 || report.reconciled() > 0) {
      log.info("Recovered {} failed entries, reconciled {} interrupted entries",
          report.recovered(), report.reconciled());
    }
    for (PublishAttempt attempt : report.attempts()) {
      ScheduleEntry entry = attempt.entry();
      if (attempt.outcome() == ExecutionOutcome.POSTED) {
        log.info("Posted {} ({}) slot={} post={} in {} ms", entry.id(), entry.contentKey(),
            entry.scheduledTime(), entry.externalPostId(), attempt.latencyMs());
      } else {
        log.warn("{} {} ({}) slot={}: {} {}", attempt.outcome(), entry.id(), entry.contentKey(),
            entry.scheduledTime(), attempt.errorKind(), attempt.error());
      }
    }
    log.info("Run finished: {}", report.outcome());
    report.healthReport().filter(HealthReport::degraded).ifPresent(this::health);
    return report.outcome() == ExecutionOutcome.STORE_ERROR ? FAILURE : OK;
  }

  private int discover() throws LockHeldException {
    AllocationResult result = slotPost.discover();
    for (ScheduleEntry entry : result.scheduled()) {
      log.info("Scheduled {} ({}) at {} [{}]", entry.id(), entry.contentKey(), entry.scheduledTime(),
          entry.source());
    }
    log.info("Discovered {} new item(s), {} already scheduled", result.scheduled().size(),
        result.rejectedDuplicates().size());
    return OK;
  }

  private int status() {
    ScheduleStatus status = slotPost.status();
    log.info("pending={} in_progress={} posted={} failed={} skipped={} overdue={}",
        status.pending(), status.count(EntryState.IN_PROGRESS), status.count(EntryState.POSTED),
        status.count(EntryState.FAILED), status.count(EntryState.SKIPPED), status.overdue());
    log.info("today: posted={} failed={}; next due: {}", status.postedToday(), status.failedToday(),
        status.nextDue() == null ? "-" : status.nextDue());
    for (ScheduleEntry entry : status.upcoming()) {
      log.info("  {} {} ({})", entry.scheduledTime(), entry.id(), entry.contentKey());
    }
    return OK;
  }

  private int failed(int limit) {
    List<ScheduleEntry> failed = slotPost.failedEntries().query(limit);
    log.info("{} failed entr(ies), showing {}", slotPost.failedEntries().count(), failed.size());
    for (ScheduleEntry entry : failed) {
      log.info("  {} ({}) slot={} attempts={} rounds={} {}: {}", entry.id(), entry.contentKey(),
          entry.scheduledTime(), entry.attemptCount(), entry.recoveryRounds(), entry.lastErrorKind(),
          entry.lastError());
    }
    return OK;
  }

  private int replay(String entryId) throws LockHeldException {
    Optional<ScheduleEntry> replayed = slotPost.failedEntries().replay(entryId);
    if (replayed.isEmpty()) {
      log.error("No FAILED entry with id {}", entryId);
      return FAILURE;
    }
    log.info("Replayed {} into slot {}", entryId, replayed.get().scheduledTime());
    return OK;
  }

  private int skip(String entryId) throws LockHeldException {
    if (!slotPost.failedEntries().skip(entryId)) {
      log.error("No PENDING entry with id {}", entryId);
      return FAILURE;
    }
    log.info("Skipped {}", entryId);
    return OK;
  }

  private int purge(PurgeReport report) {
    if (report.lockHeld()) {
      log.warn("Another run holds the lock, purge skipped");
    } else {
      log.info("Purged {} finished entries older than {} in {} batch(es)", report.deleted(),
          report.cutoff(), report.batches());
    }
    return OK;
  }

  private int health(HealthReport health) {
    String line = String.format("success rate %.1f%% (%d posted, %d failed in %s), threshold %.0f%%",
        health.successRate() * 100, health.posted(), health.failed(), health.window(),
        health.threshold() * 100);
    if (health.degraded()) {
      log.warn("DEGRADED: {}", line);
      return FAILURE;
    }
    log.info("Healthy: {}", line);
    return OK;
  }
}
