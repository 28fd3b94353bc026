package slotpost.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the scheduler.
 *
 * @see SlotPostAutoConfiguration
 */
@ConfigurationProperties(prefix = "slotpost")
public class SlotPostProperties {

  /**
   * Slot spacing. Must divide a day evenly for the grid to repeat daily.
   */
  private Duration cadence = Duration.ofMinutes(15);

  /**
   * Minimum distance between now and the first front-loaded slot.
   */
  private Duration frontLoadLead = Duration.ofMinutes(2);

  /**
   * Upper bound on boundaries probed for a free slot; 0 means four days of slots.
   */
  private int maxProbeSlots;

  private final Executor executor = new Executor();
  private final Recovery recovery = new Recovery();
  private final Health health = new Health();
  private final Lock lock = new Lock();
  private final Purge purge = new Purge();
  private final Tables tables = new Tables();
  private final Metrics metrics = new Metrics();

  public Duration getCadence() {
    return cadence;
  }

  public void setCadence(Duration cadence) {
    this.cadence = cadence;
  }

  public Duration getFrontLoadLead() {
    return frontLoadLead;
  }

  public void setFrontLoadLead(Duration frontLoadLead) {
    this.frontLoadLead = frontLoadLead;
  }

  public int getMaxProbeSlots() {
    return maxProbeSlots;
  }

  public void setMaxProbeSlots(int maxProbeSlots) {
    this.maxProbeSlots = maxProbeSlots;
  }

  public Executor getExecutor() {
    return executor;
  }

  public Recovery getRecovery() {
    return recovery;
  }

  public Health getHealth() {
    return health;
  }

  public Lock getLock() {
    return lock;
  }

  public Purge getPurge() {
    return purge;
  }

  public Tables getTables() {
    return tables;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public enum LockType {
    /** Lock file on the local file system; single host only. */
    FILE,
    /** Row in the lock table; shared by every process using the database. */
    JDBC
  }

  public static class Executor {
    private int maxAttempts = 3;
    private Duration publishTimeout = Duration.ofMinutes(3);
    /**
     * Age after which an IN_PROGRESS entry counts as abandoned; defaults to twice the publish timeout.
     */
    private Duration stuckThreshold;
    private int catchUpLimit = 3;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getPublishTimeout() {
      return publishTimeout;
    }

    public void setPublishTimeout(Duration publishTimeout) {
      this.publishTimeout = publishTimeout;
    }

    public Duration getStuckThreshold() {
      return stuckThreshold;
    }

    public void setStuckThreshold(Duration stuckThreshold) {
      this.stuckThreshold = stuckThreshold;
    }

    public int getCatchUpLimit() {
      return catchUpLimit;
    }

    public void setCatchUpLimit(int catchUpLimit) {
      this.catchUpLimit = catchUpLimit;
    }
  }

  public static class Recovery {
    private int batchSize = 3;
    private int maxRounds = 3;

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getMaxRounds() {
      return maxRounds;
    }

    public void setMaxRounds(int maxRounds) {
      this.maxRounds = maxRounds;
    }
  }

  public static class Health {
    private Duration window = Duration.ofHours(24);
    private double threshold = 0.90;
    private int minSamples = 10;

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }

    public double getThreshold() {
      return threshold;
    }

    public void setThreshold(double threshold) {
      this.threshold = threshold;
    }

    public int getMinSamples() {
      return minSamples;
    }

    public void setMinSamples(int minSamples) {
      this.minSamples = minSamples;
    }
  }

  public static class Lock {
    private LockType type = LockType.JDBC;
    /**
     * Lock file used when the type is FILE.
     */
    private String file = "slotpost.lock";
    /**
     * Lock row name used when the type is JDBC.
     */
    private String name = "scheduler";
    /**
     * Maximum lease age before a live-looking holder is reclaimed; unset means no bound.
     */
    private Duration staleAfter;

    public LockType getType() {
      return type;
    }

    public void setType(LockType type) {
      this.type = type;
    }

    public String getFile() {
      return file;
    }

    public void setFile(String file) {
      this.file = file;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public Duration getStaleAfter() {
      return staleAfter;
    }

    public void setStaleAfter(Duration staleAfter) {
      this.staleAfter = staleAfter;
    }
  }

  public static class Purge {
    private boolean enabled = true;
    /**
     * Start the background purge loop with the context.
     */
    private boolean scheduled;
    private Duration retention = Duration.ofDays(7);
    private int batchSize = 500;
    private long intervalSeconds = 3600;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public boolean isScheduled() {
      return scheduled;
    }

    public void setScheduled(boolean scheduled) {
      this.scheduled = scheduled;
    }

    public Duration getRetention() {
      return retention;
    }

    public void setRetention(Duration retention) {
      this.retention = retention;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public long getIntervalSeconds() {
      return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
    }
  }

  public static class Tables {
    private String entries = "slotpost_entry";
    private String transitions = "slotpost_transition";
    private String locks = "slotpost_lock";
    private int queryTimeoutSeconds;

    public String getEntries() {
      return entries;
    }

    public void setEntries(String entries) {
      this.entries = entries;
    }

    public String getTransitions() {
      return transitions;
    }

    public void setTransitions(String transitions) {
      this.transitions = transitions;
    }

    public String getLocks() {
      return locks;
    }

    public void setLocks(String locks) {
      this.locks = locks;
    }

    public int getQueryTimeoutSeconds() {
      return queryTimeoutSeconds;
    }

    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
      this.queryTimeoutSeconds = queryTimeoutSeconds;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "slotpost";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
