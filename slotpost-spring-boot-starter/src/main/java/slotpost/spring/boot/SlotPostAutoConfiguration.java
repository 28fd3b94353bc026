package slotpost.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import slotpost.SlotPost;
import slotpost.allocate.SlotGrid;
import slotpost.jdbc.DataSourceConnectionProvider;
import slotpost.jdbc.ScheduleTables;
import slotpost.jdbc.lock.JdbcLockManager;
import slotpost.jdbc.purge.JdbcEntryPurger;
import slotpost.jdbc.store.AbstractJdbcScheduleStore;
import slotpost.jdbc.store.JdbcScheduleStores;
import slotpost.lock.FileLockManager;
import slotpost.lock.LockManager;
import slotpost.lock.LockReclaimPolicy;
import slotpost.spi.ConnectionProvider;
import slotpost.spi.ContentDiscovery;
import slotpost.spi.MetricsExporter;
import slotpost.spi.Publisher;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Auto-configuration for the scheduler.
 *
 * <p>Wires a {@link SlotPost} from a {@link DataSource}, a user-supplied {@link Publisher}
 * and {@link SlotPostProperties}. A {@link ContentDiscovery}, {@link MetricsExporter} or
 * {@link Clock} bean is picked up when present.
 *
 * @see SlotPostProperties
 * @see SlotPostMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(SlotPost.class)
@ConditionalOnBean({DataSource.class, Publisher.class})
@EnableConfigurationProperties(SlotPostProperties.class)
public class SlotPostAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ScheduleTables scheduleTables(SlotPostProperties props) {
    SlotPostProperties.Tables t = props.getTables();
    return new ScheduleTables(t.getEntries(), t.getTransitions(), t.getLocks());
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcScheduleStore scheduleStore(DataSource dataSource, ScheduleTables tables,
      SlotPostProperties props) {
    return JdbcScheduleStores.detect(dataSource)
        .withSettings(tables, new SlotGrid(props.getCadence()), props.getTables().getQueryTimeoutSeconds());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public LockManager slotPostLockManager(SlotPostProperties props, ConnectionProvider connectionProvider,
      ScheduleTables tables, ObjectProvider<MetricsExporter> metricsProvider) {
    SlotPostProperties.Lock lock = props.getLock();
    LockReclaimPolicy policy = new LockReclaimPolicy(null, lock.getStaleAfter(), null,
        metricsProvider.getIfAvailable(), null);
    return switch (lock.getType()) {
      case FILE -> new FileLockManager(Path.of(lock.getFile()), policy);
      case JDBC -> new JdbcLockManager(connectionProvider, tables, lock.getName(), policy,
          props.getTables().getQueryTimeoutSeconds());
    };
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public SlotPost slotPost(SlotPostProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcScheduleStore scheduleStore,
      ScheduleTables tables,
      LockManager lockManager,
      Publisher publisher,
      ObjectProvider<ContentDiscovery> discoveryProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Clock> clockProvider) {

    SlotPost.Builder builder = SlotPost.builder()
        .connectionProvider(connectionProvider)
        .store(scheduleStore)
        .lockManager(lockManager)
        .publisher(publisher)
        .discovery(discoveryProvider.getIfAvailable())
        .metrics(metricsProvider.getIfAvailable())
        .clock(clockProvider.getIfAvailable())
        .cadence(props.getCadence())
        .frontLoadLead(props.getFrontLoadLead())
        .maxProbeSlots(props.getMaxProbeSlots())
        .maxAttempts(props.getExecutor().getMaxAttempts())
        .publishTimeout(props.getExecutor().getPublishTimeout())
        .stuckThreshold(props.getExecutor().getStuckThreshold())
        .catchUpLimit(props.getExecutor().getCatchUpLimit())
        .recoveryBatchSize(props.getRecovery().getBatchSize())
        .maxRecoveryRounds(props.getRecovery().getMaxRounds())
        .healthWindow(props.getHealth().getWindow())
        .healthThreshold(props.getHealth().getThreshold())
        .healthMinSamples(props.getHealth().getMinSamples());

    SlotPostProperties.Purge purge = props.getPurge();
    if (purge.isEnabled()) {
      builder.purger(new JdbcEntryPurger(tables, props.getTables().getQueryTimeoutSeconds()))
          .purgeRetention(purge.getRetention())
          .purgeBatchSize(purge.getBatchSize())
          .purgeIntervalSeconds(purge.getIntervalSeconds());
    }
    SlotPost slotPost = builder.build();
    if (purge.isEnabled() && purge.isScheduled()) {
      slotPost.startPurging();
    }
    return slotPost;
  }
}
