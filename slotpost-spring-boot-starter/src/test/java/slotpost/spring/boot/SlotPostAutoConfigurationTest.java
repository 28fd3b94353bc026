package slotpost.spring.boot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import slotpost.SlotPost;
import slotpost.execute.ExecutionOutcome;
import slotpost.jdbc.DataSourceConnectionProvider;
import slotpost.jdbc.ScheduleTables;
import slotpost.jdbc.lock.JdbcLockManager;
import slotpost.jdbc.store.AbstractJdbcScheduleStore;
import slotpost.jdbc.store.H2ScheduleStore;
import slotpost.lock.FileLockManager;
import slotpost.lock.LockManager;
import slotpost.model.ContentItem;
import slotpost.model.ScheduleStatus;
import slotpost.spi.ConnectionProvider;
import slotpost.spi.ContentDiscovery;
import slotpost.spi.Publisher;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SlotPostAutoConfigurationTest {
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          SlotPostAutoConfiguration.class))
      .withPropertyValues("spring.sql.init.schema-locations=classpath:schema/h2.sql");

  @TempDir
  Path dir;

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(PublisherConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("scheduleStore"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("slotPostLockManager"));
      assertTrue(ctx.containsBean("slotPost"));

      assertInstanceOf(H2ScheduleStore.class, ctx.getBean(AbstractJdbcScheduleStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(JdbcLockManager.class, ctx.getBean(LockManager.class));
      assertEquals(ScheduleTables.DEFAULT, ctx.getBean(ScheduleTables.class));
    });
  }

  @Test
  void backsOffWithoutPublisher() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("slotPost"));
      assertEquals(0, ctx.getBeanNamesForType(SlotPost.class).length);
    });
  }

  @Test
  void schedulesAgainstTheDatabase() {
    runner.withUserConfiguration(PublisherConfig.class, DiscoveryConfig.class).run(ctx -> {
      SlotPost slotPost = ctx.getBean(SlotPost.class);

      assertEquals(1, slotPost.discover().scheduled().size());
      ScheduleStatus status = slotPost.status();
      assertEquals(1, status.pending());
      assertEquals(Instant.parse("2026-03-02T10:15:00Z"), status.nextDue());
      assertEquals(ExecutionOutcome.NO_ACTION, slotPost.runOnce().outcome());
    });
  }

  @Test
  void fileLock() {
    Path lockFile = dir.resolve("run.lock");
    runner
        .withPropertyValues("slotpost.lock.type=FILE", "slotpost.lock.file=" + lockFile)
        .withUserConfiguration(PublisherConfig.class).run(ctx -> {
          assertInstanceOf(FileLockManager.class, ctx.getBean(LockManager.class));
        });
  }

  @Test
  void customCadenceAndTables() {
    runner
        .withPropertyValues(
            "slotpost.cadence=30m",
            "slotpost.tables.entries=blog_entry",
            "slotpost.tables.transitions=blog_transition",
            "slotpost.tables.locks=blog_lock")
        .withUserConfiguration(PublisherConfig.class).run(ctx -> {
          AbstractJdbcScheduleStore store = ctx.getBean(AbstractJdbcScheduleStore.class);
          assertEquals(Duration.ofMinutes(30), store.grid().cadence());
          assertEquals(new ScheduleTables("blog_entry", "blog_transition", "blog_lock"), store.tables());
        });
  }

  @Test
  void invalidTableNameFailsStartup() {
    runner
        .withPropertyValues("slotpost.tables.entries=bad-name")
        .withUserConfiguration(PublisherConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
        });
  }

  @Test
  void purgeCanBeDisabled() {
    runner
        .withPropertyValues("slotpost.purge.enabled=false")
        .withUserConfiguration(PublisherConfig.class).run(ctx -> {
          assertThrows(IllegalStateException.class, () -> ctx.getBean(SlotPost.class).purge());
        });
  }

  @Test
  void purgeRunsOnDemand() {
    runner.withUserConfiguration(PublisherConfig.class).run(ctx -> {
      assertEquals(0, ctx.getBean(SlotPost.class).purge().deleted());
    });
  }

  @Configuration(proxyBeanMethods = false)
  static class PublisherConfig {
    @Bean
    Publisher publisher() {
      return (payload, scheduledTime) -> "post-" + payload;
    }

    @Bean
    Clock clock() {
      return Clock.fixed(NOW, ZoneOffset.UTC);
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class DiscoveryConfig {
    @Bean
    ContentDiscovery discovery() {
      return () -> List.of(new ContentItem("note-1", "hello"));
    }
  }
}
