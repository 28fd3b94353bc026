package slotpost.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import slotpost.micrometer.MicrometerMetricsExporter;
import slotpost.spi.MetricsExporter;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlotPostMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(SlotPostMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsMicrometerExporterByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withPropertyValues("slotpost.metrics.name-prefix=blog.slotpost").run(ctx -> {
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("blog.slotpost.publish.posted").counter());
    });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("slotpost.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
    });
  }

  @Test
  void backsOffWhenExporterDefined() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
      assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void backsOffWithoutRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(SlotPostMicrometerAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Configuration(proxyBeanMethods = false)
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
