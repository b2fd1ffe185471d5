package io.ircd.spring.boot;

import io.ircd.ServerContext;
import io.ircd.event.CoreEvents;
import io.ircd.event.PostConnect;
import io.ircd.entity.LocalUser;
import io.ircd.entity.ReplySink;
import io.ircd.micrometer.MicrometerMetricsExporter;
import io.ircd.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class IrcdMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          IrcdMicrometerAutoConfiguration.class,
          IrcdAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsExporterWhenRegistryPresent() {
    runner.run(ctx -> {
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void serverContextReportsToRegistry() {
    runner.run(ctx -> {
      var server = ctx.getBean(ServerContext.class);
      var registry = ctx.getBean(MeterRegistry.class);
      LocalUser user = new LocalUser("001AAAAAA", server.localServer(), ReplySink.DISCARD, null);

      server.dispatcher().dispatch(CoreEvents.POST_CONNECT, new PostConnect(user));

      assertEquals(1.0, registry.find("ircd.dispatch").tag("event", "post-connect").counter().count());
    });
  }

  @Test
  void customNamePrefix() {
    runner.withPropertyValues("ircd.metrics.name-prefix=hub").run(ctx -> {
      var server = ctx.getBean(ServerContext.class);
      var registry = ctx.getBean(MeterRegistry.class);
      LocalUser user = new LocalUser("001AAAAAA", server.localServer(), ReplySink.DISCARD, null);

      server.dispatcher().dispatch(CoreEvents.POST_CONNECT, new PostConnect(user));

      assertNotNull(registry.find("hub.dispatch").counter());
      assertNull(registry.find("ircd.dispatch").counter());
    });
  }

  @Test
  void disabledByProperty() {
    runner.withPropertyValues("ircd.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
      assertTrue(ctx.getBeansOfType(MetricsExporter.class).isEmpty());
    });
  }

  @Test
  void backsOffWhenUserDefinesExporter() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void skippedWithoutMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            IrcdMicrometerAutoConfiguration.class,
            IrcdAutoConfiguration.class))
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertTrue(ctx.getBeansOfType(MetricsExporter.class).isEmpty());
          assertNotNull(ctx.getBean(ServerContext.class));
        });
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
