package io.ircd.spring.boot;

import io.ircd.ServerContext;
import io.ircd.config.ServerConfig;
import io.ircd.event.CoreEvents;
import io.ircd.event.DispatchInterceptor;
import io.ircd.event.PostConnect;
import io.ircd.entity.LocalUser;
import io.ircd.entity.ReplySink;
import io.ircd.ext.MalformedValuePolicy;
import io.ircd.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IrcdAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(IrcdAutoConfiguration.class));

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("serverConfig"));
      assertTrue(ctx.containsBean("serverContext"));
      assertTrue(ctx.containsBean("ircdModuleRegistrar"));

      var server = ctx.getBean(ServerContext.class);
      assertEquals("irc.local", server.localServer().name());
      assertEquals("001", server.localServer().sid());
      assertEquals(MalformedValuePolicy.TOLERATE, server.extensions().malformedValuePolicy());
      assertTrue(server.modules().loadedModules().isEmpty());
    });
  }

  @Test
  void mapsConfigTagsOntoServerConfig() {
    runner.withPropertyValues(
        "ircd.server-name=hub.example.net",
        "ircd.config.tags[0].name=connect",
        "ircd.config.tags[0].values.name=secure",
        "ircd.config.tags[0].values.requiressl=yes",
        "ircd.config.tags[1].name=connect",
        "ircd.config.tags[1].values.name=main",
        "ircd.config.tags[2].name=oper",
        "ircd.config.tags[2].values.name=alice",
        "ircd.config.tags[2].values.sslonly=true")
        .run(ctx -> {
          var config = ctx.getBean(ServerConfig.class);
          assertEquals("hub.example.net", config.serverName());
          assertEquals(2, config.connectClasses().size());
          assertTrue(config.connectClass("secure").orElseThrow().config().getBool("requiressl"));
          assertTrue(config.operBlock("alice").orElseThrow().block().getBool("sslonly"));
          assertEquals("ircd.config.tags:2", config.operBlock("alice").orElseThrow().block().location());
          assertSame(config, ctx.getBean(ServerContext.class).config());
        });
  }

  @Test
  void tagWithoutNameFailsStartup() {
    runner.withPropertyValues("ircd.config.tags[0].values.name=secure")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void rejectPolicyFromProperties() {
    runner.withPropertyValues("ircd.replication.malformed-policy=REJECT")
        .run(ctx -> assertEquals(MalformedValuePolicy.REJECT,
            ctx.getBean(ServerContext.class).extensions().malformedValuePolicy()));
  }

  @Test
  void picksUpInterceptorsAndMetrics() {
    runner.withUserConfiguration(HookConfig.class).run(ctx -> {
      var server = ctx.getBean(ServerContext.class);
      var seen = ctx.getBean(HookConfig.class).seen;
      LocalUser user = new LocalUser("001AAAAAA", server.localServer(), ReplySink.DISCARD, null);

      server.dispatcher().dispatch(CoreEvents.POST_CONNECT, new PostConnect(user));

      assertEquals(List.of("before:post-connect", "dispatched:post-connect"), seen);
    });
  }

  @Test
  void userDefinedServerContextWins() {
    runner.withUserConfiguration(CustomContextConfig.class).run(ctx -> {
      assertEquals("custom.local", ctx.getBean(ServerContext.class).localServer().name());
    });
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  @Configuration
  static class HookConfig {
    final List<String> seen = new ArrayList<>();

    @Bean
    DispatchInterceptor recordingInterceptor() {
      return DispatchInterceptor.before((kind, payload) -> seen.add("before:" + kind.name()));
    }

    @Bean
    MetricsExporter recordingMetrics() {
      return new MetricsExporter() {
        @Override
        public void incrementDispatched(String eventKind) {
          seen.add("dispatched:" + eventKind);
        }

        @Override
        public void incrementDecided(String eventKind, String outcome) {
        }

        @Override
        public void incrementListenerFailure(String eventKind) {
        }

        @Override
        public void incrementValueReleased(String slotName) {
        }

        @Override
        public void incrementDecodeFailure(String slotName) {
        }
      };
    }
  }

  @Configuration
  static class CustomContextConfig {
    @Bean
    ServerContext serverContext() {
      return ServerContext.builder()
          .config(ServerConfig.builder().serverName("custom.local").build())
          .build();
    }
  }
}
