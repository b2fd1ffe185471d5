package io.ircd.spring.boot;

import io.ircd.ext.MalformedValuePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class IrcdPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(IrcdProperties.class);
      assertEquals("irc.local", props.getServerName());
      assertEquals("001", props.getServerId());
      assertEquals(1024, props.getCompletionQueueCapacity());
      assertEquals(MalformedValuePolicy.TOLERATE, props.getReplication().getMalformedPolicy());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("ircd", props.getMetrics().getNamePrefix());
      assertTrue(props.getConfig().getTags().isEmpty());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "ircd.server-name=hub.example.net",
        "ircd.server-id=42X",
        "ircd.completion-queue-capacity=16",
        "ircd.replication.malformed-policy=REJECT",
        "ircd.metrics.enabled=false",
        "ircd.metrics.name-prefix=hub",
        "ircd.config.tags[0].name=sslinfo",
        "ircd.config.tags[0].values.operonly=yes",
        "ircd.config.tags[1].name=connect",
        "ircd.config.tags[1].values.name=secure")
        .run(ctx -> {
          var props = ctx.getBean(IrcdProperties.class);
          assertEquals("hub.example.net", props.getServerName());
          assertEquals("42X", props.getServerId());
          assertEquals(16, props.getCompletionQueueCapacity());
          assertEquals(MalformedValuePolicy.REJECT, props.getReplication().getMalformedPolicy());
          assertFalse(props.getMetrics().isEnabled());
          assertEquals("hub", props.getMetrics().getNamePrefix());
          assertEquals(2, props.getConfig().getTags().size());
          assertEquals("sslinfo", props.getConfig().getTags().get(0).getName());
          assertEquals("yes", props.getConfig().getTags().get(0).getValues().get("operonly"));
          assertEquals("secure", props.getConfig().getTags().get(1).getValues().get("name"));
        });
  }

  @Configuration
  @EnableConfigurationProperties(IrcdProperties.class)
  static class PropsConfig {
  }
}
