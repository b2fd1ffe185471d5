package io.ircd.spring.boot;

import io.ircd.micrometer.MicrometerMetricsExporter;
import io.ircd.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code ircd.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link IrcdAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the server context.
 */
@AutoConfiguration(before = IrcdAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "ircd.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(IrcdProperties.class)
public class IrcdMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry, IrcdProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
