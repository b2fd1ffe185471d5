package io.ircd.spring.boot;

import io.ircd.ServerContext;
import io.ircd.config.ConfigTag;
import io.ircd.config.ServerConfig;
import io.ircd.event.DispatchInterceptor;
import io.ircd.spi.MetricsExporter;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for the ircd server context.
 *
 * <p>Builds a {@link ServerConfig} from the {@code ircd.config.tags} properties and a
 * {@link ServerContext} around it, picking up any {@link MetricsExporter} and
 * {@link DispatchInterceptor} beans. Beans annotated with {@link IrcdModule} are loaded
 * by {@link IrcdModuleRegistrar}.
 *
 * @see IrcdProperties
 * @see IrcdMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(ServerContext.class)
@EnableConfigurationProperties(IrcdProperties.class)
public class IrcdAutoConfiguration {

    static final String PROPERTY_SOURCE = "ircd.config.tags";

    @Bean
    @ConditionalOnMissingBean
    public ServerConfig serverConfig(IrcdProperties props) {
        ServerConfig.Builder builder = ServerConfig.builder().serverName(props.getServerName());
        List<IrcdProperties.Tag> tags = props.getConfig().getTags();
        for (int i = 0; i < tags.size(); i++) {
            IrcdProperties.Tag tag = tags.get(i);
            if (tag.getName() == null || tag.getName().isBlank()) {
                throw new IllegalStateException(PROPERTY_SOURCE + "[" + i + "].name must be set");
            }
            builder.tag(ConfigTag.builder(tag.getName())
                    .location(PROPERTY_SOURCE, i)
                    .putAll(tag.getValues())
                    .build());
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ServerContext serverContext(IrcdProperties props,
                                       ServerConfig serverConfig,
                                       ObjectProvider<MetricsExporter> metricsProvider,
                                       ObjectProvider<DispatchInterceptor> interceptorProvider) {
        ServerContext.Builder builder = ServerContext.builder()
                .config(serverConfig)
                .serverId(props.getServerId())
                .malformedValuePolicy(props.getReplication().getMalformedPolicy())
                .completionQueueCapacity(props.getCompletionQueueCapacity());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        interceptorProvider.orderedStream().forEach(builder::interceptor);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public IrcdModuleRegistrar ircdModuleRegistrar(ListableBeanFactory beanFactory, ServerContext serverContext) {
        return new IrcdModuleRegistrar(beanFactory, serverContext);
    }
}
