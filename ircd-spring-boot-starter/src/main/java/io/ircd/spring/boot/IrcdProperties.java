package io.ircd.spring.boot;

import io.ircd.ext.MalformedValuePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the ircd server context.
 *
 * @see IrcdAutoConfiguration
 */
@ConfigurationProperties(prefix = "ircd")
public class IrcdProperties {

    /**
     * Name of the local server.
     */
    private String serverName = "irc.local";

    /**
     * Three character server id of the local server.
     */
    private String serverId = "001";

    /**
     * Capacity of the completion queue drained by the event loop.
     */
    private int completionQueueCapacity = 1024;

    private final Replication replication = new Replication();
    private final Metrics metrics = new Metrics();
    private final Config config = new Config();

    public String getServerName() {
        return serverName;
    }

    public void setServerName(String serverName) {
        this.serverName = serverName;
    }

    public String getServerId() {
        return serverId;
    }

    public void setServerId(String serverId) {
        this.serverId = serverId;
    }

    public int getCompletionQueueCapacity() {
        return completionQueueCapacity;
    }

    public void setCompletionQueueCapacity(int completionQueueCapacity) {
        this.completionQueueCapacity = completionQueueCapacity;
    }

    public Replication getReplication() {
        return replication;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Config getConfig() {
        return config;
    }

    public static class Replication {
        /**
         * What to do with extension values from linked servers that fail to decode.
         */
        private MalformedValuePolicy malformedPolicy = MalformedValuePolicy.TOLERATE;

        public MalformedValuePolicy getMalformedPolicy() {
            return malformedPolicy;
        }

        public void setMalformedPolicy(MalformedValuePolicy malformedPolicy) {
            this.malformedPolicy = malformedPolicy;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "ircd";

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

    public static class Config {
        /**
         * Configuration tags, in declaration order. Tags may repeat, e.g. one per connect class.
         */
        private List<Tag> tags = new ArrayList<>();

        public List<Tag> getTags() {
            return tags;
        }

        public void setTags(List<Tag> tags) {
            this.tags = tags;
        }
    }

    public static class Tag {
        private String name;
        private Map<String, String> values = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Map<String, String> getValues() {
            return values;
        }

        public void setValues(Map<String, String> values) {
            this.values = values;
        }
    }
}
