package com.switchyard.core.queue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "switchyard.queue")
public class QueueProperties {

    private int defaultMaxRetries = 3;
    private int defaultConcurrency = 1;
    private Duration retryBackoff = Duration.ZERO;
    private Duration retryBackoffMax = Duration.ofSeconds(30);
    private int completedRetention = 500;
    private Map<String, ChannelSettings> channels = new LinkedHashMap<>();

    public int getDefaultMaxRetries() { return defaultMaxRetries; }
    public void setDefaultMaxRetries(int defaultMaxRetries) { this.defaultMaxRetries = defaultMaxRetries; }
    public int getDefaultConcurrency() { return defaultConcurrency; }
    public void setDefaultConcurrency(int defaultConcurrency) { this.defaultConcurrency = defaultConcurrency; }
    public Duration getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
    public Duration getRetryBackoffMax() { return retryBackoffMax; }
    public void setRetryBackoffMax(Duration retryBackoffMax) { this.retryBackoffMax = retryBackoffMax; }
    public int getCompletedRetention() { return completedRetention; }
    public void setCompletedRetention(int completedRetention) { this.completedRetention = completedRetention; }
    public Map<String, ChannelSettings> getChannels() { return channels; }
    public void setChannels(Map<String, ChannelSettings> channels) { this.channels = channels; }

    /** Configured concurrency for a channel, or the default. */
    public int concurrencyFor(String channel) {
        ChannelSettings settings = channels.get(channel);
        return settings != null && settings.getConcurrency() != null
                ? settings.getConcurrency()
                : defaultConcurrency;
    }

    public static class ChannelSettings {
        private Integer concurrency;

        public Integer getConcurrency() { return concurrency; }
        public void setConcurrency(Integer concurrency) { this.concurrency = concurrency; }
    }
}
