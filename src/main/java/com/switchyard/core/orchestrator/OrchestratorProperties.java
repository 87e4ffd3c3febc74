package com.switchyard.core.orchestrator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "switchyard.orchestrator")
public class OrchestratorProperties {

    /** Results kept in memory for introspection. */
    private int historySize = 100;
    /** Entries returned by a history query that names no limit. */
    private int defaultHistoryLimit = 10;
    /** How long a routed request waits for a channel-bound handler. */
    private Duration queueTimeout = Duration.ofMinutes(5);
    /** Retries for handler invocations submitted through a channel. */
    private int queueMaxRetries = 0;
    /** Keyword overrides per category (replaces that category's default list). */
    private Map<String, List<String>> keywords = new LinkedHashMap<>();
    /** Category to channel bindings; bound categories run through the dispatch queue. */
    private Map<String, String> channels = new LinkedHashMap<>();

    public int getHistorySize() { return historySize; }
    public void setHistorySize(int historySize) { this.historySize = historySize; }
    public int getDefaultHistoryLimit() { return defaultHistoryLimit; }
    public void setDefaultHistoryLimit(int defaultHistoryLimit) { this.defaultHistoryLimit = defaultHistoryLimit; }
    public Duration getQueueTimeout() { return queueTimeout; }
    public void setQueueTimeout(Duration queueTimeout) { this.queueTimeout = queueTimeout; }
    public int getQueueMaxRetries() { return queueMaxRetries; }
    public void setQueueMaxRetries(int queueMaxRetries) { this.queueMaxRetries = queueMaxRetries; }
    public Map<String, List<String>> getKeywords() { return keywords; }
    public void setKeywords(Map<String, List<String>> keywords) { this.keywords = keywords; }
    public Map<String, String> getChannels() { return channels; }
    public void setChannels(Map<String, String> channels) { this.channels = channels; }
}
