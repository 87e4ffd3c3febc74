package com.switchyard.core.circuit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "switchyard.circuit")
public class CircuitBreakerProperties {

    private Settings defaults = new Settings();
    private Map<String, Settings> circuits = new LinkedHashMap<>();

    public Settings getDefaults() { return defaults; }
    public void setDefaults(Settings defaults) { this.defaults = defaults; }
    public Map<String, Settings> getCircuits() { return circuits; }
    public void setCircuits(Map<String, Settings> circuits) { this.circuits = circuits; }

    /** Config used for circuits registered implicitly on first use. */
    public CircuitConfig defaultConfig() {
        return defaults.toConfig(null);
    }

    /** Config for a named circuit: its overrides on top of the defaults. */
    public CircuitConfig configFor(String name) {
        Settings settings = circuits.get(name);
        return settings == null ? defaultConfig() : settings.toConfig(defaults);
    }

    /**
     * Thresholds for one circuit. Unset (null) fields inherit from {@code defaults}.
     */
    public static class Settings {
        private Integer failureThreshold;
        private Integer successThreshold;
        private Duration coolDown;
        private Integer callsPerMinute;

        public Integer getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(Integer failureThreshold) { this.failureThreshold = failureThreshold; }
        public Integer getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(Integer successThreshold) { this.successThreshold = successThreshold; }
        public Duration getCoolDown() { return coolDown; }
        public void setCoolDown(Duration coolDown) { this.coolDown = coolDown; }
        public Integer getCallsPerMinute() { return callsPerMinute; }
        public void setCallsPerMinute(Integer callsPerMinute) { this.callsPerMinute = callsPerMinute; }

        CircuitConfig toConfig(Settings parent) {
            return new CircuitConfig(
                    pick(failureThreshold, parent == null ? null : parent.failureThreshold,
                            CircuitConfig.DEFAULT_FAILURE_THRESHOLD),
                    pick(successThreshold, parent == null ? null : parent.successThreshold,
                            CircuitConfig.DEFAULT_SUCCESS_THRESHOLD),
                    pick(coolDown, parent == null ? null : parent.coolDown,
                            CircuitConfig.DEFAULT_COOL_DOWN),
                    pick(callsPerMinute, parent == null ? null : parent.callsPerMinute,
                            CircuitConfig.DEFAULT_CALLS_PER_MINUTE));
        }

        private static <T> T pick(T own, T inherited, T fallback) {
            if (own != null) return own;
            if (inherited != null) return inherited;
            return fallback;
        }
    }
}
