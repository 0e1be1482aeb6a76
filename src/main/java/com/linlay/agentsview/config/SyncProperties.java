package com.linlay.agentsview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "agentsview.sync")
public class SyncProperties {

    public static final String DEFAULT_MACHINE = "local";
    public static final Duration DEFAULT_PERIODIC_INTERVAL = Duration.ofMinutes(15);

    private String claudeProjectsDir = defaultUnderHome(".claude", "projects");
    private String codexSessionsDir = defaultUnderHome(".codex", "sessions");
    private String machine = DEFAULT_MACHINE;
    private boolean initialSyncEnabled = true;
    private Periodic periodic = new Periodic();

    public String getClaudeProjectsDir() {
        return claudeProjectsDir;
    }

    public void setClaudeProjectsDir(String claudeProjectsDir) {
        this.claudeProjectsDir = claudeProjectsDir;
    }

    public String getCodexSessionsDir() {
        return codexSessionsDir;
    }

    public void setCodexSessionsDir(String codexSessionsDir) {
        this.codexSessionsDir = codexSessionsDir;
    }

    public String getMachine() {
        return machine;
    }

    public void setMachine(String machine) {
        this.machine = machine;
    }

    public boolean isInitialSyncEnabled() {
        return initialSyncEnabled;
    }

    public void setInitialSyncEnabled(boolean initialSyncEnabled) {
        this.initialSyncEnabled = initialSyncEnabled;
    }

    public Periodic getPeriodic() {
        return periodic;
    }

    public void setPeriodic(Periodic periodic) {
        this.periodic = periodic == null ? new Periodic() : periodic;
    }

    private static String defaultUnderHome(String first, String second) {
        return System.getProperty("user.home") + "/" + first + "/" + second;
    }

    public static class Periodic {
        private boolean enabled = true;
        private Duration interval = DEFAULT_PERIODIC_INTERVAL;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval == null || interval.isNegative() || interval.isZero()
                    ? DEFAULT_PERIODIC_INTERVAL
                    : interval;
        }
    }
}
