package com.agentbridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Bridge settings bound from {@code bridge.*} in application.yml. Most values
 * can be overridden from the environment; see application.yml for the names.
 */
@Component
@ConfigurationProperties(prefix = "bridge")
@Data
public class BridgeProperties {

    private String stateFile = System.getProperty("user.home") + "/.discode/state.json";

    private Submit submit = new Submit();
    private Fallback fallback = new Fallback();
    private Pending pending = new Pending();
    private Files files = new Files();
    private Container container = new Container();
    private Tmux tmux = new Tmux();

    @Data
    public static class Submit {
        // Gap between typing and Enter; some CLIs only see a leading "/" command with it
        private long delayMs = 300;
        private long opencodeDelayMs = 75;

        public long delayFor(String agentType) {
            return "opencode".equals(agentType) ? opencodeDelayMs : delayMs;
        }
    }

    @Data
    public static class Fallback {
        private Duration initialDelay = Duration.ofSeconds(3);
        private Duration stableInterval = Duration.ofSeconds(2);
        private int maxChecks = 3;
        private String promptMarker = "❯";
    }

    @Data
    public static class Pending {
        private Duration recentlyCompletedTtl = Duration.ofSeconds(30);
    }

    @Data
    public static class Files {
        private long maxSizeBytes = 25L * 1024 * 1024;
        private int maxCached = 100;
    }

    @Data
    public static class Container {
        private String workspaceDir = "/workspace";
        private String dockerCommand = "docker";
        private long maxInjectBytes = 50L * 1024 * 1024;

        public String filesDir() {
            return workspaceDir + "/.discode/files";
        }
    }

    @Data
    public static class Tmux {
        private String command = "tmux";
        private Duration commandTimeout = Duration.ofSeconds(10);
    }
}
