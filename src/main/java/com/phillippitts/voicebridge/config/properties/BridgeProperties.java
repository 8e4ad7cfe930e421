package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the session-scoped conversational subprocess bridge.
 *
 * <p>Example application.properties:
 * <pre>
 * bridge.command=claude,chat
 * bridge.max-sessions=8
 * bridge.turn-timeout=120s
 * bridge.idle-timeout=30m
 * bridge.completion.mode=sentinel
 * bridge.completion.sentinel=&gt;
 * bridge.completion.quiet-period=1500ms
 * </pre>
 */
@ConfigurationProperties(prefix = "bridge")
@Validated
public class BridgeProperties {

    /** Command line of the conversational subprocess, executable first. */
    @NotEmpty(message = "Bridge command must not be empty")
    private List<String> command = new ArrayList<>(List.of("claude", "chat"));

    /** Working directory of spawned processes; blank means the server's working directory. */
    private String workingDirectory = "";

    /** Maximum number of concurrently live subprocesses. */
    @Positive(message = "Max sessions must be positive")
    private int maxSessions = 8;

    /** How long a spawn may wait for a free process slot before failing with capacity exceeded. */
    @NotNull
    private Duration capacityAcquireTimeout = Duration.ofMillis(500);

    /** Default wait for a complete reply. */
    @NotNull
    private Duration turnTimeout = Duration.ofSeconds(120);

    /** Sessions idle for longer than this are closed by the eviction sweep. */
    @NotNull
    private Duration idleTimeout = Duration.ofMinutes(30);

    /** Period of the idle eviction sweep. */
    @Positive
    private long evictionIntervalMs = 60_000;

    /** Window between closing stdin/SIGTERM and forced termination. */
    @NotNull
    private Duration shutdownGrace = Duration.ofSeconds(5);

    /** Directory of the per-session JSON history cache. */
    @NotBlank(message = "History directory must not be blank")
    private String historyDir = System.getProperty("java.io.tmpdir") + "/voice-bridge/sessions";

    /** Cap on buffered stderr kept for diagnostics. */
    @Positive
    private int maxStderrChars = 64 * 1024;

    @Valid
    private Completion completion = new Completion();

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        this.command = command;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public void setMaxSessions(int maxSessions) {
        this.maxSessions = maxSessions;
    }

    public Duration getCapacityAcquireTimeout() {
        return capacityAcquireTimeout;
    }

    public void setCapacityAcquireTimeout(Duration capacityAcquireTimeout) {
        this.capacityAcquireTimeout = capacityAcquireTimeout;
    }

    public Duration getTurnTimeout() {
        return turnTimeout;
    }

    public void setTurnTimeout(Duration turnTimeout) {
        this.turnTimeout = turnTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public long getEvictionIntervalMs() {
        return evictionIntervalMs;
    }

    public void setEvictionIntervalMs(long evictionIntervalMs) {
        this.evictionIntervalMs = evictionIntervalMs;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public String getHistoryDir() {
        return historyDir;
    }

    public void setHistoryDir(String historyDir) {
        this.historyDir = historyDir;
    }

    public int getMaxStderrChars() {
        return maxStderrChars;
    }

    public void setMaxStderrChars(int maxStderrChars) {
        this.maxStderrChars = maxStderrChars;
    }

    public Completion getCompletion() {
        return completion;
    }

    public void setCompletion(Completion completion) {
        this.completion = completion;
    }

    /**
     * Reply-completion policy settings.
     */
    public static class Completion {

        /** How the end of a reply is detected. */
        @NotNull
        private CompletionMode mode = CompletionMode.SENTINEL;

        /** Output silence that ends a reply in QUIESCENCE mode. */
        @NotNull
        private Duration quietPeriod = Duration.ofMillis(1500);

        /** Line prefix that ends a reply in SENTINEL mode (the CLI's input prompt). */
        @NotBlank
        private String sentinel = ">";

        public CompletionMode getMode() {
            return mode;
        }

        public void setMode(CompletionMode mode) {
            this.mode = mode;
        }

        public Duration getQuietPeriod() {
            return quietPeriod;
        }

        public void setQuietPeriod(Duration quietPeriod) {
            this.quietPeriod = quietPeriod;
        }

        public String getSentinel() {
            return sentinel;
        }

        public void setSentinel(String sentinel) {
            this.sentinel = sentinel;
        }
    }

    public enum CompletionMode { QUIESCENCE, SENTINEL }
}
