package org.sudandigitalarchive.mcp.telemetry;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Telemetry logger for tracking MCP tool usage, success rates, and failure patterns.
 * Outputs one JSON event per line into a file per day, plus a pretty-printed summary on shutdown.
 * <p>
 * Events carry tool names, durations, error kinds and the names of supplied parameters.
 * Argument values are never recorded.
 */
public class TelemetryLogger {
    private static final Logger log = LoggerFactory.getLogger(TelemetryLogger.class);

    static final String LOG_FILE_PREFIX = "mcp_telemetry_";
    static final String SUMMARY_FILE_PREFIX = "summary_";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Gson gson;
    private final Path telemetryDir;
    private final boolean enabled;
    private final Map<String, ToolMetrics> toolMetrics;
    private final AtomicLong sessionRequestCount;
    private final String sessionId;
    private final long sessionStartTime;

    /**
     * Metrics tracked for each tool
     */
    private static class ToolMetrics {
        final AtomicLong invocationCount = new AtomicLong(0);
        final AtomicLong successCount = new AtomicLong(0);
        final AtomicLong failureCount = new AtomicLong(0);
        final AtomicLong totalDurationMs = new AtomicLong(0);
        final AtomicLong minDurationMs = new AtomicLong(Long.MAX_VALUE);
        final AtomicLong maxDurationMs = new AtomicLong(0);
        final Map<String, AtomicLong> errorCounts = new ConcurrentHashMap<>();
    }

    /**
     * Telemetry event structure
     */
    public static class TelemetryEvent {
        public final String timestamp;
        public final String sessionId;
        public final String eventType;
        public final String toolName;
        public final String endpoint;
        public final List<String> parameters;
        public final boolean success;
        public final String errorKind;
        public final String errorMessage;
        public final long durationMs;
        public final long responseSize;
        public final Map<String, Object> metadata;

        public TelemetryEvent(String sessionId, String eventType, String toolName, String endpoint,
                              List<String> parameters, boolean success, String errorKind,
                              String errorMessage, long durationMs, long responseSize,
                              Map<String, Object> metadata) {
            this.timestamp = Instant.now().toString();
            this.sessionId = sessionId;
            this.eventType = eventType;
            this.toolName = toolName;
            this.endpoint = endpoint;
            this.parameters = parameters;
            this.success = success;
            this.errorKind = errorKind;
            this.errorMessage = errorMessage;
            this.durationMs = durationMs;
            this.responseSize = responseSize;
            this.metadata = metadata;
        }
    }

    public TelemetryLogger(Path telemetryDir) {
        this(telemetryDir, true);
    }

    private TelemetryLogger(Path telemetryDir, boolean enabled) {
        this.gson = new GsonBuilder()
            .create(); // No pretty printing for JSONL format
        this.telemetryDir = telemetryDir;
        this.toolMetrics = new ConcurrentHashMap<>();
        this.sessionRequestCount = new AtomicLong(0);
        this.sessionStartTime = System.currentTimeMillis();
        this.sessionId = generateSessionId();

        boolean usable = enabled;
        if (enabled) {
            try {
                Files.createDirectories(telemetryDir);
                log.info("Telemetry directory created/verified at: {}", telemetryDir);
            } catch (IOException e) {
                log.error("Failed to create telemetry directory {}, telemetry disabled: {}", telemetryDir, e.getMessage());
                usable = false;
            }
        }
        this.enabled = usable;
    }

    /**
     * A logger that keeps in-memory metrics but writes nothing.
     */
    public static TelemetryLogger disabled() {
        return new TelemetryLogger(null, false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Initialize the telemetry logger after construction.
     * This should be called immediately after creating the TelemetryLogger instance.
     */
    public void init() {
        logSessionEvent("SESSION_START", null);
    }

    /**
     * Log the start of a tool invocation
     *
     * @return the start time to pass to the matching success or failure call
     */
    public long logToolStart(String toolName, String endpoint, List<String> parameterNames) {
        long startTime = System.currentTimeMillis();
        sessionRequestCount.incrementAndGet();

        ToolMetrics metrics = toolMetrics.computeIfAbsent(toolName, k -> new ToolMetrics());
        metrics.invocationCount.incrementAndGet();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionRequestNumber", sessionRequestCount.get());
        metadata.put("totalInvocations", metrics.invocationCount.get());

        writeEvent(new TelemetryEvent(sessionId, "TOOL_START", toolName, endpoint,
            parameterNames, true, null, null, 0, 0, metadata));
        return startTime;
    }

    /**
     * Log successful tool completion
     */
    public void logToolSuccess(String toolName, String endpoint, long startTime, long responseSize) {
        long duration = System.currentTimeMillis() - startTime;

        ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics != null) {
            metrics.successCount.incrementAndGet();
            metrics.totalDurationMs.addAndGet(duration);
            updateMinMax(metrics, duration);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("successRate", calculateSuccessRate(toolName));
        metadata.put("avgDuration", calculateAvgDuration(toolName));

        writeEvent(new TelemetryEvent(sessionId, "TOOL_SUCCESS", toolName, endpoint,
            null, true, null, null, duration, responseSize, metadata));
    }

    /**
     * Log tool failure
     */
    public void logToolFailure(String toolName, String endpoint, long startTime,
                               String errorKind, String errorMessage) {
        long duration = System.currentTimeMillis() - startTime;
        String errorKey = errorKind != null ? errorKind : "UNKNOWN_ERROR";

        ToolMetrics metrics = toolMetrics.get(toolName);
        long errorTypeCount = 0;
        if (metrics != null) {
            metrics.failureCount.incrementAndGet();
            metrics.totalDurationMs.addAndGet(duration);
            updateMinMax(metrics, duration);
            errorTypeCount = metrics.errorCounts.computeIfAbsent(errorKey, k -> new AtomicLong(0)).incrementAndGet();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("successRate", calculateSuccessRate(toolName));
        metadata.put("failureRate", calculateFailureRate(toolName));
        metadata.put("errorTypeCount", errorTypeCount);

        writeEvent(new TelemetryEvent(sessionId, "TOOL_FAILURE", toolName, endpoint,
            null, false, errorKey, errorMessage, duration, 0, metadata));
    }

    /**
     * Log session-level events
     */
    public void logSessionEvent(String eventType, Map<String, Object> metadata) {
        Map<String, Object> sessionMetadata = new LinkedHashMap<>();
        sessionMetadata.put("sessionDuration", System.currentTimeMillis() - sessionStartTime);
        sessionMetadata.put("totalRequests", sessionRequestCount.get());
        sessionMetadata.put("uniqueToolsUsed", toolMetrics.size());
        if (metadata != null) {
            sessionMetadata.putAll(metadata);
        }

        writeEvent(new TelemetryEvent(sessionId, eventType, null, null,
            null, true, null, null, 0, 0, sessionMetadata));
    }

    /**
     * Per-tool counters for this session, keyed by tool name.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> toolSummaries = new TreeMap<>();
        for (Map.Entry<String, ToolMetrics> entry : toolMetrics.entrySet()) {
            String toolName = entry.getKey();
            ToolMetrics metrics = entry.getValue();

            Map<String, Object> toolSummary = new LinkedHashMap<>();
            toolSummary.put("invocations", metrics.invocationCount.get());
            toolSummary.put("successes", metrics.successCount.get());
            toolSummary.put("failures", metrics.failureCount.get());
            toolSummary.put("successRate", calculateSuccessRate(toolName));
            toolSummary.put("avgDurationMs", calculateAvgDuration(toolName));
            toolSummary.put("minDurationMs", metrics.minDurationMs.get() == Long.MAX_VALUE ? 0 : metrics.minDurationMs.get());
            toolSummary.put("maxDurationMs", metrics.maxDurationMs.get());

            Map<String, Long> errorTypes = new TreeMap<>();
            metrics.errorCounts.forEach((kind, count) -> errorTypes.put(kind, count.get()));
            toolSummary.put("errorTypes", errorTypes);

            toolSummaries.put(toolName, toolSummary);
        }
        return toolSummaries;
    }

    /**
     * Generate daily summary report
     */
    public void generateDailySummary() {
        if (!enabled) return;

        String today = DATE_FORMAT.format(LocalDate.now(ZoneOffset.UTC));
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("date", today);
        summary.put("sessionId", sessionId);
        summary.put("totalRequests", sessionRequestCount.get());
        summary.put("sessionDurationMs", System.currentTimeMillis() - sessionStartTime);
        summary.put("tools", snapshot());

        Path summaryFile = telemetryDir.resolve(SUMMARY_FILE_PREFIX + today + ".json");
        try (Writer writer = Files.newBufferedWriter(summaryFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            Gson prettyGson = new GsonBuilder().setPrettyPrinting().create();
            prettyGson.toJson(summary, writer);
            writer.write("\n");
            log.info("Daily summary written to: {}", summaryFile);
        } catch (IOException e) {
            log.error("Failed to write daily summary: {}", e.getMessage());
        }
    }

    /**
     * Shutdown telemetry and generate final reports
     */
    public void shutdown() {
        logSessionEvent("SESSION_END", null);
        generateDailySummary();
    }

    // Helper methods

    /**
     * Path of today's event file.
     */
    Path currentLogFile() {
        return telemetryDir.resolve(LOG_FILE_PREFIX + DATE_FORMAT.format(LocalDate.now(ZoneOffset.UTC)) + ".jsonl");
    }

    private synchronized void writeEvent(TelemetryEvent event) {
        if (!enabled) return;

        try {
            String jsonLine = gson.toJson(event) + "\n";
            Files.write(currentLogFile(), jsonLine.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to write telemetry event: {}", e.getMessage());
        }
    }

    private static String generateSessionId() {
        return "session_" + Instant.now().toEpochMilli() + "_" +
               Integer.toHexString(ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE));
    }

    private static void updateMinMax(ToolMetrics metrics, long duration) {
        metrics.minDurationMs.updateAndGet(min -> Math.min(min, duration));
        metrics.maxDurationMs.updateAndGet(max -> Math.max(max, duration));
    }

    private double calculateSuccessRate(String toolName) {
        ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics == null || metrics.invocationCount.get() == 0) {
            return 0.0;
        }
        return (double) metrics.successCount.get() / metrics.invocationCount.get();
    }

    private double calculateFailureRate(String toolName) {
        ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics == null || metrics.invocationCount.get() == 0) {
            return 0.0;
        }
        return (double) metrics.failureCount.get() / metrics.invocationCount.get();
    }

    private double calculateAvgDuration(String toolName) {
        ToolMetrics metrics = toolMetrics.get(toolName);
        if (metrics == null || metrics.invocationCount.get() == 0) {
            return 0.0;
        }
        return (double) metrics.totalDurationMs.get() / metrics.invocationCount.get();
    }
}
