package com.datapipeline.config;

import com.datapipeline.core.error.ErrorType;
import com.datapipeline.core.error.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads {@link PipelineSettings} from JSON:
 * <pre>
 * {
 *   "maxParallelStages": 4,
 *   "defaultStageTimeoutMs": 30000,
 *   "historyCapacity": 100,
 *   "retryPolicies": { "TIMEOUT": { "maxAttempts": 3, "baseDelayMs": 1000 } },
 *   "stages": { "process-images": { "timeoutMs": 600000, "critical": false } }
 * }
 * </pre>
 */
public final class PipelineSettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(PipelineSettingsLoader.class);
    private static final ObjectMapper M = new ObjectMapper();

    public static final String DEFAULT_RESOURCE = "data-pipeline.json";

    private PipelineSettingsLoader() {}

    public static PipelineSettings load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public static PipelineSettings load(InputStream in) throws IOException {
        JsonNode root = M.readTree(in);
        if (root == null || !root.isObject()) throw new IOException("Settings must be a JSON object");
        PipelineSettings d = PipelineSettings.defaults();
        try {
            return new PipelineSettings(
                    root.path("maxParallelStages").asInt(d.maxParallelStages()),
                    root.path("defaultStageTimeoutMs").asLong(d.defaultStageTimeoutMs()),
                    root.path("historyCapacity").asInt(d.historyCapacity()),
                    retryPolicies(root.path("retryPolicies"), d.retryPolicies()),
                    stageOverrides(root.path("stages")));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid settings: " + e.getMessage(), e);
        }
    }

    /** Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when there is none. */
    public static PipelineSettings loadDefault() throws IOException {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static PipelineSettings loadResource(String resource) throws IOException {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = PipelineSettingsLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", resource);
                return PipelineSettings.defaults();
            }
            log.info("Loading pipeline settings from classpath:{}", resource);
            return load(in);
        }
    }

    private static Map<ErrorType, RetryPolicy> retryPolicies(JsonNode node, Map<ErrorType, RetryPolicy> defaults)
            throws IOException {
        Map<ErrorType, RetryPolicy> out = new EnumMap<>(ErrorType.class);
        out.putAll(defaults);
        if (node.isMissingNode()) return out;
        if (!node.isObject()) throw new IOException("retryPolicies must be an object");
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            ErrorType type = errorType(e.getKey());
            RetryPolicy base = out.getOrDefault(type, RetryPolicy.DEFAULT);
            JsonNode p = e.getValue();
            out.put(type, new RetryPolicy(
                    p.path("maxAttempts").asInt(base.maxAttempts()),
                    Duration.ofMillis(p.path("baseDelayMs").asLong(base.baseDelay().toMillis())),
                    Duration.ofMillis(p.path("maxDelayMs").asLong(base.maxDelay().toMillis())),
                    p.path("multiplier").asDouble(base.multiplier()),
                    p.path("jitter").asBoolean(base.jitter())));
        }
        return out;
    }

    private static Map<String, PipelineSettings.StageOverride> stageOverrides(JsonNode node) throws IOException {
        Map<String, PipelineSettings.StageOverride> out = new LinkedHashMap<>();
        if (node.isMissingNode()) return out;
        if (!node.isObject()) throw new IOException("stages must be an object");
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode s = e.getValue();
            Long timeoutMs = s.has("timeoutMs") ? s.get("timeoutMs").asLong() : null;
            Boolean critical = s.has("critical") ? s.get("critical").asBoolean() : null;
            out.put(e.getKey(), new PipelineSettings.StageOverride(timeoutMs, critical));
        }
        return out;
    }

    private static ErrorType errorType(String key) throws IOException {
        try {
            return ErrorType.valueOf(key.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown error type in retryPolicies: " + key, e);
        }
    }
}
