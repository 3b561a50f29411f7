package com.datapipeline.config;

import com.datapipeline.core.StageDefinition;
import com.datapipeline.core.error.ErrorType;
import com.datapipeline.core.error.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class PipelineSettingsLoaderTest {

    @Test
    void missingFieldsKeepTheirDefaults() throws Exception {
        PipelineSettings s = PipelineSettingsLoader.load(json("{ \"maxParallelStages\": 8 }"));

        assertEquals(8, s.maxParallelStages());
        assertEquals(30_000L, s.defaultStageTimeoutMs());
        assertEquals(0, s.historyCapacity());
        assertEquals(RetryPolicy.defaults().get(ErrorType.TIMEOUT), s.retryPolicies().get(ErrorType.TIMEOUT));
    }

    @Test
    void retryPolicyFieldsOverrideOnlyWhatTheyName() throws Exception {
        PipelineSettings s = PipelineSettingsLoader.load(json("""
            {
              "retryPolicies": {
                "timeout": { "maxAttempts": 4 },
                "PERMISSION": { "maxAttempts": 2, "baseDelayMs": 10, "maxDelayMs": 20, "jitter": false }
              }
            }
            """));

        RetryPolicy timeout = s.retryPolicies().get(ErrorType.TIMEOUT);
        assertEquals(4, timeout.maxAttempts());
        assertEquals(Duration.ofMillis(5000), timeout.baseDelay());
        RetryPolicy permission = s.retryPolicies().get(ErrorType.PERMISSION);
        assertEquals(2, permission.maxAttempts());
        assertEquals(Duration.ofMillis(20), permission.maxDelay());
        assertFalse(permission.jitter());
    }

    @Test
    void stageOverridesAreAppliedToDefinitions() throws Exception {
        PipelineSettings s = PipelineSettingsLoader.load(json("""
            { "stages": { "sync-frontend": { "timeoutMs": 45000, "critical": true } } }
            """));
        StageDefinition sync = StageDefinition.builder("sync-frontend").parallel(true).critical(false)
            .timeoutMs(30_000).build();
        StageDefinition other = StageDefinition.builder("update-state").build();

        StageDefinition applied = s.applyTo(sync);

        assertEquals(45_000L, applied.timeoutMs());
        assertEquals(true, applied.critical());
        assertEquals(true, applied.parallel());
        assertSame(other, s.applyTo(other));
    }

    @Test
    void malformedJsonIsAnIOException() {
        assertThrows(IOException.class, () -> PipelineSettingsLoader.load(json("{ \"maxParallelStages\": ")));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IOException.class, () -> PipelineSettingsLoader.load(json("{ \"maxParallelStages\": 0 }")));
        assertThrows(IOException.class, () -> PipelineSettingsLoader.load(json("[1, 2]")));
        assertThrows(IOException.class,
            () -> PipelineSettingsLoader.load(json("{ \"retryPolicies\": { \"GREMLINS\": {} } }")));
    }

    @Test
    void loadsFromFile() throws Exception {
        Path file = Files.createTempFile("data-pipeline", ".json");
        try {
            Files.writeString(file, "{ \"defaultStageTimeoutMs\": 1000 }");
            assertEquals(1000L, PipelineSettingsLoader.load(file).defaultStageTimeoutMs());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void classpathResourceIsPickedUp() throws Exception {
        PipelineSettings s = PipelineSettingsLoader.loadDefault();

        assertEquals(2, s.maxParallelStages());
        assertEquals(10, s.historyCapacity());
        assertEquals(600_000L, s.stageOverrides().get("process-images").timeoutMs());
    }

    @Test
    void absentResourceMeansDefaults() throws Exception {
        assertEquals(PipelineSettings.defaults(), PipelineSettingsLoader.loadResource("no-such-settings.json"));
    }

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
