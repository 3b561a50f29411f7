package com.datapipeline.config;

import com.datapipeline.core.error.ErrorHandler;
import com.datapipeline.core.error.ErrorLogEntry;
import com.datapipeline.core.error.ErrorStats;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Writes an {@link ErrorHandler}'s log and statistics as a {@code {timestamp, stats, errors}} JSON document. */
public final class ErrorLogExporter {
    private static final Logger log = LoggerFactory.getLogger(ErrorLogExporter.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    public ErrorLogExporter() {
        this(Clock.systemUTC());
    }

    public ErrorLogExporter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void export(ErrorHandler handler, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream out = Files.newOutputStream(file)) {
            write(handler, out);
        }
        log.info("Error log exported to {}", file);
    }

    public void write(ErrorHandler handler, OutputStream out) throws IOException {
        mapper.writeValue(out, document(handler));
    }

    public String toJson(ErrorHandler handler) throws IOException {
        return mapper.writeValueAsString(document(handler));
    }

    private ErrorLogDocument document(ErrorHandler handler) {
        Objects.requireNonNull(handler, "handler");
        ErrorStats stats = handler.getStats();
        // the full log, not the default window
        List<ErrorLogEntry> entries = handler.getErrorLog(Integer.MAX_VALUE);
        List<ExportedError> errors = new ArrayList<>(entries.size());
        for (ErrorLogEntry e : entries) errors.add(ExportedError.of(e));
        return new ErrorLogDocument(clock.instant(), stats, errors);
    }

    record ErrorLogDocument(Instant timestamp, ErrorStats stats, List<ExportedError> errors) { }

    record ExportedError(
            String id,
            Instant timestamp,
            String type,
            String severity,
            String strategy,
            String message,
            String errorClass,
            Map<String, String> context,
            int recoveryAttempts,
            boolean resolved
    ) {
        static ExportedError of(ErrorLogEntry e) {
            // attribute values may be arbitrary objects
            Map<String, String> ctx = new LinkedHashMap<>();
            e.context().forEach((k, v) -> ctx.put(k, String.valueOf(v)));
            return new ExportedError(e.id(), e.timestamp(), e.classification().type().name(),
                    e.classification().severity().name(), e.classification().strategy().name(), e.message(),
                    e.errorClass(), ctx, e.recoveryAttempts(), e.resolved());
        }
    }
}
