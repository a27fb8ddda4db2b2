package com.opsforge.job;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes an {@link IncidentBatchResult} as indented JSON with ISO-8601 dates.
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    public ReportWriter() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    public void write(IncidentBatchResult result, Path path) throws IOException {
        Objects.requireNonNull(path, "Output path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            write(result, out);
        }
        LOG.info("Wrote {} outcome(s) to {}", result.getProcessed(), path);
    }

    /**
     * @param out destination; flushed but not closed
     */
    public void write(IncidentBatchResult result, OutputStream out) throws IOException {
        Objects.requireNonNull(result, "Result must not be null");
        Objects.requireNonNull(out, "Output stream must not be null");
        mapper.writer()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, result);
        out.flush();
    }

    /**
     * @return the result as a JSON string
     */
    public String writeAsString(IncidentBatchResult result) throws IOException {
        return mapper.writeValueAsString(result);
    }
}
