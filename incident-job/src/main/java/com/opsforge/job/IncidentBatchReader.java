package com.opsforge.job;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads an incident batch JSON document into an {@link IncidentBatch}.
 *
 * <p>
 * Unknown properties are ignored. A document that is not valid JSON, or does
 * not have the expected shape, fails the whole read with an {@link IOException}.
 * </p>
 */
public class IncidentBatchReader {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentBatchReader.class);

    private final ObjectMapper mapper;

    public IncidentBatchReader() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public IncidentBatch read(Path path) throws IOException {
        Objects.requireNonNull(path, "Input path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            IncidentBatch batch = read(in);
            LOG.info("Read {} incident(s) from {}", batch.getIncidents().size(), path);
            return batch;
        }
    }

    /**
     * @param in JSON document; not closed by this method
     */
    public IncidentBatch read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "Input stream must not be null");
        IncidentBatch batch = mapper.readValue(in, IncidentBatch.class);
        return batch == null ? new IncidentBatch() : batch;
    }
}
