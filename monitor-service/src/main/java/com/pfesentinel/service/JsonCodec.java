package com.pfesentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pfesentinel.core.model.AnalysisReport;
import com.pfesentinel.service.payload.AnalyzePayload;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * JSON mapping for the HTTP surface: request payloads in, reports and errors
 * out. Timestamps are ISO-8601 strings.
 */
public class JsonCodec {

    private final ObjectMapper mapper;

    public JsonCodec() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new Jdk8Module());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @throws IOException if the body is not a valid payload
     */
    public AnalyzePayload readPayload(InputStream body) throws IOException {
        AnalyzePayload payload = mapper.readValue(body, AnalyzePayload.class);
        return payload != null ? payload : new AnalyzePayload();
    }

    public byte[] writeReport(AnalysisReport report) throws JsonProcessingException {
        return mapper.writeValueAsBytes(report);
    }

    public byte[] writeError(String message) {
        try {
            return mapper.writeValueAsBytes(Map.of("error", message == null ? "unknown error" : message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize error body", e);
        }
    }

    ObjectMapper mapper() {
        return mapper;
    }
}
