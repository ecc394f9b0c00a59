package com.pfesentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.pfesentinel.core.engine.AnalysisEngine;
import com.pfesentinel.core.engine.AnalysisRequest;
import com.pfesentinel.core.engine.RateSeriesSource;
import com.pfesentinel.core.model.AnalysisReport;
import com.pfesentinel.service.payload.AnalyzePayload;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Handles {@code POST /analyze}: decodes the payload, runs one analysis over
 * the posted series and writes the report as JSON.
 *
 * <ul>
 * <li>{@code 400} for malformed JSON or out-of-range parameters</li>
 * <li>{@code 405} for any method other than POST</li>
 * <li>{@code 500} when the analysis itself fails</li>
 * </ul>
 */
public class AnalyzeHandler implements HttpHandler {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzeHandler.class);

    /**
     * Creates an engine bound to the series of a single request.
     */
    @FunctionalInterface
    public interface EngineFactory {
        AnalysisEngine create(RateSeriesSource source);
    }

    private final JsonCodec codec;
    private final EngineFactory engineFactory;
    private final int defaultLookbackHours;

    public AnalyzeHandler(JsonCodec codec, EngineFactory engineFactory, int defaultLookbackHours) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory must not be null");
        this.defaultLookbackHours = defaultLookbackHours;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "POST");
                respond(exchange, 405, codec.writeError("method not allowed: " + exchange.getRequestMethod()));
                return;
            }

            AnalysisRequest request;
            RateSeriesSource source;
            try (InputStream body = exchange.getRequestBody()) {
                AnalyzePayload payload = codec.readPayload(body);
                request = payload.toRequest(defaultLookbackHours);
                source = payload.toSource();
            } catch (JsonProcessingException e) {
                LOG.warn("Rejected malformed analyze payload: {}", e.getOriginalMessage());
                respond(exchange, 400, codec.writeError("malformed JSON: " + e.getOriginalMessage()));
                return;
            } catch (IllegalArgumentException e) {
                LOG.warn("Rejected analyze payload: {}", e.getMessage());
                respond(exchange, 400, codec.writeError(e.getMessage()));
                return;
            }

            AnalysisReport report;
            try (AnalysisEngine engine = engineFactory.create(source)) {
                report = engine.analyze(request);
            } catch (RuntimeException e) {
                LOG.error("Analysis failed for {}: {}", request, e.getMessage(), e);
                respond(exchange, 500, codec.writeError("analysis failed: " + e.getMessage()));
                return;
            }
            respond(exchange, 200, codec.writeReport(report));
        } finally {
            exchange.close();
        }
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
