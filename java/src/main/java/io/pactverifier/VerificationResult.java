package io.pactverifier;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.pactverifier.internal.Json;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregated outcome of one verification run, in document order.
 */
public record VerificationResult(
    String consumer,
    String provider,
    Instant startedAt,
    Instant finishedAt,
    List<InteractionVerdict> verdicts
) {
    public VerificationResult {
        verdicts = verdicts == null ? List.of() : List.copyOf(verdicts);
    }

    /**
     * @return {@code true} when every verified interaction matched without setup, transport or teardown errors.
     */
    @JsonProperty("success")
    public boolean success() {
        return verdicts.stream().allMatch(InteractionVerdict::matched);
    }

    public List<InteractionVerdict> failures() {
        return verdicts.stream()
            .filter(verdict -> !verdict.matched())
            .collect(Collectors.toList());
    }

    /**
     * Renders the run as a pretty-printed JSON report.
     */
    public String toJson() {
        try {
            return Json.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("render verification report: " + ex.getMessage(), ex);
        }
    }
}
