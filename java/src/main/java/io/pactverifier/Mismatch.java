package io.pactverifier;

/**
 * One discrepancy between the expected and the actual response.
 *
 * @param kind     which part of the response differs.
 * @param path     location of the difference, e.g. {@code $.body.items[0].id} or {@code $.headers.Content-Type}.
 * @param expected rendered expected value.
 * @param actual   rendered actual value, {@code <absent>} when missing.
 * @param message  human-readable explanation.
 */
public record Mismatch(Kind kind, String path, String expected, String actual, String message) {

    public enum Kind {
        STATUS,
        HEADER,
        BODY
    }

    @Override
    public String toString() {
        return kind + " " + path + ": " + message + " (expected " + expected + ", actual " + actual + ")";
    }
}
