package io.pactverifier.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The request a consumer recorded, replayed verbatim against the provider.
 *
 * @param method  HTTP method, as recorded (case is normalised when the request is sent).
 * @param path    absolute request path starting with {@code /}.
 * @param query   query parameters in recorded order; a parameter may repeat.
 * @param headers request headers in recorded order.
 * @param body    request body, or {@code null} when the consumer sent none.
 */
public record ExpectedRequest(
    String method,
    String path,
    Map<String, List<String>> query,
    Map<String, String> headers,
    JsonNode body
) {
    public ExpectedRequest {
        query = copyQuery(query);
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public boolean hasBody() {
        return body != null && !body.isMissingNode();
    }

    /**
     * Case-insensitive header lookup.
     */
    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static Map<String, List<String>> copyQuery(Map<String, List<String>> query) {
        if (query == null || query.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        query.forEach((name, values) -> copy.put(name, values == null ? List.of() : List.copyOf(new ArrayList<>(values))));
        return Collections.unmodifiableMap(copy);
    }
}
