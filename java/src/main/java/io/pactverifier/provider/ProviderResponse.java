package io.pactverifier.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * What the provider actually returned.
 *
 * @param status  HTTP status code.
 * @param headers response headers; lookups are case-insensitive.
 * @param body    body decoded as UTF-8, empty when there was none.
 */
public record ProviderResponse(int status, Map<String, List<String>> headers, String body) {

    public ProviderResponse {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, values == null ? List.of() : List.copyOf(new ArrayList<>(values))));
        }
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? "" : body;
    }

    /**
     * @return all values of the header, empty when absent.
     */
    public List<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null ? List.of() : values;
    }
}
