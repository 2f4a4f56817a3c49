package io.pactverifier.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The response a consumer expects. Headers and body are partial: anything the provider returns beyond them is ignored.
 *
 * @param status        exact HTTP status expected.
 * @param headers       headers that must be present with equal values.
 * @param body          expected body, or {@code null} when the body is not checked.
 * @param matchingRules rules relaxing literal equality at specific paths.
 */
public record ExpectedResponse(
    int status,
    Map<String, String> headers,
    JsonNode body,
    MatchingRules matchingRules
) {
    public ExpectedResponse {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        matchingRules = matchingRules == null ? MatchingRules.empty() : matchingRules;
    }

    public boolean hasBody() {
        return body != null && !body.isMissingNode();
    }
}
