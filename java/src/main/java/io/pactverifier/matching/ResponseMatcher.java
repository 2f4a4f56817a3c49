package io.pactverifier.matching;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactverifier.InteractionVerdict;
import io.pactverifier.Mismatch;
import io.pactverifier.internal.Json;
import io.pactverifier.model.ExpectedResponse;
import io.pactverifier.model.Interaction;
import io.pactverifier.model.MatchingRule;
import io.pactverifier.model.MatchingRules;
import io.pactverifier.provider.ProviderResponse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compares an actual provider response with the response a consumer recorded.
 *
 * <ul>
 *   <li>Status must be equal.</li>
 *   <li>Every expected header must be present with an equal value; names are case-insensitive and extra headers are
 *       ignored. {@code Content-Type} only requires the media type and the parameters the consumer named.</li>
 *   <li>Bodies are matched structurally, see {@link BodyMatcher}. Matching rules take precedence over literal values.</li>
 * </ul>
 *
 * <p>All mismatches are collected rather than stopping at the first one.</p>
 */
public final class ResponseMatcher {

    private static final Pattern COMMA_WHITESPACE = Pattern.compile("\\s*,\\s*");

    public InteractionVerdict match(Interaction interaction, ProviderResponse actual) {
        Objects.requireNonNull(interaction, "interaction");
        return InteractionVerdict.compared(interaction, compare(interaction.response(), actual));
    }

    public List<Mismatch> compare(ExpectedResponse expected, ProviderResponse actual) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(actual, "actual");
        List<Mismatch> mismatches = new ArrayList<>();

        if (expected.status() != actual.status()) {
            mismatches.add(new Mismatch(Mismatch.Kind.STATUS, "$.status",
                String.valueOf(expected.status()), String.valueOf(actual.status()),
                "expected status " + expected.status() + " but got " + actual.status()));
        }

        for (Map.Entry<String, String> header : expected.headers().entrySet()) {
            Mismatch mismatch = compareHeader(header.getKey(), header.getValue(), actual, expected.matchingRules());
            if (mismatch != null) {
                mismatches.add(mismatch);
            }
        }

        if (expected.hasBody()) {
            mismatches.addAll(compareBody(expected, actual));
        }
        return mismatches;
    }

    private Mismatch compareHeader(String name, String expectedValue, ProviderResponse actual, MatchingRules rules) {
        String path = "$.headers." + name;
        List<String> values = actual.header(name);
        if (values.isEmpty()) {
            return new Mismatch(Mismatch.Kind.HEADER, path, expectedValue, "<absent>", "expected header '" + name + "' is missing");
        }
        String joined = String.join(", ", values);

        MatchingRule rule = rules.findHeader(name);
        if (rule != null && rule.type() != MatchingRule.Type.EQUALITY) {
            boolean ok;
            switch (rule.type()) {
                case REGEX:
                    Pattern pattern = Pattern.compile(rule.regex());
                    ok = pattern.matcher(joined).matches() || values.stream().anyMatch(v -> pattern.matcher(v).matches());
                    break;
                case INCLUDE:
                    String fragment = rule.value() != null ? rule.value() : expectedValue;
                    ok = joined.contains(fragment);
                    break;
                default:
                    ok = true;
                    break;
            }
            return ok ? null : new Mismatch(Mismatch.Kind.HEADER, path, expectedValue, joined,
                "header '" + name + "' does not satisfy its " + rule.type().name().toLowerCase(Locale.ROOT) + " rule");
        }

        boolean ok;
        if (name.equalsIgnoreCase("Content-Type")) {
            ok = values.stream().anyMatch(v -> contentTypeMatches(expectedValue, v));
        } else {
            String normalized = normalize(expectedValue);
            ok = normalize(joined).equals(normalized) || values.stream().anyMatch(v -> normalize(v).equals(normalized));
        }
        return ok ? null : new Mismatch(Mismatch.Kind.HEADER, path, expectedValue, joined,
            "expected header '" + name + "' to be '" + expectedValue + "' but was '" + joined + "'");
    }

    private List<Mismatch> compareBody(ExpectedResponse expected, ProviderResponse actual) {
        JsonNode expectedBody = expected.body();
        BodyMatcher matcher = new BodyMatcher(expected.matchingRules());
        String rawBody = actual.body();

        if (expectedBody.isContainerNode()) {
            if (rawBody.isBlank()) {
                matcher.compare("$.body", expectedBody, MissingNode.getInstance(), false);
                return matcher.mismatches();
            }
            JsonNode parsed;
            try {
                parsed = Json.mapper().readTree(rawBody);
            } catch (JsonProcessingException ex) {
                return List.of(new Mismatch(Mismatch.Kind.BODY, "$.body", Json.render(expectedBody), rawBody,
                    "expected a JSON body but the response body could not be parsed: " + ex.getOriginalMessage()));
            }
            matcher.compare("$.body", expectedBody, parsed, false);
            return matcher.mismatches();
        }

        JsonNode actualBody = TextNode.valueOf(rawBody);
        if (isJson(actual.header("Content-Type"))) {
            try {
                JsonNode parsed = Json.mapper().readTree(rawBody);
                if (parsed != null && !parsed.isMissingNode()) {
                    actualBody = parsed;
                }
            } catch (JsonProcessingException ex) {
                // not JSON after all; compare as text
                actualBody = TextNode.valueOf(rawBody);
            }
        }
        if (!expectedBody.isTextual() && actualBody.isTextual()) {
            expectedBody = TextNode.valueOf(expectedBody.asText());
        }
        matcher.compare("$.body", expectedBody, actualBody, false);
        return matcher.mismatches();
    }

    static boolean contentTypeMatches(String expected, String actual) {
        Map<String, String> expectedParams = new LinkedHashMap<>();
        String expectedType = parseMediaType(expected, expectedParams);
        Map<String, String> actualParams = new LinkedHashMap<>();
        String actualType = parseMediaType(actual, actualParams);
        if (!expectedType.equals(actualType)) {
            return false;
        }
        for (Map.Entry<String, String> param : expectedParams.entrySet()) {
            String value = actualParams.get(param.getKey());
            if (value == null || !value.equalsIgnoreCase(param.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static String parseMediaType(String header, Map<String, String> params) {
        String[] parts = header.split(";");
        for (int i = 1; i < parts.length; i++) {
            int eq = parts[i].indexOf('=');
            if (eq > 0) {
                String value = parts[i].substring(eq + 1).trim();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                params.put(parts[i].substring(0, eq).trim().toLowerCase(Locale.ROOT), value);
            }
        }
        return parts[0].trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isJson(List<String> contentTypes) {
        return contentTypes.stream().anyMatch(v -> v.toLowerCase(Locale.ROOT).contains("json"));
    }

    private static String normalize(String value) {
        return COMMA_WHITESPACE.matcher(value.trim()).replaceAll(",");
    }
}
