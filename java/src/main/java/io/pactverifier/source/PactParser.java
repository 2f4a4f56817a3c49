package io.pactverifier.source;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactverifier.ErrorCode;
import io.pactverifier.VerifierException;
import io.pactverifier.internal.Json;
import io.pactverifier.model.ExpectedRequest;
import io.pactverifier.model.ExpectedResponse;
import io.pactverifier.model.Interaction;
import io.pactverifier.model.MatchingRule;
import io.pactverifier.model.MatchingRules;
import io.pactverifier.model.PactDocument;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Maps pact JSON (specification v1 to v3) onto {@link PactDocument}. Missing values are left {@code null} so that
 * {@link PactDocument#validate()} can report them; values of the wrong JSON type are rejected here.
 */
public final class PactParser {

    private PactParser() {
    }

    public static PactDocument parse(byte[] bytes, String origin) throws VerifierException {
        JsonNode root;
        try {
            root = Json.mapper().readTree(bytes == null ? new byte[0] : bytes);
        } catch (IOException ex) {
            throw new VerifierException(ErrorCode.MALFORMED_DOCUMENT, "parse pact " + origin + ": " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new VerifierException(ErrorCode.MALFORMED_DOCUMENT, "parse pact " + origin + ": document is not a JSON object");
        }

        String consumer = text(root.path("consumer").path("name"));
        String provider = text(root.path("provider").path("name"));

        JsonNode interactionsNode = root.path("interactions");
        if (!interactionsNode.isArray()) {
            throw invalid("interactions must be an array");
        }
        List<Interaction> interactions = new ArrayList<>(interactionsNode.size());
        for (int i = 0; i < interactionsNode.size(); i++) {
            interactions.add(parseInteraction(interactionsNode.get(i), i));
        }

        return new PactDocument(consumer, provider, interactions, specificationVersion(root.path("metadata")));
    }

    private static Interaction parseInteraction(JsonNode node, int index) throws VerifierException {
        if (!node.isObject()) {
            throw invalid(at(index, "interaction must be an object"));
        }
        JsonNode request = node.path("request");
        JsonNode response = node.path("response");
        return new Interaction(
            text(node.path("description")),
            providerState(node),
            request.isObject() ? parseRequest(request, index) : null,
            response.isObject() ? parseResponse(response, index) : null
        );
    }

    private static String providerState(JsonNode node) {
        String state = text(node.path("providerState"));
        if (state == null) {
            state = text(node.path("provider_state"));
        }
        if (state == null) {
            JsonNode states = node.path("providerStates");
            if (states.isArray() && states.size() > 0) {
                state = text(states.get(0).path("name"));
            }
        }
        return state;
    }

    private static ExpectedRequest parseRequest(JsonNode node, int index) throws VerifierException {
        return new ExpectedRequest(
            text(node.path("method")),
            text(node.path("path")),
            parseQuery(node.path("query"), index),
            parseHeaders(node.path("headers"), index, "request"),
            body(node)
        );
    }

    private static ExpectedResponse parseResponse(JsonNode node, int index) throws VerifierException {
        JsonNode status = node.path("status");
        return new ExpectedResponse(
            status.canConvertToInt() ? status.asInt() : 0,
            parseHeaders(node.path("headers"), index, "response"),
            body(node),
            parseMatchingRules(node.path("matchingRules"), index)
        );
    }

    private static JsonNode body(JsonNode node) {
        JsonNode body = node.get("body");
        if (body == null || body.isNull()) {
            return null;
        }
        return body;
    }

    private static Map<String, List<String>> parseQuery(JsonNode node, int index) throws VerifierException {
        Map<String, List<String>> query = new LinkedHashMap<>();
        if (node.isMissingNode() || node.isNull()) {
            return query;
        }
        if (node.isTextual()) {
            for (String pair : node.asText().split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String name = decode(eq < 0 ? pair : pair.substring(0, eq));
                String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
                query.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            }
            return query;
        }
        if (!node.isObject()) {
            throw invalid(at(index, "request query must be a string or an object"));
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> values = new ArrayList<>();
            if (field.getValue().isArray()) {
                for (JsonNode value : field.getValue()) {
                    values.add(value.asText());
                }
            } else {
                values.add(field.getValue().asText());
            }
            query.put(field.getKey(), values);
        }
        return query;
    }

    private static Map<String, String> parseHeaders(JsonNode node, int index, String side) throws VerifierException {
        Map<String, String> headers = new LinkedHashMap<>();
        if (node.isMissingNode() || node.isNull()) {
            return headers;
        }
        if (!node.isObject()) {
            throw invalid(at(index, side + " headers must be an object"));
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isArray()) {
                List<String> parts = new ArrayList<>();
                value.forEach(part -> parts.add(part.asText()));
                headers.put(field.getKey(), String.join(", ", parts));
            } else {
                headers.put(field.getKey(), value.asText());
            }
        }
        return headers;
    }

    private static MatchingRules parseMatchingRules(JsonNode node, int index) throws VerifierException {
        if (node.isMissingNode() || node.isNull()) {
            return MatchingRules.empty();
        }
        if (!node.isObject()) {
            throw invalid(at(index, "matchingRules must be an object"));
        }
        Map<String, MatchingRule> rules = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (key.startsWith("$")) {
                rules.put(key, parseRule(field.getValue(), key, index));
                continue;
            }
            // v3 layout: rules grouped by category
            switch (key.toLowerCase(Locale.ROOT)) {
                case "body":
                    collectCategory(field.getValue(), index, rules, true);
                    break;
                case "header":
                case "headers":
                    collectCategory(field.getValue(), index, rules, false);
                    break;
                default:
                    // status, path and query rules do not apply to response verification
                    break;
            }
        }
        return new MatchingRules(rules);
    }

    private static void collectCategory(JsonNode category, int index, Map<String, MatchingRule> rules, boolean body)
        throws VerifierException {
        if (!category.isObject()) {
            throw invalid(at(index, "matchingRules categories must be objects"));
        }
        Iterator<Map.Entry<String, JsonNode>> fields = category.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path;
            if (body) {
                String sub = field.getKey().startsWith("$") ? field.getKey().substring(1) : "." + field.getKey();
                path = "$.body" + sub;
            } else {
                path = "$.headers." + field.getKey();
            }
            JsonNode definition = field.getValue();
            JsonNode matchers = definition.path("matchers");
            if (matchers.isArray()) {
                if (matchers.size() == 0) {
                    continue;
                }
                definition = matchers.get(0);
            }
            rules.put(path, parseRule(definition, path, index));
        }
    }

    private static MatchingRule parseRule(JsonNode node, String path, int index) throws VerifierException {
        if (!node.isObject()) {
            throw invalid(at(index, "matching rule at " + path + " must be an object"));
        }
        String match = text(node.path("match"));
        String regex = text(node.path("regex"));
        Integer min = node.path("min").canConvertToInt() ? node.path("min").asInt() : null;
        Integer max = node.path("max").canConvertToInt() ? node.path("max").asInt() : null;

        MatchingRule.Type type;
        if (match == null) {
            if (regex != null) {
                type = MatchingRule.Type.REGEX;
            } else if (min != null || max != null) {
                type = MatchingRule.Type.TYPE;
            } else {
                throw invalid(at(index, "matching rule at " + path + " has no 'match'"));
            }
        } else if (match.equalsIgnoreCase("min") || match.equalsIgnoreCase("max")) {
            type = MatchingRule.Type.TYPE;
        } else {
            type = MatchingRule.Type.fromName(match);
            if (type == null) {
                throw invalid(at(index, "unsupported matching rule '" + match + "' at " + path));
            }
        }

        if (type == MatchingRule.Type.REGEX) {
            if (regex == null) {
                throw invalid(at(index, "regex matching rule at " + path + " has no 'regex'"));
            }
            try {
                Pattern.compile(regex);
            } catch (PatternSyntaxException ex) {
                throw invalid(at(index, "invalid regex at " + path + ": " + ex.getDescription()));
            }
        }
        return new MatchingRule(type, regex, text(node.path("value")), min, max);
    }

    private static String specificationVersion(JsonNode metadata) {
        String version = text(metadata.path("pactSpecification").path("version"));
        if (version == null) {
            version = text(metadata.path("pact-specification").path("version"));
        }
        if (version == null) {
            version = text(metadata.path("pactSpecificationVersion"));
        }
        return version;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    private static String at(int index, String message) {
        return String.format(Locale.ROOT, "interaction[%d]: %s", index, message);
    }

    private static VerifierException invalid(String message) {
        return new VerifierException(ErrorCode.INVALID_DOCUMENT, "invalid pact document: " + message);
    }
}
