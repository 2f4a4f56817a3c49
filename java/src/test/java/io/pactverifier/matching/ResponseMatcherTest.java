package io.pactverifier.matching;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactverifier.ErrorCode;
import io.pactverifier.InteractionVerdict;
import io.pactverifier.Mismatch;
import io.pactverifier.internal.Json;
import io.pactverifier.model.ExpectedRequest;
import io.pactverifier.model.ExpectedResponse;
import io.pactverifier.model.Interaction;
import io.pactverifier.model.MatchingRule;
import io.pactverifier.model.MatchingRules;
import io.pactverifier.provider.ProviderResponse;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseMatcherTest {

    private static final Map<String, List<String>> JSON_HEADERS = Map.of("Content-Type", List.of("application/json"));

    private final ResponseMatcher matcher = new ResponseMatcher();

    @Test
    void identicalResponseMatches() throws Exception {
        String body = "{\"id\":1,\"status\":\"PENDING\",\"items\":[{\"sku\":\"A-100\",\"quantity\":2}]}";
        ExpectedResponse expected = new ExpectedResponse(200, Map.of("Content-Type", "application/json"), json(body), null);

        assertTrue(matcher.compare(expected, new ProviderResponse(200, JSON_HEADERS, body)).isEmpty());
    }

    @Test
    void toleratesExtraHeadersKeysAndElements() throws Exception {
        ExpectedResponse expected = new ExpectedResponse(200, Map.of("content-type", "application/json"),
            json("{\"id\":1,\"tags\":[\"a\"]}"), null);
        Map<String, List<String>> headers = new LinkedHashMap<>(JSON_HEADERS);
        headers.put("X-Request-Id", List.of("r-1"));

        List<Mismatch> mismatches = matcher.compare(expected,
            new ProviderResponse(200, headers, "{\"id\":1,\"name\":\"extra\",\"tags\":[\"a\",\"b\"]}"));

        assertTrue(mismatches.isEmpty(), mismatches::toString);
    }

    @Test
    void collectsEveryMismatch() throws Exception {
        ExpectedResponse expected = new ExpectedResponse(200, Map.of("X-Version", "2"),
            json("{\"id\":1,\"status\":\"PENDING\"}"), null);

        List<Mismatch> mismatches = matcher.compare(expected,
            new ProviderResponse(404, JSON_HEADERS, "{\"id\":2}"));

        assertEquals(4, mismatches.size(), mismatches::toString);
        assertEquals(Mismatch.Kind.STATUS, mismatches.get(0).kind());
        assertEquals("$.status", mismatches.get(0).path());
        assertEquals("$.headers.X-Version", mismatches.get(1).path());
        assertEquals("<absent>", mismatches.get(1).actual());
        assertEquals("$.body.id", mismatches.get(2).path());
        assertEquals("$.body.status", mismatches.get(3).path());
        assertEquals("<absent>", mismatches.get(3).actual());
    }

    @Test
    void shorterArrayIsMismatch() throws Exception {
        ExpectedResponse expected = new ExpectedResponse(200, null, json("{\"items\":[1,2]}"), null);

        List<Mismatch> mismatches = matcher.compare(expected, new ProviderResponse(200, JSON_HEADERS, "{\"items\":[1]}"));

        assertEquals(1, mismatches.size());
        assertEquals("$.body.items", mismatches.get(0).path());
    }

    @Test
    void numbersCompareByValue() throws Exception {
        ExpectedResponse expected = new ExpectedResponse(200, null, json("{\"total\":1}"), null);

        assertTrue(matcher.compare(expected, new ProviderResponse(200, JSON_HEADERS, "{\"total\":1.0}")).isEmpty());
        assertEquals(1, matcher.compare(expected, new ProviderResponse(200, JSON_HEADERS, "{\"total\":\"1\"}")).size());
    }

    @Test
    void headerValuesIgnoreWhitespaceAroundCommas() {
        ExpectedResponse expected = new ExpectedResponse(200, Map.of("Allow", "GET, POST"), null, null);

        List<Mismatch> mismatches = matcher.compare(expected,
            new ProviderResponse(200, Map.of("allow", List.of("GET,POST")), ""));

        assertTrue(mismatches.isEmpty());
    }

    @Test
    void contentTypeRequiresOnlyNamedParameters() {
        assertTrue(ResponseMatcher.contentTypeMatches("application/json", "application/json; charset=UTF-8"));
        assertTrue(ResponseMatcher.contentTypeMatches("application/json; charset=utf-8", "Application/JSON;charset=UTF-8"));
        assertFalse(ResponseMatcher.contentTypeMatches("application/json; charset=utf-8", "application/json"));
        assertFalse(ResponseMatcher.contentTypeMatches("application/json", "text/plain"));
    }

    @Test
    void typeAndRegexRulesRelaxLiterals() throws Exception {
        Map<String, MatchingRule> rules = new LinkedHashMap<>();
        rules.put("$.body.orders", new MatchingRule(MatchingRule.Type.TYPE, null, null, 1, null));
        rules.put("$.body.orders[*].id", MatchingRule.anyType());
        rules.put("$.body.orders[*].createdAt", MatchingRule.regex("\\d{4}-\\d{2}-\\d{2}T.*"));
        rules.put("$.body.orders[*].total", new MatchingRule(MatchingRule.Type.DECIMAL, null, null, null, null));
        rules.put("$.headers.Content-Type", MatchingRule.regex("application/json.*"));
        ExpectedResponse expected = new ExpectedResponse(200,
            Map.of("Content-Type", "application/json; charset=utf-8"),
            json("{\"orders\":[{\"id\":\"order-1\",\"createdAt\":\"2026-01-15T10:30:00Z\",\"total\":10.5}]}"),
            new MatchingRules(rules));

        String actual = "{\"orders\":["
            + "{\"id\":\"order-7\",\"createdAt\":\"2026-03-01T08:00:00Z\",\"total\":99.95},"
            + "{\"id\":\"order-8\",\"createdAt\":\"2026-03-02T09:00:00Z\",\"total\":1.25}]}";

        List<Mismatch> mismatches = matcher.compare(expected, new ProviderResponse(200, JSON_HEADERS, actual));

        assertTrue(mismatches.isEmpty(), mismatches::toString);
    }

    @Test
    void rulesStillRejectWrongShapes() throws Exception {
        Map<String, MatchingRule> rules = new LinkedHashMap<>();
        rules.put("$.body.orders", new MatchingRule(MatchingRule.Type.TYPE, null, null, 1, null));
        rules.put("$.body.orders[*].createdAt", MatchingRule.regex("\\d{4}-\\d{2}-\\d{2}T.*"));
        rules.put("$.body.count", new MatchingRule(MatchingRule.Type.INTEGER, null, null, null, null));
        ExpectedResponse expected = new ExpectedResponse(200, null,
            json("{\"count\":1,\"orders\":[{\"id\":\"order-1\",\"createdAt\":\"2026-01-15T10:30:00Z\"}]}"),
            new MatchingRules(rules));

        List<Mismatch> empty = matcher.compare(expected,
            new ProviderResponse(200, JSON_HEADERS, "{\"count\":1.5,\"orders\":[]}"));
        assertEquals(List.of("$.body.count", "$.body.orders"), paths(empty));

        List<Mismatch> wrong = matcher.compare(expected, new ProviderResponse(200, JSON_HEADERS,
            "{\"count\":3,\"orders\":[{\"id\":7,\"createdAt\":\"yesterday\"}]}"));
        assertEquals(List.of("$.body.orders[0].id", "$.body.orders[0].createdAt"), paths(wrong));
    }

    @Test
    void decimalsKeepTheirScaleForRegexAndInclude() throws Exception {
        Map<String, MatchingRule> rules = new LinkedHashMap<>();
        rules.put("$.body.price", MatchingRule.regex("\\d+\\.\\d{2}"));
        rules.put("$.body.rate", new MatchingRule(MatchingRule.Type.INCLUDE, null, "0.0000", null, null));
        ExpectedResponse expected = new ExpectedResponse(200, null,
            json("{\"price\":100.00,\"rate\":0.00000125}"), new MatchingRules(rules));

        List<Mismatch> matching = matcher.compare(expected,
            new ProviderResponse(200, JSON_HEADERS, "{\"price\":100.00,\"rate\":0.00000125}"));
        assertTrue(matching.isEmpty(), matching::toString);

        List<Mismatch> wrongScale = matcher.compare(expected,
            new ProviderResponse(200, JSON_HEADERS, "{\"price\":100.0,\"rate\":0.00000125}"));
        assertEquals(List.of("$.body.price"), paths(wrongScale));
        assertEquals("100.0", wrongScale.get(0).actual());
    }

    @Test
    void unparseableJsonBodyIsSingleMismatch() throws Exception {
        ExpectedResponse expected = new ExpectedResponse(200, null, json("{\"id\":1}"), null);

        List<Mismatch> mismatches = matcher.compare(expected, new ProviderResponse(200, JSON_HEADERS, "<html>"));

        assertEquals(1, mismatches.size());
        assertEquals("$.body", mismatches.get(0).path());
    }

    @Test
    void textBodiesCompareLiterally() {
        ExpectedResponse expected = new ExpectedResponse(200, null, TextNode.valueOf("pong"), null);
        Map<String, List<String>> text = Map.of("Content-Type", List.of("text/plain"));

        assertTrue(matcher.compare(expected, new ProviderResponse(200, text, "pong")).isEmpty());
        assertEquals(1, matcher.compare(expected, new ProviderResponse(200, text, "ping")).size());
    }

    @Test
    void absentExpectedBodyIsNotChecked() {
        ExpectedResponse expected = new ExpectedResponse(204, null, null, null);

        assertTrue(matcher.compare(expected, new ProviderResponse(204, null, "anything")).isEmpty());
    }

    @Test
    void verdictCarriesInteractionIdentity() throws Exception {
        Interaction interaction = new Interaction("get order", "order exists",
            new ExpectedRequest("GET", "/orders/1", null, null, null),
            new ExpectedResponse(200, null, json("{\"id\":1}"), null));

        InteractionVerdict passed = matcher.match(interaction, new ProviderResponse(200, JSON_HEADERS, "{\"id\":1}"));
        InteractionVerdict failed = matcher.match(interaction, new ProviderResponse(500, JSON_HEADERS, "{\"id\":1}"));

        assertTrue(passed.matched());
        assertEquals("order exists", passed.providerState());
        assertFalse(failed.matched());
        assertEquals(ErrorCode.MISMATCH_FOUND, failed.failure());
        assertEquals(1, failed.mismatches().size());
    }

    private static JsonNode json(String text) throws Exception {
        return Json.mapper().readTree(text);
    }

    private static List<String> paths(List<Mismatch> mismatches) {
        return mismatches.stream().map(Mismatch::path).collect(java.util.stream.Collectors.toList());
    }
}
