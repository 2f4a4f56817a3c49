package io.pactverifier.matching;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.pactverifier.Mismatch;
import io.pactverifier.internal.Json;
import io.pactverifier.model.MatchingRule;
import io.pactverifier.model.MatchingRules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Structural comparison of an expected JSON body against the actual one. Expected content is strict, actual content
 * is permissive: extra object keys and extra array elements in the actual body are allowed.
 */
final class BodyMatcher {

    private static final Pattern SIMPLE_KEY = Pattern.compile("[A-Za-z0-9_\\-]+");

    private static final Comparator<JsonNode> NUMERIC_AWARE = (left, right) -> {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue());
        }
        return left.equals(right) ? 0 : 1;
    };

    private final MatchingRules rules;
    private final List<Mismatch> mismatches = new ArrayList<>();
    private final Map<String, Pattern> patterns = new HashMap<>();

    BodyMatcher(MatchingRules rules) {
        this.rules = rules == null ? MatchingRules.empty() : rules;
    }

    List<Mismatch> mismatches() {
        return List.copyOf(mismatches);
    }

    void compare(String path, JsonNode expected, JsonNode actual, boolean typeOnly) {
        if (actual == null || actual.isMissingNode()) {
            fail(path, expected, MissingNode.getInstance(), "expected " + describe(expected) + " but it was missing");
            return;
        }
        MatchingRule rule = rules.find(path);
        if (rule != null) {
            applyRule(path, rule, expected, actual);
        } else {
            compareStructure(path, expected, actual, typeOnly);
        }
    }

    private void compareStructure(String path, JsonNode expected, JsonNode actual, boolean typeOnly) {
        if (expected.isObject()) {
            if (!actual.isObject()) {
                fail(path, expected, actual, "expected an object but got " + describe(actual));
                return;
            }
            expected.fields().forEachRemaining(field -> {
                String childPath = child(path, field.getKey());
                JsonNode actualChild = actual.get(field.getKey());
                if (actualChild == null) {
                    fail(childPath, field.getValue(), MissingNode.getInstance(), "expected key '" + field.getKey() + "' is missing");
                } else {
                    compare(childPath, field.getValue(), actualChild, typeOnly);
                }
            });
        } else if (expected.isArray()) {
            if (!actual.isArray()) {
                fail(path, expected, actual, "expected an array but got " + describe(actual));
                return;
            }
            if (actual.size() < expected.size()) {
                fail(path, expected, actual, String.format(Locale.ROOT,
                    "expected an array with at least %d element(s) but got %d", expected.size(), actual.size()));
            }
            int common = Math.min(expected.size(), actual.size());
            for (int i = 0; i < common; i++) {
                compare(index(path, i), expected.get(i), actual.get(i), typeOnly);
            }
        } else if (typeOnly) {
            if (!sameType(expected, actual)) {
                fail(path, expected, actual, "expected " + describe(expected) + " but got " + describe(actual));
            }
        } else if (!expected.equals(NUMERIC_AWARE, actual)) {
            fail(path, expected, actual, "expected " + Json.render(expected) + " but got " + Json.render(actual));
        }
    }

    private void applyRule(String path, MatchingRule rule, JsonNode expected, JsonNode actual) {
        switch (rule.type()) {
            case EQUALITY:
                if (!expected.equals(NUMERIC_AWARE, actual)) {
                    fail(path, expected, actual, "expected exactly " + Json.render(expected));
                }
                break;
            case TYPE:
                applyTypeRule(path, rule, expected, actual);
                break;
            case REGEX:
                if (!actual.isValueNode() || actual.isNull() || !pattern(rule.regex()).matcher(text(actual)).matches()) {
                    fail(path, expected, actual, "expected a value matching /" + rule.regex() + "/");
                }
                break;
            case INCLUDE:
                String fragment = rule.value() != null ? rule.value() : text(expected);
                if (!actual.isValueNode() || !text(actual).contains(fragment)) {
                    fail(path, expected, actual, "expected a value including '" + fragment + "'");
                }
                break;
            case INTEGER:
                if (!actual.isIntegralNumber()) {
                    fail(path, expected, actual, "expected an integer but got " + describe(actual));
                }
                break;
            case DECIMAL:
                if (!actual.isNumber() || actual.isIntegralNumber()) {
                    fail(path, expected, actual, "expected a decimal number but got " + describe(actual));
                }
                break;
            case NUMBER:
                if (!actual.isNumber()) {
                    fail(path, expected, actual, "expected a number but got " + describe(actual));
                }
                break;
            default:
                throw new IllegalStateException("unhandled matching rule " + rule.type());
        }
    }

    private void applyTypeRule(String path, MatchingRule rule, JsonNode expected, JsonNode actual) {
        if (expected.isArray()) {
            if (!actual.isArray()) {
                fail(path, expected, actual, "expected an array but got " + describe(actual));
                return;
            }
            if (rule.min() != null && actual.size() < rule.min()) {
                fail(path, expected, actual, String.format(Locale.ROOT,
                    "expected an array with at least %d element(s) but got %d", rule.min(), actual.size()));
            }
            if (rule.max() != null && actual.size() > rule.max()) {
                fail(path, expected, actual, String.format(Locale.ROOT,
                    "expected an array with at most %d element(s) but got %d", rule.max(), actual.size()));
            }
            if (expected.size() > 0) {
                JsonNode template = expected.get(0);
                for (int i = 0; i < actual.size(); i++) {
                    compare(index(path, i), template, actual.get(i), true);
                }
            }
        } else if (expected.isObject()) {
            compareStructure(path, expected, actual, true);
        } else if (!sameType(expected, actual)) {
            fail(path, expected, actual, "expected " + describe(expected) + " but got " + describe(actual));
        }
    }

    private Pattern pattern(String regex) {
        return patterns.computeIfAbsent(regex, Pattern::compile);
    }

    private void fail(String path, JsonNode expected, JsonNode actual, String message) {
        mismatches.add(new Mismatch(Mismatch.Kind.BODY, path, Json.render(expected), Json.render(actual), message));
    }

    /**
     * Text of a value node as written on the wire; decimals keep their scale and never use exponent notation.
     */
    private static String text(JsonNode node) {
        if (node.isBigDecimal()) {
            return node.decimalValue().toPlainString();
        }
        return node.asText();
    }

    private static boolean sameType(JsonNode expected, JsonNode actual) {
        if (expected.isNumber()) {
            return actual.isNumber();
        }
        return expected.getNodeType() == actual.getNodeType();
    }

    private static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    static String child(String path, String key) {
        if (SIMPLE_KEY.matcher(key).matches()) {
            return path + "." + key;
        }
        return path + "['" + key + "']";
    }

    static String index(String path, int i) {
        return path + "[" + i + "]";
    }
}
