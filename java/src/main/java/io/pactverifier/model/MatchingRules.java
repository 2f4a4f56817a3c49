package io.pactverifier.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matching rules keyed by JSON-path style expressions such as {@code $.body.items[*].id} or
 * {@code $.headers.Content-Type}. Paths support {@code .key}, {@code ['key']}, {@code [n]} and the wildcards
 * {@code *} (any key) and {@code [*]} (any index).
 */
public final class MatchingRules {

    private static final MatchingRules EMPTY = new MatchingRules(Map.of());

    private final Map<String, MatchingRule> rules;
    private final List<Entry> entries;

    public MatchingRules(Map<String, MatchingRule> rules) {
        this.rules = rules == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        List<Entry> parsed = new ArrayList<>(this.rules.size());
        for (Map.Entry<String, MatchingRule> entry : this.rules.entrySet()) {
            parsed.add(new Entry(tokenize(entry.getKey()), entry.getValue()));
        }
        this.entries = List.copyOf(parsed);
    }

    public static MatchingRules empty() {
        return EMPTY;
    }

    public Map<String, MatchingRule> asMap() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    /**
     * Finds the rule applying to a concrete path. An exact path beats a wildcard one; among wildcard paths the one
     * with the fewest wildcards wins, then declaration order.
     *
     * @return the rule, or {@code null} when none applies.
     */
    public MatchingRule find(String concretePath) {
        if (entries.isEmpty()) {
            return null;
        }
        List<String> target = tokenize(concretePath);
        MatchingRule best = null;
        int bestWildcards = Integer.MAX_VALUE;
        for (Entry entry : entries) {
            int wildcards = wildcardsIfMatching(entry.tokens, target, false);
            if (wildcards >= 0 && wildcards < bestWildcards) {
                best = entry.rule;
                bestWildcards = wildcards;
            }
        }
        return best;
    }

    /**
     * Finds the rule for a response header, comparing header names case-insensitively.
     */
    public MatchingRule findHeader(String headerName) {
        List<String> target = List.of("headers", headerName);
        for (Entry entry : entries) {
            if (wildcardsIfMatching(entry.tokens, target, true) == 0) {
                return entry.rule;
            }
        }
        return null;
    }

    static List<String> tokenize(String path) {
        List<String> tokens = new ArrayList<>();
        if (path == null) {
            return tokens;
        }
        String p = path.trim();
        int i = p.startsWith("$") ? 1 : 0;
        while (i < p.length()) {
            char c = p.charAt(i);
            if (c == '.') {
                int end = i + 1;
                while (end < p.length() && p.charAt(end) != '.' && p.charAt(end) != '[') {
                    end++;
                }
                tokens.add(p.substring(i + 1, end));
                i = end;
            } else if (c == '[') {
                int close = p.indexOf(']', i);
                if (close < 0) {
                    tokens.add(p.substring(i));
                    break;
                }
                String inner = p.substring(i + 1, close).trim();
                if (inner.length() >= 2 && (inner.startsWith("'") || inner.startsWith("\""))) {
                    tokens.add(inner.substring(1, inner.length() - 1));
                } else {
                    tokens.add("[" + inner + "]");
                }
                i = close + 1;
            } else {
                int end = i;
                while (end < p.length() && p.charAt(end) != '.' && p.charAt(end) != '[') {
                    end++;
                }
                tokens.add(p.substring(i, end));
                i = end;
            }
        }
        return tokens;
    }

    private static int wildcardsIfMatching(List<String> pattern, List<String> target, boolean ignoreCase) {
        if (pattern.size() != target.size()) {
            return -1;
        }
        int wildcards = 0;
        for (int i = 0; i < pattern.size(); i++) {
            String expected = pattern.get(i);
            String actual = target.get(i);
            boolean index = isIndex(actual);
            if ("[*]".equals(expected) && index) {
                wildcards++;
            } else if ("*".equals(expected) && !index) {
                wildcards++;
            } else if (ignoreCase ? !expected.equalsIgnoreCase(actual) : !expected.equals(actual)) {
                return -1;
            }
        }
        return wildcards;
    }

    private static boolean isIndex(String token) {
        return token.startsWith("[") && token.endsWith("]");
    }

    @Override
    public String toString() {
        return "MatchingRules" + rules;
    }

    private record Entry(List<String> tokens, MatchingRule rule) {
    }
}
