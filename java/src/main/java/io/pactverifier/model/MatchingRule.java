package io.pactverifier.model;

import java.util.Locale;

/**
 * A single matching rule attached to a response path.
 *
 * @param type  how the actual value is compared.
 * @param regex pattern for {@link Type#REGEX}; must match the whole actual value.
 * @param value substring for {@link Type#INCLUDE}.
 * @param min   lower bound on the actual array size, or {@code null}.
 * @param max   upper bound on the actual array size, or {@code null}.
 */
public record MatchingRule(Type type, String regex, String value, Integer min, Integer max) {

    public enum Type {
        EQUALITY,
        TYPE,
        REGEX,
        INCLUDE,
        INTEGER,
        DECIMAL,
        NUMBER;

        /**
         * Resolves a rule name as written in pact files ({@code "type"}, {@code "regex"}, ...).
         *
         * @return the type, or {@code null} when the name is unknown.
         */
        public static Type fromName(String name) {
            if (name == null) {
                return null;
            }
            switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "equality":
                    return EQUALITY;
                case "type":
                    return TYPE;
                case "regex":
                    return REGEX;
                case "include":
                    return INCLUDE;
                case "integer":
                    return INTEGER;
                case "decimal":
                    return DECIMAL;
                case "number":
                    return NUMBER;
                default:
                    return null;
            }
        }
    }

    public static MatchingRule anyType() {
        return new MatchingRule(Type.TYPE, null, null, null, null);
    }

    public static MatchingRule regex(String pattern) {
        return new MatchingRule(Type.REGEX, pattern, null, null, null);
    }

    public boolean hasBounds() {
        return min != null || max != null;
    }
}
