package com.intteq.reliable.message.broker.routing;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Compiled topic pattern.
 *
 * <p>Patterns are dot-separated segments. {@code *} matches exactly one non-empty segment
 * made of letters, digits and hyphens; {@code #} matches one or more characters, dots
 * included, so it spans one or more segments. Every other segment matches literally and the
 * whole routing key must match.
 *
 * <pre>
 *   compile("orders.*.created").matches("orders.eu.created")    // true
 *   compile("orders.#").matches("orders.eu.created")             // true
 *   compile("orders.#").matches("orders")                        // false
 * </pre>
 */
@Getter
@EqualsAndHashCode(of = "pattern")
public final class RoutingKeyMatcher {

    private static final String ONE_SEGMENT = "[a-zA-Z0-9-]+";
    private static final String ONE_OR_MORE_SEGMENTS = ".+";
    private static final String SEPARATOR = "\\.";

    private final String pattern;
    private final Pattern regex;

    private RoutingKeyMatcher(String pattern, Pattern regex) {
        this.pattern = pattern;
        this.regex = regex;
    }

    public static RoutingKeyMatcher compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("routing key pattern must not be empty");
        }

        StringBuilder expression = new StringBuilder("^");
        String[] segments = pattern.split("\\.", -1);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                expression.append(SEPARATOR);
            }
            String segment = segments[i];
            switch (segment) {
                case "*" -> expression.append(ONE_SEGMENT);
                case "#" -> expression.append(ONE_OR_MORE_SEGMENTS);
                default -> expression.append(Pattern.quote(segment));
            }
        }
        expression.append('$');

        return new RoutingKeyMatcher(pattern, Pattern.compile(expression.toString()));
    }

    public boolean matches(String routingKey) {
        return routingKey != null && regex.matcher(routingKey).matches();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
