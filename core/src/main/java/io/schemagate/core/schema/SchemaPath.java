package io.schemagate.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed form of a caller-supplied path such as {@code /ifs:interfaces/interface[name='eth0']/mtu}.
 *
 * <p>Grammar: an optional leading {@code /}, then one or more {@code /}-separated segments of the
 * form {@code [prefix:]name} followed by zero or more predicates {@code [key='value']} or
 * {@code [key="value"]}. Inside a literal a doubled quote character stands for one. Empty segments,
 * a trailing {@code /} and a key repeated within one segment are malformed.
 */
public record SchemaPath(List<Segment> segments) {

    public SchemaPath {
        segments = List.copyOf(segments);
    }

    /** One path step. {@code prefix} is {@code null} when not given. */
    public record Segment(String prefix, String name, Map<String, String> predicates) {
        public Segment {
            predicates = Collections.unmodifiableMap(new LinkedHashMap<>(predicates));
        }

        public boolean hasPredicates() {
            return !predicates.isEmpty();
        }
    }

    /** Parses a path; returns empty if it is malformed. */
    public static Optional<SchemaPath> parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        Scanner scanner = new Scanner(raw);
        return Optional.ofNullable(scanner.path());
    }

    /**
     * Quotes a predicate value with single quotes, or double quotes if it contains a single quote.
     * A value holding both quote characters is single-quoted with each {@code '} doubled, which
     * {@link #parse} reads back as one quote.
     */
    public static String quote(String value) {
        if (value.indexOf('\'') < 0) {
            return "'" + value + "'";
        }
        if (value.indexOf('"') < 0) {
            return "\"" + value + "\"";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /** Renders a predicate suffix such as {@code [name='eth0']}. */
    public static String predicates(Map<String, String> keys) {
        StringBuilder sb = new StringBuilder();
        keys.forEach((k, v) -> sb.append('[').append(k).append('=').append(quote(v)).append(']'));
        return sb.toString();
    }

    private static final class Scanner {

        private final String input;
        private int pos;

        Scanner(String input) {
            this.input = input;
        }

        SchemaPath path() {
            if (peek() == '/') {
                pos++;
            }
            List<Segment> segments = new ArrayList<>();
            while (true) {
                Segment segment = segment();
                if (segment == null) {
                    return null;
                }
                segments.add(segment);
                if (atEnd()) {
                    return new SchemaPath(segments);
                }
                if (peek() != '/') {
                    return null;
                }
                pos++;
            }
        }

        private Segment segment() {
            String first = identifier();
            if (first == null) {
                return null;
            }
            String prefix = null;
            String name = first;
            if (peek() == ':') {
                pos++;
                prefix = first;
                name = identifier();
                if (name == null) {
                    return null;
                }
            }
            Map<String, String> predicates = new LinkedHashMap<>();
            while (peek() == '[') {
                pos++;
                String key = identifier();
                if (key == null || peek() != '=') {
                    return null;
                }
                pos++;
                String value = quoted();
                if (value == null || peek() != ']') {
                    return null;
                }
                pos++;
                if (predicates.putIfAbsent(key, value) != null) {
                    return null;
                }
            }
            return new Segment(prefix, name, predicates);
        }

        private String identifier() {
            int start = pos;
            while (!atEnd() && isNameChar(input.charAt(pos))) {
                pos++;
            }
            return pos > start ? input.substring(start, pos) : null;
        }

        private String quoted() {
            char quote = peek();
            if (quote != '\'' && quote != '"') {
                return null;
            }
            StringBuilder value = new StringBuilder();
            int i = pos + 1;
            while (i < input.length()) {
                char c = input.charAt(i);
                if (c == quote) {
                    // a doubled quote stands for one literal quote
                    if (i + 1 < input.length() && input.charAt(i + 1) == quote) {
                        value.append(quote);
                        i += 2;
                        continue;
                    }
                    pos = i + 1;
                    return value.toString();
                }
                value.append(c);
                i++;
            }
            return null;
        }

        private char peek() {
            return atEnd() ? '\0' : input.charAt(pos);
        }

        private boolean atEnd() {
            return pos >= input.length();
        }
    }

    /** Characters allowed in node, prefix and key names. */
    static boolean isNameChar(char c) {
        return c != '/' && c != '[' && c != ']' && c != '\'' && c != '"' && c != ':' && c != '='
                && !Character.isWhitespace(c);
    }

    /** True if {@code name} is a valid node name. */
    static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!isNameChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
