package io.recovery.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} restricted to flat string-valued objects.
 */
public final class FlatJsonCodec implements JsonCodec {
    static final FlatJsonCodec INSTANCE = new FlatJsonCodec();

    private FlatJsonCodec() {
    }

    @Override
    public String toJson(Map<String, String> values) {
        StringBuilder out = new StringBuilder("{");
        if (values != null) {
            boolean first = true;
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getKey() == null) {
                    throw new IllegalArgumentException("JSON object keys must not be null");
                }
                if (!first) {
                    out.append(',');
                }
                first = false;
                appendString(out, entry.getKey());
                out.append(':');
                if (entry.getValue() == null) {
                    out.append("null");
                } else {
                    appendString(out, entry.getValue());
                }
            }
        }
        return out.append('}').toString();
    }

    @Override
    public Map<String, String> parseObject(String json) {
        Map<String, String> result = new LinkedHashMap<>();
        if (json == null || json.isBlank() || "null".equals(json.trim())) {
            return result;
        }
        Cursor cursor = new Cursor(json);
        cursor.expect('{');
        if (cursor.consumeIf('}')) {
            cursor.expectEnd();
            return result;
        }
        do {
            String key = cursor.readString();
            cursor.expect(':');
            if (cursor.consumeLiteral("null")) {
                continue;
            }
            result.put(key, cursor.readString());
        } while (cursor.consumeIf(','));
        cursor.expect('}');
        cursor.expectEnd();
        return result;
    }

    private static void appendString(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        void expect(char c) {
            if (!consumeIf(c)) {
                throw new IllegalArgumentException("Expected '" + c + "' at position " + pos);
            }
        }

        boolean consumeIf(char c) {
            skipWhitespace();
            if (pos < text.length() && text.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }

        boolean consumeLiteral(String literal) {
            skipWhitespace();
            if (text.startsWith(literal, pos)) {
                pos += literal.length();
                return true;
            }
            return false;
        }

        void expectEnd() {
            skipWhitespace();
            if (pos != text.length()) {
                throw new IllegalArgumentException("Trailing characters at position " + pos);
            }
        }

        String readString() {
            expect('"');
            StringBuilder value = new StringBuilder();
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return value.toString();
                }
                if (c != '\\') {
                    value.append(c);
                    continue;
                }
                if (pos >= text.length()) {
                    break;
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case '"', '\\', '/' -> value.append(escaped);
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case 'b' -> value.append('\b');
                    case 'f' -> value.append('\f');
                    case 'u' -> {
                        if (pos + 4 > text.length()) {
                            throw new IllegalArgumentException("Truncated unicode escape");
                        }
                        try {
                            value.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Invalid unicode escape", e);
                        }
                        pos += 4;
                    }
                    default -> throw new IllegalArgumentException("Unsupported escape \\" + escaped);
                }
            }
            throw new IllegalArgumentException("Unterminated string");
        }
    }
}
