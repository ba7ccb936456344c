package lyza.internal.json;

import lyza.json.JsonAssertionException;
import lyza.json.JsonKind;
import lyza.json.JsonValue;

/// Shared helpers for the value model and the parser.
public final class Utils {

    private Utils() {
        throw new AssertionError("Utils cannot be instantiated");
    }

    /// ASCII `'0'..'9'` only; `Character.isDigit` would also accept other
    /// Unicode decimal digits.
    public static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    /// JSON insignificant whitespace as defined by RFC 8259.
    public static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    /// Renders a character read from a producer for an error message.
    public static String describe(int c) {
        if (c < 0) {
            return "end of input";
        }
        return switch (c) {
            case '\n' -> "'\\n'";
            case '\r' -> "'\\r'";
            case '\t' -> "'\\t'";
            default -> c < ' '
                    ? "'\\u%04x'".formatted(c)
                    : "'" + (char) c + "'";
        };
    }

    public static JsonAssertionException composeTypeError(JsonValue jv, JsonKind expected) {
        return composeError(jv, "%s is not a %s.".formatted(jv.kind().displayName(), expected.displayName()));
    }

    public static JsonAssertionException composeError(JsonValue jv, String message) {
        return new JsonAssertionException(message + " Actual value: " + abbreviate(jv));
    }

    private static String abbreviate(JsonValue jv) {
        final String text = String.valueOf(jv);
        return text.length() <= 60 ? text : text.substring(0, 57) + "...";
    }
}
