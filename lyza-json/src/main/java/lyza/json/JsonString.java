package lyza.json;

import java.util.Objects;

/// A JSON string.
///
/// The parser stores the characters between the quotes with one rule applied:
/// a backslash is dropped and the character after it is kept as written, so
/// `\n` in the source becomes the letter `n`.
///
/// @param value the string content. Non-null.
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value must not be null");
    }

    /// {@return the `JsonString` holding the given value}
    ///
    /// @throws NullPointerException if `value` is `null`
    public static JsonString of(String value) {
        return new JsonString(value);
    }

    @Override
    public JsonKind kind() {
        return JsonKind.STRING;
    }

    @Override
    public String string() {
        return value;
    }
}
