package lyza.json;

/// The tag of a {@link JsonValue}.
///
/// Every `JsonValue` reports exactly one kind through {@link JsonValue#kind()},
/// so consumers can dispatch over the closed set of JSON value types with an
/// exhaustive `switch`.
public enum JsonKind {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT;

    /// {@return the name used for this kind in diagnostics, e.g. `JsonObject`}
    public String displayName() {
        return switch (this) {
            case NULL -> "JsonNull";
            case BOOLEAN -> "JsonBoolean";
            case NUMBER -> "JsonNumber";
            case STRING -> "JsonString";
            case ARRAY -> "JsonArray";
            case OBJECT -> "JsonObject";
        };
    }
}
