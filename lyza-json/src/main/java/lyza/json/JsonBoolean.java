package lyza.json;

/// The JSON `true` and `false` literals.
///
/// @param value the boolean value
public record JsonBoolean(boolean value) implements JsonValue {

    public static final JsonBoolean TRUE = new JsonBoolean(true);
    public static final JsonBoolean FALSE = new JsonBoolean(false);

    /// {@return the `JsonBoolean` for the given value}
    public static JsonBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public JsonKind kind() {
        return JsonKind.BOOLEAN;
    }

    @Override
    public boolean bool() {
        return value;
    }
}
