package lyza.json;

/// The JSON `null` literal. All instances are equal; {@link #of()} returns a shared one.
public record JsonNull() implements JsonValue {

    private static final JsonNull INSTANCE = new JsonNull();

    /// {@return the `JsonNull`}
    public static JsonNull of() {
        return INSTANCE;
    }

    @Override
    public JsonKind kind() {
        return JsonKind.NULL;
    }
}
