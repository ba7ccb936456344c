package lyza.json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// The interface that represents JSON object.
///
/// A `JsonObject` can be produced by a {@link Json#parse(String)}.
/// Alternatively, {@link #of(Map)} can be used to obtain a `JsonObject`.
/// Member names are unique. When a document repeats a name, the value
/// written last is the one kept.
///
/// ## Example Usage
/// ```java
/// JsonObject obj = Json.parse("{\"name\": \"Alice\", \"age\": 30}");
/// String name = obj.get("name").string();   // "Alice"
/// long age = obj.get("age").toLong();       // 30
/// ```
///
/// @param members the members, unmodifiable, in the order names first appeared
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

    public JsonObject {
        final var copy = new LinkedHashMap<String, JsonValue>(Math.max(16, members.size() * 2));
        members.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "member name must not be null"),
                Objects.requireNonNull(value, "member value must not be null")));
        members = Collections.unmodifiableMap(copy);
    }

    /// {@return the `JsonObject` created from the given
    /// map of `String` to `JsonValue`s}
    ///
    /// The `JsonObject`'s members occur in the same order as the given
    /// map's entries.
    ///
    /// @param map the map of `JsonValue`s. Non-null.
    /// @throws NullPointerException if `map` is `null`, contains
    ///         any keys that are `null`, or contains any values that are `null`.
    public static JsonObject of(Map<String, ? extends JsonValue> map) {
        return new JsonObject(Collections.unmodifiableMap(map));
    }

    @Override
    public JsonKind kind() {
        return JsonKind.OBJECT;
    }
}
