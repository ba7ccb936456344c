package lyza.json;

import lyza.internal.json.Utils;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The interface that represents a JSON value.
///
/// The set of implementations is closed: a value is exactly one of
/// {@link JsonNull}, {@link JsonBoolean}, {@link JsonNumber}, {@link JsonString},
/// {@link JsonArray} or {@link JsonObject}, and {@link #kind()} names which.
/// Instances are immutable and thread safe.
///
/// A `JsonValue` tree is produced by {@link Json#parse(String)}. Each value owns
/// its children; no value is shared between two parents of the same parse.
public sealed interface JsonValue
        permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

    /// {@return the tag of this value}
    JsonKind kind();

    /// {@return the `boolean` value represented by a `JsonBoolean`}
    default boolean bool() {
        throw Utils.composeTypeError(this, JsonKind.BOOLEAN);
    }

    /// {@return this `JsonValue` as a `double`}
    default double toDouble() {
        throw Utils.composeTypeError(this, JsonKind.NUMBER);
    }

    /// {@return this `JsonValue` as a `long`}
    /// Only whole numbers within the range of `long` convert.
    default long toLong() {
        throw Utils.composeTypeError(this, JsonKind.NUMBER);
    }

    /// {@return the `String` value represented by a `JsonString`}
    default String string() {
        throw Utils.composeTypeError(this, JsonKind.STRING);
    }

    /// {@return an `Optional` containing this `JsonValue` if it is not a
    /// `JsonNull`, otherwise an empty `Optional`}
    default Optional<JsonValue> valueOrNull() {
        return kind() == JsonKind.NULL ? Optional.empty() : Optional.of(this);
    }

    /// {@return the {@link JsonArray#elements() elements} of a `JsonArray`}
    default List<JsonValue> elements() {
        throw Utils.composeTypeError(this, JsonKind.ARRAY);
    }

    /// {@return the {@link JsonObject#members() members} of a `JsonObject`}
    default Map<String, JsonValue> members() {
        throw Utils.composeTypeError(this, JsonKind.OBJECT);
    }

    /// {@return the `JsonValue` associated with the given member name of a `JsonObject`}
    ///
    /// @param name the member name
    /// @throws NullPointerException if the member name is `null`
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonObject` or
    ///         there is no association with the member name
    default JsonValue get(String name) {
        Objects.requireNonNull(name);
        final JsonValue member = members().get(name);
        if (member == null) {
            throw Utils.composeError(this,
                    "JsonObject member \"%s\" does not exist.".formatted(name));
        }
        return member;
    }

    /// {@return an `Optional` containing the `JsonValue` associated with the given member
    /// name of a `JsonObject`, otherwise if there is no association an empty `Optional`}
    ///
    /// @param name the member name
    /// @throws NullPointerException if the member name is `null`
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonObject`
    default Optional<JsonValue> getOrAbsent(String name) {
        Objects.requireNonNull(name);
        return Optional.ofNullable(members().get(name));
    }

    /// {@return the `JsonValue` associated with the given index of a `JsonArray`}
    ///
    /// @param index the index of the array
    /// @throws JsonAssertionException if this `JsonValue` is not a `JsonArray`
    ///         or the given index is outside the bounds
    default JsonValue element(int index) {
        final List<JsonValue> elements = elements();
        try {
            return elements.get(index);
        } catch (IndexOutOfBoundsException ex) {
            throw Utils.composeError(this,
                    "JsonArray index %d out of bounds for length %d."
                            .formatted(index, elements.size()));
        }
    }
}
