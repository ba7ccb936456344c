package lyza.json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// The interface that represents JSON array.
///
/// A `JsonArray` can be produced by {@link Json#parse(String)}.
/// Alternatively, {@link #of(List)} can be used to obtain a `JsonArray`.
///
/// ## Example Usage
/// ```java
/// JsonArray arr = JsonArray.of(List.of(
///     JsonString.of("first"),
///     JsonNumber.of(42),
///     JsonBoolean.of(true)
/// ));
///
/// for (JsonValue value : arr.elements()) {
///     switch (value.kind()) {
///         case STRING -> System.out.println("String: " + value.string());
///         case NUMBER -> System.out.println("Number: " + value.toLong());
///         default -> System.out.println("Other: " + value);
///     }
/// }
/// ```
///
/// @param elements the elements in document order, unmodifiable
public record JsonArray(List<JsonValue> elements) implements JsonValue {

    public JsonArray {
        // Careful not to use List::contains on src for null checking which
        // throws NPE for immutable lists
        final var copy = new ArrayList<JsonValue>(elements.size());
        for (JsonValue element : elements) {
            copy.add(Objects.requireNonNull(element, "array element must not be null"));
        }
        elements = Collections.unmodifiableList(copy);
    }

    /// {@return the `JsonArray` created from the given
    /// list of `JsonValue`s}
    ///
    /// @param src the list of `JsonValue`s. Non-null.
    /// @throws NullPointerException if `src` is `null`, or contains
    ///         any values that are `null`
    public static JsonArray of(List<? extends JsonValue> src) {
        return new JsonArray(List.copyOf(src));
    }

    @Override
    public JsonKind kind() {
        return JsonKind.ARRAY;
    }
}
