package lyza.json;

import lyza.internal.json.JsonParser;

import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// This class provides static methods for producing and converting a {@link JsonValue} tree.
///
/// {@link #parse(String)} and its overloads produce a `JsonObject` by parsing
/// JSON text whose root is an object. A bare array, string, number, boolean or
/// `null` at the top level is rejected.
///
/// {@link #toUntyped(JsonValue)} converts a tree to plain Java collections.
///
/// ## Example Usage
/// ```java
/// JsonObject doc = Json.parse("{\"name\":\"John\",\"tags\":[\"a\",\"b\"]}");
/// String name = doc.get("name").string();
/// Map<String, Object> data = (Map<String, Object>) Json.toUntyped(doc);
/// ```
///
/// Parsing is limited in two known ways. A backslash in a string keeps the
/// character after it verbatim (`\n` becomes `n`), and exponents are applied
/// as a separate power of ten after the mantissa has been converted.
public final class Json {

    private Json() {
        throw new AssertionError("Json cannot be instantiated");
    }

    /// Parses the given JSON document with {@link JsonParserOptions#DEFAULT}.
    ///
    /// @param in the input JSON document as `String`. Non-null.
    /// @throws JsonParseException if the input is not a JSON object document
    /// @throws NullPointerException if `in` is `null`
    /// @return the root object
    public static JsonObject parse(String in) {
        return parse(in, JsonParserOptions.DEFAULT);
    }

    /// Parses the given JSON document.
    ///
    /// @param in the input JSON document as `String`. Non-null.
    /// @param options the parser options. Non-null.
    /// @throws JsonParseException if the input is not a JSON object document
    /// @throws NullPointerException if `in` or `options` is `null`
    /// @return the root object
    public static JsonObject parse(String in, JsonParserOptions options) {
        Objects.requireNonNull(in);
        return parse(CharProducers.of(in), options);
    }

    /// Parses the JSON document read from `in`. The reader is not closed.
    ///
    /// @param in the reader supplying the document. Non-null.
    /// @throws JsonParseException if the input is not a JSON object document
    /// @throws java.io.UncheckedIOException if reading fails
    /// @throws NullPointerException if `in` is `null`
    /// @return the root object
    public static JsonObject parse(Reader in) {
        return parse(in, JsonParserOptions.DEFAULT);
    }

    /// Parses the JSON document read from `in` with the given options. The reader is not closed.
    ///
    /// @param in the reader supplying the document. Non-null.
    /// @param options the parser options. Non-null.
    /// @throws JsonParseException if the input is not a JSON object document
    /// @throws java.io.UncheckedIOException if reading fails
    /// @throws NullPointerException if `in` or `options` is `null`
    /// @return the root object
    public static JsonObject parse(Reader in, JsonParserOptions options) {
        Objects.requireNonNull(in);
        return parse(CharProducers.of(in), options);
    }

    /// Parses the JSON document supplied by a caller-provided producer.
    ///
    /// @param in the producer. Non-null, and not shared with another parse.
    /// @throws JsonParseException if the input is not a JSON object document
    /// @throws NullPointerException if `in` is `null`
    /// @return the root object
    public static JsonObject parse(CharProducer in) {
        return parse(in, JsonParserOptions.DEFAULT);
    }

    /// Parses the JSON document supplied by a caller-provided producer with the given options.
    ///
    /// @param in the producer. Non-null, and not shared with another parse.
    /// @param options the parser options. Non-null.
    /// @throws JsonParseException if the input is not a JSON object document
    /// @throws NullPointerException if `in` or `options` is `null`
    /// @return the root object
    public static JsonObject parse(CharProducer in, JsonParserOptions options) {
        return new JsonParser(in, options).parseDocument();
    }

    /// {@return a plain Java object equivalent to the given `JsonValue`}
    ///
    /// | JsonValue | Untyped Object |
    /// |-----------|----------------|
    /// | `JsonObject` | `Map<String, Object>`, in member order |
    /// | `JsonArray` | `List<Object>` |
    /// | `JsonString` | `String` |
    /// | `JsonNumber` | `Double` |
    /// | `JsonBoolean` | `Boolean` |
    /// | `JsonNull` | `null` |
    ///
    /// The returned collections are mutable copies owned by the caller.
    ///
    /// @param src the value to convert. Non-null.
    /// @throws NullPointerException if `src` is `null`
    public static Object toUntyped(JsonValue src) {
        Objects.requireNonNull(src);
        return switch (src.kind()) {
            case OBJECT -> {
                final Map<String, Object> map = new LinkedHashMap<>();
                src.members().forEach((name, value) -> map.put(name, toUntyped(value)));
                yield map;
            }
            case ARRAY -> {
                final List<Object> list = new ArrayList<>(src.elements().size());
                for (JsonValue element : src.elements()) {
                    list.add(toUntyped(element));
                }
                yield list;
            }
            case STRING -> src.string();
            case NUMBER -> src.toDouble();
            case BOOLEAN -> src.bool();
            case NULL -> null;
        };
    }
}
