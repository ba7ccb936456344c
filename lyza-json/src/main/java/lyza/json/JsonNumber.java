package lyza.json;

/// A JSON number, held as a 64-bit floating point value.
///
/// Whether the source text was written as an integer or with a fraction or
/// exponent is not retained: `1`, `1.0` and `10e-1` all produce the same
/// `JsonNumber`.
///
/// Literals too large for a `double` parse to positive or negative infinity.
///
/// @param value the numeric value, never NaN; finite when created by
///              {@link #of(double)}
public record JsonNumber(double value) implements JsonValue {

    public JsonNumber {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Not a valid JSON number: " + value);
        }
    }

    /// Creates a JSON number from the given `double` value.
    ///
    /// @param value the given `double` value.
    /// @return a JSON number created from the `double` value
    /// @throws IllegalArgumentException if the given `double` value
    ///         is not a finite floating-point value.
    public static JsonNumber of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a valid JSON number: " + value);
        }
        return new JsonNumber(value);
    }

    @Override
    public JsonKind kind() {
        return JsonKind.NUMBER;
    }

    @Override
    public double toDouble() {
        return value;
    }

    /// {@return this number as a `long`}
    ///
    /// @throws JsonAssertionException if the value has a fractional part or is
    ///         outside the range of `long`
    @Override
    public long toLong() {
        // 2^63 is exactly representable, so the upper bound is exclusive
        if (value != Math.rint(value) || value < -0x1p63 || value >= 0x1p63) {
            throw new JsonAssertionException(
                    "JsonNumber %s cannot be represented as a long.".formatted(value));
        }
        return (long) value;
    }
}
