package lyza.json;

import java.util.Locale;
import java.util.logging.Logger;

/// Knobs for the leniency and diagnostics of {@link Json#parse(String, JsonParserOptions)}.
///
/// {@link #DEFAULT} is built from system properties read once, when this class
/// is initialised:
///
/// | Property | Default |
/// |----------|---------|
/// | `lyza.json.strictExponent` | `false` |
/// | `lyza.json.allowTrailingContent` | `false` |
/// | `lyza.json.diagnosticTailLimit` | `64` |
///
/// Invalid property values are logged and ignored.
///
/// @param strictExponent reject an exponent marker (`e`/`E`) that has no digits
///        after it; when `false` such an exponent counts as zero
/// @param allowTrailingContent ignore whatever follows the root object instead
///        of failing
/// @param diagnosticTailLimit the most characters of unread input quoted in a
///        parse failure message; `0` quotes none
public record JsonParserOptions(boolean strictExponent, boolean allowTrailingContent, int diagnosticTailLimit) {

    private static final Logger LOG = Logger.getLogger(JsonParserOptions.class.getName());

    public static final String STRICT_EXPONENT_PROPERTY = "lyza.json.strictExponent";
    public static final String ALLOW_TRAILING_CONTENT_PROPERTY = "lyza.json.allowTrailingContent";
    public static final String DIAGNOSTIC_TAIL_LIMIT_PROPERTY = "lyza.json.diagnosticTailLimit";

    static final int DEFAULT_DIAGNOSTIC_TAIL_LIMIT = 64;

    /// The options in effect when none are given.
    public static final JsonParserOptions DEFAULT = fromSystemProperties();

    public JsonParserOptions {
        if (diagnosticTailLimit < 0) {
            throw new IllegalArgumentException("diagnosticTailLimit must not be negative: " + diagnosticTailLimit);
        }
    }

    /// {@return a copy of these options with `strictExponent` replaced}
    public JsonParserOptions strictExponent(boolean strictExponent) {
        return new JsonParserOptions(strictExponent, allowTrailingContent, diagnosticTailLimit);
    }

    /// {@return a copy of these options with `allowTrailingContent` replaced}
    public JsonParserOptions allowTrailingContent(boolean allowTrailingContent) {
        return new JsonParserOptions(strictExponent, allowTrailingContent, diagnosticTailLimit);
    }

    /// {@return a copy of these options with `diagnosticTailLimit` replaced}
    public JsonParserOptions diagnosticTailLimit(int diagnosticTailLimit) {
        return new JsonParserOptions(strictExponent, allowTrailingContent, diagnosticTailLimit);
    }

    static JsonParserOptions fromSystemProperties() {
        final boolean strictExponent = booleanProperty(STRICT_EXPONENT_PROPERTY, false);
        final boolean allowTrailingContent = booleanProperty(ALLOW_TRAILING_CONTENT_PROPERTY, false);
        final int tailLimit = tailLimitProperty();
        final var options = new JsonParserOptions(strictExponent, allowTrailingContent, tailLimit);
        LOG.fine(() -> "Default parser options: " + options);
        return options;
    }

    private static boolean booleanProperty(String key, boolean defaultValue) {
        final String value = System.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true" -> true;
            case "false" -> false;
            default -> {
                LOG.warning(() -> "Invalid value for " + key + ": " + value + ". Using default: " + defaultValue);
                yield defaultValue;
            }
        };
    }

    private static int tailLimitProperty() {
        final String value = System.getProperty(DIAGNOSTIC_TAIL_LIMIT_PROPERTY);
        if (value == null) {
            return DEFAULT_DIAGNOSTIC_TAIL_LIMIT;
        }
        try {
            final int parsed = Integer.parseInt(value.trim());
            if (parsed >= 0) {
                return parsed;
            }
        } catch (NumberFormatException ignored) {
            // reported below
        }
        LOG.warning(() -> "Invalid value for " + DIAGNOSTIC_TAIL_LIMIT_PROPERTY + ": " + value
                + ". Using default: " + DEFAULT_DIAGNOSTIC_TAIL_LIMIT);
        return DEFAULT_DIAGNOSTIC_TAIL_LIMIT;
    }
}
