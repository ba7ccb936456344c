package lyza.json;

import java.util.Objects;

/// Thrown when the input does not conform to the JSON grammar accepted by
/// {@link Json#parse(String)}.
///
/// The message is rendered as `{line}:{column}: {reason}`, where line and
/// column are 1-based and locate the character at which parsing failed. Some
/// failures also carry the input that was left unread at that point.
public class JsonParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final JsonParseError error;
    private final int line;
    private final int column;
    private final String reason;
    private final String remainingInput;

    /// Creates a new parse exception.
    /// @param error the kind of failure
    /// @param line the 1-based line of the offending character
    /// @param column the 1-based column of the offending character
    /// @param reason the human-readable description
    public JsonParseException(JsonParseError error, int line, int column, String reason) {
        this(error, line, column, reason, null);
    }

    /// Creates a new parse exception that carries the unread input.
    /// @param error the kind of failure
    /// @param line the 1-based line of the offending character
    /// @param column the 1-based column of the offending character
    /// @param reason the human-readable description
    /// @param remainingInput the input left unread when parsing failed, possibly abbreviated, or `null`
    public JsonParseException(JsonParseError error, int line, int column, String reason, String remainingInput) {
        super(formatMessage(line, column, reason, remainingInput));
        this.error = Objects.requireNonNull(error, "error must not be null");
        this.line = line;
        this.column = column;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.remainingInput = remainingInput;
    }

    /// Returns the kind of failure.
    public JsonParseError error() {
        return error;
    }

    /// Returns the 1-based line at which parsing failed.
    public int line() {
        return line;
    }

    /// Returns the 1-based column at which parsing failed.
    public int column() {
        return column;
    }

    /// Returns the description of the failure without the position prefix.
    public String reason() {
        return reason;
    }

    /// Returns the unread input captured for diagnostics, or null if this failure does not capture it.
    public String remainingInput() {
        return remainingInput;
    }

    private static String formatMessage(int line, int column, String reason, String remainingInput) {
        final var sb = new StringBuilder();
        sb.append(line).append(':').append(column).append(": ").append(reason);
        if (remainingInput != null) {
            sb.append(", remaining input: \"").append(remainingInput).append('"');
        }
        return sb.toString();
    }
}
