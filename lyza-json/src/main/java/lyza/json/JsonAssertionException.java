package lyza.json;

/// Signals that a {@link JsonValue} was accessed as a kind it is not, or that
/// a member or element being navigated to does not exist.
public class JsonAssertionException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// Creates a new assertion exception with the given message.
    /// @param message the error message
    public JsonAssertionException(String message) {
        super(message);
    }
}
