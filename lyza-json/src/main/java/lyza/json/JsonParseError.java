package lyza.json;

/// The kinds of syntax failure a parse can end with.
public enum JsonParseError {
    /// A required literal character (`{ } [ ] , : "` or a keyword letter) did not match.
    UNEXPECTED_CHARACTER,
    /// The lookahead starts none of the JSON value kinds.
    EXPECTED_VALUE,
    /// Inside an object, the next token is not a quoted member name.
    EXPECTED_KEY,
    /// Digits the number grammar requires are missing.
    MALFORMED_NUMBER,
    /// The input ended inside a string literal.
    UNTERMINATED_STRING,
    /// Something other than whitespace follows the root object.
    TRAILING_CONTENT
}
