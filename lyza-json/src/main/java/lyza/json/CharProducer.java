package lyza.json;

/// A source of characters for the parser.
///
/// A producer hands out one character at a time with a single character of
/// lookahead and keeps track of where in the input it is, so that parse
/// failures can name a line and column. It also knows what JSON whitespace is
/// and can hide it from the parser between tokens.
///
/// Whitespace skipping is a mode switched by {@link #skipWhitespace(boolean)}.
/// While it is on, whitespace is passed over before every {@link #peek()},
/// {@link #next()} and {@link #atEnd()}. While it is off, every character is
/// delivered as it appears in the input, which is what string literals need.
///
/// Producers are stateful and not thread safe. Use one producer per parse.
///
/// @see CharProducers
public interface CharProducer {

    /// Returned by {@link #peek()} and {@link #next()} once the input is exhausted.
    int EOF = -1;

    /// {@return the next character without consuming it, or {@link #EOF}}
    int peek();

    /// Consumes the next character.
    ///
    /// @return the consumed character, or {@link #EOF} if there is none; the
    ///         position does not move past the end
    int next();

    /// {@return `true` if no characters remain}
    boolean atEnd();

    /// Switches whitespace skipping on or off.
    ///
    /// @param consumeTrailing `true` to pass over whitespace now and ahead of
    ///        every following read, `false` to deliver whitespace verbatim from
    ///        here on
    void skipWhitespace(boolean consumeTrailing);

    /// {@return the 1-based line of the next character to be read}
    int line();

    /// {@return the 1-based column of the next character to be read}
    int column();
}
