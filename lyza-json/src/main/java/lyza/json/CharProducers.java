package lyza.json;

import lyza.internal.json.CharSequenceProducer;
import lyza.internal.json.ReaderProducer;

import java.io.Reader;

/// Factories for the {@link CharProducer}s bundled with this library.
///
/// Applications that already own a character source can implement
/// `CharProducer` themselves; these cover the common in-memory and `Reader` cases.
public final class CharProducers {

    private CharProducers() {
        throw new AssertionError("CharProducers cannot be instantiated");
    }

    /// {@return a producer over the characters of `text`}
    ///
    /// @throws NullPointerException if `text` is `null`
    public static CharProducer of(CharSequence text) {
        return new CharSequenceProducer(text);
    }

    /// {@return a producer over the characters of `reader`}
    ///
    /// The reader is not closed by the producer. Read failures surface as
    /// `java.io.UncheckedIOException`.
    ///
    /// @throws NullPointerException if `reader` is `null`
    public static CharProducer of(Reader reader) {
        return new ReaderProducer(reader);
    }
}
