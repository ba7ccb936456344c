package lyza.internal.json;

import java.util.Objects;

/// Produces the characters of an in-memory `CharSequence`.
public final class CharSequenceProducer extends AbstractCharProducer {

    private final CharSequence text;
    private int offset;

    public CharSequenceProducer(CharSequence text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    int lookahead() {
        return offset < text.length() ? text.charAt(offset) : EOF;
    }

    @Override
    void advance() {
        offset++;
    }
}
