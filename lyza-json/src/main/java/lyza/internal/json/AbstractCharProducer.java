package lyza.internal.json;

import lyza.json.CharProducer;

/// Position tracking and the whitespace mode shared by the bundled producers.
/// Subclasses only supply raw one-character lookahead over their source.
abstract sealed class AbstractCharProducer implements CharProducer
        permits CharSequenceProducer, ReaderProducer {

    private int line = 1;
    private int column = 1;
    private boolean skipping;

    /// {@return the next raw character, or `EOF`, without consuming it}
    abstract int lookahead();

    /// Moves past the character last returned by {@link #lookahead()}.
    abstract void advance();

    @Override
    public final int peek() {
        skipIfEnabled();
        return lookahead();
    }

    @Override
    public final int next() {
        skipIfEnabled();
        return consume();
    }

    @Override
    public final boolean atEnd() {
        skipIfEnabled();
        return lookahead() == EOF;
    }

    @Override
    public final void skipWhitespace(boolean consumeTrailing) {
        skipping = consumeTrailing;
        skipIfEnabled();
    }

    @Override
    public final int line() {
        return line;
    }

    @Override
    public final int column() {
        return column;
    }

    private void skipIfEnabled() {
        if (!skipping) {
            return;
        }
        while (Utils.isWhitespace(lookahead())) {
            consume();
        }
    }

    private int consume() {
        final int c = lookahead();
        if (c == EOF) {
            return EOF;
        }
        advance();
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }
}
