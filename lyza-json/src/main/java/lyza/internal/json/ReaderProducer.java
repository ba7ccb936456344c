package lyza.internal.json;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.logging.Logger;

/// Produces the characters of a `Reader`, holding one character of lookahead.
///
/// The reader is read through a small buffer and is never closed here; the
/// caller that opened it closes it.
public final class ReaderProducer extends AbstractCharProducer {

    private static final Logger LOG = Logger.getLogger(ReaderProducer.class.getName());

    private static final int NOT_READ = -2;

    private final Reader reader;
    private final char[] buffer = new char[4096];
    private int position;
    private int limit;
    private int current = NOT_READ;

    public ReaderProducer(Reader reader) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    @Override
    int lookahead() {
        if (current == NOT_READ) {
            current = read();
        }
        return current;
    }

    @Override
    void advance() {
        current = NOT_READ;
    }

    private int read() {
        if (position == limit) {
            try {
                final int n = reader.read(buffer, 0, buffer.length);
                if (n <= 0) {
                    // read(char[]) never returns 0 for a non-empty buffer; treat it as end of input
                    return EOF;
                }
                position = 0;
                limit = n;
                LOG.finest(() -> "Buffered " + n + " characters");
            } catch (IOException e) {
                throw new UncheckedIOException("Failed reading JSON input", e);
            }
        }
        return buffer[position++];
    }
}
