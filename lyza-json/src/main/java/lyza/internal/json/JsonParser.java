package lyza.internal.json;

import lyza.json.CharProducer;
import lyza.json.JsonArray;
import lyza.json.JsonBoolean;
import lyza.json.JsonNull;
import lyza.json.JsonNumber;
import lyza.json.JsonObject;
import lyza.json.JsonParseError;
import lyza.json.JsonParseException;
import lyza.json.JsonParserOptions;
import lyza.json.JsonString;
import lyza.json.JsonValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.logging.Logger;

/// Recursive descent parser from a {@link CharProducer} to a tree of `JsonValue`s.
///
/// There is one grammar rule per value kind. Each rule decides from a single
/// character of lookahead, consumes exactly the characters of its construct
/// and returns the finished value, or throws `JsonParseException` without
/// returning anything partial.
///
/// Between tokens the producer runs with whitespace skipping on. Rules that
/// read a token character by character (strings, numbers, keywords) switch it
/// off for the duration of the token and back on once it is complete.
///
/// A parser is bound to one producer and is not thread safe.
public final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    private final CharProducer in;
    private final JsonParserOptions options;

    public JsonParser(CharProducer in) {
        this(in, JsonParserOptions.DEFAULT);
    }

    public JsonParser(CharProducer in, JsonParserOptions options) {
        this.in = Objects.requireNonNull(in, "producer must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /// Parses a whole document. The root must be an object.
    ///
    /// @return the root object
    /// @throws JsonParseException if the input is not a JSON object document
    public JsonObject parseDocument() {
        LOG.fine(() -> "Parsing document with " + options);
        in.skipWhitespace(true);
        final JsonObject root = parseObject();
        if (!options.allowTrailingContent() && !in.atEnd()) {
            throw failure(JsonParseError.TRAILING_CONTENT, "unexpected trailing content after the root object");
        }
        LOG.fine(() -> "Parsed document root with " + root.members().size() + " members");
        return root;
    }

    /// Parses any one value, dispatching on the lookahead character.
    public JsonValue parseValue() {
        final int c = in.peek();
        return switch (c) {
            case '"' -> parseString();
            case '[' -> parseArray();
            case '{' -> parseObject();
            case 't', 'f' -> parseBoolean();
            case 'n' -> parseNull();
            default -> {
                if (c == '-' || Utils.isDigit(c)) {
                    yield parseNumber();
                }
                throw failure(JsonParseError.EXPECTED_VALUE, "expected value");
            }
        };
    }

    public JsonObject parseObject() {
        expect('{');
        final var members = new LinkedHashMap<String, JsonValue>();
        if (has('}')) {
            in.next();
            LOG.finer("Parsed empty object");
            return new JsonObject(members);
        }

        boolean more = true;
        while (more) {
            if (!has('"')) {
                throw failure(JsonParseError.EXPECTED_KEY, "expected key");
            }
            final String key = parseString().value();
            expect(':');
            final JsonValue value = parseValue();
            if (members.put(key, value) != null) {
                LOG.finer(() -> "Duplicate member name \"" + key + "\", keeping the later value");
            }
            more = mayHave(',');
        }
        expect('}');

        LOG.finer(() -> "Parsed object with " + members.size() + " members");
        return new JsonObject(members);
    }

    public JsonArray parseArray() {
        expect('[');
        final var elements = new ArrayList<JsonValue>();
        if (has(']')) {
            in.next();
            LOG.finer("Parsed empty array");
            return new JsonArray(elements);
        }

        boolean more = true;
        while (more) {
            elements.add(parseValue());
            more = mayHave(',');
        }
        expect(']');

        LOG.finer(() -> "Parsed array with " + elements.size() + " elements");
        return new JsonArray(elements);
    }

    /// Parses a string literal. A backslash is dropped and the character after
    /// it is kept verbatim; escape sequences such as `\n` or `\t` are not
    /// decoded, they yield the letters `n` and `t`.
    public JsonString parseString() {
        expect('"');
        in.skipWhitespace(false);
        final var sb = new StringBuilder();
        while (!has('"')) {
            if (in.atEnd()) {
                throw failure(JsonParseError.UNTERMINATED_STRING, "unterminated string");
            }
            if (mayHave('\\') && in.atEnd()) {
                throw failure(JsonParseError.UNTERMINATED_STRING, "unterminated string");
            }
            sb.append((char) in.next());
        }
        expect('"');
        in.skipWhitespace(true);

        LOG.finest(() -> "Parsed string of length " + sb.length());
        return new JsonString(sb.toString());
    }

    /// Parses a number. The integer and fraction digits are converted in one
    /// step; an exponent is applied afterwards as a power of ten, which can
    /// differ in the last bit from converting the whole literal at once.
    /// A result beyond the range of `double` is kept as an infinity, so
    /// `0.1e309` yields `Infinity` because `10^309` overflows first.
    public JsonNumber parseNumber() {
        in.skipWhitespace(false);

        final boolean negative = mayHave('-');
        final var digits = new StringBuilder();

        if (has('0')) {
            digits.append((char) in.next());
        } else {
            if (in.peek() < '1' || in.peek() > '9') {
                throw failure(JsonParseError.MALFORMED_NUMBER, "expected number");
            }
            appendDigits(digits);
        }

        if (has('.')) {
            digits.append((char) in.next());
            if (!Utils.isDigit(in.peek())) {
                throw failure(JsonParseError.MALFORMED_NUMBER, "expected number");
            }
            appendDigits(digits);
        }

        double value = Double.parseDouble(digits.toString());

        if (has('e') || has('E')) {
            in.next();
            final boolean negativeExponent = has('-');
            if (negativeExponent || has('+')) {
                in.next();
            }
            final var exponent = new StringBuilder();
            appendDigits(exponent);
            if (exponent.length() == 0) {
                if (options.strictExponent()) {
                    throw failure(JsonParseError.MALFORMED_NUMBER, "expected exponent digits");
                }
                LOG.finest("Exponent without digits treated as zero");
            } else if (value != 0 && !Double.isInfinite(value)) {
                // zero and infinity are fixed points; 0 * 10^400 or Infinity * 10^-400 would be NaN
                final double power = Double.parseDouble(exponent.toString());
                value *= Math.pow(10, negativeExponent ? -power : power);
            }
        }

        in.skipWhitespace(true);
        final double result = negative ? -value : value;
        LOG.finest(() -> "Parsed number " + result);
        return new JsonNumber(result);
    }

    public JsonBoolean parseBoolean() {
        if (has('t')) {
            matchKeyword("true");
            return JsonBoolean.TRUE;
        }
        if (has('f')) {
            matchKeyword("false");
            return JsonBoolean.FALSE;
        }
        throw failure(JsonParseError.EXPECTED_VALUE, "expected boolean");
    }

    public JsonNull parseNull() {
        if (!has('n')) {
            throw failure(JsonParseError.EXPECTED_VALUE, "expected null");
        }
        matchKeyword("null");
        return JsonNull.of();
    }

    // Utility functions

    private boolean has(char c) {
        return in.peek() == c;
    }

    private boolean mayHave(char c) {
        if (has(c)) {
            in.next();
            return true;
        }
        return false;
    }

    private void appendDigits(StringBuilder sb) {
        while (Utils.isDigit(in.peek())) {
            sb.append((char) in.next());
        }
    }

    private void matchKeyword(String keyword) {
        // the first letter is already known to match; whitespace must not split the rest
        expect(keyword.charAt(0));
        in.skipWhitespace(false);
        for (int i = 1; i < keyword.length(); i++) {
            expect(keyword.charAt(i));
        }
        in.skipWhitespace(true);
    }

    private void expect(char expected) {
        final int actual = in.peek();
        if (actual != expected) {
            throw new JsonParseException(JsonParseError.UNEXPECTED_CHARACTER, in.line(), in.column(),
                    "expected " + Utils.describe(expected) + " but " +
                            (actual == CharProducer.EOF ? "reached end of input" : "found " + Utils.describe(actual)));
        }
        in.next();
    }

    /// Builds a failure located at the current lookahead and quotes the input
    /// left unread, consuming it.
    private JsonParseException failure(JsonParseError error, String reason) {
        // capture the position before draining moves it
        in.peek();
        final int line = in.line();
        final int column = in.column();

        in.skipWhitespace(false);
        final int limit = options.diagnosticTailLimit();
        final var tail = new StringBuilder();
        boolean truncated = false;
        while (!in.atEnd()) {
            final int c = in.next();
            if (tail.length() < limit) {
                tail.append((char) c);
            } else {
                truncated = true;
            }
        }
        if (truncated) {
            tail.append('…');
        }

        LOG.fine(() -> "Parse failure at " + line + ":" + column + ": " + reason);
        return new JsonParseException(error, line, column, reason, limit == 0 ? null : tail.toString());
    }
}
