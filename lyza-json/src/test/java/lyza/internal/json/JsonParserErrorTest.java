package lyza.internal.json;

import lyza.json.Json;
import lyza.json.JsonParseError;
import lyza.json.JsonParseException;
import lyza.json.JsonParserOptions;
import lyza.json.LyzaJsonLoggingConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Failure kinds, positions and rendered messages.
class JsonParserErrorTest extends LyzaJsonLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonParserErrorTest.class.getName());

    private static JsonParseException failure(String json) {
        return failure(json, JsonParserOptions.DEFAULT);
    }

    private static JsonParseException failure(String json, JsonParserOptions options) {
        try {
            Json.parse(json, options);
        } catch (JsonParseException e) {
            LOG.fine(() -> "Rejected " + json + ": " + e.getMessage());
            return e;
        }
        throw new AssertionError("Expected a parse failure for: " + json);
    }

    @Test
    void testTrailingCommaInArray() {
        LOG.info(() -> "TEST: testTrailingCommaInArray");
        final var e = failure("{\"a\":[1,2,]}");
        assertThat(e.error()).isEqualTo(JsonParseError.EXPECTED_VALUE);
        assertThat(e.line()).isEqualTo(1);
        assertThat(e.column()).isEqualTo(11);
        assertThat(e.remainingInput()).isEqualTo("]}");
        assertThat(e.getMessage()).isEqualTo("1:11: expected value, remaining input: \"]}\"");
    }

    @Test
    void testTrailingCommaInObject() {
        LOG.info(() -> "TEST: testTrailingCommaInObject");
        final var e = failure("{\"a\":1,}");
        assertThat(e.error()).isEqualTo(JsonParseError.EXPECTED_KEY);
        assertThat(e.column()).isEqualTo(8);
        assertThat(e.getMessage()).isEqualTo("1:8: expected key, remaining input: \"}\"");
    }

    @Test
    void testNonStringKey() {
        LOG.info(() -> "TEST: testNonStringKey");
        final var e = failure("{1:2}");
        assertThat(e.error()).isEqualTo(JsonParseError.EXPECTED_KEY);
        assertThat(e.column()).isEqualTo(2);
    }

    @ParameterizedTest
    @ValueSource(strings = {"42", "[1]", "\"text\"", "true", "null"})
    void testNonObjectRootIsRejected(String json) {
        LOG.info(() -> "TEST: testNonObjectRootIsRejected " + json);
        final var e = failure(json);
        assertThat(e.error()).isEqualTo(JsonParseError.UNEXPECTED_CHARACTER);
        assertThat(e.line()).isEqualTo(1);
        assertThat(e.column()).isEqualTo(1);
        assertThat(e.reason()).startsWith("expected '{' but found ");
        assertThat(e.remainingInput()).isNull();
    }

    @Test
    void testBareNumberRootMessage() {
        LOG.info(() -> "TEST: testBareNumberRootMessage");
        assertThat(failure("42").getMessage()).isEqualTo("1:1: expected '{' but found '4'");
        assertThat(failure("  \n 42").getMessage()).isEqualTo("2:2: expected '{' but found '4'");
    }

    @Test
    void testEmptyInput() {
        LOG.info(() -> "TEST: testEmptyInput");
        assertThat(failure("").getMessage()).isEqualTo("1:1: expected '{' but reached end of input");
        assertThat(failure(" \t ").getMessage()).isEqualTo("1:4: expected '{' but reached end of input");
    }

    @Test
    void testKeywordMismatch() {
        LOG.info(() -> "TEST: testKeywordMismatch");
        assertThat(failure("{\"a\":tru}").getMessage()).isEqualTo("1:9: expected 'e' but found '}'");
        assertThat(failure("{\"a\":fals}").getMessage()).isEqualTo("1:10: expected 'e' but found '}'");
        assertThat(failure("{\"a\":nil}").getMessage()).isEqualTo("1:7: expected 'u' but found 'i'");
    }

    @Test
    void testKeywordCannotBeSplitByWhitespace() {
        LOG.info(() -> "TEST: testKeywordCannotBeSplitByWhitespace");
        assertThat(failure("{\"a\":t rue}").getMessage()).isEqualTo("1:7: expected 'r' but found ' '");
    }

    @Test
    void testKeywordAtEndOfInput() {
        LOG.info(() -> "TEST: testKeywordAtEndOfInput");
        assertThat(failure("{\"a\": nul").getMessage()).isEqualTo("1:10: expected 'l' but reached end of input");
    }

    @Test
    void testMissingColon() {
        LOG.info(() -> "TEST: testMissingColon");
        final var e = failure("{\"a\" 1}");
        assertThat(e.error()).isEqualTo(JsonParseError.UNEXPECTED_CHARACTER);
        assertThat(e.getMessage()).isEqualTo("1:6: expected ':' but found '1'");
    }

    @Test
    void testMissingCommaBetweenMembers() {
        LOG.info(() -> "TEST: testMissingCommaBetweenMembers");
        assertThat(failure("{\"a\":1 \"b\":2}").getMessage()).isEqualTo("1:8: expected '}' but found '\"'");
    }

    @Test
    void testUnclosedObject() {
        LOG.info(() -> "TEST: testUnclosedObject");
        assertThat(failure("{\"a\":[1]").getMessage()).isEqualTo("1:9: expected '}' but reached end of input");
    }

    @Test
    void testPositionOnLaterLine() {
        LOG.info(() -> "TEST: testPositionOnLaterLine");
        final var e = failure("{\n  \"a\": 1,\n  \"b\": @\n}");
        assertThat(e.error()).isEqualTo(JsonParseError.EXPECTED_VALUE);
        assertThat(e.line()).isEqualTo(3);
        assertThat(e.column()).isEqualTo(8);
        assertThat(e.remainingInput()).isEqualTo("@\n}");
        assertThat(e.getMessage()).startsWith("3:8: expected value");
    }

    @Test
    void testControlCharacterIsDescribed() {
        LOG.info(() -> "TEST: testControlCharacterIsDescribed");
        assertThat(failure("{\"a\" \u0001}").reason()).isEqualTo("expected ':' but found '\\u0001'");
    }

    @Test
    void testTrailingContentAfterRoot() {
        LOG.info(() -> "TEST: testTrailingContentAfterRoot");
        final var e = failure("{} x");
        assertThat(e.error()).isEqualTo(JsonParseError.TRAILING_CONTENT);
        assertThat(e.column()).isEqualTo(4);
        assertThat(e.remainingInput()).isEqualTo("x");

        assertThat(Json.parse("{}  \n\t").members()).isEmpty();
        assertThat(Json.parse("{\"a\":1} {\"b\":2}", JsonParserOptions.DEFAULT.allowTrailingContent(true)).members())
                .containsOnlyKeys("a");
    }

    @Test
    void testRemainingInputIsTruncated() {
        LOG.info(() -> "TEST: testRemainingInputIsTruncated");
        final var e = failure("{\"a\":@abcdef}", JsonParserOptions.DEFAULT.diagnosticTailLimit(3));
        assertThat(e.remainingInput()).isEqualTo("@ab…");
        assertThat(e.getMessage()).isEqualTo("1:6: expected value, remaining input: \"@ab…\"");
    }

    @Test
    void testRemainingInputCanBeSuppressed() {
        LOG.info(() -> "TEST: testRemainingInputCanBeSuppressed");
        final var e = failure("{\"a\":@abcdef}", JsonParserOptions.DEFAULT.diagnosticTailLimit(0));
        assertThat(e.remainingInput()).isNull();
        assertThat(e.getMessage()).isEqualTo("1:6: expected value");
    }

    @Test
    void testNullInputIsRejected() {
        LOG.info(() -> "TEST: testNullInputIsRejected");
        assertThatThrownBy(() -> Json.parse((String) null)).isInstanceOf(NullPointerException.class);
    }
}
