package lyza.json;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class JsonPatternMatchingTests extends LyzaJsonLoggingConfig {

    private String identifyJsonValue(JsonValue jsonValue) {
        return switch (jsonValue.kind()) {
            case OBJECT -> "Object with " + jsonValue.members().size() + " members";
            case ARRAY -> "Array with " + jsonValue.elements().size() + " elements";
            case STRING -> "String with value: " + jsonValue.string();
            case NUMBER -> "Number with value: " + jsonValue.toDouble();
            case BOOLEAN -> "Boolean with value: " + jsonValue.bool();
            case NULL -> "Null";
        };
    }

    @Test
    void testSwitchOverKinds() {
        String json = """
        {
            "myObject": {},
            "myArray": [1, 2],
            "myString": "hello",
            "myNumber": 123.45,
            "myBoolean": true,
            "myNull": null
        }
        """;

        JsonObject jsonObject = Json.parse(json);

        assertThat(identifyJsonValue(jsonObject)).isEqualTo("Object with 6 members");
        assertThat(identifyJsonValue(jsonObject.get("myObject"))).isEqualTo("Object with 0 members");
        assertThat(identifyJsonValue(jsonObject.get("myArray"))).isEqualTo("Array with 2 elements");
        assertThat(identifyJsonValue(jsonObject.get("myString"))).isEqualTo("String with value: hello");
        assertThat(identifyJsonValue(jsonObject.get("myNumber"))).isEqualTo("Number with value: 123.45");
        assertThat(identifyJsonValue(jsonObject.get("myBoolean"))).isEqualTo("Boolean with value: true");
        assertThat(identifyJsonValue(jsonObject.get("myNull"))).isEqualTo("Null");
    }

    @Test
    void testInstanceofPatternsAgreeWithKind() {
        JsonObject jsonObject = Json.parse("{\"s\":\"x\",\"n\":1,\"b\":false,\"z\":null,\"a\":[],\"o\":{}}");
        for (JsonValue value : jsonObject.members().values()) {
            final JsonKind expected;
            if (value instanceof JsonString) {
                expected = JsonKind.STRING;
            } else if (value instanceof JsonNumber) {
                expected = JsonKind.NUMBER;
            } else if (value instanceof JsonBoolean) {
                expected = JsonKind.BOOLEAN;
            } else if (value instanceof JsonNull) {
                expected = JsonKind.NULL;
            } else if (value instanceof JsonArray) {
                expected = JsonKind.ARRAY;
            } else {
                assertThat(value).isInstanceOf(JsonObject.class);
                expected = JsonKind.OBJECT;
            }
            assertThat(value.kind()).isEqualTo(expected);
        }
    }
}
