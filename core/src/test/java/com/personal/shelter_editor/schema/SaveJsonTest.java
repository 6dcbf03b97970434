package com.personal.shelter_editor.schema;

import com.google.gson.JsonObject;
import com.personal.shelter_editor.Fixtures;
import org.junit.jupiter.api.Test;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import static org.assertj.core.api.Assertions.*;

class SaveJsonTest {

    @Test
    void parseObject_shouldPreserveKeyOrder() throws Exception {
        JsonObject root = SaveJson.parseObject("{\"zeta\":1,\"alpha\":2,\"mid\":{\"b\":1,\"a\":2}}");

        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, ?> entry : root.entrySet()) {
            keys.add(entry.getKey());
        }
        assertThat(keys).containsExactly("zeta", "alpha", "mid");
        assertThat(SaveJson.serialize(root)).isEqualTo("{\"zeta\":1,\"alpha\":2,\"mid\":{\"b\":1,\"a\":2}}");
    }

    @Test
    void serialize_shouldReproduceUntouchedSaveExactly() throws Exception {
        String json = Fixtures.read(Fixtures.SAVE_JSON);

        assertThat(SaveJson.serialize(SaveJson.parseObject(json))).isEqualTo(json);
    }

    @Test
    void serialize_shouldKeepNullsAndHtmlCharacters() throws Exception {
        String json = "{\"a\":null,\"name\":\"<Vault & Co>\",\"list\":[1,null,\"x\"]}";

        assertThat(SaveJson.serialize(SaveJson.parseObject(json))).isEqualTo(json);
    }

    @Test
    void serialize_shouldKeepNumberLiterals() throws Exception {
        String json = "{\"f\":402.0,\"g\":1.5E3,\"i\":-7,\"big\":12345678901234567890}";

        assertThat(SaveJson.serialize(SaveJson.parseObject(json))).isEqualTo(json);
    }

    @Test
    void parseObject_shouldAcceptSurroundingWhitespace() throws Exception {
        assertThat(SaveJson.parseObject("  {\"a\":1}\n").get("a").getAsInt()).isEqualTo(1);
    }

    @Test
    void parseObject_shouldRejectMalformedJson() {
        assertThatThrownBy(() -> SaveJson.parseObject("{\"a\":")).isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> SaveJson.parseObject("{a:1}")).isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> SaveJson.parseObject("")).isInstanceOf(ParseException.class);
    }

    @Test
    void parseObject_shouldRejectTrailingContent() {
        assertThatThrownBy(() -> SaveJson.parseObject("{\"a\":1} {\"b\":2}")).isInstanceOf(ParseException.class);
    }

    @Test
    void parseObject_shouldRejectNonObjectRoot() {
        assertThatThrownBy(() -> SaveJson.parseObject("[1,2,3]"))
                .isInstanceOf(ParseException.class)
                .hasMessage("Save data must be a JSON object.");
    }

    @Test
    void serializePretty_shouldIndent() throws Exception {
        assertThat(SaveJson.serializePretty(SaveJson.parseObject("{\"a\":{\"b\":1}}")))
                .isEqualTo("{\n  \"a\": {\n    \"b\": 1\n  }\n}");
    }
}
