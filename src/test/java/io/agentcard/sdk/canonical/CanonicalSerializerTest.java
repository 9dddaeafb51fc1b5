package io.agentcard.sdk.canonical;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentcard.sdk.AgentCard;
import io.agentcard.sdk.internal.Json;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalSerializerTest {

    @Test
    void sortsKeysAtEveryLevelAndKeepsArrayOrder() throws Exception {
        AgentCard card = AgentCard.parse("{\"b\":1,\"a\":{\"z\":[3,1,{\"y\":true,\"x\":null}],\"c\":\"v\"}}");

        assertEquals("{\"a\":{\"c\":\"v\",\"z\":[3,1,{\"x\":null,\"y\":true}]},\"b\":1}", canonical(card));
    }

    @Test
    void equalDocumentsProduceIdenticalBytes() throws Exception {
        AgentCard first = AgentCard.parse("{\"name\":\"Agent\",\"skills\":[{\"id\":\"s\",\"tags\":[\"a\"]}],\"version\":\"1\"}");
        AgentCard second = AgentCard.parse("{ \"version\" : \"1\", \"skills\" : [ { \"tags\" : [\"a\"], \"id\" : \"s\" } ],\n \"name\":\"Agent\" }");

        assertArrayEquals(CanonicalSerializer.canonicalize(first), CanonicalSerializer.canonicalize(second));
    }

    @Test
    void dropsOnlyTopLevelSignatures() throws Exception {
        AgentCard card = AgentCard.parse("{\"signatures\":[{\"protected\":\"p\",\"signature\":\"s\"}],"
            + "\"extensions\":[{\"signatures\":[\"kept\"]}],\"meta\":{\"signatures\":1}}");

        String canonical = canonical(card);

        assertEquals("{\"extensions\":[{\"signatures\":[\"kept\"]}],\"meta\":{\"signatures\":1}}", canonical);
    }

    @Test
    void leavesSourceDocumentUntouched() {
        ObjectNode document = Json.mapper().createObjectNode().put("name", "Agent");
        document.putArray("signatures").addObject().put("protected", "p");

        ObjectNode copy = CanonicalSerializer.withoutField(document, "signatures");

        assertFalse(copy.has("signatures"));
        assertTrue(document.has("signatures"));
    }

    @Test
    void writesCompactUtf8WithoutEscapingNonAscii() throws Exception {
        AgentCard card = AgentCard.parse("{\"name\":\"Agénte ✓\",\"path\":\"a/b\",\"quote\":\"say \\\"hi\\\"\\n\"}");

        assertEquals("{\"name\":\"Agénte ✓\",\"path\":\"a/b\",\"quote\":\"say \\\"hi\\\"\\n\"}", canonical(card));
    }

    @Test
    void escapesControlCharactersWithLowerCaseHex() throws Exception {
        AgentCard card = AgentCard.parse("{\"a\":\"x\\u001fy\\u000b\\u0000\",\"k\\u001b\":\"\\b\\t\\f\\r\"}");

        assertEquals("{\"a\":\"x\\u001fy\\u000b\\u0000\",\"k\\u001b\":\"\\b\\t\\f\\r\"}", canonical(card));
    }

    @Test
    void keepsSurrogatePairsAndEscapesLoneSurrogates() throws Exception {
        AgentCard card = AgentCard.parse("{\"emoji\":\"\\ud83d\\ude00\",\"lone\":\"a\\ud800b\\udc00\"}");

        String emoji = new String(Character.toChars(0x1F600));
        assertEquals("{\"emoji\":\"" + emoji + "\",\"lone\":\"a\\ud800b\\udc00\"}", canonical(card));
    }

    @Test
    void rendersNumbersLikeJsonStringify() throws Exception {
        AgentCard card = AgentCard.parse("{\"a\":1.0,\"b\":1.50,\"c\":-0.0,\"d\":12345678901234567890,\"e\":1e21,\"f\":1.5e-7,\"g\":0.000001}");

        assertEquals("{\"a\":1,\"b\":1.5,\"c\":0,\"d\":12345678901234567890,\"e\":1e+21,\"f\":1.5e-7,\"g\":0.000001}", canonical(card));
    }

    @Test
    void formatsDecimalBoundaries() {
        assertEquals("100", CanonicalSerializer.formatDecimal(new BigDecimal("1E+2")));
        assertEquals("-2.5", CanonicalSerializer.formatDecimal(new BigDecimal("-2.500")));
        assertEquals("1.2e+22", CanonicalSerializer.formatDecimal(new BigDecimal("12000000000000000000000")));
        assertEquals("1e-7", CanonicalSerializer.formatDecimal(new BigDecimal("0.0000001")));
    }

    private static String canonical(AgentCard card) {
        return new String(CanonicalSerializer.canonicalize(card), StandardCharsets.UTF_8);
    }
}
