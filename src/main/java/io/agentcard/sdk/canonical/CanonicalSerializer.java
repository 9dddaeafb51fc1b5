package io.agentcard.sdk.canonical;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentcard.sdk.AgentCard;
import io.agentcard.sdk.internal.Json;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Produces the bytes an Agent Card signature is computed over.
 *
 * <p>The card is copied without its top-level {@code signatures} member, object members are written in
 * lexicographic key order at every depth (array order is kept) and the result is compact UTF-8 JSON. Numbers are
 * written the way ECMAScript {@code JSON.stringify} writes them, and strings are escaped the same way (see
 * {@link EcmaScriptString}), so cards signed by JavaScript tooling verify.</p>
 */
public final class CanonicalSerializer {

    private static final BigDecimal PLAIN_UPPER_BOUND = new BigDecimal("1e21");
    private static final BigDecimal PLAIN_LOWER_BOUND = new BigDecimal("1e-6");

    private CanonicalSerializer() {
    }

    public static byte[] canonicalize(AgentCard card) {
        Objects.requireNonNull(card, "card");
        return canonicalize(withoutField(card.document(), AgentCard.SIGNATURES_FIELD));
    }

    public static byte[] canonicalize(JsonNode node) {
        Objects.requireNonNull(node, "node");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator generator = Json.mapper().getFactory().createGenerator(out)) {
            write(generator, node);
        } catch (IOException ex) {
            // ByteArrayOutputStream never throws
            throw new UncheckedIOException(ex);
        }
        return out.toByteArray();
    }

    /**
     * Returns a deep copy of {@code source} minus one top-level member. Nested members with the same name stay.
     */
    public static ObjectNode withoutField(ObjectNode source, String field) {
        ObjectNode copy = source.deepCopy();
        copy.remove(field);
        return copy;
    }

    private static void write(JsonGenerator generator, JsonNode node) throws IOException {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            generator.writeStartObject();
            for (String name : names) {
                generator.writeFieldName(new EcmaScriptString(name));
                write(generator, node.get(name));
            }
            generator.writeEndObject();
        } else if (node.isArray()) {
            generator.writeStartArray();
            for (JsonNode item : node) {
                write(generator, item);
            }
            generator.writeEndArray();
        } else if (node.isTextual()) {
            generator.writeString(new EcmaScriptString(node.textValue()));
        } else if (node.isBoolean()) {
            generator.writeBoolean(node.booleanValue());
        } else if (node.isNumber()) {
            writeNumber(generator, node);
        } else {
            generator.writeNull();
        }
    }

    private static void writeNumber(JsonGenerator generator, JsonNode node) throws IOException {
        if (node.isIntegralNumber()) {
            generator.writeNumber(node.bigIntegerValue());
            return;
        }
        if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
            generator.writeNull();
            return;
        }
        generator.writeNumber(formatDecimal(node.decimalValue()));
    }

    static String formatDecimal(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        BigDecimal stripped = value.stripTrailingZeros();
        BigDecimal magnitude = stripped.abs();
        if (magnitude.compareTo(PLAIN_UPPER_BOUND) < 0 && magnitude.compareTo(PLAIN_LOWER_BOUND) >= 0) {
            return stripped.toPlainString();
        }

        String digits = stripped.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - stripped.scale();
        StringBuilder sb = new StringBuilder();
        if (stripped.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent >= 0 ? '+' : '-').append(Math.abs(exponent));
        return sb.toString();
    }
}
