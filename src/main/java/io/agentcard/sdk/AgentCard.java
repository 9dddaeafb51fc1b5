package io.agentcard.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentcard.sdk.internal.Json;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Agent Card document as parsed from its JSON transport. Apart from {@code signatures} the content is opaque;
 * every other member only matters as part of the canonical payload.
 */
public final class AgentCard {

    public static final String SIGNATURES_FIELD = "signatures";

    private final ObjectNode document;

    private AgentCard(ObjectNode document) {
        this.document = document;
    }

    /**
     * Wraps an already parsed card. The node is copied so later mutations by the caller are not observed.
     *
     * @throws IllegalArgumentException when the node is not a JSON object.
     */
    public static AgentCard of(JsonNode node) {
        Objects.requireNonNull(node, "node");
        if (!node.isObject()) {
            throw new IllegalArgumentException("Agent Card must be a JSON object");
        }
        return new AgentCard(((ObjectNode) node).deepCopy());
    }

    public static AgentCard parse(String json) throws IOException {
        Objects.requireNonNull(json, "json");
        JsonNode node = Json.mapper().readTree(json);
        if (node == null || !node.isObject()) {
            throw new IOException("Agent Card must be a JSON object");
        }
        return new AgentCard((ObjectNode) node);
    }

    /**
     * Returns a copy of the underlying document.
     */
    public ObjectNode document() {
        return document.deepCopy();
    }

    /**
     * Signature entries in card order. Elements that are not JSON objects are returned as {@code null} so the
     * index of every entry is preserved.
     */
    public List<AgentCardSignature> signatures() {
        JsonNode array = document.path(SIGNATURES_FIELD);
        if (!array.isArray() || array.isEmpty()) {
            return Collections.emptyList();
        }
        List<AgentCardSignature> entries = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            if (!item.isObject()) {
                entries.add(null);
                continue;
            }
            entries.add(new AgentCardSignature(text(item, "protected"), text(item, "signature")));
        }
        return Collections.unmodifiableList(entries);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }
}
