package com.titiplex.mist.core.signaling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.signaling.payload.SignalingPayload;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON {@code {type, from, to?, payload, timestamp}} ; {@code from}/{@code to} en base64 standard.
 * Tout ce qui sort de {@link #decode} est typé et validé.
 */
@Component
public class EnvelopeCodec {
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public byte[] encode(SignalingEnvelope env) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", env.type().wireName());
        root.put("from", env.from().base64());
        if (env.to() != null) root.put("to", env.to().base64());
        root.set("payload", mapper.valueToTree(env.payload()));
        root.put("timestamp", env.timestamp());
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public SignalingEnvelope decode(byte[] bytes) {
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new InvalidEnvelopeException("not JSON", e);
        }
        if (root == null || !root.isObject()) throw new InvalidEnvelopeException("envelope must be an object");

        String typeName = root.path("type").asText(null);
        EnvelopeType type = EnvelopeType.fromWire(typeName)
                .orElseThrow(() -> new InvalidEnvelopeException("unknown type " + typeName));
        PeerKey from = key(root.get("from"), "from");
        PeerKey to = root.hasNonNull("to") ? key(root.get("to"), "to") : null;
        JsonNode ts = root.get("timestamp");
        if (ts == null || !ts.canConvertToLong()) throw new InvalidEnvelopeException("timestamp missing");
        JsonNode payloadNode = root.get("payload");
        if (payloadNode == null || !payloadNode.isObject()) throw new InvalidEnvelopeException("payload missing");

        SignalingPayload payload;
        try {
            payload = mapper.treeToValue(payloadNode, type.payloadClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidEnvelopeException("malformed " + type.wireName() + " payload", e);
        }
        payload.validate();
        return new SignalingEnvelope(type, from, to, payload, ts.asLong());
    }

    private static PeerKey key(JsonNode node, String field) {
        if (node == null || !node.isTextual()) throw new InvalidEnvelopeException(field + " missing");
        try {
            return PeerKey.fromBase64(node.asText());
        } catch (IllegalArgumentException e) {
            throw new InvalidEnvelopeException(field + " is not a valid public key", e);
        }
    }
}
