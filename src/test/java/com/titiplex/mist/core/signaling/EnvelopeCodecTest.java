package com.titiplex.mist.core.signaling;

import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.model.TrustOrigin;
import com.titiplex.mist.core.signaling.payload.HandshakeInitPayload;
import com.titiplex.mist.core.signaling.payload.PresencePayload;
import com.titiplex.mist.core.signaling.payload.TransportOfferPayload;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCodecTest {

    private static final SecureRandom RNG = new SecureRandom();
    private final EnvelopeCodec codec = new EnvelopeCodec();

    static PeerKey randomKey() {
        byte[] b = new byte[32];
        RNG.nextBytes(b);
        return PeerKey.of(b);
    }

    private static byte[] json(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void handshakeInitIsDecodedIntoItsTypedPayload() {
        PeerKey alice = randomKey();
        PeerKey bob = randomKey();
        String eph = Base64.getEncoder().encodeToString(new byte[32]);
        HandshakeInitPayload p = new HandshakeInitPayload(eph, 3, 12, "alice", TrustOrigin.DIRECT_VERIFICATION);

        SignalingEnvelope env = codec.decode(codec.encode(
                new SignalingEnvelope(EnvelopeType.HANDSHAKE_INIT, alice, bob, p, 42L)));

        assertThat(env.type()).isEqualTo(EnvelopeType.HANDSHAKE_INIT);
        assertThat(env.from()).isEqualTo(alice);
        assertThat(env.to()).isEqualTo(bob);
        assertThat(env.timestamp()).isEqualTo(42L);
        assertThat(env.payload(HandshakeInitPayload.class)).isEqualTo(p);
        assertThat(env.payload(HandshakeInitPayload.class).material().oneTimePrekeyId()).isEqualTo(12);
    }

    @Test
    void broadcastHasNoRecipient() {
        byte[] frame = codec.encode(new SignalingEnvelope(EnvelopeType.PRESENCE, randomKey(), null,
                new PresencePayload(true), 1L));
        assertThat(new String(frame, StandardCharsets.UTF_8)).doesNotContain("\"to\"");
        assertThat(codec.decode(frame).to()).isNull();
    }

    @Test
    void unknownTypeIsRejected() {
        String from = randomKey().base64();
        assertThatThrownBy(() -> codec.decode(json(
                "{\"type\":\"chat\",\"from\":\"" + from + "\",\"payload\":{},\"timestamp\":1}")))
                .isInstanceOf(InvalidEnvelopeException.class);
    }

    @Test
    void malformedEnvelopesAreRejected() {
        String from = randomKey().base64();
        assertThatThrownBy(() -> codec.decode(json("not json"))).isInstanceOf(InvalidEnvelopeException.class);
        assertThatThrownBy(() -> codec.decode(json("[1,2]"))).isInstanceOf(InvalidEnvelopeException.class);
        assertThatThrownBy(() -> codec.decode(json(
                "{\"type\":\"presence\",\"from\":\"AAAA\",\"payload\":{\"online\":true},\"timestamp\":1}")))
                .isInstanceOf(InvalidEnvelopeException.class);
        assertThatThrownBy(() -> codec.decode(json(
                "{\"type\":\"presence\",\"from\":\"" + from + "\",\"payload\":{\"online\":true}}")))
                .isInstanceOf(InvalidEnvelopeException.class);
        assertThatThrownBy(() -> codec.decode(json(
                "{\"type\":\"presence\",\"from\":\"" + from + "\",\"timestamp\":1}")))
                .isInstanceOf(InvalidEnvelopeException.class);
    }

    @Test
    void payloadIsValidatedOnDecode() {
        String from = randomKey().base64();
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);
        assertThatThrownBy(() -> codec.decode(json("{\"type\":\"handshake-init\",\"from\":\"" + from
                + "\",\"payload\":{\"ephemeralKey\":\"" + shortKey
                + "\",\"signedPrekeyId\":1,\"trustOrigin\":\"SHARED_LINK\"},\"timestamp\":1}")))
                .isInstanceOf(InvalidEnvelopeException.class);
        assertThatThrownBy(() -> codec.decode(json("{\"type\":\"transport-offer\",\"from\":\"" + from
                + "\",\"payload\":{\"linkId\":\"l1\",\"candidates\":[\"nohost\"]},\"timestamp\":1}")))
                .isInstanceOf(InvalidEnvelopeException.class);
    }

    @Test
    void envelopeRefusesAPayloadOfTheWrongType() {
        assertThatThrownBy(() -> new SignalingEnvelope(EnvelopeType.PRESENCE, randomKey(), null,
                new TransportOfferPayload("l1", List.of("10.0.0.1:7900")), 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
