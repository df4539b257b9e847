package com.titiplex.mist.core.verification;

import com.titiplex.mist.core.crypto.IdentityService;
import com.titiplex.mist.core.crypto.NodeState;
import com.titiplex.mist.core.crypto.engine.CryptoEngine;
import com.titiplex.mist.core.crypto.engine.Curve25519CryptoEngine;
import com.titiplex.mist.core.crypto.engine.IdentityKeyPair;
import com.titiplex.mist.core.model.TrustOrigin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VerificationServiceTest {

    private static final long NOW = 1_700_000_000_000L;

    private final CryptoEngine engine = new Curve25519CryptoEngine();
    private VerificationService service;
    private IdentityService identity;
    private IdentityKeyPair me;

    @BeforeEach
    void setUp() {
        me = engine.generateIdentity();
        ContactCard card = InviteCodecTest.cardOf(engine, me, "alice");
        identity = mock(IdentityService.class);
        when(identity.identity()).thenReturn(me);
        ContactCard plain = new ContactCard(card.v(), card.pk(), card.spk(), card.spkId(), card.sig(), null, null,
                card.name());
        when(identity.localBundle()).thenReturn(plain.bundle());
        when(identity.reserveBundle()).thenReturn(card.bundle());
        NodeState ns = new NodeState();
        ns.displayName = "alice";
        service = new VerificationService(identity, new InviteCodec(engine), ns);
    }

    @Test
    void verificationCodeIsShortLivedAndDirect() {
        String code = service.createVerificationCode(NOW);
        InviteCodec.Parsed parsed = service.parse(code, NOW);

        assertThat(parsed.expiresAt() - NOW).isLessThanOrEqualTo(VerificationService.VERIFICATION_TTL.toMillis());
        assertThat(VerificationService.originOf(parsed.kind())).isEqualTo(TrustOrigin.DIRECT_VERIFICATION);
        assertThatThrownBy(() -> service.parse(code, NOW + VerificationService.VERIFICATION_TTL.toMillis() + 1000))
                .isInstanceOf(InviteException.class);
    }

    @Test
    void inviteLinkIsASharedLink() {
        InviteCodec.Parsed parsed = service.parse(service.createInvite(NOW), NOW + 3_600_000L);
        assertThat(VerificationService.originOf(parsed.kind())).isEqualTo(TrustOrigin.SHARED_LINK);
        assertThat(parsed.card().name()).isEqualTo("alice");
    }

    @Test
    void invitesReserveAPrekeyButTheCardDoesNot() {
        assertThat(service.parse(service.createInvite(NOW), NOW).card().opkId()).isEqualTo(1);
        service.createVerificationCode(NOW);
        assertThat(service.localCard().opk()).isNull();

        verify(identity, times(2)).reserveBundle();
    }

    @Test
    void cardSurvivesItsJsonForm() {
        ContactCard card = service.parseCard(service.localCardJson());
        assertThat(card.peerKey()).isEqualTo(me.peerKey());
        assertThat(card).isEqualTo(service.localCard());
    }

    @Test
    void malformedCardIsRejected() {
        assertThatThrownBy(() -> service.parseCard("{\"v\":1,\"pk\":\"AAAA\"}")).isInstanceOf(InviteException.class);
        assertThatThrownBy(() -> service.parseCard("nope")).isInstanceOf(InviteException.class);
    }
}
