package com.titiplex.mist.ui;

import com.titiplex.mist.core.model.ContactRecord;
import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.model.TrustOrigin;
import com.titiplex.mist.core.orchestrator.SessionOrchestrator;
import com.titiplex.mist.core.session.RoleOrderingViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsoleControllerTest {

    private final SessionOrchestrator orchestrator = mock(SessionOrchestrator.class);
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private ConsoleController console;
    private PeerKey bob;

    private static PeerKey key(int fill) {
        byte[] b = new byte[32];
        Arrays.fill(b, (byte) fill);
        return PeerKey.of(b);
    }

    @BeforeEach
    void setUp() {
        bob = key(7);
        when(orchestrator.self()).thenReturn(key(1));
        when(orchestrator.contacts()).thenReturn(List.of(
                new ContactRecord(bob, "bob", TrustOrigin.SHARED_LINK, 1L)));
        console = new ConsoleController(orchestrator);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private void run(String script) {
        console.run(new ByteArrayInputStream(script.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void sendResolvesTheContactByPrefix() {
        when(orchestrator.sendPlaintext(eq(bob), any())).thenReturn(true);

        run("send " + bob.base64().substring(0, 6) + " hello there\nquit\n");

        verify(orchestrator).sendPlaintext(bob, "hello there".getBytes(StandardCharsets.UTF_8));
        assertThat(output()).contains("sent");
    }

    @Test
    void errorsArePrintedAndTheLoopGoesOn() {
        when(orchestrator.sendPlaintext(eq(bob), any()))
                .thenThrow(new RoleOrderingViolationException(bob, "wait for a first message"));
        when(orchestrator.createInvite()).thenReturn("MIST1.x.y");

        run("send zz hi\nsend " + bob.base64().substring(0, 6) + " hi\ninvite\nquit\n");

        assertThat(output())
                .contains("error: no contact matches zz")
                .contains("error: wait for a first message")
                .contains("MIST1.x.y");
    }

    @Test
    void incomingMessageIsShownWithTheContactName() {
        run("quit\n");
        console.onMessageDecrypted(bob, "hi".getBytes(StandardCharsets.UTF_8));
        assertThat(output()).contains("bob> hi");
    }
}
