package com.titiplex.mist.ui;

import com.titiplex.mist.core.model.ContactRecord;
import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.model.TrustOrigin;
import com.titiplex.mist.core.orchestrator.RejectionReason;
import com.titiplex.mist.core.orchestrator.SessionEventListener;
import com.titiplex.mist.core.orchestrator.SessionOrchestrator;
import com.titiplex.mist.core.session.SessionException;
import com.titiplex.mist.core.crypto.engine.CryptoException;
import com.titiplex.mist.core.transport.LinkPhase;
import com.titiplex.mist.core.verification.InviteException;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

@Component
public class ConsoleController implements SessionEventListener {
    private static final String HELP = """
            card                 carte de contact locale (JSON)
            invite               lien d'invitation (24 h)
            verify               code de vérification (5 min)
            accept <lien>        accepter une invitation
            scan <json>          ajouter une carte scannée
            contacts             lister les contacts
            send <id> <texte>    envoyer un message (id = début de la clé)
            remove <id>          supprimer un contact
            reset                nouvelle identité (détruit tout)
            quit""";

    private final SessionOrchestrator orchestrator;
    private PrintStream out = System.out;

    public ConsoleController(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public void run(InputStream in, PrintStream out) {
        this.out = out;
        orchestrator.addListener(this);
        out.println("Mist node " + orchestrator.self().base64());
        out.println(HELP);
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                if (!handle(line.trim())) break;
            }
        } catch (IOException e) {
            out.println("console closed: " + e.getMessage());
        } finally {
            orchestrator.removeListener(this);
        }
    }

    boolean handle(String line) {
        if (line.isEmpty()) return true;
        String[] parts = line.split("\\s+", 3);
        try {
            switch (parts[0]) {
                case "quit" -> {
                    return false;
                }
                case "card" -> out.println(orchestrator.localCardJson());
                case "invite" -> out.println(orchestrator.createInvite());
                case "verify" -> out.println(orchestrator.createVerificationCode());
                case "accept" -> out.println("handshake sent to " + orchestrator.acceptInvite(arg(parts, 1)));
                case "scan" -> out.println("handshake sent to " + orchestrator.scanCard(line.substring("scan".length()).trim()));
                case "contacts" -> orchestrator.contacts().forEach(c ->
                        out.println(c.publicKey().base64() + "  " + c.displayName() + "  " + c.trustOrigin()));
                case "send" -> {
                    PeerKey peer = resolve(arg(parts, 1));
                    boolean sent = orchestrator.sendPlaintext(peer, arg(parts, 2).getBytes(StandardCharsets.UTF_8));
                    out.println(sent ? "sent" : "not sent (offline)");
                }
                case "remove" -> {
                    orchestrator.removeContact(resolve(arg(parts, 1)));
                    out.println("removed");
                }
                case "reset" -> out.println("new identity " + orchestrator.resetIdentity().base64());
                default -> out.println(HELP);
            }
        } catch (IllegalArgumentException | InviteException | SessionException | CryptoException e) {
            out.println("error: " + e.getMessage());
        }
        return true;
    }

    private PeerKey resolve(String prefix) {
        List<ContactRecord> matches = orchestrator.contacts().stream()
                .filter(c -> c.publicKey().base64().startsWith(prefix))
                .toList();
        if (matches.size() != 1) throw new IllegalArgumentException(matches.isEmpty()
                ? "no contact matches " + prefix : "ambiguous id " + prefix);
        return matches.get(0).publicKey();
    }

    private static String arg(String[] parts, int i) {
        if (parts.length <= i) throw new IllegalArgumentException("missing argument");
        return parts[i];
    }

    private String name(PeerKey peer) {
        Optional<ContactRecord> c = orchestrator.contacts().stream().filter(r -> r.publicKey().equals(peer)).findFirst();
        return c.map(ContactRecord::displayName).orElse(peer.shortId());
    }

    @Override
    public void onFriendAdded(PeerKey peer, TrustOrigin origin) {
        out.println("+ " + name(peer) + " (" + origin + ")");
    }

    @Override
    public void onMessageDecrypted(PeerKey peer, byte[] plaintext) {
        out.println(name(peer) + "> " + new String(plaintext, StandardCharsets.UTF_8));
    }

    @Override
    public void onTransportStateChanged(PeerKey peer, LinkPhase phase) {
        out.println("~ link " + name(peer) + " " + phase);
    }

    @Override
    public void onMessageRejected(PeerKey peer, RejectionReason reason) {
        out.println("! message from " + peer + " rejected: " + reason);
    }

    @Override
    public void onPresenceChanged(PeerKey peer, boolean online) {
        out.println("* " + name(peer) + (online ? " online" : " offline"));
    }

    @Override
    public void onTyping(PeerKey peer, boolean typing) {
        if (typing) out.println("… " + name(peer) + " is typing");
    }
}
