package com.titiplex.mist.core.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.mist.core.crypto.engine.CryptoEngine;
import com.titiplex.mist.core.crypto.engine.CryptoException;
import com.titiplex.mist.core.crypto.engine.IdentityKeyPair;
import com.titiplex.mist.core.crypto.engine.OneTimePrekey;
import com.titiplex.mist.core.crypto.engine.PrekeyBundle;
import com.titiplex.mist.core.crypto.engine.SignedPrekey;
import com.titiplex.mist.core.store.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class IdentityService {
    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final CryptoEngine engine;
    private final Repository repo;
    private final LocalSecrets secrets;
    private final Path idFile;
    private final int oneTimeCount;
    private final Duration rotation;
    private final Duration grace;

    private IdentityKeyPair identity;
    private int lastOneTimeId;   // jamais réattribué pendant la vie du processus

    public IdentityService(CryptoEngine engine, Repository repo, LocalSecrets secrets,
                           @Value("${app.data.dir}") String dataDir,
                           @Value("${app.prekeys.one-time-count:20}") int oneTimeCount,
                           @Value("${app.prekeys.rotation-days:7}") int rotationDays,
                           @Value("${app.prekeys.grace-days:3}") int graceDays) {
        this.engine = engine;
        this.repo = repo;
        this.secrets = secrets;
        this.idFile = Path.of(dataDir, "identity", "me.json");
        this.oneTimeCount = Math.max(1, oneTimeCount);
        this.rotation = Duration.ofDays(rotationDays);
        this.grace = Duration.ofDays(graceDays);
    }

    @SuppressWarnings("unchecked")
    public synchronized IdentityKeyPair ensureIdentity(NodeState ns, String displayName) {
        try {
            Files.createDirectories(idFile.getParent());
            if (Files.exists(idFile)) {
                Map<String, Object> m = mapper.readValue(Files.readAllBytes(idFile), Map.class);
                byte[] priv = secrets.open(Base64.getDecoder().decode((String) m.get("priv")));
                identity = engine.restoreIdentity(priv);
                byte[] pub = Base64.getDecoder().decode((String) m.get("pub"));
                if (!Arrays.equals(pub, identity.publicKey()))
                    throw new CryptoException("Stored identity is inconsistent: public key mismatch");
                ns.displayName = (displayName != null && !displayName.isBlank())
                        ? displayName : (String) m.getOrDefault("displayName", "anonymous");
                log.info("Identity restored: {}", identity.peerKey());
            } else {
                identity = engine.generateIdentity();
                ns.displayName = (displayName != null && !displayName.isBlank()) ? displayName : "anonymous";
                writeIdentity(ns.displayName);
                log.info("New identity generated: {}", identity.peerKey());
            }
            ns.identity = identity;
            return identity;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read or write " + idFile, e);
        }
    }

    public synchronized IdentityKeyPair identity() {
        if (identity == null) throw new IllegalStateException("identity not loaded");
        return identity;
    }

    public synchronized void ensurePrekeys() {
        if (repo.listSignedPrekeys().isEmpty()) {
            SignedPrekey spk = engine.generateSignedPrekey(identity(), nextSignedPrekeyId());
            repo.saveSignedPrekey(spk);
            log.info("Signed prekey {} generated", spk.id());
        }
        replenishIfLow();
    }

    public synchronized boolean rotateSignedPrekeyIfDue(long now) {
        boolean rotated = false;
        SignedPrekey current = currentSignedPrekey();
        if (current.timestamp() + rotation.toMillis() <= now) {
            SignedPrekey generated = engine.generateSignedPrekey(identity(), nextSignedPrekeyId());
            // daté de l'instant de rotation : la période de grâce part de là
            SignedPrekey next = new SignedPrekey(generated.id(), generated.publicKey(), generated.privateKey(),
                    generated.signature(), now);
            repo.saveSignedPrekey(next);
            log.info("Signed prekey rotated: {} -> {}", current.id(), next.id());
            current = next;
            rotated = true;
        }
        // l'ancien n'est supprimé qu'une fois la période de grâce écoulée
        for (SignedPrekey old : repo.listSignedPrekeys()) {
            if (old.id() != current.id() && current.timestamp() + grace.toMillis() <= now) {
                repo.deleteSignedPrekey(old.id());
                log.info("Signed prekey {} expired", old.id());
            }
        }
        return rotated;
    }

    public synchronized SignedPrekey currentSignedPrekey() {
        return repo.listSignedPrekeys().stream()
                .max(Comparator.comparingInt(SignedPrekey::id))
                .orElseThrow(() -> new IllegalStateException("no signed prekey, call ensurePrekeys first"));
    }

    public synchronized Optional<SignedPrekey> findSignedPrekey(int id) {
        return repo.listSignedPrekeys().stream().filter(p -> p.id() == id).findFirst();
    }

    public synchronized Optional<OneTimePrekey> findOneTimePrekey(int id) {
        return repo.listOneTimePrekeys().stream().filter(p -> p.id() == id).findFirst();
    }

    public synchronized void consumeOneTimePrekey(int id) {
        lastOneTimeId = Math.max(lastOneTimeId, id);
        repo.deleteOneTimePrekey(id);
        replenishIfLow();
    }

    public synchronized int oneTimePrekeyCount() {
        return repo.listOneTimePrekeys().size();
    }

    // carte réutilisable par plusieurs personnes : pas de prekey à usage unique
    public synchronized PrekeyBundle localBundle() {
        return bundleWith(null);
    }

    // invitation : un prekey à usage unique remis à personne d'autre
    public synchronized PrekeyBundle reserveBundle() {
        List<OneTimePrekey> free = repo.listUnreservedOneTimePrekeys();
        if (free.isEmpty()) return bundleWith(null);
        OneTimePrekey otk = free.get(0);
        repo.reserveOneTimePrekey(otk.id());
        replenishIfLow();
        return bundleWith(otk);
    }

    private PrekeyBundle bundleWith(OneTimePrekey otk) {
        SignedPrekey spk = currentSignedPrekey();
        return new PrekeyBundle(identity().publicKey(), spk.id(), spk.publicKey(), spk.signature(),
                otk == null ? null : otk.id(), otk == null ? null : otk.publicKey());
    }

    public synchronized byte[] exportBackup(String passphrase, String displayName) {
        try {
            Map<String, Object> out = new HashMap<>();
            out.put("v", 1);
            out.put("displayName", displayName);
            out.put("priv", Base64.getEncoder().encodeToString(identity().privateKey()));
            return CryptoBox.encrypt(passphrase, mapper.writeValueAsBytes(out));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // une identité différente emporte sessions, contacts et prekeys
    @SuppressWarnings("unchecked")
    public synchronized IdentityKeyPair importBackup(String passphrase, byte[] blob, NodeState ns) {
        try {
            Map<String, Object> m = mapper.readValue(CryptoBox.decrypt(passphrase, blob), Map.class);
            IdentityKeyPair restored = engine.restoreIdentity(Base64.getDecoder().decode((String) m.get("priv")));
            boolean changed = identity == null || !Arrays.equals(identity.publicKey(), restored.publicKey());
            if (changed) {
                repo.clear();
                lastOneTimeId = 0;
            }
            identity = restored;
            ns.identity = restored;
            Object name = m.get("displayName");
            if (name instanceof String s && !s.isBlank()) ns.displayName = s;
            writeIdentity(ns.displayName);
            ensurePrekeys();
            log.info("Identity imported from backup: {} (changed={})", restored.peerKey(), changed);
            return restored;
        } catch (IOException e) {
            throw new CryptoException("Unreadable backup", e);
        }
    }

    public synchronized IdentityKeyPair resetIdentity(NodeState ns) {
        repo.clear();
        lastOneTimeId = 0;
        identity = engine.generateIdentity();
        ns.identity = identity;
        writeIdentity(ns.displayName);
        ensurePrekeys();
        log.warn("Identity reset, new identity {}", identity.peerKey());
        return identity;
    }

    private void writeIdentity(String displayName) {
        try {
            Map<String, Object> out = new HashMap<>();
            out.put("displayName", displayName);
            out.put("pub", Base64.getEncoder().encodeToString(identity.publicKey()));
            out.put("priv", Base64.getEncoder().encodeToString(secrets.seal(identity.privateKey())));
            Files.createDirectories(idFile.getParent());
            Files.writeString(idFile, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(out));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + idFile, e);
        }
    }

    private void replenishIfLow() {
        // les prekeys réservés attendent leur handshake : seul le stock libre compte
        List<OneTimePrekey> free = repo.listUnreservedOneTimePrekeys();
        if (free.size() * 2 >= oneTimeCount) return;
        int highest = repo.listOneTimePrekeys().stream().mapToInt(OneTimePrekey::id).max().orElse(0);
        int start = Math.max(lastOneTimeId, highest) + 1;
        List<OneTimePrekey> fresh = engine.generateOneTimePrekeys(start, oneTimeCount - free.size());
        lastOneTimeId = start + fresh.size() - 1;
        repo.saveOneTimePrekeys(fresh);
        log.info("One-time prekeys replenished: {} -> {}", free.size(), oneTimeCount);
    }

    private int nextSignedPrekeyId() {
        return repo.listSignedPrekeys().stream().mapToInt(SignedPrekey::id).max().orElse(0) + 1;
    }
}
