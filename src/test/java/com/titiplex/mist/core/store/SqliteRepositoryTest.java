package com.titiplex.mist.core.store;

import com.titiplex.mist.core.crypto.LocalSecrets;
import com.titiplex.mist.core.crypto.engine.CryptoEngine;
import com.titiplex.mist.core.crypto.engine.Curve25519CryptoEngine;
import com.titiplex.mist.core.crypto.engine.IdentityKeyPair;
import com.titiplex.mist.core.crypto.engine.OneTimePrekey;
import com.titiplex.mist.core.crypto.engine.SignedPrekey;
import com.titiplex.mist.core.model.ContactRecord;
import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.model.TrustOrigin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteRepositoryTest {

    @TempDir
    Path dir;

    private final CryptoEngine engine = new Curve25519CryptoEngine();
    private LocalSecrets secrets;
    private SqliteRepository repo;
    private PeerKey bob;

    @BeforeEach
    void setUp() {
        secrets = new LocalSecrets(dir.toString());
        repo = new SqliteRepository(dir.toString(), secrets);
        bob = engine.generateIdentity().peerKey();
    }

    @AfterEach
    void tearDown() {
        repo.close();
    }

    @Test
    void olderSessionVersionNeverOverwritesNewerOne() {
        repo.saveSession(new StoredSession(bob, "INITIATOR", new byte[]{2}, 2, 20));
        repo.saveSession(new StoredSession(bob, "INITIATOR", new byte[]{1}, 1, 30));

        assertThat(repo.listSessions()).singleElement().satisfies(s -> {
            assertThat(s.version()).isEqualTo(2);
            assertThat(s.state()).containsExactly(2);
        });

        repo.saveSession(new StoredSession(bob, "INITIATOR", new byte[]{3}, 3, 40));
        assertThat(repo.listSessions().get(0).state()).containsExactly(3);
    }

    @Test
    void sessionsSurviveReopening() {
        repo.saveSession(new StoredSession(bob, "RESPONDER", new byte[]{7, 7}, 1, 10));
        repo.flush();
        repo.close();

        SqliteRepository reopened = new SqliteRepository(dir.toString(), new LocalSecrets(dir.toString()));
        try {
            assertThat(reopened.listSessions()).singleElement().satisfies(s -> {
                assertThat(s.peer()).isEqualTo(bob);
                assertThat(s.role()).isEqualTo("RESPONDER");
                assertThat(s.state()).containsExactly(7, 7);
            });
        } finally {
            reopened.close();
        }
    }

    @Test
    void contactIsInsertedOnlyOnce() {
        ContactRecord c = new ContactRecord(bob, "bob", TrustOrigin.DIRECT_VERIFICATION, 5);
        assertThat(repo.insertContactIfAbsent(c)).isTrue();
        assertThat(repo.insertContactIfAbsent(new ContactRecord(bob, "other", TrustOrigin.SHARED_LINK, 6))).isFalse();

        assertThat(repo.listContacts()).containsExactly(c);
        repo.deleteContact(bob);
        assertThat(repo.listContacts()).isEmpty();
    }

    @Test
    void prekeysKeepTheirPrivatePartAcrossStorage() {
        IdentityKeyPair id = engine.generateIdentity();
        SignedPrekey spk = engine.generateSignedPrekey(id, 1);
        repo.saveSignedPrekey(spk);
        repo.saveOneTimePrekeys(engine.generateOneTimePrekeys(1, 3));

        assertThat(repo.listSignedPrekeys()).singleElement()
                .satisfies(p -> assertThat(p.privateKey()).isEqualTo(spk.privateKey()));
        repo.deleteOneTimePrekey(2);
        assertThat(repo.listOneTimePrekeys()).extracting(OneTimePrekey::id).containsExactly(1, 3);

        repo.reserveOneTimePrekey(1);
        assertThat(repo.listUnreservedOneTimePrekeys()).extracting(OneTimePrekey::id).containsExactly(3);
        assertThat(repo.listOneTimePrekeys()).extracting(OneTimePrekey::id).containsExactly(1, 3);
    }

    @Test
    void clearEmptiesEveryTable() {
        repo.saveSession(new StoredSession(bob, "INITIATOR", new byte[]{1}, 1, 1));
        repo.insertContactIfAbsent(new ContactRecord(bob, "bob", TrustOrigin.SHARED_LINK, 1));
        repo.saveOneTimePrekeys(engine.generateOneTimePrekeys(1, 2));

        repo.clear();

        assertThat(repo.listSessions()).isEmpty();
        assertThat(repo.listContacts()).isEmpty();
        assertThat(repo.listOneTimePrekeys()).isEmpty();
    }
}
