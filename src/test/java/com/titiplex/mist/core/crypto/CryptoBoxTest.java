package com.titiplex.mist.core.crypto;

import com.titiplex.mist.core.crypto.engine.CryptoException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CryptoBoxTest {

    @TempDir
    Path dir;

    @Test
    void passphraseBoxOpensOnlyWithTheRightPassphrase() {
        byte[] secret = "identity seed".getBytes(StandardCharsets.UTF_8);
        byte[] blob = CryptoBox.encrypt("pass", secret);

        assertThat(CryptoBox.decrypt("pass", blob)).isEqualTo(secret);
        assertThatThrownBy(() -> CryptoBox.decrypt("other", blob)).isInstanceOf(CryptoException.class);
    }

    @Test
    void deviceKeyIsStableAcrossInstances() {
        LocalSecrets first = new LocalSecrets(dir.toString());
        String sealed = first.sealString("hello");
        assertThat(sealed).doesNotContain("hello");

        LocalSecrets second = new LocalSecrets(dir.toString());
        assertThat(second.openString(sealed)).isEqualTo("hello");
    }

    @Test
    void alteredBlobIsRejected() {
        LocalSecrets secrets = new LocalSecrets(dir.toString());
        byte[] blob = secrets.seal(new byte[]{1, 2, 3});
        blob[blob.length - 1] ^= 1;
        assertThatThrownBy(() -> secrets.open(blob)).isInstanceOf(IllegalStateException.class);
    }
}
