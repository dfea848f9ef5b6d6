package com.clipper.platform.publisher.security;

import com.clipper.platform.publisher.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncryptionServiceTest {

    private final EncryptionService encryptionService = new EncryptionService(Fixtures.SECRET_KEY);

    @Test
    void decryptsWhatItEncrypted() {
        String cipherText = encryptionService.encrypt("EAAG-long-lived-token");

        assertThat(cipherText).isNotEqualTo("EAAG-long-lived-token");
        assertThat(encryptionService.decrypt(cipherText)).isEqualTo("EAAG-long-lived-token");
    }

    @Test
    void encryptingTwiceGivesDifferentCipherTexts() {
        assertThat(encryptionService.encrypt("same")).isNotEqualTo(encryptionService.encrypt("same"));
    }

    @Test
    void passesNullThrough() {
        assertThat(encryptionService.encrypt(null)).isNull();
        assertThat(encryptionService.decrypt(null)).isNull();
    }

    @Test
    void refusesToStartWithoutKey() {
        assertThatThrownBy(() -> new EncryptionService(""))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("encryption.secret-key");
    }

    @Test
    void refusesKeysOfTheWrongLength() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[10]);

        assertThatThrownBy(() -> new EncryptionService(shortKey))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("16, 24 or 32");
    }

    @Test
    void rejectsCipherTextFromAnotherKey() {
        EncryptionService other = new EncryptionService(Base64.getEncoder().encodeToString(new byte[16]));

        assertThatThrownBy(() -> other.decrypt(encryptionService.encrypt("token")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Decryption failed");
    }
}
