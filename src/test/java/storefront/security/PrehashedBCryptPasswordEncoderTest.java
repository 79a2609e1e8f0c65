package storefront.security;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PrehashedBCryptPasswordEncoderTest {

    PrehashedBCryptPasswordEncoder encoder = new PrehashedBCryptPasswordEncoder(4);

    @Test
    void matches_onlyTheEncodedPassword() {
        var hash = encoder.encode("password1");

        assertThat(hash).startsWith("$2");
        assertThat(encoder.matches("password1", hash)).isTrue();
        assertThat(encoder.matches("password2", hash)).isFalse();
    }

    @Test
    void multibytePasswords_sharingFirst72Bytes_areDistinguished() {
        // 108 UTF-8 bytes; plain bcrypt would only see the shared "é" prefix
        var registered = "é".repeat(36) + "A".repeat(36);
        var other = "é".repeat(36) + "B".repeat(36);

        var hash = encoder.encode(registered);

        assertThat(encoder.matches(registered, hash)).isTrue();
        assertThat(encoder.matches(other, hash)).isFalse();
    }

    @Test
    void longPasswords_differingOnlyAfter72Characters_areDistinguished() {
        var registered = "a".repeat(100);

        var hash = encoder.encode(registered);

        assertThat(encoder.matches(registered, hash)).isTrue();
        assertThat(encoder.matches("a".repeat(99) + "b", hash)).isFalse();
    }
}
