package storefront.security;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TokenServiceTest {

    static final String SECRET = "unit-test-secret-0123456789-abcdefghijklmnop";
    static final Instant ISSUED_AT = Instant.parse("2025-03-01T10:00:00Z");

    private static TokenService at(Instant instant) {
        return new TokenService(SECRET, Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void issue_thenVerify_returnsUserIdAsSubject() {
        var tokens = at(ISSUED_AT);

        var token = tokens.issue(42L);

        assertThat(tokens.verify(token)).contains(42L);
    }

    @Test
    void verify_acceptsTokenJustBeforeExpiry() {
        var token = at(ISSUED_AT).issue(7L);

        var later = at(ISSUED_AT.plus(TokenService.TOKEN_TTL).minus(Duration.ofMinutes(1)));

        assertThat(later.verify(token)).contains(7L);
    }

    @Test
    void verify_rejectsTokenAfterExpiry() {
        var token = at(ISSUED_AT).issue(7L);

        var later = at(ISSUED_AT.plus(TokenService.TOKEN_TTL).plus(Duration.ofMinutes(1)));

        assertThat(later.verify(token)).isEmpty();
    }

    @Test
    void verify_acceptsTokenOneSecondBeforeExpiry() {
        var token = at(ISSUED_AT).issue(7L);

        var later = at(ISSUED_AT.plus(TokenService.TOKEN_TTL).minusSeconds(1));

        assertThat(later.verify(token)).contains(7L);
    }

    @Test
    void verify_rejectsTokenAtExactExpiry() {
        var token = at(ISSUED_AT).issue(7L);

        var atExpiry = at(ISSUED_AT.plus(TokenService.TOKEN_TTL));

        assertThat(atExpiry.verify(token)).isEmpty();
    }

    @Test
    void verify_rejectsTokenSignedWithAnotherKey() {
        var foreign = new TokenService("some-other-secret-0123456789-abcdefghijklmnop",
                Clock.fixed(ISSUED_AT, ZoneOffset.UTC));
        var token = foreign.issue(1L);

        assertThat(at(ISSUED_AT).verify(token)).isEmpty();
    }

    @Test
    void verify_rejectsGarbage() {
        var tokens = at(ISSUED_AT);

        assertThat(tokens.verify("not-a-jwt")).isEmpty();
        assertThat(tokens.verify("")).isEmpty();
    }
}
