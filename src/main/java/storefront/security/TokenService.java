package storefront.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Issues and verifies the signed bearer tokens handed out at login.
 * <p>
 * A token carries the user's id as its subject and is accepted strictly before
 * issue time + {@link #TOKEN_TTL}.
 * Verification is stateless: a token stays valid for its whole lifetime regardless of later
 * account changes.
 */
@Component
public class TokenService {
    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    public static final Duration TOKEN_TTL = Duration.ofDays(1);

    private final SecretKey signingKey;
    private final Clock clock;

    @Autowired
    public TokenService(@Value("${app.auth.jwt-secret}") String jwtSecret) {
        this(jwtSecret, Clock.systemUTC());
    }

    public TokenService(String jwtSecret, Clock clock) {
        // throws WeakKeyException for secrets shorter than 256 bits
        this.signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
    }

    public String issue(long userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(Long.toString(userId))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(TOKEN_TTL)))
                .signWith(signingKey)
                .compact();
    }

    /**
     * Returns the user id carried by a valid token, or empty when the token is malformed,
     * signed with another key, expired, or has no numeric subject.
     */
    public Optional<Long> verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            // a token is dead from the instant it expires on, not one tick later
            Date expiration = claims.getExpiration();
            if (expiration == null || !clock.instant().isBefore(expiration.toInstant())) {
                log.warn("Rejected token at or past its expiry");
                return Optional.empty();
            }
            return Optional.of(Long.parseLong(claims.getSubject()));
        } catch (ExpiredJwtException e) {
            log.warn("Rejected expired token: {}", e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            // NumberFormatException lands here too
            log.warn("Rejected invalid token: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
