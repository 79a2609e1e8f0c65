package storefront.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;

import storefront.domain.User;
import storefront.exception.BadRequestException;
import storefront.exception.DuplicateResourceException;
import storefront.exception.InvalidCredentialsException;
import storefront.repository.UserRepository;
import storefront.security.PrehashedBCryptPasswordEncoder;
import storefront.security.TokenService;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AuthServiceTest {

    UserRepository users;
    PasswordEncoder encoder;
    TokenService tokens;
    AuthService service;

    @BeforeEach
    void setUp() {
        users = mock(UserRepository.class);
        encoder = spy(new PrehashedBCryptPasswordEncoder(4));
        tokens = new TokenService("unit-test-secret-0123456789-abcdefghijklmnop");
        service = new AuthService(users, encoder, tokens);
    }

    @Test
    void register_hashesPasswordAndReturnsCreatedUser() {
        when(users.create(any(User.class))).thenAnswer(invocation -> {
            User u = invocation.getArgument(0);
            u.setId(10L);
            return u;
        });

        var user = service.register("alice", "alice@example.com", "s3cret-pass", false);

        assertThat(user.getId()).isEqualTo(10L);
        assertThat(user.getPasswordHash()).isNotEqualTo("s3cret-pass");
        assertThat(encoder.matches("s3cret-pass", user.getPasswordHash())).isTrue();
        assertThat(user.isAdmin()).isFalse();
    }

    @Test
    void register_duplicateEmail_failsWithoutInsert() {
        when(users.existsByEmail("taken@example.com")).thenReturn(true);

        assertThatThrownBy(() -> service.register(null, "taken@example.com", "password1", false))
                .isInstanceOf(DuplicateResourceException.class)
                .hasMessage("Email already exists");

        verify(users, never()).create(any());
    }

    @Test
    void register_duplicateUsername_failsWithoutInsert() {
        when(users.existsByUsername("bob")).thenReturn(true);

        assertThatThrownBy(() -> service.register("bob", "bob2@example.com", "password1", false))
                .isInstanceOf(DuplicateResourceException.class)
                .hasMessage("Username already exists");

        verify(users, never()).create(any());
    }

    @Test
    void register_uniquenessViolationAtInsert_isReportedAsDuplicate() {
        when(users.create(any(User.class))).thenThrow(new DuplicateKeyException("users_email_key"));

        assertThatThrownBy(() -> service.register("carol", "carol@example.com", "password1", false))
                .isInstanceOf(DuplicateResourceException.class);
    }

    @Test
    void login_byUsername_issuesTokenForUserId() {
        var stored = new User(5L, "dave", "dave@example.com", encoder.encode("password1"), true);
        when(users.findByUsername("dave")).thenReturn(Optional.of(stored));

        var result = service.login("dave", null, "password1");

        assertThat(tokens.verify(result.getToken())).contains(5L);
        assertThat(result.getUser().getEmail()).isEqualTo("dave@example.com");
        assertThat(result.getUser().isAdmin()).isTrue();
    }

    @Test
    void login_fallsBackToEmailWhenUsernameUnknown() {
        var stored = new User(6L, "erin", "erin@example.com", encoder.encode("password1"), false);
        when(users.findByUsername("nobody")).thenReturn(Optional.empty());
        when(users.findByEmail("erin@example.com")).thenReturn(Optional.of(stored));

        var result = service.login("nobody", "erin@example.com", "password1");

        assertThat(tokens.verify(result.getToken())).contains(6L);
    }

    @Test
    void login_wrongPasswordAndUnknownUser_failWithSameMessage() {
        var stored = new User(7L, null, "frank@example.com", encoder.encode("password1"), false);
        when(users.findByEmail("frank@example.com")).thenReturn(Optional.of(stored));
        when(users.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        var wrongPassword = catchMessage(() -> service.login(null, "frank@example.com", "wrong-pass"));
        var unknownUser = catchMessage(() -> service.login(null, "ghost@example.com", "password1"));

        assertThat(wrongPassword).isEqualTo(AuthService.INVALID_CREDENTIALS);
        assertThat(unknownUser).isEqualTo(wrongPassword);
    }

    @Test
    void login_unknownUser_stillChecksPasswordAgainstAHash() {
        when(users.findByEmail("ghost@example.com")).thenReturn(Optional.empty());
        clearInvocations(encoder);

        assertThatThrownBy(() -> service.login(null, "ghost@example.com", "password1"))
                .isInstanceOf(InvalidCredentialsException.class);

        verify(encoder).matches(eq("password1"), anyString());
    }

    @Test
    void login_withoutIdentifier_isRejected() {
        assertThatThrownBy(() -> service.login(null, " ", "password1"))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Missing username or email");

        verifyNoInteractions(users);
    }

    private static String catchMessage(Runnable call) {
        try {
            call.run();
        } catch (InvalidCredentialsException e) {
            return e.getMessage();
        }
        throw new AssertionError("expected InvalidCredentialsException");
    }
}
