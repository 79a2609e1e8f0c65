package storefront.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import storefront.domain.User;
import storefront.exception.BadRequestException;
import storefront.exception.DuplicateResourceException;
import storefront.exception.InvalidCredentialsException;
import storefront.repository.UserRepository;
import storefront.security.TokenService;

import java.util.Optional;

@Service
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_CREDENTIALS = "Invalid username or password";

    private final UserRepository users;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;

    // checked when no account matches, so unknown users cost the same hash as wrong passwords
    private final String dummyHash;

    public AuthService(UserRepository users, PasswordEncoder passwordEncoder, TokenService tokenService) {
        this.users = users;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.dummyHash = passwordEncoder.encode("no-such-account-placeholder");
    }

    /**
     * Creates an account with a bcrypt-hashed password.
     *
     * @param username optional, unique when given
     * @throws DuplicateResourceException when the username or email is already registered
     */
    @Transactional
    public User register(String username, String email, String rawPassword, boolean admin) {
        if (username != null && users.existsByUsername(username)) {
            throw new DuplicateResourceException("Username already exists");
        }
        if (users.existsByEmail(email)) {
            throw new DuplicateResourceException("Email already exists");
        }

        var user = new User(null, username, email, passwordEncoder.encode(rawPassword), admin);
        try {
            users.create(user);
        } catch (DuplicateKeyException e) {
            // lost a race against a concurrent registration
            throw new DuplicateResourceException("Username or email already exists");
        }

        log.info("Registered user id={} admin={}", user.getId(), user.isAdmin());
        return user;
    }

    /**
     * Looks the user up by username, falling back to email, and checks the password.
     * Unknown identifier and wrong password fail with the same message.
     *
     * @throws BadRequestException when neither identifier is given
     * @throws InvalidCredentialsException when the credentials do not match an account
     */
    public LoginResult login(String username, String email, String rawPassword) {
        if (isBlank(username) && isBlank(email)) {
            throw new BadRequestException("Missing username or email");
        }

        Optional<User> found = isBlank(username) ? Optional.empty() : users.findByUsername(username);
        if (found.isEmpty() && !isBlank(email)) {
            found = users.findByEmail(email);
        }

        if (found.isEmpty()) {
            passwordEncoder.matches(rawPassword, dummyHash);
            log.warn("Failed login attempt");
            throw new InvalidCredentialsException(INVALID_CREDENTIALS);
        }

        User user = found.get();
        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            log.warn("Failed login attempt");
            throw new InvalidCredentialsException(INVALID_CREDENTIALS);
        }

        return new LoginResult(tokenService.issue(user.getId()), user);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static class LoginResult {
        private final String token;
        private final User user;

        public LoginResult(String token, User user) {
            this.token = token;
            this.user = user;
        }

        public String getToken() {
            return token;
        }

        public User getUser() {
            return user;
        }
    }
}
