package storefront.service;

import org.springframework.stereotype.Service;

import storefront.domain.User;
import storefront.repository.UserRepository;

@Service
public class AuthorizationService {

    private final UserRepository users;

    public AuthorizationService(UserRepository users) {
        this.users = users;
    }

    /**
     * Reloads the caller's row on every call, so a token issued before a privilege change
     * is judged by the current flag. A user that no longer exists is not an admin.
     */
    public boolean isAdmin(long userId) {
        return users.findById(userId)
                .map(User::isAdmin)
                .orElse(false);
    }
}
