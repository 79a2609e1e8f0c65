package storefront.repository;

import java.util.Optional;

import storefront.domain.User;

public interface UserRepository {
    Optional<User> findById(long id);

    Optional<User> findByUsername(String username);

    Optional<User> findByEmail(String email);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    /**
     * Inserts the user and assigns the generated id.
     *
     * @throws org.springframework.dao.DuplicateKeyException when username or email is taken
     */
    User create(User user);
}
