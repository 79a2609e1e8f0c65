package storefront.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import storefront.domain.User;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Optional;

@Repository
public class JdbcUserRepository implements UserRepository {

    private final JdbcTemplate jdbc;

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    private static final RowMapper<User> USER_ROW_MAPPER = new RowMapper<>() {
        @Override
        public User mapRow(ResultSet rs, int rowNum) throws SQLException {
            var u = new User();
            u.setId(rs.getLong("id"));
            u.setUsername(rs.getString("username"));
            u.setEmail(rs.getString("email"));
            u.setPasswordHash(rs.getString("password"));
            u.setAdmin(rs.getBoolean("is_admin"));
            return u;
        }
    };

    @Override
    public Optional<User> findById(long id) {
        return findOneBy("id", id);
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return findOneBy("username", username);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return findOneBy("email", email);
    }

    @Override
    public boolean existsByUsername(String username) {
        return countBy("username", username) > 0;
    }

    @Override
    public boolean existsByEmail(String email) {
        return countBy("email", email) > 0;
    }

    @Override
    public User create(User user) {
        KeyHolder keys = new GeneratedKeyHolder();

        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                    INSERT INTO users (username, email, password, is_admin)
                    VALUES (?, ?, ?, ?)
                    """, new String[] { "id" });
            if (user.getUsername() == null)
                ps.setNull(1, Types.VARCHAR);
            else
                ps.setString(1, user.getUsername());
            ps.setString(2, user.getEmail());
            ps.setString(3, user.getPasswordHash());
            ps.setBoolean(4, user.isAdmin());
            return ps;
        }, keys);

        user.setId(keys.getKeyAs(Number.class).longValue());
        return user;
    }

    // column is always a literal from this class, never request data
    private Optional<User> findOneBy(String column, Object value) {
        var rows = jdbc.query(
                "SELECT id, username, email, password, is_admin FROM users WHERE " + column + " = ?",
                USER_ROW_MAPPER, value);
        return rows.stream().findFirst();
    }

    private int countBy(String column, Object value) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM users WHERE " + column + " = ?", Integer.class, value);
        return n == null ? 0 : n;
    }
}
