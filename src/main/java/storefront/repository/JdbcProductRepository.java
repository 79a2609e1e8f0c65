package storefront.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import storefront.domain.Product;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcProductRepository implements ProductRepository {

    private final JdbcTemplate jdbc;

    public JdbcProductRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    private static final RowMapper<Product> PRODUCT_ROW_MAPPER = new RowMapper<>() {
        @Override
        public Product mapRow(ResultSet rs, int rowNum) throws SQLException {
            var p = new Product();
            p.setId(rs.getLong("id"));
            p.setName(rs.getString("name"));
            p.setDescription(rs.getString("description"));
            p.setPrice(rs.getDouble("price"));
            p.setStock(rs.getInt("stock"));
            return p;
        }
    };

    @Override
    public List<Product> findAll() {
        // no ORDER BY: callers get the table's natural order
        return jdbc.query("""
                SELECT id, name, description, price, stock
                FROM products
                """, PRODUCT_ROW_MAPPER);
    }

    @Override
    public Optional<Product> findById(long id) {
        var rows = jdbc.query("""
                SELECT id, name, description, price, stock
                FROM products
                WHERE id = ?
                """, PRODUCT_ROW_MAPPER, id);

        return rows.stream().findFirst();
    }

    @Override
    public Product create(Product product) {
        KeyHolder keys = new GeneratedKeyHolder();

        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement("""
                    INSERT INTO products (name, description, price, stock)
                    VALUES (?, ?, ?, ?)
                    """, new String[] { "id" });
            ps.setString(1, product.getName());
            if (product.getDescription() == null)
                ps.setNull(2, Types.VARCHAR);
            else
                ps.setString(2, product.getDescription());
            ps.setDouble(3, product.getPrice());
            ps.setInt(4, product.getStock());
            return ps;
        }, keys);

        product.setId(keys.getKeyAs(Number.class).longValue());
        return product;
    }

    @Override
    public boolean update(Product product) {
        int rows = jdbc.update("""
                UPDATE products
                SET name = ?, description = ?, price = ?, stock = ?
                WHERE id = ?
                """,
                product.getName(),
                product.getDescription(),
                product.getPrice(),
                product.getStock(),
                product.getId());
        return rows > 0;
    }

    @Override
    public boolean deleteById(long id) {
        return jdbc.update("DELETE FROM products WHERE id = ?", id) > 0;
    }
}
