package storefront.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import storefront.domain.Product;

import static org.assertj.core.api.Assertions.assertThat;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Import(JdbcProductRepository.class)
class JdbcProductRepositoryTest {

    @Autowired
    JdbcProductRepository repo;

    @Autowired
    JdbcTemplate jdbc;

    @BeforeEach
    void clean() {
        jdbc.update("DELETE FROM products");
    }

    @Test
    void create_assignsIdAndRoundTrips() {
        var created = repo.create(new Product(null, "Fruit", "Fresh fruit", 15.99, 100));

        assertThat(created.getId()).isNotNull();
        var loaded = repo.findById(created.getId()).orElseThrow();
        assertThat(loaded.getName()).isEqualTo("Fruit");
        assertThat(loaded.getDescription()).isEqualTo("Fresh fruit");
        assertThat(loaded.getPrice()).isEqualTo(15.99);
        assertThat(loaded.getStock()).isEqualTo(100);
    }

    @Test
    void create_keepsNullDescription() {
        var created = repo.create(new Product(null, "Vegetable", null, 10.99, 200));

        assertThat(repo.findById(created.getId()).orElseThrow().getDescription()).isNull();
    }

    @Test
    void findAll_returnsEveryRow() {
        repo.create(new Product(null, "Fruit", null, 15.99, 100));
        repo.create(new Product(null, "Vegetable", null, 10.99, 200));

        assertThat(repo.findAll()).extracting(Product::getName)
                .containsExactlyInAnyOrder("Fruit", "Vegetable");
    }

    @Test
    void update_overwritesRow() {
        var p = repo.create(new Product(null, "Fruit", "Fresh fruit", 15.99, 100));
        p.setStock(0);
        p.setDescription("");

        assertThat(repo.update(p)).isTrue();

        var loaded = repo.findById(p.getId()).orElseThrow();
        assertThat(loaded.getStock()).isZero();
        assertThat(loaded.getDescription()).isEmpty();
    }

    @Test
    void update_missingRow_returnsFalse() {
        assertThat(repo.update(new Product(12345L, "Ghost", null, 1.0, 1))).isFalse();
    }

    @Test
    void deleteById_removesRowOnce() {
        var p = repo.create(new Product(null, "Fruit", null, 15.99, 100));

        assertThat(repo.deleteById(p.getId())).isTrue();
        assertThat(repo.deleteById(p.getId())).isFalse();
        assertThat(repo.findById(p.getId())).isEmpty();
    }
}
