package storefront.repository;

import java.util.List;
import java.util.Optional;

import storefront.domain.Product;

public interface ProductRepository {
    List<Product> findAll();

    Optional<Product> findById(long id);

    Product create(Product product);

    /**
     * @return false when no row with the product's id exists
     */
    boolean update(Product product);

    boolean deleteById(long id);
}
