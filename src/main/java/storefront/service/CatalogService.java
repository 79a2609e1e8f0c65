package storefront.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import storefront.domain.Product;
import storefront.exception.ForbiddenAccessException;
import storefront.exception.ResourceNotFoundException;
import storefront.repository.ProductRepository;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

@Service
public class CatalogService {
    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final ProductRepository repo;
    private final AuthorizationService authorization;

    public CatalogService(ProductRepository repo, AuthorizationService authorization) {
        this.repo = repo;
        this.authorization = authorization;
    }

    public List<Product> listProducts() {
        return repo.findAll();
    }

    public Optional<Product> getProduct(long id) {
        return repo.findById(id);
    }

    @Transactional
    public Product createProduct(Product p) {
        var created = repo.create(p);
        log.info("Created product id={}", created.getId());
        return created;
    }

    /**
     * Loads the product, lets {@code changes} modify it and writes it back.
     *
     * @return the updated product, or empty when no product has this id
     */
    @Transactional
    public Optional<Product> updateProduct(long id, Consumer<Product> changes) {
        var existing = repo.findById(id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        var p = existing.get();
        changes.accept(p);
        p.setId(id);
        if (!repo.update(p)) {
            // deleted between the read and the write
            return Optional.empty();
        }
        log.info("Updated product id={}", id);
        return Optional.of(p);
    }

    /**
     * @throws ForbiddenAccessException when the caller is not an admin
     * @throws ResourceNotFoundException when no product has this id
     */
    @Transactional
    public void deleteProduct(long id, long callerId) {
        if (!authorization.isAdmin(callerId)) {
            throw new ForbiddenAccessException("Not authorised to delete a product");
        }
        if (!repo.deleteById(id)) {
            throw notFound(id);
        }
        log.info("Deleted product id={} by user id={}", id, callerId);
    }

    public static ResourceNotFoundException notFound(long id) {
        return new ResourceNotFoundException("Product with id " + id + " does not exist");
    }
}
