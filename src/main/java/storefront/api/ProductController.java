package storefront.api;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import storefront.api.dto.CreateProductRequest;
import storefront.api.dto.MessageResponse;
import storefront.api.dto.ProductResponse;
import storefront.api.dto.UpdateProductRequest;
import storefront.domain.Product;
import storefront.service.CatalogService;

import java.util.List;

@RestController
@RequestMapping("/products")
public class ProductController {

    private final CatalogService service;

    public ProductController(CatalogService service) {
        this.service = service;
    }

    @GetMapping
    public List<ProductResponse> listProducts() {
        return service.listProducts().stream()
                .map(ProductResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public ProductResponse getProduct(@PathVariable long id) {
        return service.getProduct(id)
                .map(ProductResponse::from)
                .orElseThrow(() -> CatalogService.notFound(id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProductResponse createProduct(@Valid @RequestBody CreateProductRequest req) {
        var p = new Product();
        p.setName(req.getName());
        p.setDescription(req.getDescription());
        p.setPrice(req.getPrice());
        p.setStock(req.getStock() == null ? 0 : req.getStock());

        return ProductResponse.from(service.createProduct(p));
    }

    @RequestMapping(value = "/{id}", method = { RequestMethod.PUT, RequestMethod.PATCH })
    public ProductResponse updateProduct(@PathVariable long id, @Valid @RequestBody UpdateProductRequest req) {
        return service.updateProduct(id, req::applyTo)
                .map(ProductResponse::from)
                .orElseThrow(() -> CatalogService.notFound(id));
    }

    @DeleteMapping("/{id}")
    public MessageResponse deleteProduct(@PathVariable long id, @AuthenticationPrincipal Long userId) {
        service.deleteProduct(id, userId);
        return new MessageResponse("Product with id " + id + " has been deleted.");
    }
}
