package storefront.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import storefront.domain.Product;

import java.util.HashSet;
import java.util.Set;

/**
 * Partial product update. Jackson only calls a setter when the key is present in the body,
 * so the setters record which fields the client sent. A sent field is applied even when its
 * value is 0 or an empty string; an absent field keeps the stored value.
 */
public class UpdateProductRequest {

    private final Set<String> present = new HashSet<>();

    @Size(max = 100)
    private String name;

    private String description;

    @PositiveOrZero
    private Double price;

    @PositiveOrZero
    private Integer stock;

    public void setName(String name) {
        present.add("name");
        this.name = name;
    }

    public void setDescription(String description) {
        present.add("description");
        this.description = description;
    }

    public void setPrice(Double price) {
        present.add("price");
        this.price = price;
    }

    public void setStock(Integer stock) {
        present.add("stock");
        this.stock = stock;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Double getPrice() {
        return price;
    }

    public Integer getStock() {
        return stock;
    }

    @JsonIgnore
    public boolean isPresent(String field) {
        return present.contains(field);
    }

    @JsonIgnore
    @AssertTrue(message = "name must not be null or blank")
    public boolean isNameValid() {
        return !present.contains("name") || (name != null && !name.isBlank());
    }

    @JsonIgnore
    @AssertTrue(message = "price must not be null")
    public boolean isPriceValid() {
        return !present.contains("price") || price != null;
    }

    @JsonIgnore
    @AssertTrue(message = "price must be a finite number")
    public boolean isPriceFinite() {
        return price == null || Double.isFinite(price);
    }

    @JsonIgnore
    @AssertTrue(message = "stock must not be null")
    public boolean isStockValid() {
        return !present.contains("stock") || stock != null;
    }

    /**
     * Copies the sent fields onto {@code p}. {@code description: null} clears the description.
     */
    public void applyTo(Product p) {
        if (present.contains("name"))
            p.setName(name);
        if (present.contains("description"))
            p.setDescription(description);
        if (present.contains("price"))
            p.setPrice(price);
        if (present.contains("stock"))
            p.setStock(stock);
    }
}
