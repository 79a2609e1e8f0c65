package storefront.api.dto;

import storefront.domain.Product;

public class ProductResponse {
    private Long id;
    private String name;
    private String description;
    private double price;
    private int stock;

    public static ProductResponse from(Product p) {
        var r = new ProductResponse();
        r.id = p.getId();
        r.name = p.getName();
        r.description = p.getDescription();
        r.price = p.getPrice();
        r.stock = p.getStock();
        return r;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public double getPrice() {
        return price;
    }

    public int getStock() {
        return stock;
    }
}
