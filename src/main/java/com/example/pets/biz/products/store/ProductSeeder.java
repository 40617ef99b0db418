package com.example.pets.biz.products.store;

import com.example.pets.biz.products.models.Product;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

@Slf4j
@Component
public class ProductSeeder {

    static final List<Product> SEED_PRODUCTS = List.of(
            Product.builder().name("Squeaky Bone").price(new BigDecimal("20.99")).build(),
            Product.builder().name("Knotted Rope").price(new BigDecimal("12.99")).build()
    );

    private final IProductStore productStore;

    private final boolean seedEnabled;

    public ProductSeeder(
            IProductStore productStore,
            @Value("${app.products.seed.enabled:true}") boolean seedEnabled
    ) {
        this.productStore = productStore;
        this.seedEnabled = seedEnabled;
    }

    @PostConstruct
    public void seed() {
        if (!seedEnabled) {
            log.info("ProductSeeder::seed - Seeding disabled");
            return;
        }
        try {
            if (productStore.count() > 0) {
                log.info("ProductSeeder::seed - Store already holds {} products, skipping", productStore.count());
                return;
            }
            for (Product product : SEED_PRODUCTS) {
                Product stored = productStore.insert(product);
                log.info("ProductSeeder::seed - Seeded product id={} name={}", stored.getId(), stored.getName());
            }
        } catch (Exception e) {
            log.error("ProductSeeder::seed - An error occurred seeding the store", e);
        }
    }
}
