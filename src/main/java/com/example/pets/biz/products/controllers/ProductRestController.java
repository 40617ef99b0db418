package com.example.pets.biz.products.controllers;

import com.example.pets.biz.products.models.Product;
import com.example.pets.biz.products.store.IProductStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/products")
public class ProductRestController {

    private final IProductStore productStore;

    @GetMapping(produces = "application/json")
    public ResponseEntity<List<Product>> findAll() {
        log.info("ProductRestController::findAll");
        return ResponseEntity.ok(productStore.findAll());
    }

    @GetMapping(path = "/{id}", produces = "application/json")
    public ResponseEntity<Product> findById(@PathVariable("id") Long id) {
        log.info("ProductRestController::findById - id: {}", id);
        return productStore.findById(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.info("ProductRestController::findById - Product id: {} not found", id);
                    return ResponseEntity.notFound().build();
                });
    }

    @PostMapping(consumes = "application/json", produces = "application/json")
    public ResponseEntity<Product> create(
            @RequestBody Product product,
            UriComponentsBuilder uriBuilder
    ) {
        log.info("ProductRestController::create - name: {}", product.getName());
        Product created = productStore.insert(product);
        URI location = uriBuilder.path("/products/{id}").buildAndExpand(created.getId()).toUri();
        log.info("ProductRestController::create - Created product id: {} at {}", created.getId(), location);
        return ResponseEntity.created(location).body(created);
    }

    @PutMapping(path = "/{id}", consumes = "application/json")
    public ResponseEntity<Void> update(@PathVariable("id") Long id, @RequestBody Product product) {
        log.info("ProductRestController::update - id: {}", id);
        if (!productStore.replace(id, product)) {
            log.info("ProductRestController::update - Product id: {} not found", id);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") Long id) {
        log.info("ProductRestController::delete - id: {}", id);
        if (!productStore.remove(id)) {
            log.info("ProductRestController::delete - Product id: {} not found", id);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

}
