package com.example.pets.biz.products.store;

import com.example.pets.biz.commons.exceptions.ProductIdMismatchException;
import com.example.pets.biz.commons.exceptions.ProductValidationException;
import com.example.pets.biz.products.models.Product;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

@Slf4j
@RequiredArgsConstructor
@Service
public class InMemoryProductStore implements IProductStore {

    private final Validator validator;

    private final Object monitor = new Object();
    private final Map<Long, Product> store = new LinkedHashMap<>();
    private long lastId = 0;

    @Override
    public List<Product> findAll() {
        synchronized (monitor) {
            List<Product> products = new ArrayList<>(store.size());
            store.values().forEach(p -> products.add(copyOf(p)));
            log.debug("InMemoryProductStore::findAll - {} products", products.size());
            return Collections.unmodifiableList(products);
        }
    }

    @Override
    public Optional<Product> findById(Long id) {
        synchronized (monitor) {
            Product product = store.get(id);
            if (product == null) {
                log.debug("InMemoryProductStore::findById - Product with id={} not found", id);
                return Optional.empty();
            }
            return Optional.of(copyOf(product));
        }
    }

    @Override
    public Product insert(Product candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        validate(candidate);
        synchronized (monitor) {
            long id = ++lastId;
            if (candidate.getId() != null) {
                log.debug("InMemoryProductStore::insert - Ignoring client supplied id={}", candidate.getId());
            }
            Product stored = candidate.toBuilder().id(id).build();
            store.put(id, stored);
            log.info("InMemoryProductStore::insert - Stored product id={} name={}", id, stored.getName());
            return copyOf(stored);
        }
    }

    @Override
    public boolean replace(Long id, Product candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        if (!Objects.equals(id, candidate.getId())) {
            log.warn("InMemoryProductStore::replace - Id mismatch, path id={} body id={}", id, candidate.getId());
            throw new ProductIdMismatchException(id, candidate.getId());
        }
        validate(candidate);
        synchronized (monitor) {
            if (!store.containsKey(id)) {
                log.debug("InMemoryProductStore::replace - Product with id={} not found", id);
                return false;
            }
            store.put(id, copyOf(candidate));
            log.info("InMemoryProductStore::replace - Replaced product id={}", id);
            return true;
        }
    }

    @Override
    public boolean remove(Long id) {
        synchronized (monitor) {
            Product removed = store.remove(id);
            if (removed == null) {
                log.debug("InMemoryProductStore::remove - Product with id={} not found", id);
                return false;
            }
            log.info("InMemoryProductStore::remove - Removed product id={}", id);
            return true;
        }
    }

    @Override
    public int count() {
        synchronized (monitor) {
            return store.size();
        }
    }

    private void validate(Product candidate) {
        Set<ConstraintViolation<Product>> violations = validator.validate(candidate);
        if (violations.isEmpty()) {
            return;
        }
        Map<String, List<String>> errors = new TreeMap<>();
        for (ConstraintViolation<Product> violation : violations) {
            errors.computeIfAbsent(violation.getPropertyPath().toString(), k -> new ArrayList<>())
                    .add(violation.getMessage());
        }
        log.warn("InMemoryProductStore::validate - Rejected product, failing fields: {}", errors.keySet());
        throw new ProductValidationException(errors);
    }

    private static Product copyOf(Product product) {
        return product.toBuilder().build();
    }
}
