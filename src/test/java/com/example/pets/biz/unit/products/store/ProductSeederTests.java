package com.example.pets.biz.unit.products.store;

import com.example.pets.biz.products.models.Product;
import com.example.pets.biz.products.store.IProductStore;
import com.example.pets.biz.products.store.InMemoryProductStore;
import com.example.pets.biz.products.store.ProductSeeder;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProductSeederTests {

    @Test
    void seedsEmptyStoreWithTwoProductsInOrder() {
        IProductStore store = new InMemoryProductStore(Validation.buildDefaultValidatorFactory().getValidator());

        new ProductSeeder(store, true).seed();

        List<Product> products = store.findAll();
        assertEquals(2, products.size());
        assertEquals(new Product(1L, "Squeaky Bone", new BigDecimal("20.99")), products.get(0));
        assertEquals(new Product(2L, "Knotted Rope", new BigDecimal("12.99")), products.get(1));
    }

    @Test
    void seedingIsIdempotent() {
        IProductStore store = new InMemoryProductStore(Validation.buildDefaultValidatorFactory().getValidator());
        ProductSeeder seeder = new ProductSeeder(store, true);

        seeder.seed();
        seeder.seed();

        assertEquals(2, store.count());
    }

    @Test
    void skipsStoreThatAlreadyHoldsProducts() {
        IProductStore store = mock(IProductStore.class);
        when(store.count()).thenReturn(1);

        new ProductSeeder(store, true).seed();

        verify(store, never()).insert(any());
    }

    @Test
    void doesNothingWhenDisabled() {
        IProductStore store = mock(IProductStore.class);

        new ProductSeeder(store, false).seed();

        verifyNoInteractions(store);
    }

    @Test
    void seedingFailureIsLoggedNotThrown() {
        IProductStore store = mock(IProductStore.class);
        when(store.count()).thenReturn(0);
        when(store.insert(any())).thenThrow(new IllegalStateException("boom"));

        ProductSeeder seeder = new ProductSeeder(store, true);

        assertDoesNotThrow(seeder::seed);
        verify(store, times(1)).insert(any());
    }
}
