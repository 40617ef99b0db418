package com.example.pets.biz.products.store;

import com.example.pets.biz.products.models.Product;

import java.util.List;
import java.util.Optional;

public interface IProductStore {

    List<Product> findAll();

    Optional<Product> findById(Long id);

    Product insert(Product candidate);

    // checks id mismatch first, then fields, then existence; false when nothing is stored under id
    boolean replace(Long id, Product candidate);

    boolean remove(Long id);

    int count();

}
