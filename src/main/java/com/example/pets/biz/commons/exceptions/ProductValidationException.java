package com.example.pets.biz.commons.exceptions;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Getter
public class ProductValidationException extends RuntimeException {

    private final Map<String, List<String>> errors;

    public ProductValidationException(Map<String, List<String>> errors) {
        super("Invalid product fields: " + errors.keySet());
        this.errors = Collections.unmodifiableMap(errors);
    }
}
