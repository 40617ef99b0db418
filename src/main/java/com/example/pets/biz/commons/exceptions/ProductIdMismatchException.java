package com.example.pets.biz.commons.exceptions;

import lombok.Getter;

@Getter
public class ProductIdMismatchException extends RuntimeException {

    private final Long pathId;
    private final Long bodyId;

    public ProductIdMismatchException(Long pathId, Long bodyId) {
        super("Product id " + bodyId + " does not match requested id " + pathId);
        this.pathId = pathId;
        this.bodyId = bodyId;
    }
}
