package com.example.pets.biz.commons.dto;

import java.util.List;
import java.util.Map;

public record ValidationErrorResponse(int status, String title, Map<String, List<String>> errors) {

    public static final String TITLE = "One or more validation errors occurred.";

    public ValidationErrorResponse(int status, Map<String, List<String>> errors) {
        this(status, TITLE, errors);
    }
}
