package com.example.pets.biz.commons.dto;

public record ErrorResponse(int status, String error, String message) {
}
