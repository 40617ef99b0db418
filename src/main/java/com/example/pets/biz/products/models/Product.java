package com.example.pets.biz.products.models;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    public static final String MIN_PRICE = "0.01";

    // largest value a 128-bit decimal can hold
    public static final String MAX_PRICE = "79228162514264337593543950335";

    private Long id;

    @NotBlank(message = "The name field is required.")
    private String name;

    @NotNull(message = "The price field is required.")
    @DecimalMin(value = MIN_PRICE, message = "The field price must be between " + MIN_PRICE + " and " + MAX_PRICE + ".")
    @DecimalMax(value = MAX_PRICE, message = "The field price must be between " + MIN_PRICE + " and " + MAX_PRICE + ".")
    private BigDecimal price;

}
