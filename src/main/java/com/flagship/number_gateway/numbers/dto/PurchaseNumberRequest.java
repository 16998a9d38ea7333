package com.flagship.number_gateway.numbers.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class PurchaseNumberRequest {

    @NotBlank(message = "Service is required")
    @Size(max = 32, message = "Service code is too long")
    @JsonProperty("service")
    String service;

    @NotBlank(message = "Country is required")
    @Size(max = 16, message = "Country code is too long")
    @JsonProperty("country")
    String country;

    @Size(max = 32, message = "Operator is too long")
    @JsonProperty("operator")
    String operator;

    @DecimalMin(value = "0.0001", message = "Maximum price must be greater than 0")
    @JsonProperty("max_price")
    BigDecimal maxPrice;
}
