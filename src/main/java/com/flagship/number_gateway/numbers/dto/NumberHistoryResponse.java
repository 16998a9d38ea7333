package com.flagship.number_gateway.numbers.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.numbers.NumberPurchase;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
public class NumberHistoryResponse {

    @JsonProperty("numbers")
    List<NumberResponse> numbers;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("total")
    long total;

    @JsonProperty("total_pages")
    int totalPages;

    public static NumberHistoryResponse from(Page<NumberPurchase> page) {
        return NumberHistoryResponse.builder()
            .numbers(page.getContent().stream().map(NumberResponse::from).collect(Collectors.toList()))
            .page(page.getNumber())
            .size(page.getSize())
            .total(page.getTotalElements())
            .totalPages(page.getTotalPages())
            .build();
    }
}
