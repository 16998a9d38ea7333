package com.flagship.number_gateway.deposit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.number_gateway.deposit.PaymentDeposit;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
public class DepositListResponse {

    @JsonProperty("deposits")
    List<DepositResponse> deposits;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("total")
    long total;

    public static DepositListResponse from(Page<PaymentDeposit> page) {
        return DepositListResponse.builder()
            .deposits(page.getContent().stream().map(DepositResponse::from).collect(Collectors.toList()))
            .page(page.getNumber())
            .size(page.getSize())
            .total(page.getTotalElements())
            .build();
    }
}
