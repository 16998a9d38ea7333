package com.flagship.number_gateway.numbers.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class FullSmsResponse {

    @JsonProperty("activation_id")
    String activationId;

    @JsonProperty("text")
    String text;
}
