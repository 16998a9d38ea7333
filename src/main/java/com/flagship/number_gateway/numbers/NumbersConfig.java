package com.flagship.number_gateway.numbers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class NumbersConfig {

    @Bean
    public RefundPolicy refundPolicy(NumbersProperties properties) {
        RefundPolicy policy = switch (properties.getRefundPolicy()) {
            case FULL -> new RefundPolicy.Full();
            case TIME_DECAYED -> new RefundPolicy.TimeDecayed(properties.getDecayRefundFactor());
        };
        log.info("Refund policy: {}", policy.type());
        return policy;
    }
}
