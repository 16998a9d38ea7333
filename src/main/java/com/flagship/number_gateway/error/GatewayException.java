package com.flagship.number_gateway.error;

import lombok.Getter;

/**
 * Typed business failure carrying a machine-readable {@link ErrorCode}.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;

    public GatewayException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public GatewayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
