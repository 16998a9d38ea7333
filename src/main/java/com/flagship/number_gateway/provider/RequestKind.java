package com.flagship.number_gateway.provider;

/**
 * Whether a provider call only reads state or mutates it.
 * Reads may run in parallel; writes are serialized by the dispatcher.
 */
public enum RequestKind {
    READ,
    WRITE
}
