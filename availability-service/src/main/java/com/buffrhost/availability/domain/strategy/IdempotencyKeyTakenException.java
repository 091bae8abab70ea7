package com.buffrhost.availability.domain.strategy;

import lombok.Getter;

/**
 * A concurrent request with the same idempotency key committed its reservation first.
 * The caller's transaction is rolled back; the winner's reservation can be read once it has ended.
 */
@Getter
public class IdempotencyKeyTakenException extends RuntimeException {
    private final String idempotencyKey;

    public IdempotencyKeyTakenException(String idempotencyKey, Throwable cause) {
        super("Idempotency key " + idempotencyKey + " was stored by a concurrent request", cause);
        this.idempotencyKey = idempotencyKey;
    }
}
