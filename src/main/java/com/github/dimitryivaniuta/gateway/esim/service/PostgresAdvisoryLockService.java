package com.github.dimitryivaniuta.gateway.esim.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Transaction-scoped Postgres advisory locks keyed by order line item.
 *
 * <p>The delivery row does not exist yet when a notification arrives, so there is nothing to lock
 * {@code FOR UPDATE}. {@code pg_advisory_xact_lock} serializes redelivered notifications for the same
 * line item until the creating transaction commits; the lock is released with the transaction.</p>
 */
@Component
public class PostgresAdvisoryLockService {

    private final JdbcTemplate jdbcTemplate;

    public PostgresAdvisoryLockService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Blocks until this transaction holds the lock for a line item.
     *
     * @param orderId storefront order id
     * @param lineItemId storefront line item id
     */
    public void lockLineItem(String orderId, String lineItemId) {
        long lockId = toLongHash("delivery|" + orderId + "|" + lineItemId);
        jdbcTemplate.queryForObject("select pg_advisory_xact_lock(?)", Object.class, lockId);
    }

    static long toLongHash(String s) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
