package com.aitrader.backend.service.risk;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Idempotency keys for order placement. The key depends on trader, signal and the UTC minute
 * only, so repeated cycles within a minute collide on purpose.
 */
public final class ClientOrderIds {

    private static final DateTimeFormatter MINUTE_BUCKET =
            DateTimeFormatter.ofPattern("yyyyMMddHHmm").withZone(ZoneOffset.UTC);
    private static final String PREFIX = "T";
    private static final int HASH_CHARS = 16;

    public static final String TAKE_PROFIT_SUFFIX = "_TP";
    public static final String STOP_LOSS_SUFFIX = "_SL";

    private ClientOrderIds() {
    }

    public static String generate(Object traderId, Object signalId, Instant timestamp) {
        String data = traderId + ":" + signalId + ":" + MINUTE_BUCKET.format(timestamp);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(data.getBytes(StandardCharsets.UTF_8));
            return PREFIX + HexFormat.of().formatHex(digest).substring(0, HASH_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String takeProfit(String clientOrderId) {
        return clientOrderId + TAKE_PROFIT_SUFFIX;
    }

    public static String stopLoss(String clientOrderId) {
        return clientOrderId + STOP_LOSS_SUFFIX;
    }
}
