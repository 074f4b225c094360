package com.orderbookserver.domain;

/**
 * Record of a successful match between one buy and one sell intent.
 * Not retained after it has been turned into a broadcast.
 */
public record Trade(String tradeId, Commodity commodity, long buyerClientId, long sellerClientId) {}
