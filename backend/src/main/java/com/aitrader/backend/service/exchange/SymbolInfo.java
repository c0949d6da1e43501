package com.aitrader.backend.service.exchange;

import java.math.BigDecimal;

/**
 * Trading rules for one symbol. Quantities are always in base-asset units.
 *
 * @param contractSize base-asset units per exchange order unit, 1 where orders are sized in the base asset
 */
public record SymbolInfo(
        String symbol,
        int pricePrecision,
        int quantityPrecision,
        BigDecimal minQuantity,
        BigDecimal maxQuantity,
        BigDecimal minNotional,
        BigDecimal contractSize
) {
}
