package com.aitrader.backend.service.exchange;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Capability interface over one derivatives exchange. Instances own their HTTP client and
 * must be closed after the unit of work that created them.
 */
public interface ExchangeAdapter extends AutoCloseable {

    ExchangeType exchange();

    /**
     * Cached per process.
     * @throws com.aitrader.backend.exception.SymbolNotFoundException if the exchange has no such symbol
     */
    SymbolInfo getSymbolInfo(String symbol);

    BigDecimal getBalance(String asset);

    Optional<PositionInfo> getPosition(String symbol);

    List<PositionInfo> getPositions();

    /**
     * @param symbol optional filter, null for all symbols
     */
    List<OrderResult> getOpenOrders(String symbol);

    /**
     * Best effort; false when the exchange rejects the change.
     */
    boolean setLeverage(String symbol, int leverage);

    OrderResult placeMarketOrder(String symbol, OrderSide side, BigDecimal quantity, String clientOrderId);

    OrderResult placeTakeProfit(String symbol, OrderSide side, BigDecimal quantity, BigDecimal stopPrice, String clientOrderId);

    OrderResult placeStopLoss(String symbol, OrderSide side, BigDecimal quantity, BigDecimal stopPrice, String clientOrderId);

    /**
     * Keyed by exchange order id when present, otherwise by client order id.
     */
    boolean cancelOrder(String symbol, String orderId, String clientOrderId);

    /**
     * Keyed by exchange order id when present, otherwise by client order id.
     * Empty when the exchange does not know the order.
     */
    Optional<OrderResult> getOrder(String symbol, String orderId, String clientOrderId);

    /**
     * Current mark price.
     */
    BigDecimal getTicker(String symbol);

    @Override
    void close();
}
