package com.aitrader.backend.service.exchange;

import com.aitrader.backend.exception.ExchangeApiException;
import com.aitrader.backend.exception.SymbolNotFoundException;
import com.aitrader.backend.util.PrecisionUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * USDT-M futures on Binance. Signed requests carry an HMAC-SHA256 of the query string.
 */
@Slf4j
public class BinanceAdapter extends AbstractExchangeAdapter {

    private static final String API_KEY_HEADER = "X-MBX-APIKEY";

    public BinanceAdapter(ExchangeCredentials credentials, ExchangeClientSupport support) {
        super(credentials, support);
    }

    @Override
    public ExchangeType exchange() {
        return ExchangeType.BINANCE;
    }

    @Override
    protected SymbolInfo fetchSymbolInfo(String symbol) {
        JsonNode info = read(() -> send(HttpMethod.GET, "/fapi/v1/exchangeInfo", new HttpHeaders(), null));
        for (JsonNode entry : info.path("symbols")) {
            if (!symbol.equals(entry.path("symbol").asText())) {
                continue;
            }
            BigDecimal minQty = null;
            BigDecimal maxQty = null;
            BigDecimal minNotional = null;
            for (JsonNode filter : entry.path("filters")) {
                String type = filter.path("filterType").asText();
                if ("LOT_SIZE".equals(type)) {
                    minQty = decimalOrNull(filter, "minQty");
                    maxQty = decimalOrNull(filter, "maxQty");
                } else if ("MIN_NOTIONAL".equals(type)) {
                    minNotional = decimalOrNull(filter, "notional");
                }
            }
            return new SymbolInfo(symbol,
                    entry.path("pricePrecision").asInt(2),
                    entry.path("quantityPrecision").asInt(3),
                    minQty != null ? minQty : BigDecimal.ZERO,
                    maxQty,
                    minNotional != null ? minNotional : BigDecimal.ZERO,
                    BigDecimal.ONE);
        }
        throw new SymbolNotFoundException(symbol);
    }

    @Override
    public BigDecimal getBalance(String asset) {
        JsonNode balances = read(() -> signed(HttpMethod.GET, "/fapi/v2/balance", new LinkedHashMap<>()));
        for (JsonNode balance : balances) {
            if (asset.equals(balance.path("asset").asText())) {
                return decimalOrZero(balance, "availableBalance");
            }
        }
        return BigDecimal.ZERO;
    }

    @Override
    public Optional<PositionInfo> getPosition(String symbol) {
        return getPositions().stream().filter(p -> symbol.equals(p.symbol())).findFirst();
    }

    @Override
    public List<PositionInfo> getPositions() {
        JsonNode positions = read(() -> signed(HttpMethod.GET, "/fapi/v2/positionRisk", new LinkedHashMap<>()));
        List<PositionInfo> result = new ArrayList<>();
        for (JsonNode position : positions) {
            BigDecimal amount = decimalOrZero(position, "positionAmt");
            if (amount.signum() == 0) {
                continue;
            }
            result.add(new PositionInfo(
                    position.path("symbol").asText(),
                    amount.signum() > 0 ? "LONG" : "SHORT",
                    amount.abs(),
                    decimalOrNull(position, "entryPrice"),
                    decimalOrZero(position, "unRealizedProfit"),
                    position.path("leverage").asInt(1),
                    "isolated".equalsIgnoreCase(position.path("marginType").asText()) ? "ISOLATED" : "CROSS"));
        }
        return result;
    }

    @Override
    public List<OrderResult> getOpenOrders(String symbol) {
        Map<String, String> params = new LinkedHashMap<>();
        if (symbol != null) {
            params.put("symbol", symbol);
        }
        try {
            JsonNode orders = read(() -> signed(HttpMethod.GET, "/fapi/v1/openOrders", params));
            List<OrderResult> result = new ArrayList<>();
            for (JsonNode order : orders) {
                result.add(toOrderResult(order));
            }
            return result;
        } catch (ExchangeApiException e) {
            log.warn("binance open orders lookup failed: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public boolean setLeverage(String symbol, int leverage) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("leverage", String.valueOf(leverage));
        try {
            signed(HttpMethod.POST, "/fapi/v1/leverage", params);
            return true;
        } catch (ExchangeApiException e) {
            log.warn("binance set leverage {}x on {} failed: {}", leverage, symbol, e.getMessage());
            return false;
        }
    }

    @Override
    public OrderResult placeMarketOrder(String symbol, OrderSide side, BigDecimal quantity, String clientOrderId) {
        return placeSafely(clientOrderId, () -> {
            BigDecimal qty = normalizeQuantity(symbol, quantity);
            if (qty.signum() <= 0) {
                return OrderResult.failure("INVALID_QUANTITY", "Quantity rounds to zero for " + symbol);
            }
            Map<String, String> params = new LinkedHashMap<>();
            params.put("symbol", symbol);
            params.put("side", side.name());
            params.put("type", "MARKET");
            params.put("quantity", PrecisionUtils.plain(qty));
            params.put("newClientOrderId", clientOrderId);
            params.put("newOrderRespType", "RESULT");
            return toOrderResult(signed(HttpMethod.POST, "/fapi/v1/order", params));
        });
    }

    @Override
    public OrderResult placeTakeProfit(String symbol, OrderSide side, BigDecimal quantity, BigDecimal stopPrice, String clientOrderId) {
        return placeConditional("TAKE_PROFIT_MARKET", symbol, side, quantity, stopPrice, clientOrderId);
    }

    @Override
    public OrderResult placeStopLoss(String symbol, OrderSide side, BigDecimal quantity, BigDecimal stopPrice, String clientOrderId) {
        return placeConditional("STOP_MARKET", symbol, side, quantity, stopPrice, clientOrderId);
    }

    private OrderResult placeConditional(String type, String symbol, OrderSide side, BigDecimal quantity,
                                         BigDecimal stopPrice, String clientOrderId) {
        return placeSafely(clientOrderId, () -> {
            BigDecimal qty = normalizeQuantity(symbol, quantity);
            if (qty.signum() <= 0) {
                return OrderResult.failure("INVALID_QUANTITY", "Quantity rounds to zero for " + symbol);
            }
            Map<String, String> params = new LinkedHashMap<>();
            params.put("symbol", symbol);
            params.put("side", side.name());
            params.put("type", type);
            params.put("quantity", PrecisionUtils.plain(qty));
            params.put("stopPrice", PrecisionUtils.plain(normalizePrice(symbol, stopPrice)));
            params.put("reduceOnly", "true");
            params.put("newClientOrderId", clientOrderId);
            return toOrderResult(signed(HttpMethod.POST, "/fapi/v1/order", params));
        });
    }

    @Override
    public boolean cancelOrder(String symbol, String orderId, String clientOrderId) {
        try {
            signed(HttpMethod.DELETE, "/fapi/v1/order", orderKey(symbol, orderId, clientOrderId));
            return true;
        } catch (ExchangeApiException e) {
            log.warn("binance cancel {} failed: {}", orderId != null ? orderId : clientOrderId, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<OrderResult> getOrder(String symbol, String orderId, String clientOrderId) {
        Map<String, String> params = orderKey(symbol, orderId, clientOrderId);
        try {
            return Optional.of(toOrderResult(read(() -> signed(HttpMethod.GET, "/fapi/v1/order", params))));
        } catch (ExchangeApiException e) {
            if (e.getStatusCode() >= 400 && e.getStatusCode() < 500) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public BigDecimal getTicker(String symbol) {
        JsonNode index = read(() -> send(HttpMethod.GET, "/fapi/v1/premiumIndex?symbol=" + encode(symbol),
                new HttpHeaders(), null));
        return decimalOrNull(index, "markPrice");
    }

    @Override
    protected String exchangeErrorCode(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            JsonNode code = objectMapper.readTree(responseBody).get("code");
            return code != null && !code.isNull() ? code.asText() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private Map<String, String> orderKey(String symbol, String orderId, String clientOrderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        if (orderId != null) {
            params.put("orderId", orderId);
        } else {
            params.put("origClientOrderId", clientOrderId);
        }
        return params;
    }

    private JsonNode signed(HttpMethod method, String path, Map<String, String> params) {
        Map<String, String> all = new LinkedHashMap<>(params);
        all.put("timestamp", String.valueOf(nowMillis()));
        all.put("recvWindow", String.valueOf(support.getProperties().getRecvWindowMillis()));
        String query = toQuery(all);
        String signature = hmacHex("HmacSHA256", credentials.apiSecret(), query);
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, credentials.apiKey());
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        return send(method, path + "?" + query + "&signature=" + signature, headers, null);
    }

    private OrderResult toOrderResult(JsonNode order) {
        BigDecimal executed = decimalOrZero(order, "executedQty");
        return new OrderResult(true,
                order.path("orderId").asText(null),
                order.path("clientOrderId").asText(null),
                mapStatus(order.path("status").asText()),
                executed,
                positiveOrNull(decimalOrNull(order, "avgPrice")),
                null,
                null,
                order);
    }

    static OrderStatus mapStatus(String status) {
        return switch (status) {
            case "PARTIALLY_FILLED" -> OrderStatus.PARTIALLY_FILLED;
            case "FILLED" -> OrderStatus.FILLED;
            case "CANCELED" -> OrderStatus.CANCELED;
            case "REJECTED" -> OrderStatus.REJECTED;
            case "EXPIRED", "EXPIRED_IN_MATCH" -> OrderStatus.EXPIRED;
            default -> OrderStatus.NEW;
        };
    }

    private static String toQuery(Map<String, String> params) {
        StringBuilder query = new StringBuilder();
        params.forEach((key, value) -> {
            if (query.length() > 0) {
                query.append('&');
            }
            query.append(key).append('=').append(encode(value));
        });
        return query.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
