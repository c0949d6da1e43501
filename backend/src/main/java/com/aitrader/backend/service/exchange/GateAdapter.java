package com.aitrader.backend.service.exchange;

import com.aitrader.backend.exception.ExchangeApiException;
import com.aitrader.backend.exception.SymbolNotFoundException;
import com.aitrader.backend.util.PrecisionUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Gate.io USDT perpetual futures (API v4). Orders are sized in whole contracts of
 * {@code quanto_multiplier} base units each, signed by side; callers always see base units.
 * Trigger orders live under a separate resource; their ids are prefixed with
 * {@value #PRICE_ORDER_PREFIX} so lookups and cancels reach the right endpoint.
 */
@Slf4j
public class GateAdapter extends AbstractExchangeAdapter {

    static final String PRICE_ORDER_PREFIX = "price:";
    private static final String API_PREFIX = "/api/v4";
    private static final String FUTURES = "/futures/usdt";
    private static final String TEXT_PREFIX = "t-";

    public GateAdapter(ExchangeCredentials credentials, ExchangeClientSupport support) {
        super(credentials, support);
    }

    @Override
    public ExchangeType exchange() {
        return ExchangeType.GATE;
    }

    static String toContract(String symbol) {
        if (symbol.contains("_")) {
            return symbol;
        }
        if (symbol.endsWith("USDT")) {
            return symbol.substring(0, symbol.length() - 4) + "_USDT";
        }
        return symbol;
    }

    @Override
    protected SymbolInfo fetchSymbolInfo(String symbol) {
        String contract = toContract(symbol);
        JsonNode contracts = read(() -> send(HttpMethod.GET, API_PREFIX + FUTURES + "/contracts", new HttpHeaders(), null));
        for (JsonNode entry : contracts) {
            if (!contract.equals(entry.path("name").asText())) {
                continue;
            }
            BigDecimal multiplier = positiveOrNull(decimalOrNull(entry, "quanto_multiplier"));
            if (multiplier == null) {
                multiplier = BigDecimal.ONE;
            }
            BigDecimal minSize = decimalOrNull(entry, "order_size_min");
            BigDecimal maxSize = decimalOrNull(entry, "order_size_max");
            return new SymbolInfo(symbol,
                    PrecisionUtils.precisionOf(entry.path("order_price_round").asText("0.01")),
                    PrecisionUtils.precisionOf(multiplier.toPlainString()),
                    (minSize != null ? minSize : BigDecimal.ONE).multiply(multiplier),
                    maxSize != null ? maxSize.multiply(multiplier) : null,
                    BigDecimal.ONE,
                    multiplier);
        }
        throw new SymbolNotFoundException(symbol);
    }

    @Override
    public BigDecimal getBalance(String asset) {
        JsonNode account = read(() -> signed(HttpMethod.GET, FUTURES + "/accounts", "", null));
        return decimalOrZero(account, "available");
    }

    @Override
    public Optional<PositionInfo> getPosition(String symbol) {
        String contract = toContract(symbol);
        return getPositions().stream().filter(p -> contract.equals(p.symbol())).findFirst();
    }

    @Override
    public List<PositionInfo> getPositions() {
        JsonNode positions = read(() -> signed(HttpMethod.GET, FUTURES + "/positions", "", null));
        List<PositionInfo> result = new ArrayList<>();
        for (JsonNode position : positions) {
            BigDecimal size = decimalOrZero(position, "size");
            if (size.signum() == 0) {
                continue;
            }
            String contract = position.path("contract").asText();
            result.add(new PositionInfo(
                    contract,
                    size.signum() > 0 ? "LONG" : "SHORT",
                    baseQuantity(contract, size.abs()),
                    decimalOrNull(position, "entry_price"),
                    decimalOrZero(position, "unrealised_pnl"),
                    position.path("leverage").asInt(1),
                    "single".equals(position.path("mode").asText()) ? "CROSS" : "ISOLATED"));
        }
        return result;
    }

    @Override
    public List<OrderResult> getOpenOrders(String symbol) {
        String query = "status=open" + (symbol != null ? "&contract=" + encode(toContract(symbol)) : "");
        try {
            JsonNode orders = read(() -> signed(HttpMethod.GET, FUTURES + "/orders", query, null));
            List<OrderResult> result = new ArrayList<>();
            for (JsonNode order : orders) {
                result.add(toOrderResult(symbol, order));
            }
            return result;
        } catch (ExchangeApiException e) {
            log.warn("gate open orders lookup failed: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public boolean setLeverage(String symbol, int leverage) {
        try {
            signed(HttpMethod.POST, FUTURES + "/positions/" + toContract(symbol) + "/leverage",
                    "leverage=" + leverage, null);
            return true;
        } catch (ExchangeApiException e) {
            log.warn("gate set leverage {}x on {} failed: {}", leverage, symbol, e.getMessage());
            return false;
        }
    }

    @Override
    public OrderResult placeMarketOrder(String symbol, OrderSide side, BigDecimal quantity, String clientOrderId) {
        return placeSafely(clientOrderId, () -> {
            long size = contracts(symbol, quantity);
            if (size <= 0) {
                return OrderResult.failure("INVALID_QUANTITY", "Quantity rounds to zero contracts for " + symbol);
            }
            ObjectNode body = objectMapper.createObjectNode();
            body.put("contract", toContract(symbol));
            body.put("size", side == OrderSide.BUY ? size : -size);
            body.put("price", "0");
            body.put("tif", "ioc");
            body.put("text", TEXT_PREFIX + clientOrderId);
            return toOrderResult(symbol, signed(HttpMethod.POST, FUTURES + "/orders", "", toJson(body)));
        });
    }

    @Override
    public OrderResult placeTakeProfit(String symbol, OrderSide side, BigDecimal quantity, BigDecimal stopPrice, String clientOrderId) {
        // closing a long with SELL triggers when price rises to the target
        return placeTrigger(symbol, side, quantity, stopPrice, clientOrderId, side == OrderSide.SELL ? 1 : 2);
    }

    @Override
    public OrderResult placeStopLoss(String symbol, OrderSide side, BigDecimal quantity, BigDecimal stopPrice, String clientOrderId) {
        return placeTrigger(symbol, side, quantity, stopPrice, clientOrderId, side == OrderSide.SELL ? 2 : 1);
    }

    private OrderResult placeTrigger(String symbol, OrderSide side, BigDecimal quantity, BigDecimal stopPrice,
                                     String clientOrderId, int rule) {
        return placeSafely(clientOrderId, () -> {
            long size = contracts(symbol, quantity);
            if (size <= 0) {
                return OrderResult.failure("INVALID_QUANTITY", "Quantity rounds to zero contracts for " + symbol);
            }
            ObjectNode body = objectMapper.createObjectNode();
            ObjectNode initial = body.putObject("initial");
            initial.put("contract", toContract(symbol));
            initial.put("size", side == OrderSide.BUY ? size : -size);
            initial.put("price", "0");
            initial.put("tif", "ioc");
            initial.put("reduce_only", true);
            initial.put("text", TEXT_PREFIX + clientOrderId);
            ObjectNode trigger = body.putObject("trigger");
            trigger.put("strategy_type", 0);
            trigger.put("price_type", 0);
            trigger.put("price", PrecisionUtils.plain(normalizePrice(symbol, stopPrice)));
            trigger.put("rule", rule);

            JsonNode response = signed(HttpMethod.POST, FUTURES + "/price_orders", "", toJson(body));
            return new OrderResult(true,
                    PRICE_ORDER_PREFIX + response.path("id").asText(),
                    clientOrderId,
                    OrderStatus.NEW,
                    BigDecimal.ZERO,
                    null,
                    null,
                    null,
                    response);
        });
    }

    @Override
    public boolean cancelOrder(String symbol, String orderId, String clientOrderId) {
        String path = orderPath(orderId, clientOrderId);
        if (path == null) {
            return false;
        }
        try {
            signed(HttpMethod.DELETE, path, "", null);
            return true;
        } catch (ExchangeApiException e) {
            log.warn("gate cancel {} failed: {}", orderId != null ? orderId : clientOrderId, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<OrderResult> getOrder(String symbol, String orderId, String clientOrderId) {
        String path = orderPath(orderId, clientOrderId);
        if (path == null) {
            return Optional.empty();
        }
        try {
            JsonNode order = read(() -> signed(HttpMethod.GET, path, "", null));
            if (orderId != null && orderId.startsWith(PRICE_ORDER_PREFIX)) {
                return Optional.of(toPriceOrderResult(orderId, clientOrderId, order));
            }
            return Optional.of(toOrderResult(symbol, order));
        } catch (ExchangeApiException e) {
            if (e.getStatusCode() >= 400 && e.getStatusCode() < 500) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public BigDecimal getTicker(String symbol) {
        JsonNode tickers = read(() -> send(HttpMethod.GET,
                API_PREFIX + FUTURES + "/tickers?contract=" + encode(toContract(symbol)), new HttpHeaders(), null));
        if (!tickers.isArray() || tickers.isEmpty()) {
            throw new SymbolNotFoundException(symbol);
        }
        return decimalOrNull(tickers.get(0), "mark_price");
    }

    private long contracts(String symbol, BigDecimal quantity) {
        BigDecimal contractSize = getSymbolInfo(symbol).contractSize();
        return normalizeQuantity(symbol, quantity).divide(contractSize, 0, RoundingMode.DOWN).longValue();
    }

    private BigDecimal baseQuantity(String symbol, BigDecimal contracts) {
        if (contracts.signum() == 0) {
            return contracts;
        }
        return contracts.multiply(getSymbolInfo(symbol).contractSize());
    }

    private String orderPath(String orderId, String clientOrderId) {
        if (orderId != null && orderId.startsWith(PRICE_ORDER_PREFIX)) {
            return FUTURES + "/price_orders/" + orderId.substring(PRICE_ORDER_PREFIX.length());
        }
        if (orderId != null) {
            return FUTURES + "/orders/" + orderId;
        }
        if (clientOrderId != null) {
            return FUTURES + "/orders/" + TEXT_PREFIX + clientOrderId;
        }
        return null;
    }

    /**
     * Headers per the v4 scheme: HMAC-SHA512 over method, path, query, body hash and epoch seconds.
     */
    private JsonNode signed(HttpMethod method, String path, String query, String body) {
        String fullPath = API_PREFIX + path;
        String payload = body != null ? body : "";
        String timestamp = String.valueOf(nowMillis() / 1000);
        String signatureBase = method.name() + "\n" + fullPath + "\n" + query + "\n" + sha512Hex(payload) + "\n" + timestamp;

        HttpHeaders headers = new HttpHeaders();
        headers.set("KEY", credentials.apiKey());
        headers.set("Timestamp", timestamp);
        headers.set("SIGN", hmacHex("HmacSHA512", credentials.apiSecret(), signatureBase));
        headers.setContentType(MediaType.APPLICATION_JSON);
        return send(method, query.isEmpty() ? fullPath : fullPath + "?" + query, headers, body);
    }

    private OrderResult toOrderResult(String symbol, JsonNode order) {
        BigDecimal size = decimalOrZero(order, "size").abs();
        BigDecimal left = decimalOrZero(order, "left").abs();
        BigDecimal filled = size.subtract(left);
        String text = order.path("text").asText(null);
        String contract = symbol != null ? symbol : order.path("contract").asText();
        return new OrderResult(true,
                order.path("id").asText(null),
                text != null && text.startsWith(TEXT_PREFIX) ? text.substring(TEXT_PREFIX.length()) : text,
                mapStatus(order.path("status").asText(), filled, left),
                baseQuantity(contract, filled),
                positiveOrNull(decimalOrNull(order, "fill_price")),
                null,
                null,
                order);
    }

    private OrderResult toPriceOrderResult(String orderId, String clientOrderId, JsonNode order) {
        String status = order.path("status").asText();
        OrderStatus mapped = switch (status) {
            case "finished" -> OrderStatus.FILLED;
            case "cancelled", "invalid", "expired" -> OrderStatus.CANCELED;
            default -> OrderStatus.NEW;
        };
        return new OrderResult(true, orderId, clientOrderId, mapped, BigDecimal.ZERO, null, null, null, order);
    }

    static OrderStatus mapStatus(String status, BigDecimal filled, BigDecimal left) {
        return switch (status) {
            case "open" -> filled.signum() > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.NEW;
            case "finished" -> filled.signum() == 0 && left.signum() > 0 ? OrderStatus.CANCELED : OrderStatus.FILLED;
            case "cancelled", "liquidated" -> OrderStatus.CANCELED;
            default -> OrderStatus.NEW;
        };
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
