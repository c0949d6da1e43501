package com.aitrader.backend.service.risk;

import com.aitrader.backend.service.plan.TradePlanOutput;
import com.aitrader.backend.util.PrecisionUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Hard gate between a validated model plan and the exchange. Every failed check is reported,
 * not just the first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskManager {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final Clock clock;

    /**
     * @param currentPrice mark price, null when it could not be fetched
     */
    public RiskReport check(TradePlanOutput plan, RiskProfile profile, AccountState account, BigDecimal currentPrice) {
        switch (plan.getAction()) {
            case SKIP:
                return RiskReport.allow("Action is skip");
            case CLOSE:
                return RiskReport.allow("Close action allowed");
            default:
                break;
        }

        if (plan.getSymbol() == null || plan.getSide() == null || plan.getPositionSize() == null) {
            return RiskReport.block(List.of("Missing required fields for open action"));
        }

        List<String> reasons = new ArrayList<>();
        int leverage = plan.getLeverage() == null ? 1 : plan.getLeverage();
        BigDecimal price = currentPrice != null && currentPrice.signum() > 0 ? currentPrice : null;

        if (leverage > profile.getMaxLeverage()) {
            reasons.add("Leverage " + leverage + " exceeds max " + profile.getMaxLeverage());
        }

        if (account.getOpenPositions() >= profile.getMaxConcurrentPositions()) {
            reasons.add("Max concurrent positions (" + profile.getMaxConcurrentPositions() + ") reached");
        }

        BigDecimal quantity = calculateQuantity(plan.getPositionSize(), profile, price);
        if (quantity == null) {
            reasons.add("Could not calculate valid quantity");
        } else {
            BigDecimal notional = price == null ? null : quantity.multiply(price);
            if (profile.getMaxPositionNotional() != null && notional != null
                    && notional.compareTo(profile.getMaxPositionNotional()) > 0) {
                reasons.add("Position notional " + PrecisionUtils.plain(notional)
                        + " exceeds max " + PrecisionUtils.plain(profile.getMaxPositionNotional()));
            }
            if (profile.getMaxPositionQty() != null && quantity.compareTo(profile.getMaxPositionQty()) > 0) {
                reasons.add("Position qty " + quantity.toPlainString()
                        + " exceeds max " + PrecisionUtils.plain(profile.getMaxPositionQty()));
            }
            if (quantity.compareTo(profile.getMinQuantity()) < 0) {
                reasons.add("Position qty " + quantity.toPlainString()
                        + " below min " + PrecisionUtils.plain(profile.getMinQuantity()));
            }
            if (notional != null && notional.compareTo(profile.getMinNotional()) < 0) {
                reasons.add("Position notional " + PrecisionUtils.plain(notional)
                        + " below min " + PrecisionUtils.plain(profile.getMinNotional()));
            }
        }

        BigDecimal lossCap = profile.getDailyLossCap();
        if (lossCap != null && lossCap.signum() > 0
                && account.getCurrentDailyPnl().compareTo(lossCap.negate()) < 0) {
            reasons.add("Daily loss cap " + PrecisionUtils.plain(lossCap) + " exceeded");
        }

        String cooldown = checkCooldown(plan.getSymbol(), plan.getSide().getValue(), account.getRecentTrades(),
                profile.getCooldownSeconds());
        if (cooldown != null) {
            reasons.add(cooldown);
        }

        if (quantity != null && price != null) {
            BigDecimal requiredMargin = quantity.multiply(price)
                    .divide(BigDecimal.valueOf(leverage), 8, RoundingMode.HALF_UP);
            if (requiredMargin.compareTo(account.getAvailableBalance()) > 0) {
                reasons.add("Insufficient margin: need " + PrecisionUtils.plain(requiredMargin)
                        + ", have " + PrecisionUtils.plain(account.getAvailableBalance()));
            }
        }

        if (!reasons.isEmpty()) {
            log.info("Risk check blocked {} {}: {}", plan.getSymbol(), plan.getSide().getValue(), reasons);
            return RiskReport.block(reasons);
        }
        return RiskReport.allow(normalize(plan, quantity, leverage, profile, price));
    }

    BigDecimal calculateQuantity(TradePlanOutput.PositionSize size, RiskProfile profile, BigDecimal price) {
        BigDecimal raw;
        if (size.getMode() == TradePlanOutput.SizeMode.QTY) {
            raw = size.getValue();
        } else {
            if (price == null) {
                return null;
            }
            raw = size.getValue().divide(price, profile.getQuantityPrecision() + 8, RoundingMode.DOWN);
        }
        BigDecimal quantity = PrecisionUtils.roundQuantity(raw, profile.getQuantityPrecision());
        return quantity.signum() > 0 ? quantity : null;
    }

    private String checkCooldown(String symbol, String side, List<RecentTrade> recentTrades, long cooldownSeconds) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusSeconds(cooldownSeconds);
        for (RecentTrade trade : recentTrades) {
            if (symbol.equals(trade.symbol()) && side.equals(trade.side())
                    && trade.createdAt() != null && trade.createdAt().isAfter(cutoff)) {
                return "Cooldown active for " + symbol + " " + side + " (wait " + cooldownSeconds + "s)";
            }
        }
        return null;
    }

    private NormalizedPlan normalize(TradePlanOutput plan, BigDecimal quantity, int leverage,
                                     RiskProfile profile, BigDecimal price) {
        int pricePrecision = profile.getPricePrecision();
        boolean isLong = plan.getSide() == TradePlanOutput.Side.LONG;

        BigDecimal entryPrice = plan.getEntry() != null && plan.getEntry().getPrice() != null
                ? PrecisionUtils.roundPrice(plan.getEntry().getPrice(), pricePrecision)
                : null;
        BigDecimal tpPrice = targetPrice(plan.getTp(), price, isLong, pricePrecision);
        BigDecimal slPrice = targetPrice(plan.getSl(), price, !isLong, pricePrecision);

        return new NormalizedPlan(
                plan.getSymbol(),
                plan.getSide().getValue(),
                quantity,
                Math.min(leverage, profile.getMaxLeverage()),
                plan.getEntry() != null ? plan.getEntry().getType().name().toLowerCase(Locale.ROOT) : "market",
                entryPrice,
                tpPrice,
                slPrice,
                plan.getTimeInForce() == null ? null : plan.getTimeInForce().name());
    }

    /**
     * @param above true when the target sits above the current price (long TP, short SL)
     */
    private static BigDecimal targetPrice(TradePlanOutput.TpSl target, BigDecimal price, boolean above, int precision) {
        if (target == null) {
            return null;
        }
        if (target.getMode() == TradePlanOutput.TpSlMode.PRICE) {
            return PrecisionUtils.roundPrice(target.getValue(), precision);
        }
        if (price == null) {
            return null;
        }
        BigDecimal fraction = target.getValue().divide(HUNDRED);
        BigDecimal factor = above ? BigDecimal.ONE.add(fraction) : BigDecimal.ONE.subtract(fraction);
        return PrecisionUtils.roundPrice(price.multiply(factor), precision);
    }
}
