package com.aitrader.backend.service.plan;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Trade plan as produced by the model, before risk checks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradePlanOutput {

    @NotNull
    private Action action;

    private String symbol;

    private Side side;

    @Valid
    private Entry entry;

    @Valid
    @JsonProperty("position_size")
    private PositionSize positionSize;

    @NotNull
    @Min(1)
    @Max(125)
    @Builder.Default
    @JsonDeserialize(using = WholeNumberDeserializer.class)
    private Integer leverage = 1;

    @Valid
    private TpSl tp;

    @Valid
    private TpSl sl;

    @JsonProperty("time_in_force")
    private TimeInForce timeInForce;

    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal confidence;

    @NotNull
    @Size(max = 500)
    @JsonProperty("reason_summary")
    private String reasonSummary;

    @Builder.Default
    private Evidence evidence = new Evidence();

    @JsonIgnore
    public boolean isOpen() {
        return action == Action.OPEN;
    }

    public enum Action {
        @JsonProperty("open") OPEN,
        @JsonProperty("close") CLOSE,
        @JsonProperty("skip") SKIP;

        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Side {
        @JsonProperty("long") LONG,
        @JsonProperty("short") SHORT;

        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum EntryType {
        @JsonProperty("market") MARKET,
        @JsonProperty("limit") LIMIT
    }

    public enum SizeMode {
        @JsonProperty("notional") NOTIONAL,
        @JsonProperty("qty") QTY
    }

    public enum TpSlMode {
        @JsonProperty("percent") PERCENT,
        @JsonProperty("price") PRICE
    }

    public enum TimeInForce {
        GTC,
        IOC
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        @NotNull
        private EntryType type;

        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal price;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PositionSize {
        @NotNull
        private SizeMode mode;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TpSl {
        @NotNull
        private TpSlMode mode;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Evidence {
        private List<Map<String, Object>> signals = new ArrayList<>();
        private Map<String, Object> indicators = new LinkedHashMap<>();
        @JsonProperty("key_levels")
        private Map<String, Object> keyLevels = new LinkedHashMap<>();
    }
}
