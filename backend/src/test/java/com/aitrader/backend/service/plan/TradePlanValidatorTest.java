package com.aitrader.backend.service.plan;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TradePlanValidatorTest {

    private final TradePlanValidator validator = new TradePlanValidator();

    @AfterEach
    void tearDown() {
        validator.close();
    }

    @Test
    void acceptsCompleteOpenPlan() {
        String json = "{\"action\":\"open\",\"symbol\":\"BTCUSDT\",\"side\":\"long\","
                + "\"entry\":{\"type\":\"market\",\"price\":null},"
                + "\"position_size\":{\"mode\":\"notional\",\"value\":100},"
                + "\"leverage\":5,"
                + "\"tp\":{\"mode\":\"percent\",\"value\":2},"
                + "\"sl\":{\"mode\":\"price\",\"value\":49000.5},"
                + "\"time_in_force\":\"GTC\","
                + "\"confidence\":0.72,"
                + "\"reason_summary\":\"Breakout above resistance\","
                + "\"evidence\":{\"signals\":[{\"name\":\"rsi\"}],\"indicators\":{\"rsi\":61},\"key_levels\":{}}}";

        ValidationResult result = validator.validate(json);

        assertThat(result.valid()).isTrue();
        TradePlanOutput plan = result.plan();
        assertThat(plan.getAction()).isEqualTo(TradePlanOutput.Action.OPEN);
        assertThat(plan.getSide()).isEqualTo(TradePlanOutput.Side.LONG);
        assertThat(plan.getPositionSize().getValue()).isEqualByComparingTo("100");
        assertThat(plan.getSl().getMode()).isEqualTo(TradePlanOutput.TpSlMode.PRICE);
        assertThat(plan.getSl().getValue()).isEqualByComparingTo("49000.5");
        assertThat(plan.getTimeInForce()).isEqualTo(TradePlanOutput.TimeInForce.GTC);
        assertThat(plan.getEvidence().getIndicators()).containsKey("rsi");
    }

    @Test
    void skipNeedsOnlyCoreFields() {
        ValidationResult result = validator.validate(
                "{\"action\":\"skip\",\"confidence\":0.3,\"reason_summary\":\"Choppy market\"}");

        assertThat(result.valid()).isTrue();
        assertThat(result.plan().getLeverage()).isEqualTo(1);
        assertThat(result.plan().getEvidence()).isNotNull();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void rejectsNonJson() {
        ValidationResult result = validator.validate("Sure! Here is the plan: open long");

        assertThat(result.valid()).isFalse();
        assertThat(result.plan()).isNull();
        assertThat(result.errors()).singleElement().asString().startsWith("Invalid JSON");
    }

    @Test
    void rejectsEmptyAndNullDocuments() {
        assertThat(validator.validate("  ").errors()).containsExactly("Invalid JSON: empty response");
        assertThat(validator.validate("null").errors()).containsExactly("Schema error: expected a JSON object");
    }

    @Test
    void rejectsUnknownProperties() {
        ValidationResult result = validator.validate(
                "{\"action\":\"skip\",\"confidence\":0.3,\"reason_summary\":\"x\",\"mood\":\"bullish\"}");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).singleElement().asString().startsWith("Schema error");
    }

    @Test
    void rejectsValuesOutsideEnumsAndRanges() {
        assertThat(validator.validate("{\"action\":\"buy\",\"confidence\":0.3,\"reason_summary\":\"x\"}").errors())
                .singleElement().asString().startsWith("Schema error");
        assertThat(validator.validate("{\"action\":\"skip\",\"confidence\":1.5,\"reason_summary\":\"x\"}").errors())
                .singleElement().asString().startsWith("Schema error: confidence");
        assertThat(validator.validate("{\"action\":\"skip\",\"leverage\":200,\"confidence\":0.5,\"reason_summary\":\"x\"}")
                .errors()).singleElement().asString().startsWith("Schema error: leverage");
        assertThat(validator.validate("{\"action\":\"skip\",\"leverage\":2.5,\"confidence\":0.5,\"reason_summary\":\"x\"}")
                .valid()).isFalse();
    }

    @Test
    void leverageAcceptsWholeNumberFloatsOnly() {
        ValidationResult whole = validator.validate(
                "{\"action\":\"skip\",\"leverage\":10.0,\"confidence\":0.5,\"reason_summary\":\"x\"}");
        ValidationResult fractional = validator.validate(
                "{\"action\":\"skip\",\"leverage\":10.5,\"confidence\":0.5,\"reason_summary\":\"x\"}");
        ValidationResult quoted = validator.validate(
                "{\"action\":\"skip\",\"leverage\":\"10\",\"confidence\":0.5,\"reason_summary\":\"x\"}");

        assertThat(whole.valid()).isTrue();
        assertThat(whole.plan().getLeverage()).isEqualTo(10);
        assertThat(fractional.errors()).singleElement().asString().startsWith("Schema error");
        assertThat(quoted.errors()).singleElement().asString().startsWith("Schema error");
    }

    @Test
    void rejectsMissingCoreFields() {
        ValidationResult result = validator.validate("{\"action\":\"skip\"}");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(2);
        assertThat(result.errors().get(0)).startsWith("Schema error: confidence");
        assertThat(result.errors().get(1)).startsWith("Schema error: reasonSummary");
    }

    @Test
    void rejectsOverlongReason() {
        String reason = "r".repeat(501);

        ValidationResult result = validator.validate(
                "{\"action\":\"skip\",\"confidence\":0.3,\"reason_summary\":\"" + reason + "\"}");

        assertThat(result.valid()).isFalse();
    }

    @Test
    void openWithoutTradeFieldsListsEachMissingField() {
        ValidationResult result = validator.validate(
                "{\"action\":\"open\",\"side\":\"short\",\"confidence\":0.8,\"reason_summary\":\"x\"}");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly(
                "Validation error: symbol is required when action is 'open'",
                "Validation error: entry is required when action is 'open'",
                "Validation error: position_size is required when action is 'open'");
    }

    @Test
    void rejectsNonPositiveSize() {
        ValidationResult result = validator.validate("{\"action\":\"open\",\"symbol\":\"BTCUSDT\",\"side\":\"long\","
                + "\"entry\":{\"type\":\"market\"},\"position_size\":{\"mode\":\"qty\",\"value\":0},"
                + "\"confidence\":0.8,\"reason_summary\":\"x\"}");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).singleElement().asString().startsWith("Schema error: positionSize.value");
    }
}
