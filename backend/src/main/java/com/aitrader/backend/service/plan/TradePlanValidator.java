package com.aitrader.backend.service.plan;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.annotation.PreDestroy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Turns raw model text into a {@link TradePlanOutput}. Never throws; every problem comes back
 * as an invalid {@link ValidationResult}.
 */
@Component
public class TradePlanValidator {

    private final ObjectMapper strictMapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .build();

    private final ValidatorFactory validatorFactory = Validation.buildDefaultValidatorFactory();
    private final Validator validator = validatorFactory.getValidator();

    public ValidationResult validate(String content) {
        if (content == null || content.isBlank()) {
            return ValidationResult.invalid("Invalid JSON: empty response");
        }

        TradePlanOutput plan;
        try {
            plan = strictMapper.readValue(content, TradePlanOutput.class);
        } catch (JsonParseException e) {
            return ValidationResult.invalid("Invalid JSON: " + truncate(e.getOriginalMessage(), 100));
        } catch (JacksonException e) {
            return ValidationResult.invalid("Schema error: " + truncate(e.getOriginalMessage(), 200));
        }
        if (plan == null) {
            return ValidationResult.invalid("Schema error: expected a JSON object");
        }

        Set<ConstraintViolation<TradePlanOutput>> violations = validator.validate(plan);
        if (!violations.isEmpty()) {
            List<String> errors = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> "Schema error: " + v.getPropertyPath() + " " + v.getMessage())
                    .toList();
            return ValidationResult.invalid(errors);
        }

        List<String> errors = new ArrayList<>();
        if (plan.isOpen()) {
            requireForOpen(plan.getSymbol() == null || plan.getSymbol().isBlank(), "symbol", errors);
            requireForOpen(plan.getSide() == null, "side", errors);
            requireForOpen(plan.getEntry() == null, "entry", errors);
            requireForOpen(plan.getPositionSize() == null, "position_size", errors);
        }
        if (plan.getEvidence() == null) {
            plan.setEvidence(new TradePlanOutput.Evidence());
        }
        return errors.isEmpty() ? ValidationResult.ok(plan) : ValidationResult.invalid(errors);
    }

    @PreDestroy
    void close() {
        validatorFactory.close();
    }

    private static void requireForOpen(boolean missing, String field, List<String> errors) {
        if (missing) {
            errors.add("Validation error: " + field + " is required when action is 'open'");
        }
    }

    private static String truncate(String message, int max) {
        String text = message == null ? "" : message;
        return text.length() <= max ? text : text.substring(0, max);
    }
}
