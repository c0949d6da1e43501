package com.aitrader.backend.service.plan;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Integer field that also takes whole-number floats such as {@code 10.0}. Fractions and
 * non-numeric tokens are rejected.
 */
class WholeNumberDeserializer extends StdDeserializer<Integer> {

    WholeNumberDeserializer() {
        super(Integer.class);
    }

    @Override
    public Integer deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            return p.getIntValue();
        }
        if (p.currentToken() == JsonToken.VALUE_NUMBER_FLOAT) {
            BigDecimal value = p.getDecimalValue();
            try {
                return value.intValueExact();
            } catch (ArithmeticException e) {
                return (Integer) ctxt.handleWeirdNumberValue(Integer.class, value, "expected a whole number");
            }
        }
        return (Integer) ctxt.handleUnexpectedToken(Integer.class, p);
    }
}
