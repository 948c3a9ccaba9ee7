package com.priceprediction.dto;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/** Reads bedrooms as an integer, accepting "Studio" (any case) as 0. */
public class BedroomsDeserializer extends StdDeserializer<Integer> {

    public BedroomsDeserializer() {
        super(Integer.class);
    }

    @Override
    public Integer deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_STRING) {
            String text = p.getText().trim();
            if (text.isEmpty()) {
                return null;
            }
            if ("studio".equalsIgnoreCase(text)) {
                return 0;
            }
            try {
                return Integer.valueOf(text);
            } catch (NumberFormatException ex) {
                return (Integer) ctxt.handleWeirdStringValue(Integer.class, text,
                    "bedrooms must be a whole number or \"Studio\"");
            }
        }
        if (p.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            return p.getIntValue();
        }
        return (Integer) ctxt.handleUnexpectedToken(Integer.class, p);
    }
}
