package com.nfservice.plugboleto.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import java.io.IOException;
import java.math.BigDecimal;

/** Reads a service amount, given as a JSON string or number, through {@link Amounts}. */
public class AmountDeserializer extends JsonDeserializer<BigDecimal> {

  @Override
  public BigDecimal deserialize(JsonParser parser, DeserializationContext context)
      throws IOException {
    if (parser.currentToken() == JsonToken.VALUE_NUMBER_INT
        || parser.currentToken() == JsonToken.VALUE_NUMBER_FLOAT) {
      return Amounts.scale(parser.getDecimalValue());
    }
    try {
      return Amounts.parse(parser.getValueAsString());
    } catch (NumberFormatException e) {
      return (BigDecimal) context.handleWeirdStringValue(BigDecimal.class,
          parser.getValueAsString(), "not a monetary amount");
    }
  }

  @Override
  public BigDecimal getNullValue(DeserializationContext context) {
    return Amounts.ZERO;
  }
}
