package com.nfservice.plugboleto.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import java.io.IOException;
import java.time.LocalDate;

public class ServiceDateDeserializer extends JsonDeserializer<LocalDate> {

  @Override
  public LocalDate deserialize(JsonParser parser, DeserializationContext context)
      throws IOException {
    try {
      return ServiceDates.parseDate(parser.getValueAsString());
    } catch (IllegalArgumentException e) {
      return (LocalDate) context.handleWeirdStringValue(LocalDate.class,
          parser.getValueAsString(), e.getMessage());
    }
  }
}
