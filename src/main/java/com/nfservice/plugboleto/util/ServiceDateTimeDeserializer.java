package com.nfservice.plugboleto.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import java.io.IOException;
import java.time.LocalDateTime;

public class ServiceDateTimeDeserializer extends JsonDeserializer<LocalDateTime> {

  @Override
  public LocalDateTime deserialize(JsonParser parser, DeserializationContext context)
      throws IOException {
    try {
      return ServiceDates.parseDateTime(parser.getValueAsString());
    } catch (IllegalArgumentException e) {
      return (LocalDateTime) context.handleWeirdStringValue(LocalDateTime.class,
          parser.getValueAsString(), e.getMessage());
    }
  }
}
