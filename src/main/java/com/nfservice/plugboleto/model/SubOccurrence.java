package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** A {code, message} detail attached to an occurrence, e.g. one rejection reason. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SubOccurrence {

  private final String code;
  private final String message;

  @JsonCreator
  public SubOccurrence(@JsonProperty("codigo") String code,
      @JsonProperty("mensagem") String message) {
    this.code = code;
    this.message = message;
  }

  @JsonProperty("code")
  public String getCode() {
    return code;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SubOccurrence)) {
      return false;
    }
    SubOccurrence that = (SubOccurrence) o;
    return Objects.equals(code, that.code) && Objects.equals(message, that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message);
  }

  @Override
  public String toString() {
    return code + ":" + message;
  }
}
