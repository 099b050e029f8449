package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** PlugBoleto {@code TipoImpressao} values. */
public enum PrintMode {
  NORMAL("0"),
  BOOKLET_DOUBLE_LANDSCAPE("1"),
  BOOKLET_TRIPLE_PORTRAIT("2"),
  DOUBLE_PORTRAIT("3"),
  WATERMARK("4"),
  CUSTOM("99");

  private final String code;

  PrintMode(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  /** Custom layouts send a {@code Personalizacao} payload instead of a title list. */
  public boolean isCustomLayout() {
    return this == CUSTOM;
  }

  @JsonCreator
  public static PrintMode fromCode(String code) {
    for (PrintMode mode : values()) {
      if (mode.code.equals(code) || mode.name().equalsIgnoreCase(code)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown print mode: " + code);
  }
}
