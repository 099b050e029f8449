package com.nfservice.plugboleto.translation;

/** CNAB return-file layout. Occurrence codes mean different things per layout. */
public enum LayoutVersion {
  CNAB_400("400"),
  CNAB_240("240");

  private final String code;

  LayoutVersion(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  /** {@code "400"} selects CNAB 400; anything else is read as CNAB 240. */
  public static LayoutVersion fromCode(String code) {
    return code != null && CNAB_400.code.equals(code.trim()) ? CNAB_400 : CNAB_240;
  }
}
