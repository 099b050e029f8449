package com.nfservice.plugboleto.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point handling of the monetary strings PlugBoleto sends.
 *
 * <p>Values arrive either in Brazilian notation ({@code "1.234,56"}) or with a dot as the
 * decimal separator ({@code "105.5"}). Both are parsed to a {@link BigDecimal} with scale 2,
 * never through {@code double}.
 */
public final class Amounts {

  public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);

  private Amounts() {
  }

  /**
   * Parses a service amount. Missing or blank values are zero.
   *
   * @throws NumberFormatException if the text is not a number in either notation
   */
  public static BigDecimal parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return ZERO;
    }
    String text = raw.trim().replace("R$", "").replace(" ", "");
    if (text.indexOf(',') >= 0) {
      text = text.replace(".", "").replace(',', '.');
    }
    return scale(new BigDecimal(text));
  }

  public static BigDecimal scale(BigDecimal value) {
    if (value == null) {
      return ZERO;
    }
    return value.setScale(2, RoundingMode.HALF_EVEN);
  }
}
