package com.nfservice.plugboleto.translation;

import static com.nfservice.plugboleto.translation.ActionGenerators.ABATEMENT_CANCELED;
import static com.nfservice.plugboleto.translation.ActionGenerators.ABATEMENT_COMPLETED;
import static com.nfservice.plugboleto.translation.ActionGenerators.CANCELED;
import static com.nfservice.plugboleto.translation.ActionGenerators.CHANGE_DUE_DATE;
import static com.nfservice.plugboleto.translation.ActionGenerators.CONFIRMED;
import static com.nfservice.plugboleto.translation.ActionGenerators.PAYED;
import static com.nfservice.plugboleto.translation.ActionGenerators.PAYED_REFERENCE;
import static com.nfservice.plugboleto.translation.ActionGenerators.REJECTED;
import static com.nfservice.plugboleto.translation.ActionGenerators.REMOVE_PAYED;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Occurrence-code tables per bank and CNAB layout.
 *
 * <p>Read-only after class initialization and safe to share between threads. Codes missing
 * from a table resolve to {@link ActionGenerators#DEFAULT} in {@link OccurrenceTranslator};
 * a bank without a table for a layout (089 has no CNAB 240 table) behaves the same way.
 *
 * <p>Every bank uses {@link ActionGenerators#PAYED}, which reports interest as paid value
 * minus face value.
 */
public final class BankRuleTable {

  private static final Map<String, Map<LayoutVersion, Map<String, ActionGenerator>>> RULES =
      Map.ofEntries(
          bank("237",
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03", "24")
                  .map(PAYED, "06", "15", "16", "17")
                  .map(PAYED_REFERENCE, "09")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14")
                  .map(REMOVE_PAYED, "22"),
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "17", "45")
                  .map(PAYED_REFERENCE, "09")),
          bank("341",
              codes()
                  .map(CONFIRMED, "02", "64", "73")
                  .map(REJECTED, "03", "15", "16", "17", "18", "60")
                  .map(PAYED, "06", "07", "08", "10", "59")
                  .map(PAYED_REFERENCE, "09", "32")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14"),
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03", "15", "16", "17", "18", "60")
                  .map(PAYED, "06", "08", "23")
                  .map(PAYED_REFERENCE, "09", "10", "32")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14")),
          bank("001",
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "05", "06", "07", "08", "15")
                  .map(PAYED_REFERENCE, "09", "10", "20")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14"),
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "17", "23", "45")
                  .map(PAYED_REFERENCE, "09")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14")),
          bank("033",
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "07", "08", "17")
                  .map(PAYED_REFERENCE, "09", "10")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14"),
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "17", "23", "25")
                  .map(PAYED_REFERENCE, "09")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14")),
          bank("748",
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "15", "17")
                  .map(PAYED_REFERENCE, "09", "10")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14"),
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "17", "23")
                  .map(PAYED_REFERENCE, "09")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14")),
          bank("756",
              codes()
                  .map(CONFIRMED, "02")
                  .map(PAYED, "05", "06", "15")
                  .map(CANCELED, "09", "10")
                  .map(CHANGE_DUE_DATE, "14"),
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "17", "23")
                  .map(CANCELED, "09")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14")),
          bank("104",
              codes()
                  .map(CONFIRMED, "01")
                  .map(PAYED_REFERENCE, "02")
                  .map(CHANGE_DUE_DATE, "05")
                  .map(PAYED, "21", "22"),
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06")
                  .map(PAYED_REFERENCE, "09")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14")),
          bank("422",
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "15")
                  .map(PAYED_REFERENCE, "09", "40")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14"),
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "15")
                  .map(PAYED_REFERENCE, "09", "40")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14")),
          bank("021",
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "17")
                  .map(PAYED_REFERENCE, "09")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14"),
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03")
                  .map(PAYED, "06", "17")
                  .map(PAYED_REFERENCE, "09")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14")),
          bank("089",
              codes()
                  .map(CONFIRMED, "02")
                  .map(REJECTED, "03", "30")
                  .map(PAYED, "05", "06", "15", "16", "17")
                  .map(PAYED_REFERENCE, "09")
                  .map(ABATEMENT_COMPLETED, "12")
                  .map(ABATEMENT_CANCELED, "13")
                  .map(CHANGE_DUE_DATE, "14"),
              null));

  private BankRuleTable() {
  }

  /** Generator for the code, or empty when the bank, layout or code has no entry. */
  public static Optional<ActionGenerator> lookup(String bankId, LayoutVersion layout,
      String code) {
    Map<LayoutVersion, Map<String, ActionGenerator>> layouts = RULES.get(bankId);
    if (layouts == null) {
      return Optional.empty();
    }
    Map<String, ActionGenerator> codes = layouts.get(layout);
    if (codes == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(codes.get(code));
  }

  public static Set<String> supportedBanks() {
    return RULES.keySet();
  }

  /** Codes with an explicit entry, in declaration order. Empty for unknown bank or layout. */
  public static Map<String, ActionGenerator> entries(String bankId, LayoutVersion layout) {
    Map<LayoutVersion, Map<String, ActionGenerator>> layouts = RULES.get(bankId);
    if (layouts == null || !layouts.containsKey(layout)) {
      return Map.of();
    }
    return layouts.get(layout);
  }

  private static Map.Entry<String, Map<LayoutVersion, Map<String, ActionGenerator>>> bank(
      String bankId, CodeTable cnab400, CodeTable cnab240) {
    Map<LayoutVersion, Map<String, ActionGenerator>> layouts = new EnumMap<>(LayoutVersion.class);
    layouts.put(LayoutVersion.CNAB_400, cnab400.build());
    if (cnab240 != null) {
      layouts.put(LayoutVersion.CNAB_240, cnab240.build());
    }
    return Map.entry(bankId, Collections.unmodifiableMap(layouts));
  }

  private static CodeTable codes() {
    return new CodeTable();
  }

  private static final class CodeTable {

    private final Map<String, ActionGenerator> entries = new LinkedHashMap<>();

    CodeTable map(ActionGenerator generator, String... codes) {
      for (String code : codes) {
        if (entries.putIfAbsent(code, generator) != null) {
          throw new IllegalStateException("Duplicate occurrence code " + code);
        }
      }
      return this;
    }

    Map<String, ActionGenerator> build() {
      return Collections.unmodifiableMap(entries);
    }
  }
}
