package com.nfservice.plugboleto.translation;

import com.nfservice.plugboleto.model.Title;
import com.nfservice.plugboleto.util.Amounts;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared generators referenced by the {@link BankRuleTable}.
 *
 * <p>Data keys are stable: {@code number} is the bank reference ("nosso número"),
 * {@code document_number} the caller's document number. Amounts are {@link BigDecimal}
 * with scale 2 and dates are date-only.
 */
public final class ActionGenerators {

  /**
   * Full settlement: payment date, discount, paid value and interest. Interest is
   * {@code paidValue - faceValue}, computed in fixed point.
   */
  public static final ActionGenerator PAYED = (title, occurrence) -> {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("document_number", title.getDocumentNumber());
    data.put("occurrence_date", title.getPaymentDate());
    data.put("discount", title.getDiscountValue());
    data.put("value", title.getPaidValue());
    data.put("others_receipts", Amounts.ZERO);
    data.put("interest_delay", Amounts.ZERO);
    data.put("interest_default", interest(title));
    return NormalizedAction.of(ActionKind.PAYED, data);
  };

  /** Settlement reported without payment details; only the bank reference is known. */
  public static final ActionGenerator PAYED_REFERENCE =
      (title, occurrence) -> NormalizedAction.of(ActionKind.PAYED, reference(title));

  public static final ActionGenerator CONFIRMED =
      (title, occurrence) -> NormalizedAction.of(ActionKind.CONFIRMED, reference(title));

  public static final ActionGenerator CANCELED =
      (title, occurrence) -> NormalizedAction.of(ActionKind.CANCELED, reference(title));

  public static final ActionGenerator REJECTED = (title, occurrence) -> {
    Map<String, Object> data = reference(title);
    data.put("document_number", title.getDocumentNumber());
    String message = "Duplicata " + title.getDocumentNumber() + " rejeitada. ("
        + occurrence.getMessage() + ").";
    return NormalizedAction.of(ActionKind.REJECTED, data, message,
        occurrence.getSubOccurrences());
  };

  public static final ActionGenerator ABATEMENT_COMPLETED = (title, occurrence) -> {
    Map<String, Object> data = reference(title);
    data.put("discount_amount", title.getRebateValue());
    return NormalizedAction.of(ActionKind.ABATEMENT_COMPLETED, data);
  };

  public static final ActionGenerator ABATEMENT_CANCELED = (title, occurrence) -> {
    Map<String, Object> data = reference(title);
    data.put("discount_amount", title.getRebateValue());
    return NormalizedAction.of(ActionKind.ABATEMENT_CANCELED, data);
  };

  public static final ActionGenerator CHANGE_DUE_DATE = (title, occurrence) -> {
    Map<String, Object> data = reference(title);
    data.put("due_date", title.getDueDate());
    return NormalizedAction.of(ActionKind.CHANGE_DUE_DATE, data);
  };

  public static final ActionGenerator REMOVE_PAYED = (title, occurrence) -> {
    Map<String, Object> data = reference(title);
    data.put("value", title.getRebateValue());
    return NormalizedAction.of(ActionKind.REMOVE_PAYED, data);
  };

  /** Unclassified or informational movement: a message and the sub-occurrences, no data. */
  public static final ActionGenerator DEFAULT = (title, occurrence) -> {
    String message = "Movimento Duplicata " + title.getDocumentNumber() + " ("
        + occurrence.getMessage() + ").";
    return NormalizedAction.of(ActionKind.DEFAULT, new LinkedHashMap<>(), message,
        occurrence.getSubOccurrences());
  };

  private ActionGenerators() {
  }

  static BigDecimal interest(Title title) {
    return Amounts.scale(title.getPaidValue().subtract(title.getFaceValue()));
  }

  private static Map<String, Object> reference(Title title) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("number", title.getOurNumber());
    return data;
  }
}
