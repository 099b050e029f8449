package com.nfservice.plugboleto.model;

import java.util.Locale;

/**
 * Lifecycle of a title as seen by this integration.
 *
 * <p>Transitions are monotonic: {@code PENDING -> ACCEPTED -> PAID}, with {@code REJECTED}
 * and {@code FAILED} reachable from {@code PENDING} or {@code ACCEPTED}. A title that is
 * {@code PAID} or {@code REJECTED} never goes back.
 */
public enum TitleStatus {
  PENDING,
  ACCEPTED,
  REJECTED,
  PAID,
  FAILED;

  /**
   * Maps the service {@code situacao} to a status. Unknown values are treated as pending.
   */
  public static TitleStatus fromSituacao(String situacao) {
    if (situacao == null) {
      return PENDING;
    }
    switch (situacao.trim().toUpperCase(Locale.ROOT)) {
      case "EMITIDO":
      case "REGISTRADO":
      case "BAIXADO":
        return ACCEPTED;
      case "LIQUIDADO":
      case "PAGO":
        return PAID;
      case "REJEITADO":
        return REJECTED;
      case "FALHA":
        return FAILED;
      default:
        return PENDING;
    }
  }

  public boolean canTransitionTo(TitleStatus next) {
    if (next == this) {
      return true;
    }
    switch (this) {
      case PENDING:
        return true;
      case ACCEPTED:
        return next != PENDING;
      default:
        return false;
    }
  }

  /** Returns {@code next} when the move is allowed, otherwise keeps this status. */
  public TitleStatus advance(TitleStatus next) {
    return canTransitionTo(next) ? next : this;
  }
}
