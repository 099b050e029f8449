package com.nfservice.plugboleto.model;

import java.util.Locale;

/** Server-side state of an asynchronous batch operation. */
public enum OperationStatus {
  PROCESSING,
  PROCESSED,
  ERROR;

  /** Maps the service {@code situacao}; anything unexpected is an error. */
  public static OperationStatus fromSituacao(String situacao) {
    if (situacao == null) {
      return ERROR;
    }
    switch (situacao.trim().toUpperCase(Locale.ROOT)) {
      case "PROCESSANDO":
        return PROCESSING;
      case "PROCESSADO":
        return PROCESSED;
      default:
        return ERROR;
    }
  }
}
