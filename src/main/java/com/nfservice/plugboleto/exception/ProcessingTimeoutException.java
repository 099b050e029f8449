package com.nfservice.plugboleto.exception;

import java.util.List;

/**
 * Thrown when a print job is still not materialized after every polling attempt.
 * Carries the last status message and per-item reasons in the same layout as
 * {@link SubmissionRejectedException}.
 */
public class ProcessingTimeoutException extends RuntimeException {

  private final String protocol;

  public ProcessingTimeoutException(String protocol, String lastMessage, List<String> reasons) {
    super(SubmissionRejectedException.compose(lastMessage, reasons));
    this.protocol = protocol;
  }

  public String getProtocol() {
    return protocol;
  }
}
