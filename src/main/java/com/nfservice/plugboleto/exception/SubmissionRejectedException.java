package com.nfservice.plugboleto.exception;

import java.util.List;

/**
 * Thrown when the PlugBoleto service answers with an error envelope ({@code _status: erro}).
 *
 * <p>The message is composed as the service message followed by the itemized reasons, one
 * per line, so operators see both the summary and the per-item cause. Handled by
 * {@link CommonExceptionHandler} to produce a 422 response.
 */
public class SubmissionRejectedException extends RuntimeException {

  private final String serviceMessage;
  private final List<String> reasons;

  public SubmissionRejectedException(String serviceMessage, List<String> reasons) {
    super(compose(serviceMessage, reasons));
    this.serviceMessage = serviceMessage;
    this.reasons = List.copyOf(reasons);
  }

  public SubmissionRejectedException(String serviceMessage) {
    this(serviceMessage, List.of());
  }

  public String getServiceMessage() {
    return serviceMessage;
  }

  public List<String> getReasons() {
    return reasons;
  }

  static String compose(String serviceMessage, List<String> reasons) {
    String summary = serviceMessage == null ? "" : serviceMessage;
    if (reasons.isEmpty()) {
      return summary;
    }
    return summary + "\n" + String.join("\n", reasons);
  }
}
