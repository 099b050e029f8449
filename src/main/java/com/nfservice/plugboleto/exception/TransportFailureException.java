package com.nfservice.plugboleto.exception;

/**
 * Thrown when the PlugBoleto service is unreachable or returns a server error (5xx).
 * Never retried by this layer. Handled by {@link CommonExceptionHandler} to produce a
 * 502 Bad Gateway response.
 */
public class TransportFailureException extends RuntimeException {

  public TransportFailureException(String message) {
    super(message);
  }

  public TransportFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
