package com.nfservice.plugboleto.exception;

/**
 * Thrown when the calling thread is interrupted while waiting between polling attempts.
 * The interrupt flag is restored before this is thrown.
 */
public class PollingInterruptedException extends RuntimeException {

  public PollingInterruptedException(String message, InterruptedException cause) {
    super(message, cause);
  }
}
