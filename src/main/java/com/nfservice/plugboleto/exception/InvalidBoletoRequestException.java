package com.nfservice.plugboleto.exception;

/**
 * Thrown when a caller request fails local checks before anything is sent to the service,
 * e.g. an empty id list or empty return-file content.
 */
public class InvalidBoletoRequestException extends RuntimeException {

  public InvalidBoletoRequestException(String message) {
    super(message);
  }
}
