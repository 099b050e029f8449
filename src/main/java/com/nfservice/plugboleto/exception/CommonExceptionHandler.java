package com.nfservice.plugboleto.exception;

import com.nfservice.plugboleto.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Global exception handler that maps domain exceptions to HTTP responses.
 *
 * <ul>
 *   <li>{@link InvalidBoletoRequestException} -> 400 Bad Request</li>
 *   <li>{@link SubmissionRejectedException} -> 422 Unprocessable Entity</li>
 *   <li>{@link TransportFailureException} -> 502 Bad Gateway</li>
 *   <li>{@link ProcessingTimeoutException} -> 504 Gateway Timeout</li>
 * </ul>
 */
@ControllerAdvice
public class CommonExceptionHandler {

  private static final Logger LOG = LoggerFactory.getLogger(CommonExceptionHandler.class);

  @ExceptionHandler(InvalidBoletoRequestException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidBoletoRequestException ex) {
    LOG.warn("Invalid boleto request: {}", ex.getMessage());
    return new ResponseEntity<>(new ErrorResponse(ex.getMessage()), HttpStatus.BAD_REQUEST);
  }

  /** Returns a 422 with the service message and itemized reasons. */
  @ExceptionHandler(SubmissionRejectedException.class)
  public ResponseEntity<ErrorResponse> handleSubmissionRejected(SubmissionRejectedException ex) {
    LOG.warn("Submission rejected by PlugBoleto: {} reasons={}", ex.getServiceMessage(),
        ex.getReasons());
    return new ResponseEntity<>(new ErrorResponse(ex.getMessage()),
        HttpStatus.UNPROCESSABLE_ENTITY);
  }

  /** Returns a 502 when PlugBoleto is unreachable or returns 5xx. */
  @ExceptionHandler(TransportFailureException.class)
  public ResponseEntity<ErrorResponse> handleTransportFailure(TransportFailureException ex) {
    LOG.error("PlugBoleto unavailable", ex);
    return new ResponseEntity<>(new ErrorResponse(ex.getMessage()), HttpStatus.BAD_GATEWAY);
  }

  @ExceptionHandler(ProcessingTimeoutException.class)
  public ResponseEntity<ErrorResponse> handleProcessingTimeout(ProcessingTimeoutException ex) {
    LOG.warn("Processing timed out for protocol {}", ex.getProtocol());
    return new ResponseEntity<>(new ErrorResponse(ex.getMessage()), HttpStatus.GATEWAY_TIMEOUT);
  }

  /** Returns a 400 when the request body cannot be parsed. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException ex) {
    LOG.warn("Malformed request body: {}", ex.getMessage());
    String message = extractReadableMessage(ex);
    return new ResponseEntity<>(new ErrorResponse(message), HttpStatus.BAD_REQUEST);
  }

  private String extractReadableMessage(HttpMessageNotReadableException ex) {
    String detail = ex.getMostSpecificCause().getMessage();
    if (detail != null && detail.contains("Unrecognized field")) {
      int start = detail.indexOf('"');
      int end = detail.indexOf('"', start + 1);
      if (start >= 0 && end > start) {
        return "Unrecognized field: '" + detail.substring(start + 1, end) + "'";
      }
    }
    return "Malformed request body";
  }
}
