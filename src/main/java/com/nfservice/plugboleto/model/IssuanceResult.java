package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batch issuance.
 *
 * <ul>
 *   <li>{@code success} - accepted and not reported as failed by the follow-up query</li>
 *   <li>{@code errors} - refused by the batch, or accepted and then resolved as
 *   {@code FALHA}/{@code REJEITADO}</li>
 *   <li>{@code unresolved} - accepted but absent from the follow-up query; still in flight
 *   on the service side, neither success nor failure yet</li>
 * </ul>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IssuanceResult {

  private boolean status = true;
  private List<IssuedTitle> success = new ArrayList<>();
  private List<FailedTitle> errors = new ArrayList<>();
  private List<IssuedTitle> unresolved = new ArrayList<>();
  private String error;

  public boolean isStatus() {
    return status;
  }

  public void setStatus(boolean status) {
    this.status = status;
  }

  public List<IssuedTitle> getSuccess() {
    return success;
  }

  public void setSuccess(List<IssuedTitle> success) {
    this.success = success;
  }

  public List<FailedTitle> getErrors() {
    return errors;
  }

  public void setErrors(List<FailedTitle> errors) {
    this.errors = errors;
  }

  public List<IssuedTitle> getUnresolved() {
    return unresolved;
  }

  public void setUnresolved(List<IssuedTitle> unresolved) {
    this.unresolved = unresolved;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
