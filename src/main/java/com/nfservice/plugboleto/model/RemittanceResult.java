package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a remittance file generation. {@code remittance} is the service record of the
 * generated file; {@code titles} lists the integration ids it contains.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RemittanceResult {

  private boolean status;
  private JsonNode remittance;
  private List<String> titles = new ArrayList<>();
  private List<RemittanceFailure> errors = new ArrayList<>();

  public boolean isStatus() {
    return status;
  }

  public void setStatus(boolean status) {
    this.status = status;
  }

  public JsonNode getRemittance() {
    return remittance;
  }

  public void setRemittance(JsonNode remittance) {
    this.remittance = remittance;
  }

  public List<String> getTitles() {
    return titles;
  }

  public void setTitles(List<String> titles) {
    this.titles = titles;
  }

  public List<RemittanceFailure> getErrors() {
    return errors;
  }

  public void setErrors(List<RemittanceFailure> errors) {
    this.errors = errors;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class RemittanceFailure {

    private String integrationId;
    private String error;

    public RemittanceFailure() {
    }

    public RemittanceFailure(String integrationId, String error) {
      this.integrationId = integrationId;
      this.error = error;
    }

    public String getIntegrationId() {
      return integrationId;
    }

    public String getError() {
      return error;
    }
  }
}
