package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** A title that was not issued, either refused in the batch or reclassified afterwards. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FailedTitle {

  public static final String SITUACAO_FALHA = "FALHA";

  private String integrationId;
  private String ourNumber;
  private String documentNumber;
  private String situacao = SITUACAO_FALHA;
  private String motive;

  public FailedTitle() {
  }

  public FailedTitle(String integrationId, String ourNumber, String documentNumber,
      String motive) {
    this.integrationId = integrationId;
    this.ourNumber = ourNumber;
    this.documentNumber = documentNumber;
    this.motive = motive;
  }

  public String getIntegrationId() {
    return integrationId;
  }

  public void setIntegrationId(String integrationId) {
    this.integrationId = integrationId;
  }

  public String getOurNumber() {
    return ourNumber;
  }

  public void setOurNumber(String ourNumber) {
    this.ourNumber = ourNumber;
  }

  public String getDocumentNumber() {
    return documentNumber;
  }

  public void setDocumentNumber(String documentNumber) {
    this.documentNumber = documentNumber;
  }

  public String getSituacao() {
    return situacao;
  }

  public void setSituacao(String situacao) {
    this.situacao = situacao;
  }

  public String getMotive() {
    return motive;
  }

  public void setMotive(String motive) {
    this.motive = motive;
  }
}
