package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A title the service accepted in an issuance batch, enriched with the fields of the
 * follow-up query once it is resolved.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IssuedTitle {

  @JsonAlias({"idintegracao", "IdIntegracao"})
  private String integrationId;

  private String situacao;

  @JsonAlias("TituloNossoNumero")
  private String ourNumber;

  @JsonAlias("TituloNumeroDocumento")
  private String documentNumber;

  @JsonAlias("TituloLinhaDigitavel")
  private String digitableLine;

  @JsonAlias("TituloCodigoBarras")
  private String barcode;

  @JsonProperty(access = JsonProperty.Access.READ_ONLY)
  private TitleStatus status = TitleStatus.ACCEPTED;

  public IssuedTitle() {
  }

  public IssuedTitle(String integrationId) {
    this.integrationId = integrationId;
  }

  /** Copies the resolved query fields and advances the status. */
  public void enrich(Title resolved) {
    this.situacao = resolved.getSituacao();
    this.digitableLine = resolved.getDigitableLine();
    this.barcode = resolved.getBarcode();
    this.documentNumber = resolved.getDocumentNumber();
    if (resolved.getOurNumber() != null) {
      this.ourNumber = resolved.getOurNumber();
    }
    this.status = status.advance(resolved.getStatus());
  }

  public String getIntegrationId() {
    return integrationId;
  }

  public void setIntegrationId(String integrationId) {
    this.integrationId = integrationId;
  }

  public String getSituacao() {
    return situacao;
  }

  public void setSituacao(String situacao) {
    this.situacao = situacao;
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

  public String getDigitableLine() {
    return digitableLine;
  }

  public void setDigitableLine(String digitableLine) {
    this.digitableLine = digitableLine;
  }

  public String getBarcode() {
    return barcode;
  }

  public void setBarcode(String barcode) {
    this.barcode = barcode;
  }

  public TitleStatus getStatus() {
    return status;
  }

  public void setStatus(TitleStatus status) {
    this.status = status;
  }
}
