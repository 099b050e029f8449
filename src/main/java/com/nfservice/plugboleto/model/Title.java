package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.nfservice.plugboleto.util.AmountDeserializer;
import com.nfservice.plugboleto.util.Amounts;
import com.nfservice.plugboleto.util.ServiceDateDeserializer;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A boleto as returned by the PlugBoleto titles query ({@code GET /boletos}).
 *
 * <p>Property names follow the service payload. Monetary fields are fixed-point
 * ({@link BigDecimal}, scale 2) and default to zero when the service omits them.
 * The integration id is the only key used to correlate submissions with query results.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Title {

  @JsonProperty("IdIntegracao")
  private String integrationId;

  @JsonProperty("CedenteCodigoBanco")
  private String bankCode;

  @JsonProperty("TituloNumeroDocumento")
  private String documentNumber;

  @JsonProperty("TituloNossoNumero")
  private String ourNumber;

  @JsonProperty("TituloValor")
  @JsonDeserialize(using = AmountDeserializer.class)
  private BigDecimal faceValue = Amounts.ZERO;

  @JsonProperty("TituloDataVencimento")
  @JsonDeserialize(using = ServiceDateDeserializer.class)
  private LocalDate dueDate;

  @JsonProperty("situacao")
  private String situacao;

  @JsonProperty("motivo")
  private String motive;

  @JsonProperty("TituloLinhaDigitavel")
  private String digitableLine;

  @JsonProperty("TituloCodigoBarras")
  private String barcode;

  @JsonProperty("PagamentoData")
  @JsonDeserialize(using = ServiceDateDeserializer.class)
  private LocalDate paymentDate;

  @JsonProperty("PagamentoValorPago")
  @JsonDeserialize(using = AmountDeserializer.class)
  private BigDecimal paidValue = Amounts.ZERO;

  @JsonProperty("PagamentoValorDesconto")
  @JsonDeserialize(using = AmountDeserializer.class)
  private BigDecimal discountValue = Amounts.ZERO;

  @JsonProperty("PagamentoValorAbatimento")
  @JsonDeserialize(using = AmountDeserializer.class)
  private BigDecimal rebateValue = Amounts.ZERO;

  @JsonProperty("TituloMovimentos")
  private List<Occurrence> occurrences = new ArrayList<>();

  public String getIntegrationId() {
    return integrationId;
  }

  public void setIntegrationId(String integrationId) {
    this.integrationId = integrationId;
  }

  public String getBankCode() {
    return bankCode;
  }

  public void setBankCode(String bankCode) {
    this.bankCode = bankCode;
  }

  public String getDocumentNumber() {
    return documentNumber;
  }

  public void setDocumentNumber(String documentNumber) {
    this.documentNumber = documentNumber;
  }

  public String getOurNumber() {
    return ourNumber;
  }

  public void setOurNumber(String ourNumber) {
    this.ourNumber = ourNumber;
  }

  public BigDecimal getFaceValue() {
    return faceValue;
  }

  public void setFaceValue(BigDecimal faceValue) {
    this.faceValue = Amounts.scale(faceValue);
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public void setDueDate(LocalDate dueDate) {
    this.dueDate = dueDate;
  }

  public String getSituacao() {
    return situacao;
  }

  public void setSituacao(String situacao) {
    this.situacao = situacao;
  }

  @JsonIgnore
  public TitleStatus getStatus() {
    return TitleStatus.fromSituacao(situacao);
  }

  public String getMotive() {
    return motive;
  }

  public void setMotive(String motive) {
    this.motive = motive;
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

  public LocalDate getPaymentDate() {
    return paymentDate;
  }

  public void setPaymentDate(LocalDate paymentDate) {
    this.paymentDate = paymentDate;
  }

  public BigDecimal getPaidValue() {
    return paidValue;
  }

  public void setPaidValue(BigDecimal paidValue) {
    this.paidValue = Amounts.scale(paidValue);
  }

  public BigDecimal getDiscountValue() {
    return discountValue;
  }

  public void setDiscountValue(BigDecimal discountValue) {
    this.discountValue = Amounts.scale(discountValue);
  }

  public BigDecimal getRebateValue() {
    return rebateValue;
  }

  public void setRebateValue(BigDecimal rebateValue) {
    this.rebateValue = Amounts.scale(rebateValue);
  }

  public List<Occurrence> getOccurrences() {
    return occurrences;
  }

  public void setOccurrences(List<Occurrence> occurrences) {
    this.occurrences = occurrences == null ? new ArrayList<>() : occurrences;
  }
}
