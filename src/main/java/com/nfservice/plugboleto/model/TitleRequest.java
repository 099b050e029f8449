package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One title submitted for issuance. The payload follows the PlugBoleto batch layout
 * ({@code CedenteContaNumero}, {@code TituloValor}, {@code SacadoNome}, ...) and is forwarded
 * as-is apart from the defaults set by {@link #applyIssuanceDefaults()}.
 */
public class TitleRequest {

  static final String BANK_CODE = "CedenteContaCodigoBanco";
  static final String PAYMENT_PLACE = "TituloLocalPagamento";
  static final String MODALITY = "TituloModalidade";
  static final String DEFAULT_PAYMENT_PLACE = "Pagável em qualquer banco até o vencimento";

  private final Map<String, Object> fields = new LinkedHashMap<>();

  public static TitleRequest of(Map<String, ?> fields) {
    TitleRequest request = new TitleRequest();
    fields.forEach(request::set);
    return request;
  }

  @JsonAnySetter
  public void set(String name, Object value) {
    fields.put(name, value);
  }

  @JsonAnyGetter
  public Map<String, Object> getFields() {
    return fields;
  }

  public Object get(String name) {
    return fields.get(name);
  }

  public String getBankCode() {
    Object value = fields.get(BANK_CODE);
    return value == null ? null : value.toString();
  }

  /** Sets the payment place every title carries and the bank 089 modality. */
  public void applyIssuanceDefaults() {
    fields.put(PAYMENT_PLACE, DEFAULT_PAYMENT_PLACE);
    if ("089".equals(getBankCode())) {
      fields.put(MODALITY, "1");
    }
  }
}
