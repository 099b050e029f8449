package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A title found in a return file that the service could not match to a known title.
 * Passed through to the caller unchanged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnreconciledTitle {

  @JsonProperty("number")
  @JsonAlias("TituloNossoNumeroOriginal")
  private String number;

  @JsonProperty("number_doc")
  @JsonAlias("TituloNumeroDocumento")
  private String documentNumber;

  @JsonProperty("occurrences")
  @JsonAlias("Ocorrencias")
  private JsonNode occurrences;

  public String getNumber() {
    return number;
  }

  public void setNumber(String number) {
    this.number = number;
  }

  public String getDocumentNumber() {
    return documentNumber;
  }

  public void setDocumentNumber(String documentNumber) {
    this.documentNumber = documentNumber;
  }

  public JsonNode getOccurrences() {
    return occurrences;
  }

  public void setOccurrences(JsonNode occurrences) {
    this.occurrences = occurrences;
  }
}
