package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.nfservice.plugboleto.util.ServiceDateTimeDeserializer;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One bank-reported movement against a title ({@code TituloMovimentos} entry).
 *
 * <p>Created by the service when it reads a return file. The code is bank and layout
 * specific; {@link com.nfservice.plugboleto.translation.OccurrenceTranslator} turns it into
 * a {@link com.nfservice.plugboleto.translation.NormalizedAction}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Occurrence {

  @JsonProperty("codigo")
  private String code;

  @JsonProperty("mensagem")
  private String message;

  @JsonProperty("data")
  @JsonDeserialize(using = ServiceDateTimeDeserializer.class)
  private LocalDateTime date;

  @JsonProperty("ocorrencias")
  private List<SubOccurrence> subOccurrences = new ArrayList<>();

  public Occurrence() {
  }

  public Occurrence(String code, String message, LocalDateTime date) {
    this.code = code;
    this.message = message;
    this.date = date;
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public LocalDateTime getDate() {
    return date;
  }

  public void setDate(LocalDateTime date) {
    this.date = date;
  }

  public List<SubOccurrence> getSubOccurrences() {
    return subOccurrences;
  }

  public void setSubOccurrences(List<SubOccurrence> subOccurrences) {
    this.subOccurrences = subOccurrences == null ? new ArrayList<>() : subOccurrences;
  }
}
