package com.nfservice.plugboleto.translation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nfservice.plugboleto.model.SubOccurrence;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The bank-agnostic event produced from one occurrence.
 *
 * <p>Immutable. The data map keeps insertion order so two actions built from the same inputs
 * serialize identically. {@code code} and {@code date} are only set once the action is
 * attached to the occurrence it came from during return-file processing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NormalizedAction {

  private final ActionKind action;
  private final Map<String, Object> data;
  private final String message;
  private final List<SubOccurrence> occurrences;
  private final String code;
  private final LocalDateTime date;

  NormalizedAction(ActionKind action, Map<String, Object> data, String message,
      List<SubOccurrence> occurrences, String code, LocalDateTime date) {
    this.action = Objects.requireNonNull(action, "action");
    this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    this.message = message;
    this.occurrences = occurrences == null || occurrences.isEmpty()
        ? null
        : List.copyOf(occurrences);
    this.code = code;
    this.date = date;
  }

  static NormalizedAction of(ActionKind action, Map<String, Object> data) {
    return new NormalizedAction(action, data, null, null, null, null);
  }

  static NormalizedAction of(ActionKind action, Map<String, Object> data, String message,
      List<SubOccurrence> occurrences) {
    return new NormalizedAction(action, data, message, occurrences, null, null);
  }

  /** Copy carrying the raw occurrence code and timestamp. */
  public NormalizedAction withOrigin(String code, LocalDateTime date) {
    return new NormalizedAction(action, data, message, occurrences, code, date);
  }

  @JsonProperty("action")
  public ActionKind getAction() {
    return action;
  }

  @JsonProperty("data")
  public Map<String, Object> getData() {
    return data;
  }

  @JsonProperty("message")
  public String getMessage() {
    return message;
  }

  @JsonProperty("occurrences")
  public List<SubOccurrence> getOccurrences() {
    return occurrences;
  }

  @JsonProperty("code")
  public String getCode() {
    return code;
  }

  @JsonProperty("date")
  public LocalDateTime getDate() {
    return date;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NormalizedAction)) {
      return false;
    }
    NormalizedAction that = (NormalizedAction) o;
    return action == that.action
        && data.equals(that.data)
        && Objects.equals(message, that.message)
        && Objects.equals(occurrences, that.occurrences)
        && Objects.equals(code, that.code)
        && Objects.equals(date, that.date);
  }

  @Override
  public int hashCode() {
    return Objects.hash(action, data, message, occurrences, code, date);
  }

  @Override
  public String toString() {
    return "NormalizedAction{action=" + action.getName() + ", data=" + data
        + ", message=" + message + ", code=" + code + "}";
  }
}
