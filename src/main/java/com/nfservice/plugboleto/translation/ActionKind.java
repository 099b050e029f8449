package com.nfservice.plugboleto.translation;

import com.fasterxml.jackson.annotation.JsonValue;

/** Bank-agnostic kinds of event a return-file occurrence can produce. */
public enum ActionKind {
  CONFIRMED("confirmed"),
  PAYED("payed"),
  REJECTED("rejected"),
  CANCELED("canceled"),
  ABATEMENT_COMPLETED("abatementCompleted"),
  ABATEMENT_CANCELED("abatementCanceled"),
  CHANGE_DUE_DATE("changeDueDate"),
  REMOVE_PAYED("removePayed"),
  DEFAULT("default");

  private final String name;

  ActionKind(String name) {
    this.name = name;
  }

  @JsonValue
  public String getName() {
    return name;
  }
}
