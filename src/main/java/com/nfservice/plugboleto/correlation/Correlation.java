package com.nfservice.plugboleto.correlation;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of matching submitted ids against a follow-up query. Ids the query did not return
 * are kept in {@link #getUnresolved()}, never dropped.
 */
public final class Correlation<R> {

  private final Map<String, R> resolved;
  private final List<String> unresolved;

  Correlation(Map<String, R> resolved, List<String> unresolved) {
    this.resolved = Collections.unmodifiableMap(resolved);
    this.unresolved = List.copyOf(unresolved);
  }

  /** Resolved records keyed by integration id, in submission order. */
  public Map<String, R> getResolved() {
    return resolved;
  }

  public List<String> getUnresolved() {
    return unresolved;
  }

  public Optional<R> find(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(resolved.get(id));
  }

  public boolean isResolved(String id) {
    return id != null && resolved.containsKey(id);
  }
}
