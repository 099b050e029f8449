package com.nfservice.plugboleto.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nfservice.plugboleto.translation.NormalizedAction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized outcome of a processed return file.
 *
 * <ul>
 *   <li>{@code titles} - ordered actions per integration id, one per occurrence</li>
 *   <li>{@code unreconciled} - titles in the file the service could not match</li>
 *   <li>{@code unresolved} - ids the file referenced but the detail query did not return</li>
 * </ul>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReturnFileResult {

  private Map<String, List<NormalizedAction>> titles = new LinkedHashMap<>();
  private List<UnreconciledTitle> unreconciled = new ArrayList<>();
  private List<String> unresolved = new ArrayList<>();
  private AsyncOperation operation;

  public Map<String, List<NormalizedAction>> getTitles() {
    return titles;
  }

  public void setTitles(Map<String, List<NormalizedAction>> titles) {
    this.titles = titles;
  }

  public List<UnreconciledTitle> getUnreconciled() {
    return unreconciled;
  }

  public void setUnreconciled(List<UnreconciledTitle> unreconciled) {
    this.unreconciled = unreconciled;
  }

  public List<String> getUnresolved() {
    return unresolved;
  }

  public void setUnresolved(List<String> unresolved) {
    this.unresolved = unresolved;
  }

  public AsyncOperation getOperation() {
    return operation;
  }

  public void setOperation(AsyncOperation operation) {
    this.operation = operation;
  }
}
