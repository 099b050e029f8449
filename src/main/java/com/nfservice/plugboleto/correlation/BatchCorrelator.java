package com.nfservice.plugboleto.correlation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconciles submitted integration ids with the records a follow-up query returns for them.
 *
 * <p>The query is called once with the distinct ids. Records whose id was not submitted are
 * ignored; submitted ids with no record are reported as unresolved. Null and blank ids
 * carry nothing to correlate on and are dropped before the query.
 */
@Component
public class BatchCorrelator {

  private static final Logger LOG = LoggerFactory.getLogger(BatchCorrelator.class);

  public <R> Correlation<R> correlate(List<String> submittedIds,
      Function<List<String>, List<R>> queryByIds, Function<R, String> idOf) {
    Set<String> distinct = new LinkedHashSet<>();
    for (String id : submittedIds) {
      if (id != null && !id.isBlank()) {
        distinct.add(id);
      }
    }
    List<String> ids = new ArrayList<>(distinct);
    if (ids.isEmpty()) {
      return new Correlation<>(Map.of(), List.of());
    }
    return index(ids, queryByIds.apply(ids), idOf);
  }

  /** Matches already fetched records against the submitted ids. */
  public <R> Correlation<R> index(List<String> submittedIds, List<R> records,
      Function<R, String> idOf) {
    Map<String, R> byId = new HashMap<>();
    for (R record : records) {
      String id = idOf.apply(record);
      if (id != null) {
        byId.put(id, record);
      }
    }

    Map<String, R> resolved = new LinkedHashMap<>();
    List<String> unresolved = new ArrayList<>();
    for (String id : submittedIds) {
      R record = byId.get(id);
      if (record == null) {
        unresolved.add(id);
      } else {
        resolved.put(id, record);
      }
    }
    if (!unresolved.isEmpty()) {
      LOG.info("event=correlation.unresolved count={} ids={}", unresolved.size(), unresolved);
    }
    return new Correlation<>(resolved, unresolved);
  }
}
