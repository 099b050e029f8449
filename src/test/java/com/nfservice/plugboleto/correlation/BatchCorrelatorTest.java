package com.nfservice.plugboleto.correlation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BatchCorrelator")
class BatchCorrelatorTest {

  private final BatchCorrelator correlator = new BatchCorrelator();

  private static String[] row(String id, String value) {
    return new String[] {id, value};
  }

  @Test
  @DisplayName("Should query once with distinct ids and keep submission order")
  void shouldQueryOnceWithDistinctIds() {
    // given
    List<List<String>> queries = new ArrayList<>();
    Function<List<String>, List<String[]>> query = ids -> {
      queries.add(ids);
      return List.of(row("b", "2"), row("a", "1"));
    };

    // when
    Correlation<String[]> correlation = correlator.correlate(List.of("a", "b", "a"), query,
        r -> r[0]);

    // then
    assertEquals(List.of(List.of("a", "b")), queries);
    assertEquals(List.of("a", "b"), new ArrayList<>(correlation.getResolved().keySet()));
    assertTrue(correlation.getUnresolved().isEmpty());
  }

  @Test
  @DisplayName("Should report ids absent from the query result as unresolved")
  void shouldReportMissingIds() {
    // when
    Correlation<String[]> correlation = correlator.correlate(List.of("a", "b", "c"),
        ids -> List.<String[]>of(row("b", "2")), r -> r[0]);

    // then
    assertEquals(List.of("a", "c"), correlation.getUnresolved());
    assertTrue(correlation.isResolved("b"));
    assertFalse(correlation.isResolved("a"));
    assertEquals("2", correlation.find("b").orElseThrow()[1]);
  }

  @Test
  @DisplayName("Should ignore records that were not submitted")
  void shouldIgnoreForeignRecords() {
    // when
    Correlation<String[]> correlation = correlator.correlate(List.of("a"),
        ids -> List.of(row("a", "1"), row("zz", "9"), row(null, "0")), r -> r[0]);

    // then
    assertEquals(1, correlation.getResolved().size());
    assertTrue(correlation.find("zz").isEmpty());
  }

  @Test
  @DisplayName("Should drop null and blank ids before querying")
  void shouldDropMissingIds() {
    // given
    List<List<String>> queries = new ArrayList<>();
    Function<List<String>, List<String[]>> query = ids -> {
      queries.add(ids);
      return List.<String[]>of(row("a", "1"));
    };

    // when
    Correlation<String[]> correlation = correlator.correlate(Arrays.asList("a", null, " "),
        query, r -> r[0]);

    // then
    assertEquals(List.of(List.of("a")), queries);
    assertTrue(correlation.isResolved("a"));
    assertTrue(correlation.getUnresolved().isEmpty());
    assertTrue(correlation.find(null).isEmpty());
    assertFalse(correlation.isResolved(null));
  }

  @Test
  @DisplayName("Should not query when only missing ids were submitted")
  void shouldSkipQuery_whenOnlyMissingIds() {
    // when
    Correlation<String[]> correlation = correlator.correlate(Arrays.asList(null, ""), ids -> {
      throw new AssertionError("query must not run");
    }, r -> r[0]);

    // then
    assertTrue(correlation.getResolved().isEmpty());
    assertTrue(correlation.find(null).isEmpty());
  }

  @Test
  @DisplayName("Should not query when nothing was submitted")
  void shouldSkipQuery_whenNoIds() {
    // when
    Correlation<String[]> correlation = correlator.correlate(List.of(), ids -> {
      throw new AssertionError("query must not run");
    }, r -> r[0]);

    // then
    assertTrue(correlation.getResolved().isEmpty());
    assertTrue(correlation.getUnresolved().isEmpty());
  }
}
