package com.ospicorp.abundanceindex.index.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.abundanceindex.imputation.model.ImputedCount;
import com.ospicorp.abundanceindex.index.model.AbundanceIndex;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class IndexAggregatorTest {

  /** June 7th 2010 is a Monday, so day {@code i} falls on weekday {@code i + 1}. */
  private static ImputedCount day(String site, int i, int season, int complete, Double fitted) {
    LocalDate date = LocalDate.of(2010, 6, 7).plusDays(i);
    return new ImputedCount("Pieris napi", site, date, 23, date.getDayOfWeek().getValue(), 100 + i,
        2010, season, null, 0, complete, i + 1, 0.1, fitted, fitted);
  }

  private static List<ImputedCount> week(String site, Double... fitted) {
    List<ImputedCount> rows = new ArrayList<>();
    for (int i = 0; i < fitted.length; i++) {
      rows.add(day(site, i, 1, 1, fitted[i]));
    }
    return rows;
  }

  @Test
  void dailyIndexSumsFittedValues() {
    var out = IndexAggregator.aggregate(week("S1", 1d, 2d, 3d, 4d, 5d, 6d, 7d), false);

    assertEquals(1, out.size());
    assertEquals(new AbundanceIndex("S1", 2010, 28d), out.get(0));
  }

  @Test
  void weeklyIndexKeepsOnlyTheRepresentativeWeekday() {
    var out = IndexAggregator.aggregate(week("S1", 1d, 2d, 3d, 4d, 5d, 6d, 7d), true);

    assertEquals(4d, out.get(0).abundanceIndex());
    assertEquals(2d, IndexAggregator.aggregate(week("S1", 1d, 2d, 3d), true, 2).get(0)
        .abundanceIndex());
  }

  @Test
  void outOfSeasonAndIncompleteSeasonRowsAreIgnored() {
    List<ImputedCount> rows = new ArrayList<>(week("S1", 1d, 2d));
    rows.add(day("S1", 2, 0, 1, 50d));
    rows.add(day("S2", 0, 1, 0, 9d));

    var out = IndexAggregator.aggregate(rows, false);

    assertEquals(List.of(new AbundanceIndex("S1", 2010, 3d)), out);
  }

  @Test
  void missingFittedValueMakesTheIndexMissing() {
    List<ImputedCount> rows = new ArrayList<>(week("S1", 1d, null, 3d));
    rows.addAll(week("S2", 0d, 0d, 0d));

    var out = IndexAggregator.aggregate(rows, false);

    assertEquals(2, out.size());
    assertNull(out.get(0).abundanceIndex());
    assertEquals(0d, out.get(1).abundanceIndex());
  }

  @Test
  void emptyInputGivesNoIndices() {
    assertTrue(IndexAggregator.aggregate(List.of(), true).isEmpty());
  }
}
