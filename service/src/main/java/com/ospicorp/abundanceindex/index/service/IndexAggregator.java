package com.ospicorp.abundanceindex.index.service;

import com.ospicorp.abundanceindex.imputation.model.ImputedCount;
import com.ospicorp.abundanceindex.index.model.AbundanceIndex;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sums fitted counts of complete, in-season days into one index per site and year, either over
 * every day or over one representative weekday per week.
 */
public final class IndexAggregator {
  public static final int DEFAULT_WEEK_DAY = 4;

  private IndexAggregator() {
  }

  public static List<AbundanceIndex> aggregate(List<ImputedCount> imputed, boolean byWeek) {
    return aggregate(imputed, byWeek, DEFAULT_WEEK_DAY);
  }

  public static List<AbundanceIndex> aggregate(List<ImputedCount> imputed, boolean byWeek,
      int weekDay) {
    Map<SiteYear, Double> sums = new LinkedHashMap<>();
    Set<SiteYear> incomplete = new HashSet<>();
    for (ImputedCount row : imputed) {
      if (row.completeSeason() != 1 || row.season() == 0) {
        continue;
      }
      if (byWeek && row.weekDay() != weekDay) {
        continue;
      }
      SiteYear key = new SiteYear(row.siteId(), row.year());
      sums.putIfAbsent(key, 0d);
      if (row.fitted() == null) {
        incomplete.add(key);
      } else {
        sums.merge(key, row.fitted(), Double::sum);
      }
    }
    List<AbundanceIndex> out = new ArrayList<>(sums.size());
    for (var e : sums.entrySet()) {
      Double value = incomplete.contains(e.getKey()) ? null : e.getValue();
      out.add(new AbundanceIndex(e.getKey().siteId(), e.getKey().year(), value));
    }
    return out;
  }

  private record SiteYear(String siteId, int year) {}
}
