package com.ospicorp.abundanceindex.imputation.service;

import static com.ospicorp.abundanceindex.support.SeasonTableFixtures.SPECIES;
import static com.ospicorp.abundanceindex.support.SeasonTableFixtures.count;
import static com.ospicorp.abundanceindex.support.SeasonTableFixtures.point;
import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.abundanceindex.common.DiagnosticKind;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurvePoint;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurveTable;
import com.ospicorp.abundanceindex.imputation.model.ImputationRow;
import com.ospicorp.abundanceindex.imputation.model.PhenologyOutcome;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PhenologyResolverTest {

  private final PhenologyResolver resolver = new PhenologyResolver();

  /** Three days of curve per year; {@code nm} of the first day, or null for a failed curve. */
  private static List<FlightCurvePoint> curve(int year, Double firstNm) {
    LocalDate start = LocalDate.of(year, 6, 1);
    List<FlightCurvePoint> points = new ArrayList<>();
    points.add(point(start, 1, firstNm));
    points.add(point(start.plusDays(1), 2, firstNm == null ? null : 0.5));
    points.add(point(start.plusDays(2), 3, firstNm == null ? null : 0.25));
    return points;
  }

  private static FlightCurveTable curves(Object... yearAndNm) {
    List<FlightCurvePoint> points = new ArrayList<>();
    for (int i = 0; i < yearAndNm.length; i += 2) {
      points.addAll(curve((Integer) yearAndNm[i], (Double) yearAndNm[i + 1]));
    }
    return new FlightCurveTable(points);
  }

  private static List<ImputationRow> yearWithoutCurve(int year) {
    LocalDate start = LocalDate.of(year, 6, 1);
    List<ImputationRow> rows = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      rows.add(ImputationRow.joined(count("S1", start.plusDays(i), 1, null), i + 1, null));
    }
    return rows;
  }

  @Test
  void candidatesAlternateOutwardsFromTheYear() {
    assertThat(PhenologyResolver.candidateYears(2010, 2000, 2030))
        .containsExactly(2009, 2011, 2008, 2012, 2007, 2013, 2006, 2014, 2005, 2015);
  }

  @Test
  void candidatesStayStrictlyInsideTheCurveYears() {
    assertThat(PhenologyResolver.candidateYears(2011, 2009, 2015))
        .containsExactly(2010, 2012, 2013, 2014);
    assertThat(PhenologyResolver.candidateYears(2009, 2009, 2010)).isEmpty();
  }

  @Test
  void completeYearIsLeftAlone() {
    List<ImputationRow> rows = List.of(
        ImputationRow.joined(count("S1", LocalDate.of(2010, 6, 1), 1, 2d), 1, 0.4));

    PhenologyOutcome outcome = resolver.resolve(SPECIES, 2010, rows, curves(2010, 0.4));

    assertThat(outcome.rows()).isSameAs(rows);
    assertThat(outcome.resolved()).isTrue();
    assertThat(outcome.diagnostic()).isNull();
  }

  @Test
  void previousYearWinsOverNextYear() {
    FlightCurveTable curves = curves(2009, 0.2, 2010, 0.1, 2011, null, 2012, 0.3, 2013, 0.2);

    PhenologyOutcome outcome = resolver.resolve(SPECIES, 2011, yearWithoutCurve(2011), curves);

    assertThat(outcome.donorYear()).isEqualTo(2010);
    assertThat(outcome.rows()).extracting(ImputationRow::nm).containsExactly(0.1, 0.5, 0.25);
    assertThat(outcome.rows()).extracting(ImputationRow::trimDayNo).containsExactly(1, 2, 3);
    assertThat(outcome.diagnostic().kind()).isEqualTo(DiagnosticKind.PHENOLOGY_SUBSTITUTED);
    assertThat(outcome.diagnostic().message()).contains("2010").contains("2011");
  }

  @Test
  void nextYearIsUsedWhenPreviousYearFailed() {
    FlightCurveTable curves = curves(2009, 0.2, 2010, null, 2011, null, 2012, 0.3, 2013, 0.2);

    PhenologyOutcome outcome = resolver.resolve(SPECIES, 2011, yearWithoutCurve(2011), curves);

    assertThat(outcome.donorYear()).isEqualTo(2012);
    assertThat(outcome.rows().get(0).nm()).isEqualTo(0.3);
  }

  @Test
  void firstAndLastYearsAreNeverDonors() {
    FlightCurveTable curves = curves(2009, 0.2, 2010, null, 2011, 0.1);

    PhenologyOutcome outcome = resolver.resolve(SPECIES, 2010, yearWithoutCurve(2010), curves);

    assertThat(outcome.resolved()).isFalse();
    assertThat(outcome.donorYear()).isNull();
    assertThat(outcome.rows()).allMatch(r -> r.nm() == null);
    assertThat(outcome.diagnostic().kind()).isEqualTo(DiagnosticKind.UNRESOLVED_PHENOLOGY);
  }

  @Test
  void donorsBeyondTheHorizonAreNotUsed() {
    FlightCurveTable curves = curves(2000, 0.2, 2001, 0.2, 2002, null, 2003, null, 2004, null,
        2005, null, 2006, null, 2007, null, 2008, null, 2009, null, 2010, null, 2011, null,
        2012, null, 2013, null, 2014, 0.2);

    PhenologyOutcome outcome = resolver.resolve(SPECIES, 2007, yearWithoutCurve(2007), curves);

    assertThat(outcome.resolved()).isFalse();
  }

  @Test
  void substitutionRenumbersDaysFromTheFirstDayOfTheYear() {
    LocalDate start = LocalDate.of(2011, 6, 1);
    List<ImputationRow> rows = List.of(
        ImputationRow.joined(count("S1", start.plusDays(1), 1, null), null, null),
        ImputationRow.joined(count("S1", start, 1, null), null, null));

    List<ImputationRow> out = PhenologyResolver.substitute(rows, curve(2010, 0.1));

    assertThat(out).extracting(ImputationRow::trimDayNo).containsExactly(2, 1);
    assertThat(out).extracting(ImputationRow::nm).containsExactly(0.5, 0.1);
  }
}
