package com.ospicorp.abundanceindex.imputation.service;

import static com.ospicorp.abundanceindex.support.SeasonTableFixtures.count;
import static com.ospicorp.abundanceindex.support.SeasonTableFixtures.point;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.abundanceindex.common.Diagnostic;
import com.ospicorp.abundanceindex.common.DiagnosticKind;
import com.ospicorp.abundanceindex.common.InputContractException;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurvePoint;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurveTable;
import com.ospicorp.abundanceindex.imputation.model.ImputationOptions;
import com.ospicorp.abundanceindex.imputation.model.ImputationResult;
import com.ospicorp.abundanceindex.imputation.model.ImputationRow;
import com.ospicorp.abundanceindex.imputation.model.ImputedCount;
import com.ospicorp.abundanceindex.season.model.SeasonCount;
import com.ospicorp.abundanceindex.season.model.SeasonTable;
import com.ospicorp.abundanceindex.stats.IrlsGlmSolver;
import com.ospicorp.abundanceindex.stats.ModelFamily;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AbundanceImputerTest {

  private static final Double[] SITE_A = {3d, 2d, null, 6d, null, null};
  private static final Double[] SITE_ZERO = {null, 0d, null, 0d, null, null};
  private static final Double[] CURVE = {0d, 0.1, 0.2, 0.3, 0.4, 0d};

  private final AbundanceImputer imputer = new AbundanceImputer(new PhenologyResolver(),
      new SiteRegressionFitter(new IrlsGlmSolver()));

  /** Six days from June 1st; the first and the last one are outside the season. */
  private static List<SeasonCount> site(String site, int year, Double[] counts) {
    LocalDate start = LocalDate.of(year, 6, 1);
    List<SeasonCount> rows = new ArrayList<>();
    for (int i = 0; i < counts.length; i++) {
      rows.add(count(site, start.plusDays(i), i == 0 || i == counts.length - 1 ? 0 : 1, counts[i]));
    }
    return rows;
  }

  private static SeasonTable table(int... years) {
    List<SeasonCount> rows = new ArrayList<>();
    for (int year : years) {
      rows.addAll(site("A", year, SITE_A));
      rows.addAll(site("ZERO", year, SITE_ZERO));
    }
    return new SeasonTable(rows);
  }

  private static List<FlightCurvePoint> curve(int year, Double[] nm) {
    LocalDate start = LocalDate.of(year, 6, 1);
    List<FlightCurvePoint> points = new ArrayList<>();
    for (int i = 0; i < nm.length; i++) {
      points.add(point(start.plusDays(i), i + 1, nm[i]));
    }
    return points;
  }

  private static FlightCurveTable curves(int... years) {
    List<FlightCurvePoint> points = new ArrayList<>();
    for (int year : years) {
      points.addAll(curve(year, CURVE));
    }
    return new FlightCurveTable(points);
  }

  private static List<Double> imputed(ImputationResult result, String site, int year) {
    return result.rows().stream()
        .filter(r -> r.siteId().equals(site) && r.year() == year)
        .map(ImputedCount::imputedCount)
        .toList();
  }

  @Test
  void unvisitedDaysAreFilledFromTheScaledCurve() {
    ImputationResult result = imputer.impute(table(2010), curves(2010), ImputationOptions.defaults());

    List<Double> a = imputed(result, "A", 2010);
    assertThat(a.get(0)).isZero();
    assertThat(a.get(1)).isEqualTo(2d);
    assertThat(a.get(2)).isCloseTo(4d, within(1e-4));
    assertThat(a.get(3)).isEqualTo(6d);
    assertThat(a.get(4)).isCloseTo(8d, within(1e-4));
    assertThat(a.get(5)).isZero();
    assertThat(imputed(result, "ZERO", 2010)).containsOnly(0d);
    assertThat(result.models()).containsOnlyKeys("glm_mod_Pieris_napi_2010");
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  void outputKeepsTheSeasonTableOrderAndColumns() {
    SeasonTable table = table(2010);

    ImputationResult result = imputer.impute(table, curves(2010), ImputationOptions.defaults());

    assertThat(result.rows()).hasSize(table.rows().size());
    for (int i = 0; i < table.rows().size(); i++) {
      SeasonCount s = table.rows().get(i);
      ImputedCount r = result.rows().get(i);
      assertThat(r.siteId()).isEqualTo(s.siteId());
      assertThat(r.date()).isEqualTo(s.date());
      assertThat(r.count()).isEqualTo(s.count());
      assertThat(r.trimDayNo()).isEqualTo(i % 6 + 1);
    }
  }

  @Test
  void onlyRequestedYearsAreReturned() {
    ImputationResult result = imputer.impute(table(2010, 2011), curves(2010, 2011),
        ImputationOptions.defaults().withYears(Set.of(2011)));

    assertThat(result.rows()).isNotEmpty().allMatch(r -> r.year() == 2011);
    assertThat(result.models()).containsOnlyKeys("glm_mod_Pieris_napi_2011");
  }

  @Test
  void missingCurveIsBorrowedFromTheAdjacentYear() {
    List<FlightCurvePoint> points = new ArrayList<>(curves(2009, 2010).points());
    points.addAll(curve(2011, new Double[] {null, null, null, null, null, null}));
    points.addAll(curves(2012).points());

    ImputationResult result = imputer.impute(table(2011), new FlightCurveTable(points),
        ImputationOptions.defaults());

    assertThat(result.diagnostics()).extracting(Diagnostic::kind)
        .containsExactly(DiagnosticKind.PHENOLOGY_SUBSTITUTED);
    assertThat(result.diagnostics().get(0).year()).isEqualTo(2011);
    assertThat(imputed(result, "A", 2011).get(4)).isCloseTo(8d, within(1e-4));
  }

  @Test
  void withoutNearestPhenologyAMissingCurveSkipsTheModel() {
    List<FlightCurvePoint> points = new ArrayList<>(curves(2009, 2010, 2012).points());
    points.addAll(curve(2011, new Double[] {null, null, null, null, null, null}));

    ImputationResult result = imputer.impute(table(2011), new FlightCurveTable(points),
        ImputationOptions.defaults().withNearestPhenology(false));

    assertThat(result.diagnostics()).extracting(Diagnostic::kind)
        .containsExactly(DiagnosticKind.NO_MODEL_FITTED);
    assertThat(result.models().get("glm_mod_Pieris_napi_2011").succeeded()).isFalse();
    List<Double> a = imputed(result, "A", 2011);
    assertThat(a.get(1)).isEqualTo(2d);
    assertThat(a.get(2)).isNull();
    assertThat(imputed(result, "ZERO", 2011)).containsOnly(0d);
  }

  @Test
  void seasonDaysWithZeroCurveAreFlooredForTheOffset() {
    SeasonCount inSeason = count("A", LocalDate.of(2010, 6, 2), 1, 4d);
    SeasonCount outOfSeason = count("A", LocalDate.of(2010, 6, 1), 0, 4d);

    List<ImputationRow> prepared = AbundanceImputer.prepare(List.of(
        ImputationRow.joined(inSeason, 2, 0d),
        ImputationRow.joined(outOfSeason, 1, 0d)));

    assertThat(prepared.get(0).nm()).isEqualTo(AbundanceImputer.MIN_NM);
    assertThat(prepared.get(0).count()).isEqualTo(4d);
    assertThat(prepared.get(1).nm()).isZero();
    assertThat(prepared.get(1).count()).isNull();
  }

  @Test
  void speciesMustMatchTheCurves() {
    List<FlightCurvePoint> other = curves(2010).points().stream()
        .map(p -> new FlightCurvePoint("Pieris rapae", p.date(), p.week(), p.weekDay(),
            p.daySince(), p.year(), p.season(), p.trimDayNo(), p.nm()))
        .toList();

    assertThatThrownBy(() -> imputer.impute(table(2010), new FlightCurveTable(other),
        ImputationOptions.defaults()))
        .isInstanceOf(InputContractException.class)
        .satisfies(ex -> assertThat(((InputContractException) ex).errorCode())
            .isEqualTo(InputContractException.SPECIES_MISMATCH));
  }

  @Test
  void negativeBinomialIsRejected() {
    assertThatThrownBy(() -> imputer.impute(table(2010), curves(2010),
        ImputationOptions.defaults().withFamily(ModelFamily.NEGATIVE_BINOMIAL)))
        .isInstanceOf(InputContractException.class)
        .hasMessageContaining("quasipoisson");
  }
}
