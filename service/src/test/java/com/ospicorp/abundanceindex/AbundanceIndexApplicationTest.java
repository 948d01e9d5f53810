package com.ospicorp.abundanceindex;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.abundanceindex.config.AbundanceProperties;
import com.ospicorp.abundanceindex.flightcurve.model.CurveEstimationOptions;
import com.ospicorp.abundanceindex.index.service.AbundancePipeline;
import com.ospicorp.abundanceindex.stats.ModelFamily;
import com.ospicorp.abundanceindex.stats.PenalizedSplineSolver;
import com.ospicorp.abundanceindex.stats.SmoothingRegressionSolver;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AbundanceIndexApplicationTest {

  @Autowired
  private AbundanceProperties properties;

  @Autowired
  private SmoothingRegressionSolver smoothingRegressionSolver;

  @Autowired
  private AbundancePipeline pipeline;

  @Autowired
  private TestRestTemplate restTemplate;

  @Test
  void contextWiresThePipeline() {
    assertThat(pipeline).isNotNull();
    assertThat(smoothingRegressionSolver).isInstanceOf(PenalizedSplineSolver.class);
  }

  @Test
  void propertiesCarryTheDefaults() {
    CurveEstimationOptions curves = properties.flightCurve().toOptions();

    assertThat(curves.family()).isEqualTo(ModelFamily.POISSON);
    assertThat(curves.maxSitesPerFit()).isEqualTo(100);
    assertThat(curves.retainWorkingData()).isFalse();
    assertThat(properties.imputation().family()).isEqualTo(ModelFamily.QUASI_POISSON);
    assertThat(properties.index().weekDay()).isEqualTo(4);
    assertThat(properties.solver().lambdas()).hasSize(8);
  }

  @Test
  void apiDocsAreExposed() {
    @SuppressWarnings("rawtypes")
    ResponseEntity<Map> response = restTemplate.getForEntity("/v3/api-docs", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsKey("paths");
    @SuppressWarnings("unchecked")
    Map<String, Object> paths = (Map<String, Object>) response.getBody().get("paths");
    assertThat(paths).containsKeys("/v1/indices", "/v1/flight-curves");
  }
}
