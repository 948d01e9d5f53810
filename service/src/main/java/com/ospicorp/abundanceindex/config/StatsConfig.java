package com.ospicorp.abundanceindex.config;

import com.ospicorp.abundanceindex.stats.CountRegressionSolver;
import com.ospicorp.abundanceindex.stats.IrlsGlmSolver;
import com.ospicorp.abundanceindex.stats.PenalizedSplineSolver;
import com.ospicorp.abundanceindex.stats.SmoothingRegressionSolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StatsConfig {

  @Bean
  SmoothingRegressionSolver smoothingRegressionSolver(AbundanceProperties properties) {
    AbundanceProperties.Solver solver = properties.solver();
    return new PenalizedSplineSolver(solver.basisSize(), solver.smootherMaxIterations(),
        solver.lambdas());
  }

  @Bean
  CountRegressionSolver countRegressionSolver(AbundanceProperties properties) {
    return new IrlsGlmSolver(properties.solver().glmMaxIterations());
  }
}
