package com.ospicorp.abundanceindex.stats;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Penalised iteratively re-weighted least squares for log-link count models:
 * {@code log(mu) = X beta + offset}, minimising deviance plus {@code lambda * |R beta|^2}.
 */
final class IrlsEngine {
  private static final double TOLERANCE = 1e-8;
  private static final double MIN_MEAN = 2.220446e-16;
  private static final double QR_THRESHOLD = 1e-10;
  private static final int MAX_THETA_UPDATES = 25;
  private static final double MIN_THETA = 1e-4;
  private static final double MAX_THETA = 1e8;

  private IrlsEngine() {
  }

  /**
   * @param x design matrix, one row per observation
   * @param penaltyRoot square root of the penalty ({@code S = R'R}), or null when unpenalised
   */
  static FitResult<IrlsFit> fit(double[][] x, double[] y, double[] offset, double[][] penaltyRoot,
      double lambda, ModelFamily family, SolveMode mode, int maxIterations) {
    int n = y.length;
    if (n == 0) {
      return FitResult.failure("no observations to fit");
    }
    int p = x[0].length;
    if (p == 0) {
      return FitResult.failure("design matrix has no columns");
    }
    double[] mu = new double[n];
    double[] eta = new double[n];
    for (int i = 0; i < n; i++) {
      if (y[i] < 0 || !Double.isFinite(y[i])) {
        return FitResult.failure("count " + y[i] + " is not a valid response");
      }
      mu[i] = y[i] + 0.1;
      eta[i] = Math.log(mu[i]);
    }

    double theta = family == ModelFamily.NEGATIVE_BINOMIAL ? 1d : Double.POSITIVE_INFINITY;
    int outerPasses = family == ModelFamily.NEGATIVE_BINOMIAL ? MAX_THETA_UPDATES : 1;
    double[] beta = null;
    double deviance = Double.NaN;
    int iterations = 0;
    double[] w = new double[n];
    double[] z = new double[n];

    try {
      for (int outer = 0; outer < outerPasses; outer++) {
        double previous = Double.POSITIVE_INFINITY;
        boolean converged = false;
        for (int iter = 1; iter <= maxIterations; iter++) {
          iterations++;
          for (int i = 0; i < n; i++) {
            w[i] = workingWeight(mu[i], theta);
            z[i] = eta[i] - offset[i] + (y[i] - mu[i]) / mu[i];
          }
          beta = mode == SolveMode.FAST
              ? solveNormalEquations(x, w, z, penaltyRoot, lambda)
              : solveAugmented(x, w, z, penaltyRoot, lambda);
          for (int i = 0; i < n; i++) {
            eta[i] = dot(x[i], beta) + offset[i];
            if (!Double.isFinite(eta[i])) {
              return FitResult.failure("linear predictor became non-finite at iteration " + iter);
            }
            mu[i] = Math.max(Math.exp(eta[i]), MIN_MEAN);
            if (!Double.isFinite(mu[i])) {
              return FitResult.failure("fitted mean overflowed at iteration " + iter);
            }
          }
          deviance = deviance(y, mu, theta);
          if (Math.abs(deviance - previous) / (Math.abs(deviance) + 0.1) < TOLERANCE) {
            converged = true;
            break;
          }
          previous = deviance;
        }
        if (!converged) {
          return FitResult.failure("IRLS did not converge after " + maxIterations + " iterations");
        }
        if (family != ModelFamily.NEGATIVE_BINOMIAL) {
          break;
        }
        double updated = momentTheta(y, mu);
        if (Math.abs(updated - theta) <= 1e-4 * theta) {
          theta = updated;
          break;
        }
        theta = updated;
      }

      for (int i = 0; i < n; i++) {
        w[i] = workingWeight(mu[i], theta);
      }
      double edf = effectiveDegrees(x, w, penaltyRoot, lambda);
      double pearson = 0d;
      for (int i = 0; i < n; i++) {
        double r = y[i] - mu[i];
        pearson += r * r / variance(mu[i], theta);
      }
      return FitResult.success(new IrlsFit(beta, deviance, edf, pearson, theta, iterations, n));
    } catch (MathIllegalArgumentException | MathArithmeticException ex) {
      return FitResult.failure("linear system could not be solved: " + ex.getMessage());
    }
  }

  static double deviance(double[] y, double[] mu, double theta) {
    double total = 0d;
    for (int i = 0; i < y.length; i++) {
      double yi = y[i];
      double term = yi > 0 ? yi * Math.log(yi / mu[i]) : 0d;
      if (Double.isInfinite(theta)) {
        term -= yi - mu[i];
      } else {
        term -= (yi + theta) * Math.log((yi + theta) / (mu[i] + theta));
      }
      total += 2d * term;
    }
    return total;
  }

  private static double workingWeight(double mu, double theta) {
    return Double.isInfinite(theta) ? mu : mu / (1d + mu / theta);
  }

  private static double variance(double mu, double theta) {
    return Double.isInfinite(theta) ? mu : mu + mu * mu / theta;
  }

  private static double momentTheta(double[] y, double[] mu) {
    double num = 0d;
    double den = 0d;
    for (int i = 0; i < y.length; i++) {
      double r = y[i] - mu[i];
      num += mu[i] * mu[i];
      den += r * r - mu[i];
    }
    if (den <= 0d) {
      return MAX_THETA;
    }
    return Math.min(Math.max(num / den, MIN_THETA), MAX_THETA);
  }

  private static double[] solveAugmented(double[][] x, double[] w, double[] z,
      double[][] penaltyRoot, double lambda) {
    int n = x.length;
    int p = x[0].length;
    int r = penaltyRoot == null || lambda <= 0d ? 0 : penaltyRoot.length;
    double[][] a = new double[n + r][p];
    double[] b = new double[n + r];
    for (int i = 0; i < n; i++) {
      double sw = Math.sqrt(w[i]);
      for (int j = 0; j < p; j++) {
        a[i][j] = sw * x[i][j];
      }
      b[i] = sw * z[i];
    }
    double sl = Math.sqrt(lambda);
    for (int k = 0; k < r; k++) {
      for (int j = 0; j < p; j++) {
        a[n + k][j] = sl * penaltyRoot[k][j];
      }
    }
    RealVector solution = new QRDecomposition(new Array2DRowRealMatrix(a, false), QR_THRESHOLD)
        .getSolver()
        .solve(new ArrayRealVector(b, false));
    return solution.toArray();
  }

  private static double[] solveNormalEquations(double[][] x, double[] w, double[] z,
      double[][] penaltyRoot, double lambda) {
    int p = x[0].length;
    double[][] m = crossProduct(x, w);
    addPenalty(m, penaltyRoot, lambda);
    double[] rhs = new double[p];
    for (int i = 0; i < x.length; i++) {
      double wz = w[i] * z[i];
      if (wz == 0d) {
        continue;
      }
      for (int j = 0; j < p; j++) {
        rhs[j] += x[i][j] * wz;
      }
    }
    RealVector solution = new CholeskyDecomposition(new Array2DRowRealMatrix(m, false))
        .getSolver()
        .solve(new ArrayRealVector(rhs, false));
    return solution.toArray();
  }

  /** trace((X'WX + lambda S)^-1 X'WX) */
  private static double effectiveDegrees(double[][] x, double[] w, double[][] penaltyRoot,
      double lambda) {
    int p = x[0].length;
    if (penaltyRoot == null || lambda <= 0d) {
      return p;
    }
    double[][] xtwx = crossProduct(x, w);
    double[][] m = crossProduct(x, w);
    addPenalty(m, penaltyRoot, lambda);
    RealMatrix influence = new LUDecomposition(new Array2DRowRealMatrix(m, false))
        .getSolver()
        .solve(new Array2DRowRealMatrix(xtwx, false));
    return influence.getTrace();
  }

  private static double[][] crossProduct(double[][] x, double[] w) {
    int p = x[0].length;
    double[][] m = new double[p][p];
    for (int i = 0; i < x.length; i++) {
      double[] row = x[i];
      double wi = w[i];
      for (int j = 0; j < p; j++) {
        double v = row[j] * wi;
        if (v == 0d) {
          continue;
        }
        for (int k = j; k < p; k++) {
          m[j][k] += v * row[k];
        }
      }
    }
    for (int j = 0; j < p; j++) {
      for (int k = 0; k < j; k++) {
        m[j][k] = m[k][j];
      }
    }
    return m;
  }

  private static void addPenalty(double[][] m, double[][] penaltyRoot, double lambda) {
    if (penaltyRoot == null || lambda <= 0d) {
      return;
    }
    int p = m.length;
    for (double[] row : penaltyRoot) {
      for (int j = 0; j < p; j++) {
        if (row[j] == 0d) {
          continue;
        }
        for (int k = 0; k < p; k++) {
          m[j][k] += lambda * (row[j] * row[k]);
        }
      }
    }
  }

  private static double dot(double[] a, double[] b) {
    double s = 0d;
    for (int j = 0; j < a.length; j++) {
      s += a[j] * b[j];
    }
    return s;
  }
}
