package com.ospicorp.abundanceindex.stats;

/**
 * Cubic B-spline basis on equally spaced knots over {@code [lower, upper]}, with the matching
 * second-order difference penalty. Values outside the range are clamped to the boundary.
 */
public final class BSplineBasis {
  private static final int DEGREE = 3;

  private final double lower;
  private final double upper;
  private final int size;
  private final int segments;
  private final double step;

  public BSplineBasis(double lower, double upper, int size) {
    if (size < DEGREE + 1) {
      throw new IllegalArgumentException("basis size must be at least " + (DEGREE + 1));
    }
    if (!(upper >= lower)) {
      throw new IllegalArgumentException("upper bound must not be below lower bound");
    }
    this.lower = lower;
    // a single distinct day still needs a non-empty interval
    this.upper = upper > lower ? upper : lower + 1d;
    this.size = size;
    this.segments = size - DEGREE;
    this.step = (this.upper - this.lower) / segments;
  }

  public int size() {
    return size;
  }

  public double lower() {
    return lower;
  }

  public double upper() {
    return upper;
  }

  public double[] evaluate(double x) {
    double u = Math.min(Math.max(x, lower), upper);
    int span = (int) Math.floor((u - lower) / step);
    if (span >= segments) {
      span = segments - 1;
    }
    if (span < 0) {
      span = 0;
    }
    int i = span + DEGREE;
    double[] left = new double[DEGREE + 1];
    double[] right = new double[DEGREE + 1];
    double[] n = new double[DEGREE + 1];
    n[0] = 1d;
    for (int j = 1; j <= DEGREE; j++) {
      left[j] = u - knot(i + 1 - j);
      right[j] = knot(i + j) - u;
      double saved = 0d;
      for (int r = 0; r < j; r++) {
        double temp = n[r] / (right[r + 1] + left[j - r]);
        n[r] = saved + right[r + 1] * temp;
        saved = left[j - r] * temp;
      }
      n[j] = saved;
    }
    double[] out = new double[size];
    for (int r = 0; r <= DEGREE; r++) {
      // roundoff at the upper knot can leave values just below zero
      out[span + r] = Math.max(n[r], 0d);
    }
    return out;
  }

  /** Rows of the second-order difference operator, {@code (size - 2) x size}. */
  public double[][] differencePenalty() {
    double[][] d = new double[size - 2][size];
    for (int r = 0; r < size - 2; r++) {
      d[r][r] = 1d;
      d[r][r + 1] = -2d;
      d[r][r + 2] = 1d;
    }
    return d;
  }

  private double knot(int k) {
    return lower + (k - DEGREE) * step;
  }
}
