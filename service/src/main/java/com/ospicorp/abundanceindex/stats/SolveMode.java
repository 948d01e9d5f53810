package com.ospicorp.abundanceindex.stats;

public enum SolveMode {
  // QR of the augmented weighted system
  STANDARD,
  // Cholesky of the penalised normal equations, cheaper on many rows
  FAST
}
