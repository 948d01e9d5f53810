package com.ospicorp.abundanceindex.stats;

/**
 * Outcome of one model fit: either a usable model or the reason it could not be produced.
 * Solvers report numerical trouble through {@link Failure} instead of throwing.
 */
public sealed interface FitResult<M> permits FitResult.Success, FitResult.Failure {

  static <M> FitResult<M> success(M model) {
    return new Success<>(model);
  }

  static <M> FitResult<M> failure(String reason) {
    return new Failure<>(reason);
  }

  boolean succeeded();

  record Success<M>(M model) implements FitResult<M> {
    @Override
    public boolean succeeded() {
      return true;
    }
  }

  record Failure<M>(String reason) implements FitResult<M> {
    @Override
    public boolean succeeded() {
      return false;
    }
  }
}
