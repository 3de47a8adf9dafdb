package io.cardest.sketch;

public interface CardinalityEstimator<T>
{
  /**
   * Observes one element given its 32-bit hash. The hash must come from a function with good
   * uniformity and avalanche behaviour; the estimator does no mixing of its own.
   */
  void addHash(int hash);

  void merge(T that);
  long cardinality();
  void reset();
  long memoryFootprint();

  String name();
}
