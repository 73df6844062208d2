package io.hyperloglog.sketch;

/**
 * Approximate count of distinct values, in bounded memory.
 *
 * @param <T> the estimator type accepted by {@link #merge(Object)}
 */
public interface CardinalityEstimator<T>
{
  void add(byte[] value);
  void add(long value);

  /**
   * Folds {@code that} into this estimator so it counts the union of both inputs.
   */
  void merge(T that);

  void clear();

  double estimate();

  default long cardinality()
  {
    return Math.round(estimate());
  }

  /**
   * @return bytes held by the sketch itself
   */
  long memoryFootprint();

  String name();
}
