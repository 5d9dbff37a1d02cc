package com.github.keenon.tiedcrf.learning;

/**
 * A Gaussian prior on the weights, as a penalty of (lambda / 2) * ||theta||^2 on the negative log-likelihood.
 */
public class L2Regularizer {
  public final double lambda;

  public L2Regularizer(double lambda) {
    if (!(lambda >= 0) || Double.isInfinite(lambda)) {
      throw new IllegalArgumentException("Regularization strength must be finite and non-negative, got " + lambda);
    }
    this.lambda = lambda;
  }

  /**
   * @return (lambda / 2) * sum of theta_i^2
   */
  public double cost(double[] theta) {
    double sumOfSquares = 0.0;
    for (double t : theta) sumOfSquares += t * t;
    return lambda / 2.0 * sumOfSquares;
  }

  /**
   * @return the derivative of the cost with respect to theta[p], which is lambda * theta[p]
   */
  public double derivative(double[] theta, int p) {
    return lambda * theta[p];
  }
}
