package com.github.keenon.tiedcrf.learning;

import com.github.keenon.tiedcrf.model.Feature;

import java.util.List;

/**
 * Computes the negative log-likelihood of the true labels, given the log partition function.
 * <p>
 * The summed weights of the features that fire on the true labels are exactly the unnormalized log-potential of the
 * true joint assignment, so NLL = logZ - (that sum) + regularization, with no approximation.
 */
public class LikelihoodEvaluator {
  private LikelihoodEvaluator() {
  }

  /**
   * Which features fire on the true labels, and the weight each one contributes.
   */
  public static class FeatureCounts {
    /** 1 for each feature that matches the labels, 0 otherwise, in feature order */
    public final double[] unweighted;
    /** theta[paramIdx] for each feature that matches the labels, 0 otherwise, in feature order */
    public final double[] weighted;

    FeatureCounts(double[] unweighted, double[] weighted) {
      this.unweighted = unweighted;
      this.weighted = weighted;
    }

    /**
     * @return the unnormalized log-potential of the labels
     */
    public double weightedSum() {
      double sum = 0.0;
      for (double w : weighted) sum += w;
      return sum;
    }
  }

  /**
   * @param labels   the true assignment, indexed by variable
   * @param features the features
   * @param theta    the shared weights
   * @return the per-feature counts on the labels
   */
  public static FeatureCounts featureCounts(int[] labels, List<Feature> features, double[] theta) {
    double[] unweighted = new double[features.size()];
    double[] weighted = new double[features.size()];
    for (int i = 0; i < features.size(); i++) {
      Feature feature = features.get(i);
      if (feature.matches(labels)) {
        unweighted[i] = 1.0;
        weighted[i] = theta[feature.paramIdx];
      }
    }
    return new FeatureCounts(unweighted, weighted);
  }

  /**
   * @param logPartitionFunction logZ of the model
   * @param counts               the feature counts on the true labels
   * @param theta                the shared weights
   * @param regularizer          the penalty on the weights
   * @return logZ - sum of active weights + regularization cost
   */
  public static double negativeLogLikelihood(double logPartitionFunction, FeatureCounts counts, double[] theta,
                       L2Regularizer regularizer) {
    return logPartitionFunction - counts.weightedSum() + regularizer.cost(theta);
  }
}
