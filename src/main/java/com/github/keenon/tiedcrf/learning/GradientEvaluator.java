package com.github.keenon.tiedcrf.learning;

import com.carrotsearch.hppc.IntArrayList;
import com.carrotsearch.hppc.IntObjectMap;
import com.carrotsearch.hppc.cursors.IntObjectCursor;
import com.github.keenon.tiedcrf.inference.CalibratedCliqueTree;
import com.github.keenon.tiedcrf.model.Feature;
import com.github.keenon.tiedcrf.model.FeatureSet;
import com.github.keenon.tiedcrf.model.TableFactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the gradient of the negative log-likelihood with respect to the shared weights.
 * <p>
 * For each parameter p, the gradient is (model expected count of p) - (empirical count of p) + lambda * theta[p],
 * where both counts sum over every feature tied to p. The model expectation of a feature is the probability of its
 * assignment, read off the normalized marginal of a calibrated clique that covers its scope.
 */
public class GradientEvaluator {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(GradientEvaluator.class);

  private GradientEvaluator() {
  }

  /**
   * @param tree        the calibrated clique tree for the current weights
   * @param featureSet  the features and the number of parameters
   * @param counts      the feature counts on the true labels
   * @param theta       the shared weights
   * @param regularizer the penalty on the weights
   * @return the gradient, one entry per parameter
   */
  public static double[] gradient(CalibratedCliqueTree tree, FeatureSet featureSet, LikelihoodEvaluator.FeatureCounts counts,
                  double[] theta, L2Regularizer regularizer) {
    double[] featureExpectations = featureExpectations(tree, featureSet.features);
    IntObjectMap<IntArrayList> groups = featureSet.getParameterGroups();

    double[] gradient = new double[featureSet.numParams];
    for (int p = 0; p < gradient.length; p++) {
      gradient[p] = regularizer.derivative(theta, p);
    }

    // Tied features reduce into their shared parameter; the regularizer is counted once per parameter, not per feature
    for (IntObjectCursor<IntArrayList> cursor : groups) {
      double expected = 0.0;
      double empirical = 0.0;
      IntArrayList group = cursor.value;
      for (int k = 0; k < group.size(); k++) {
        int i = group.get(k);
        expected += featureExpectations[i];
        empirical += counts.unweighted[i];
      }
      gradient[cursor.key] += expected - empirical;
    }

    return gradient;
  }

  /**
   * @return sum over features with paramIdx p of the feature's count on the labels, for each p
   */
  public static double[] empiricalCounts(FeatureSet featureSet, LikelihoodEvaluator.FeatureCounts counts) {
    double[] empirical = new double[featureSet.numParams];
    for (IntObjectCursor<IntArrayList> cursor : featureSet.getParameterGroups()) {
      for (int k = 0; k < cursor.value.size(); k++) {
        empirical[cursor.key] += counts.unweighted[cursor.value.get(k)];
      }
    }
    return empirical;
  }

  /**
   * @return sum over features with paramIdx p of the model probability that the feature fires, for each p
   */
  public static double[] expectedCounts(CalibratedCliqueTree tree, FeatureSet featureSet) {
    double[] featureExpectations = featureExpectations(tree, featureSet.features);
    double[] expected = new double[featureSet.numParams];
    for (IntObjectCursor<IntArrayList> cursor : featureSet.getParameterGroups()) {
      for (int k = 0; k < cursor.value.size(); k++) {
        expected[cursor.key] += featureExpectations[cursor.value.get(k)];
      }
    }
    return expected;
  }

  /**
   * Finds the probability under the model that each feature fires. The covering clique, and the marginal over the
   * feature's scope, are looked up once per distinct scope rather than once per feature.
   *
   * @param tree     the calibrated clique tree
   * @param features the features
   * @return one probability per feature, in feature order
   * @throws IllegalStateException if some feature's scope isn't inside any clique, which the tree builder must prevent
   */
  public static double[] featureExpectations(CalibratedCliqueTree tree, List<Feature> features) {
    Map<Scope, TableFactor> marginals = new HashMap<>();
    double[] expectations = new double[features.size()];

    for (int i = 0; i < features.size(); i++) {
      Feature feature = features.get(i);
      Scope scope = new Scope(feature.scope);
      TableFactor marginal = marginals.get(scope);
      if (marginal == null) {
        marginal = coveringMarginal(tree, feature.scope);
        marginals.put(scope, marginal);
      }
      expectations[i] = marginal.getValue(feature.assignment);
    }

    log.debug("Read " + features.size() + " feature expectations from " + marginals.size() + " distinct scopes");
    return expectations;
  }

  ////////////////////////////////////////////////////////////////////////////
  // PRIVATE IMPLEMENTATION
  ////////////////////////////////////////////////////////////////////////////

  private static TableFactor coveringMarginal(CalibratedCliqueTree tree, int[] scope) {
    int clique = tree.findCoveringClique(scope);
    if (clique == -1) {
      throw new IllegalStateException("No clique in the calibrated tree covers the feature scope " +
          Arrays.toString(scope));
    }
    TableFactor marginal = tree.getMarginal(clique, scope);

    if (assertsEnabled()) {
      // Calibration should make every covering clique agree. Check that rather than trust it.
      IntArrayList covering = tree.findCoveringCliques(scope);
      for (int k = 0; k < covering.size(); k++) {
        int other = covering.get(k);
        if (other == clique) continue;
        if (!marginal.potentialsEqual(tree.getMarginal(other, scope), 1.0e-6)) {
          log.error("Cliques " + clique + " and " + other + " disagree on the marginal over " + Arrays.toString(scope));
        }
        assert marginal.potentialsEqual(tree.getMarginal(other, scope), 1.0e-6);
      }
    }

    return marginal;
  }

  /**
   * Hashable wrapper for a variable scope.
   */
  private static final class Scope {
    final int[] variables;

    Scope(int[] variables) {
      this.variables = variables;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Scope && Arrays.equals(variables, ((Scope) o).variables);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(variables);
    }
  }

  @SuppressWarnings("*")
  private static boolean assertsEnabled() {
    boolean assertsEnabled = false;
    assert (assertsEnabled = true); // intentional side effect
    return assertsEnabled;
  }
}
