package com.github.keenon.tiedcrf.learning;

import com.github.keenon.tiedcrf.features.CharacterFeatureGenerator;
import com.github.keenon.tiedcrf.inference.CalibratedCliqueTree;
import com.github.keenon.tiedcrf.inference.CliqueTree;
import com.github.keenon.tiedcrf.model.FeatureSet;
import com.github.keenon.tiedcrf.model.ModelParams;
import com.github.keenon.tiedcrf.model.TableFactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The per-instance objective for maximum likelihood training of a CRF with tied weights: the negative log-likelihood
 * of one labeled instance, and its gradient with respect to the weights.
 * <p>
 * Nothing is kept between calls. Features, factors and the clique tree are rebuilt every time, so an optimizer can call
 * this repeatedly with new weights, and from as many threads as it likes on different instances.
 */
public class InstanceNegLogLikelihood {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(InstanceNegLogLikelihood.class);

  /**
   * Little data structure for passing around the objective and its gradient.
   */
  public static class Result {
    public final double nll;
    public final double[] gradient;

    public Result(double nll, double[] gradient) {
      this.nll = nll;
      this.gradient = gradient;
    }
  }

  private final ModelParams modelParams;
  private final CharacterFeatureGenerator featureGenerator;
  private final L2Regularizer regularizer;

  public InstanceNegLogLikelihood(ModelParams modelParams) {
    this.modelParams = modelParams;
    this.featureGenerator = new CharacterFeatureGenerator(modelParams);
    this.regularizer = new L2Regularizer(modelParams.lambda);
  }

  /**
   * One-shot form of {@link #evaluate(int[][], int[], double[])}.
   */
  public static Result evaluate(int[][] x, int[] y, double[] theta, ModelParams modelParams) {
    return new InstanceNegLogLikelihood(modelParams).evaluate(x, y, theta);
  }

  /**
   * Generates the features for an observed word, and evaluates the objective on its labels.
   *
   * @param x     the observed image features, indexed [character][image feature]
   * @param y     the true character labels
   * @param theta the shared weights
   * @return the negative log-likelihood and its gradient
   */
  public Result evaluate(int[][] x, int[] y, double[] theta) {
    if (y == null) throw new IllegalArgumentException("Can't evaluate the likelihood of an unlabeled instance");
    return evaluate(featureGenerator.buildFeatureSet(x, y), y, theta);
  }

  /**
   * Evaluates the objective for a feature set that's already been built.
   * <p>
   * Every entry of y is a variable of the model. Variables that no feature touches are uniform, and contribute
   * log(numHiddenStates) each to the partition function.
   *
   * @param featureSet the features of the instance
   * @param y          the true labels, one per variable
   * @param theta      the shared weights, one per parameter
   * @return the negative log-likelihood and its gradient
   * @throws IllegalArgumentException if the inputs don't fit together
   */
  public Result evaluate(FeatureSet featureSet, int[] y, double[] theta) {
    checkInputs(featureSet, y, theta);

    List<TableFactor> factors = FactorAssembler.assemble(featureSet.features, theta, modelParams.numHiddenStates);
    CliqueTree cliqueTree = CliqueTree.build(factors);
    CalibratedCliqueTree calibrated = cliqueTree.calibrate();

    double logPartitionFunction = calibrated.getLogPartitionFunction() +
        untouchedVariables(featureSet, y.length) * Math.log(modelParams.numHiddenStates);

    LikelihoodEvaluator.FeatureCounts counts = LikelihoodEvaluator.featureCounts(y, featureSet.features, theta);
    double nll = LikelihoodEvaluator.negativeLogLikelihood(logPartitionFunction, counts, theta, regularizer);
    double[] gradient = GradientEvaluator.gradient(calibrated, featureSet, counts, theta, regularizer);

    if (!Double.isFinite(nll)) {
      log.warn("Non-finite negative log-likelihood " + nll + " for " + featureSet);
    }
    log.debug("nll=" + nll + " logZ=" + logPartitionFunction + " over " + featureSet);

    return new Result(nll, gradient);
  }

  /**
   * Finds the most likely labels for an observed word under the given weights.
   *
   * @param x     the observed image features, indexed [character][image feature]
   * @param theta the shared weights
   * @return one label per character
   */
  public int[] predict(int[][] x, double[] theta) {
    FeatureSet featureSet = featureGenerator.buildFeatureSet(x, null);
    checkWeights(featureSet, theta);
    featureSet.validate(modelParams.numHiddenStates);

    List<TableFactor> factors = FactorAssembler.assemble(featureSet.features, theta, modelParams.numHiddenStates);
    int[] map = CliqueTree.build(factors).calculateMAP();

    int[] labels = new int[x.length];
    for (int i = 0; i < labels.length; i++) {
      // With no features touching a character (no characters at all), there's nothing to prefer, so take state 0
      labels[i] = i < map.length && map[i] != -1 ? map[i] : 0;
    }
    return labels;
  }

  ////////////////////////////////////////////////////////////////////////////
  // PRIVATE IMPLEMENTATION
  ////////////////////////////////////////////////////////////////////////////

  private void checkInputs(FeatureSet featureSet, int[] y, double[] theta) {
    checkWeights(featureSet, theta);
    featureSet.validate(modelParams.numHiddenStates);

    if (y.length < featureSet.numVariables()) {
      throw new IllegalArgumentException("Features touch " + featureSet.numVariables() + " variables, but only " +
          y.length + " labels were given");
    }
    for (int i = 0; i < y.length; i++) {
      if (y[i] < 0 || y[i] >= modelParams.numHiddenStates) {
        throw new IllegalArgumentException("Label " + i + " is " + y[i] + ", outside [0, " +
            modelParams.numHiddenStates + ")");
      }
    }
  }

  private static void checkWeights(FeatureSet featureSet, double[] theta) {
    if (theta.length != featureSet.numParams) {
      throw new IllegalArgumentException("Got " + theta.length + " weights for " + featureSet.numParams + " parameters");
    }
    for (int i = 0; i < theta.length; i++) {
      if (!Double.isFinite(theta[i])) {
        throw new IllegalArgumentException("Weight " + i + " is " + theta[i]);
      }
    }
  }

  private static int untouchedVariables(FeatureSet featureSet, int numVariables) {
    boolean[] touched = new boolean[numVariables];
    featureSet.features.forEach(f -> {
      for (int v : f.scope) touched[v] = true;
    });
    int untouched = 0;
    for (boolean t : touched) if (!t) untouched++;
    return untouched;
  }
}
