package com.github.keenon.tiedcrf.model;

import java.util.Properties;

/**
 * The fixed settings of a CRF: how many states each hidden (label) variable and each observed (pixel) variable has,
 * and the strength of the L2 penalty on the weights.
 */
public class ModelParams {
  public static final String NUM_HIDDEN_STATES = "crf.numHiddenStates";
  public static final String NUM_OBSERVED_STATES = "crf.numObservedStates";
  public static final String LAMBDA = "crf.lambda";

  // 26 letters, on/off pixels, and the regularization the OCR model was tuned with
  public static final int DEFAULT_NUM_HIDDEN_STATES = 26;
  public static final int DEFAULT_NUM_OBSERVED_STATES = 2;
  public static final double DEFAULT_LAMBDA = 0.003;

  public final int numHiddenStates;
  public final int numObservedStates;
  public final double lambda;

  public ModelParams(int numHiddenStates, int numObservedStates, double lambda) {
    if (numHiddenStates < 1) {
      throw new IllegalArgumentException("Need at least one hidden state, got " + numHiddenStates);
    }
    if (numObservedStates < 1) {
      throw new IllegalArgumentException("Need at least one observed state, got " + numObservedStates);
    }
    if (!(lambda >= 0) || Double.isInfinite(lambda)) {
      throw new IllegalArgumentException("Regularization strength must be finite and non-negative, got " + lambda);
    }
    this.numHiddenStates = numHiddenStates;
    this.numObservedStates = numObservedStates;
    this.lambda = lambda;
  }

  /**
   * Reads model settings out of a properties object, falling back on the OCR defaults for anything missing.
   *
   * @param props the properties, with keys {@link #NUM_HIDDEN_STATES}, {@link #NUM_OBSERVED_STATES} and
   *              {@link #LAMBDA}
   * @return the parsed ModelParams
   */
  public static ModelParams fromProperties(Properties props) {
    try {
      int numHiddenStates = Integer.parseInt(props.getProperty(NUM_HIDDEN_STATES,
          Integer.toString(DEFAULT_NUM_HIDDEN_STATES)).trim());
      int numObservedStates = Integer.parseInt(props.getProperty(NUM_OBSERVED_STATES,
          Integer.toString(DEFAULT_NUM_OBSERVED_STATES)).trim());
      double lambda = Double.parseDouble(props.getProperty(LAMBDA, Double.toString(DEFAULT_LAMBDA)).trim());
      return new ModelParams(numHiddenStates, numObservedStates, lambda);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Malformed CRF model properties: " + e.getMessage(), e);
    }
  }

  /**
   * @return the same model, with a different regularization strength
   */
  public ModelParams withLambda(double lambda) {
    return new ModelParams(numHiddenStates, numObservedStates, lambda);
  }

  @Override
  public String toString() {
    return "ModelParams{numHiddenStates=" + numHiddenStates + ", numObservedStates=" + numObservedStates +
        ", lambda=" + lambda + "}";
  }
}
