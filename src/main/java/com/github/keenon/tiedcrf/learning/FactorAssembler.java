package com.github.keenon.tiedcrf.learning;

import com.github.keenon.tiedcrf.model.Feature;
import com.github.keenon.tiedcrf.model.TableFactor;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns indicator features and the shared weights into log-linear table factors, one per feature.
 * <p>
 * A feature's factor is 1 everywhere except at the feature's assignment, where it is exp(theta[paramIdx]). Factors
 * hold log potentials, so that means 0 everywhere and theta at the assignment, and no weight is ever exponentiated.
 */
public class FactorAssembler {
  private FactorAssembler() {
  }

  /**
   * @param features        the features, in order
   * @param theta           the shared weights
   * @param numHiddenStates the number of states of every variable
   * @return one factor per feature, in feature order. Factors are never merged here.
   */
  public static List<TableFactor> assemble(List<Feature> features, double[] theta, int numHiddenStates) {
    List<TableFactor> factors = new ArrayList<>(features.size());
    for (Feature feature : features) {
      factors.add(assemble(feature, theta, numHiddenStates));
    }
    return factors;
  }

  /**
   * Builds the factor for a single feature.
   */
  public static TableFactor assemble(Feature feature, double[] theta, int numHiddenStates) {
    int[] cardinalities = new int[feature.scope.length];
    for (int i = 0; i < cardinalities.length; i++) {
      cardinalities[i] = numHiddenStates;
    }

    TableFactor factor = TableFactor.ones(feature.scope.clone(), cardinalities);
    factor.setAssignmentValue(feature.assignment, theta[feature.paramIdx]);
    return factor;
  }
}
