package com.github.keenon.tiedcrf.model;

import java.util.Arrays;

/**
 * A binary indicator feature. It fires when the variables in scope take exactly the values in assignment, and when it
 * fires it contributes theta[paramIdx] to the unnormalized log-potential. Many features may point at the same
 * paramIdx, which is how weights get tied across positions.
 */
public class Feature {
  public final int[] scope;
  public final int[] assignment;
  public final int paramIdx;

  public Feature(int[] scope, int[] assignment, int paramIdx) {
    if (scope.length != assignment.length) {
      throw new IllegalArgumentException("Feature scope " + Arrays.toString(scope) + " and assignment " +
          Arrays.toString(assignment) + " have different lengths");
    }
    this.scope = scope;
    this.assignment = assignment;
    this.paramIdx = paramIdx;
  }

  /**
   * @param labels a full assignment, indexed by variable
   * @return whether the labels restricted to this feature's scope equal its assignment
   */
  public boolean matches(int[] labels) {
    for (int i = 0; i < scope.length; i++) {
      if (labels[scope[i]] != assignment[i]) return false;
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Feature)) return false;
    Feature other = (Feature) o;
    return paramIdx == other.paramIdx && Arrays.equals(scope, other.scope) && Arrays.equals(assignment, other.assignment);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Arrays.hashCode(scope) + Arrays.hashCode(assignment)) + paramIdx;
  }

  @Override
  public String toString() {
    return "Feature{var=" + Arrays.toString(scope) + ", assignment=" + Arrays.toString(assignment) +
        ", paramIdx=" + paramIdx + "}";
  }
}
