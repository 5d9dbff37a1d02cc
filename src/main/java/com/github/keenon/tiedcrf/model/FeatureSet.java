package com.github.keenon.tiedcrf.model;

import com.carrotsearch.hppc.IntArrayList;
import com.carrotsearch.hppc.IntObjectHashMap;
import com.carrotsearch.hppc.IntObjectMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The indicator features for one instance, along with the size of the (shared) parameter vector they index into.
 * Read-only once built.
 */
public class FeatureSet {
  public final int numParams;
  public final List<Feature> features;

  public FeatureSet(int numParams, List<Feature> features) {
    if (numParams < 0) throw new IllegalArgumentException("Can't have a negative number of parameters: " + numParams);
    this.numParams = numParams;
    this.features = Collections.unmodifiableList(new ArrayList<>(features));
  }

  /**
   * Checks the feature set against the model before anything is computed from it, so that a bad paramIdx or an
   * out of range assignment fails here rather than as a wrong answer later.
   *
   * @param numHiddenStates the number of states of every variable
   * @throws IllegalArgumentException describing the first malformed feature
   */
  public void validate(int numHiddenStates) {
    for (int i = 0; i < features.size(); i++) {
      Feature f = features.get(i);
      if (f.paramIdx < 0 || f.paramIdx >= numParams) {
        throw new IllegalArgumentException("Feature " + i + " " + f + " has paramIdx outside [0, " + numParams + ")");
      }
      if (f.scope.length == 0) {
        throw new IllegalArgumentException("Feature " + i + " " + f + " has an empty scope");
      }
      for (int j = 0; j < f.scope.length; j++) {
        if (f.scope[j] < 0) {
          throw new IllegalArgumentException("Feature " + i + " " + f + " has a negative variable index");
        }
        if (f.assignment[j] < 0 || f.assignment[j] >= numHiddenStates) {
          throw new IllegalArgumentException("Feature " + i + " " + f + " has an assignment outside [0, " +
              numHiddenStates + ")");
        }
        for (int k = 0; k < j; k++) {
          if (f.scope[k] == f.scope[j]) {
            throw new IllegalArgumentException("Feature " + i + " " + f + " repeats variable " + f.scope[j]);
          }
        }
      }
    }
  }

  /**
   * @return one more than the largest variable index touched by any feature
   */
  public int numVariables() {
    int max = -1;
    for (Feature f : features) {
      for (int v : f.scope) if (v > max) max = v;
    }
    return max + 1;
  }

  /**
   * Groups features by the parameter they share. Parameters that no feature uses are absent from the map.
   *
   * @return paramIdx to the indices (into features) of every feature with that paramIdx, in feature order
   */
  public IntObjectMap<IntArrayList> getParameterGroups() {
    IntObjectMap<IntArrayList> groups = new IntObjectHashMap<>();
    for (int i = 0; i < features.size(); i++) {
      int paramIdx = features.get(i).paramIdx;
      IntArrayList group = groups.get(paramIdx);
      if (group == null) {
        group = new IntArrayList();
        groups.put(paramIdx, group);
      }
      group.add(i);
    }
    return groups;
  }

  @Override
  public String toString() {
    return "FeatureSet{numParams=" + numParams + ", features=" + features.size() + "}";
  }

  /**
   * Convenience for building small feature sets by hand.
   */
  public static FeatureSet of(int numParams, Feature... features) {
    return new FeatureSet(numParams, Arrays.asList(features));
  }
}
