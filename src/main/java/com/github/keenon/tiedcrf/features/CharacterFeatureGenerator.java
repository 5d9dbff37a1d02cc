package com.github.keenon.tiedcrf.features;

import com.github.keenon.tiedcrf.model.Feature;
import com.github.keenon.tiedcrf.model.FeatureSet;
import com.github.keenon.tiedcrf.model.ModelParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the indicator features of a chain CRF over a word's characters, where every character is observed through
 * a fixed set of discrete image features (pixels).
 * <p>
 * Three families of features are generated, all tied across positions in the word:
 * <ul>
 *   <li>conditioned singletons, one weight per (image feature, character, pixel value),</li>
 *   <li>unconditioned singletons, one bias weight per character,</li>
 *   <li>pairwise transitions between neighboring characters, one weight per character pair.</li>
 * </ul>
 * Parameters are laid out in that order.
 */
public class CharacterFeatureGenerator {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(CharacterFeatureGenerator.class);

  private final ModelParams modelParams;

  public CharacterFeatureGenerator(ModelParams modelParams) {
    this.modelParams = modelParams;
  }

  /**
   * @param numImageFeatures the number of image features per character
   * @return the number of parameters the generated features index into
   */
  public int numParams(int numImageFeatures) {
    int h = modelParams.numHiddenStates;
    return h * numImageFeatures * modelParams.numObservedStates + h + h * h;
  }

  /**
   * @return the parameter of the conditioned singleton for this (image feature, character, pixel value)
   */
  public int conditionedSingletonParam(int imageFeature, int hiddenState, int observedState) {
    return (imageFeature * modelParams.numHiddenStates + hiddenState) * modelParams.numObservedStates + observedState;
  }

  /**
   * @return the bias parameter for this character
   */
  public int unconditionedSingletonParam(int numImageFeatures, int hiddenState) {
    return modelParams.numHiddenStates * numImageFeatures * modelParams.numObservedStates + hiddenState;
  }

  /**
   * @return the transition parameter for this pair of neighboring characters
   */
  public int pairParam(int numImageFeatures, int leftState, int rightState) {
    int h = modelParams.numHiddenStates;
    return h * numImageFeatures * modelParams.numObservedStates + h + leftState * h + rightState;
  }

  /**
   * Generates all the features for one word.
   *
   * @param x the observed image features, indexed [character][image feature], each in [0, numObservedStates)
   * @param y the labels, one per character. Only used to check the instance is well formed; may be null when decoding.
   * @return the feature set for the instance
   */
  public FeatureSet buildFeatureSet(int[][] x, int[] y) {
    int numChars = x.length;
    int numImageFeatures = numChars == 0 ? 0 : x[0].length;
    int h = modelParams.numHiddenStates;

    for (int v = 0; v < numChars; v++) {
      if (x[v].length != numImageFeatures) {
        throw new IllegalArgumentException("Character " + v + " has " + x[v].length + " image features, expected " +
            numImageFeatures);
      }
      for (int f = 0; f < numImageFeatures; f++) {
        if (x[v][f] < 0 || x[v][f] >= modelParams.numObservedStates) {
          throw new IllegalArgumentException("Image feature " + f + " of character " + v + " is " + x[v][f] +
              ", outside [0, " + modelParams.numObservedStates + ")");
        }
      }
    }
    if (y != null && y.length != numChars) {
      throw new IllegalArgumentException("Got " + y.length + " labels for " + numChars + " characters");
    }

    List<Feature> features = new ArrayList<>();

    for (int v = 0; v < numChars; v++) {
      for (int state = 0; state < h; state++) {
        for (int f = 0; f < numImageFeatures; f++) {
          features.add(new Feature(new int[]{v}, new int[]{state}, conditionedSingletonParam(f, state, x[v][f])));
        }
      }
    }

    for (int v = 0; v < numChars; v++) {
      for (int state = 0; state < h; state++) {
        features.add(new Feature(new int[]{v}, new int[]{state}, unconditionedSingletonParam(numImageFeatures, state)));
      }
    }

    for (int v = 0; v < numChars - 1; v++) {
      for (int left = 0; left < h; left++) {
        for (int right = 0; right < h; right++) {
          features.add(new Feature(new int[]{v, v + 1}, new int[]{left, right}, pairParam(numImageFeatures, left, right)));
        }
      }
    }

    log.debug("Generated " + features.size() + " features over " + numChars + " characters");
    return new FeatureSet(numParams(numImageFeatures), features);
  }
}
