package com.github.keenon.tiedcrf.model;

import com.carrotsearch.hppc.IntArrayList;
import com.carrotsearch.hppc.IntObjectMap;
import org.junit.Test;

import static org.junit.Assert.*;

public class FeatureSetTest {

  @Test
  public void testParameterGroupsKeepFeatureOrder() {
    FeatureSet featureSet = FeatureSet.of(4,
        new Feature(new int[]{0}, new int[]{0}, 2),
        new Feature(new int[]{1}, new int[]{0}, 0),
        new Feature(new int[]{2}, new int[]{1}, 2),
        new Feature(new int[]{0, 1}, new int[]{1, 1}, 2));

    IntObjectMap<IntArrayList> groups = featureSet.getParameterGroups();
    assertEquals(2, groups.size());
    assertArrayEquals(new int[]{0, 2, 3}, groups.get(2).toArray());
    assertArrayEquals(new int[]{1}, groups.get(0).toArray());
    assertFalse(groups.containsKey(1));
    assertFalse(groups.containsKey(3));
    assertEquals(3, featureSet.numVariables());
  }

  @Test
  public void testMatches() {
    Feature feature = new Feature(new int[]{2, 0}, new int[]{1, 3}, 0);
    assertTrue(feature.matches(new int[]{3, 9, 1}));
    assertFalse(feature.matches(new int[]{3, 9, 0}));
    assertFalse(feature.matches(new int[]{1, 9, 3}));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMismatchedFeatureLengths() {
    new Feature(new int[]{0, 1}, new int[]{0}, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testValidateRepeatedVariable() {
    FeatureSet.of(1, new Feature(new int[]{1, 1}, new int[]{0, 0}, 0)).validate(2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testValidateNegativeParamIdx() {
    FeatureSet.of(1, new Feature(new int[]{0}, new int[]{0}, -1)).validate(2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testValidateEmptyScope() {
    FeatureSet.of(1, new Feature(new int[0], new int[0], 0)).validate(2);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testFeaturesAreReadOnly() {
    FeatureSet.of(1, new Feature(new int[]{0}, new int[]{0}, 0)).features.clear();
  }
}
