package com.github.keenon.tiedcrf.model;

import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.*;

/**
 * Checks the factor operations against values worked out directly from the tables.
 */
public class TableFactorTest {

  private static TableFactor randomFactor(int[] neighbors, int[] dimensions, Random r) {
    TableFactor factor = new TableFactor(neighbors, dimensions);
    for (int[] assignment : factor) {
      factor.setAssignmentValue(assignment, Math.log(0.1 + r.nextDouble()));
    }
    return factor;
  }

  private static TableFactor factorOf(int[] neighbors, int[] dimensions, double... potentials) {
    TableFactor factor = new TableFactor(neighbors, dimensions);
    int i = 0;
    for (int[] assignment : factor) {
      factor.setAssignmentValue(assignment, Math.log(potentials[i++]));
    }
    return factor;
  }

  @Test
  public void testMultiply() {
    Random r = new Random(42L);
    TableFactor a = randomFactor(new int[]{0, 1}, new int[]{2, 3}, r);
    TableFactor b = randomFactor(new int[]{1, 2}, new int[]{3, 2}, r);

    TableFactor product = a.multiply(b);
    assertArrayEquals(new int[]{0, 1, 2}, product.neighborIndices);
    assertArrayEquals(new int[]{2, 3, 2}, product.getDimensions());

    for (int[] assignment : product) {
      double expected = a.getValue(new int[]{assignment[0], assignment[1]}) *
          b.getValue(new int[]{assignment[1], assignment[2]});
      assertEquals(expected, product.getValue(assignment), 1.0e-12);
    }
  }

  @Test
  public void testMultiplyScalesAgainstSubset() {
    Random r = new Random(7L);
    TableFactor big = randomFactor(new int[]{3, 1}, new int[]{2, 2}, r);
    TableFactor small = randomFactor(new int[]{1}, new int[]{2}, r);
    TableFactor product = big.multiply(small);
    assertArrayEquals(new int[]{3, 1}, product.neighborIndices);
    for (int[] assignment : product) {
      assertEquals(big.getValue(assignment) * small.getValue(new int[]{assignment[1]}),
          product.getValue(assignment), 1.0e-12);
    }
  }

  @Test
  public void testCompetingLargePotentialsDontUnderflow() {
    // exp(-1000) isn't a double, but the ratio between these two factors' entries doesn't need to be
    TableFactor first = TableFactor.ones(new int[]{0}, new int[]{2});
    first.setAssignmentValue(new int[]{0}, 1000.0);
    TableFactor second = TableFactor.ones(new int[]{0}, new int[]{2});
    second.setAssignmentValue(new int[]{1}, 1000.0);

    TableFactor product = first.multiply(second);
    assertEquals(1000.0, product.getAssignmentValue(new int[]{0}), 0.0);
    assertEquals(1000.0, product.getAssignmentValue(new int[]{1}), 0.0);
    assertEquals(1000.0 + Math.log(2), product.logValueSum(), 1.0e-9);

    TableFactor distribution = product.normalize();
    assertEquals(0.5, distribution.getValue(new int[]{0}), 1.0e-12);
    assertEquals(0.5, distribution.getValue(new int[]{1}), 1.0e-12);
    assertEquals(1000.0 + Math.log(2), product.sumOut(0).logValueSum(), 1.0e-9);
    assertArrayEquals(new double[]{0.5, 0.5}, product.getSummedMarginals()[0], 1.0e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMultiplyMismatchedSizes() {
    TableFactor.ones(new int[]{0}, new int[]{2}).multiply(TableFactor.ones(new int[]{0}, new int[]{3}));
  }

  @Test
  public void testSumOutAndMaxOut() {
    TableFactor factor = factorOf(new int[]{4, 7}, new int[]{2, 2}, 1.0, 2.0, 3.0, 5.0);

    TableFactor summed = factor.sumOut(7);
    assertArrayEquals(new int[]{4}, summed.neighborIndices);
    assertEquals(3.0, summed.getValue(new int[]{0}), 1.0e-12);
    assertEquals(8.0, summed.getValue(new int[]{1}), 1.0e-12);

    TableFactor maxed = factor.maxOut(4);
    assertArrayEquals(new int[]{7}, maxed.neighborIndices);
    assertEquals(3.0, maxed.getValue(new int[]{0}), 1.0e-12);
    assertEquals(5.0, maxed.getValue(new int[]{1}), 1.0e-12);

    TableFactor scalar = summed.sumOut(4);
    assertEquals(0, scalar.neighborIndices.length);
    assertEquals(Math.log(11.0), scalar.logValueSum(), 1.0e-12);
  }

  @Test
  public void testSumOutOfZeroPotentials() {
    TableFactor factor = factorOf(new int[]{0, 1}, new int[]{2, 2}, 0.0, 0.0, 2.0, 0.0);
    TableFactor summed = factor.sumOut(1);
    assertEquals(Double.NEGATIVE_INFINITY, summed.getAssignmentValue(new int[]{0}), 0.0);
    assertEquals(2.0, summed.getValue(new int[]{1}), 1.0e-12);
    assertArrayEquals(new double[]{0.0, 1.0}, factor.getSummedMarginals()[0], 1.0e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSumOutMissingVariable() {
    TableFactor.ones(new int[]{0}, new int[]{2}).sumOut(1);
  }

  @Test
  public void testMarginalizeToReordersScope() {
    Random r = new Random(3L);
    TableFactor factor = randomFactor(new int[]{0, 1, 2}, new int[]{2, 3, 2}, r);

    TableFactor marginal = factor.marginalizeTo(new int[]{2, 0});
    assertArrayEquals(new int[]{2, 0}, marginal.neighborIndices);
    assertArrayEquals(new int[]{2, 2}, marginal.getDimensions());

    for (int x2 = 0; x2 < 2; x2++) {
      for (int x0 = 0; x0 < 2; x0++) {
        double expected = 0.0;
        for (int x1 = 0; x1 < 3; x1++) expected += factor.getValue(new int[]{x0, x1, x2});
        assertEquals(expected, marginal.getValue(new int[]{x2, x0}), 1.0e-12);
      }
    }
  }

  @Test
  public void testMarginalizeIgnoresOutOfScopeVariables() {
    Random r = new Random(5L);
    TableFactor factor = randomFactor(new int[]{0, 1}, new int[]{2, 2}, r);
    TableFactor marginal = factor.marginalize(new int[]{1, 9});
    assertArrayEquals(new int[]{0}, marginal.neighborIndices);
    assertEquals(factor.logValueSum(), marginal.logValueSum(), 1.0e-12);
  }

  @Test
  public void testNormalizeGivesDistribution() {
    Random r = new Random(11L);
    TableFactor factor = randomFactor(new int[]{0, 1}, new int[]{3, 3}, r);
    TableFactor normalized = factor.normalize();

    assertEquals(0.0, normalized.logValueSum(), 1.0e-12);
    double total = Math.exp(factor.logValueSum());
    for (int[] assignment : factor) {
      assertEquals(factor.getValue(assignment) / total, normalized.getValue(assignment), 1.0e-12);
    }
  }

  @Test
  public void testMarginalsSumToOne() {
    Random r = new Random(13L);
    TableFactor factor = randomFactor(new int[]{0, 1}, new int[]{3, 2}, r);
    for (double[] marginal : factor.getSummedMarginals()) {
      double sum = 0.0;
      for (double d : marginal) sum += d;
      assertEquals(1.0, sum, 1.0e-12);
    }
    for (double[] marginal : factor.getMaxedMarginals()) {
      double sum = 0.0;
      for (double d : marginal) sum += d;
      assertEquals(1.0, sum, 1.0e-12);
    }
  }

  @Test
  public void testArgmaxConsistentWith() {
    TableFactor factor = factorOf(new int[]{0, 1}, new int[]{2, 2}, 1.0, 4.0, 3.0, 2.0);

    assertArrayEquals(new int[]{0, 1}, factor.argmaxConsistentWith(new int[]{-1, -1}));
    assertArrayEquals(new int[]{1, 0}, factor.argmaxConsistentWith(new int[]{1, -1}));
    assertArrayEquals(new int[]{1, 0}, factor.argmaxConsistentWith(new int[]{-1, 0}));
  }
}
