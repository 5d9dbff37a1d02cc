package com.github.keenon.tiedcrf.model;

import java.util.Arrays;
import java.util.Iterator;

/**
 * A factor over a set of discrete variables, backed by a dense table of natural-log potentials.
 * <p>
 * The value this factor assigns to an assignment is exp(table[assignment]), so {@link #getAssignmentValue(int[])}
 * returns a log value and {@link #getValue(int[])} the potential itself. Products add tables, and sums are taken with
 * log-sum-exp, so products of factors built from large, competing weights never underflow to zero.
 */
public class TableFactor extends NDArrayDoubles {
  public final int[] neighborIndices;

  /**
   * Makes a factor of all ones (log value 0) over the given variables.
   *
   * @param neighborIndices the variables this factor touches, in table order
   * @param dimensions      the number of states of each of those variables
   */
  public TableFactor(int[] neighborIndices, int[] dimensions) {
    super(dimensions);
    assert neighborIndices.length == dimensions.length;
    this.neighborIndices = neighborIndices;
  }

  private TableFactor(int[] neighborIndices, int[] dimensions, double[] values) {
    super(dimensions, values);
    this.neighborIndices = neighborIndices;
  }

  /**
   * @return a factor that assigns 1 to every assignment of the given variables
   */
  public static TableFactor ones(int[] neighborIndices, int[] dimensions) {
    return new TableFactor(neighborIndices, dimensions);
  }

  @Override
  public TableFactor deepCopy() {
    return new TableFactor(neighborIndices.clone(), dimensions.clone(), values.clone());
  }

  /**
   * @return the potential of this assignment, exp of the stored log value. May overflow where the log value does not.
   */
  public double getValue(int[] assignment) {
    return Math.exp(getAssignmentValue(assignment));
  }

  /**
   * @return log of the sum of the potentials of every assignment of this factor
   */
  public double logValueSum() {
    return logSumExp(values);
  }

  /**
   * @param variable a variable index
   * @return the position of that variable in this factor's table, or -1 if it isn't in scope
   */
  public int positionOf(int variable) {
    for (int i = 0; i < neighborIndices.length; i++) {
      if (neighborIndices[i] == variable) return i;
    }
    return -1;
  }

  /**
   * @param scope a set of variables
   * @return whether every variable in scope is a neighbor of this factor
   */
  public boolean contains(int[] scope) {
    for (int v : scope) {
      if (positionOf(v) == -1) return false;
    }
    return true;
  }

  /**
   * Product of two factors. The result's variables are this factor's, followed by any of other's not already here.
   *
   * @param other the factor to multiply with
   * @return a new factor
   */
  public TableFactor multiply(TableFactor other) {
    int[] resultNeighbors = new int[neighborIndices.length + other.neighborIndices.length];
    int[] resultDimensions = new int[resultNeighbors.length];
    System.arraycopy(neighborIndices, 0, resultNeighbors, 0, neighborIndices.length);
    System.arraycopy(dimensions, 0, resultDimensions, 0, dimensions.length);
    int size = neighborIndices.length;

    int[] otherPositions = new int[other.neighborIndices.length];
    for (int i = 0; i < other.neighborIndices.length; i++) {
      int pos = positionOf(other.neighborIndices[i]);
      if (pos == -1) {
        pos = size;
        resultNeighbors[size] = other.neighborIndices[i];
        resultDimensions[size] = other.dimensions[i];
        size++;
      } else if (dimensions[pos] != other.dimensions[i]) {
        throw new IllegalArgumentException("Variable " + other.neighborIndices[i] + " has size " + dimensions[pos] +
            " here, but " + other.dimensions[i] + " in the other factor");
      }
      otherPositions[i] = pos;
    }

    TableFactor result = new TableFactor(Arrays.copyOf(resultNeighbors, size), Arrays.copyOf(resultDimensions, size));

    int[] thisAssignment = new int[neighborIndices.length];
    int[] otherAssignment = new int[other.neighborIndices.length];

    Iterator<int[]> fastPassByReferenceIterator = result.fastPassByReferenceIterator();
    int offset = 0;
    while (fastPassByReferenceIterator.hasNext()) {
      int[] assignment = fastPassByReferenceIterator.next();
      System.arraycopy(assignment, 0, thisAssignment, 0, thisAssignment.length);
      for (int i = 0; i < otherAssignment.length; i++) {
        otherAssignment[i] = assignment[otherPositions[i]];
      }
      result.values[offset++] = getAssignmentValue(thisAssignment) + other.getAssignmentValue(otherAssignment);
    }

    return result;
  }

  /**
   * Sum out a single variable.
   *
   * @param variable the variable to remove
   * @return a factor over the remaining variables
   */
  public TableFactor sumOut(int variable) {
    return eliminate(variable, false);
  }

  /**
   * Max out a single variable, for MAP inference.
   *
   * @param variable the variable to remove
   * @return a factor over the remaining variables
   */
  public TableFactor maxOut(int variable) {
    return eliminate(variable, true);
  }

  /**
   * Sums out every listed variable. Variables not in this factor's scope are ignored.
   *
   * @param varsToEliminate the variables to sum out
   * @return a factor over the variables that remain
   */
  public TableFactor marginalize(int[] varsToEliminate) {
    TableFactor result = this;
    for (int v : varsToEliminate) {
      if (result.positionOf(v) != -1) result = result.sumOut(v);
    }
    return result == this ? deepCopy() : result;
  }

  /**
   * Sums out everything outside of scope, and lays the result out in the order scope lists its variables.
   *
   * @param scope the variables to keep, all of which must be in this factor
   * @return a factor whose neighborIndices equal scope
   */
  public TableFactor marginalizeTo(int[] scope) {
    if (!contains(scope)) {
      throw new IllegalArgumentException("Can't marginalize " + Arrays.toString(neighborIndices) + " down to " +
          Arrays.toString(scope) + ", which isn't a subset");
    }
    int[] toEliminate = new int[neighborIndices.length];
    int numToEliminate = 0;
    for (int n : neighborIndices) {
      boolean keep = false;
      for (int s : scope) {
        if (s == n) {
          keep = true;
          break;
        }
      }
      if (!keep) toEliminate[numToEliminate++] = n;
    }
    return marginalize(Arrays.copyOf(toEliminate, numToEliminate)).reorder(scope);
  }

  /**
   * @param order a permutation of this factor's neighbors
   * @return the same factor, with its table laid out in the given variable order
   */
  public TableFactor reorder(int[] order) {
    assert order.length == neighborIndices.length;
    if (Arrays.equals(order, neighborIndices)) return this;

    int[] sourcePositions = new int[order.length];
    int[] newDimensions = new int[order.length];
    for (int i = 0; i < order.length; i++) {
      sourcePositions[i] = positionOf(order[i]);
      if (sourcePositions[i] == -1) {
        throw new IllegalArgumentException("Variable " + order[i] + " isn't in " + Arrays.toString(neighborIndices));
      }
      newDimensions[i] = dimensions[sourcePositions[i]];
    }

    TableFactor result = new TableFactor(order.clone(), newDimensions);
    int[] sourceAssignment = new int[order.length];
    Iterator<int[]> fastPassByReferenceIterator = result.fastPassByReferenceIterator();
    int offset = 0;
    while (fastPassByReferenceIterator.hasNext()) {
      int[] assignment = fastPassByReferenceIterator.next();
      for (int i = 0; i < assignment.length; i++) {
        sourceAssignment[sourcePositions[i]] = assignment[i];
      }
      result.values[offset++] = getAssignmentValue(sourceAssignment);
    }
    return result;
  }

  /**
   * Rescales the factor so its potentials sum to 1, i.e. into the distribution it is proportional to. A factor whose
   * potentials sum to zero or to infinity has no such distribution, and is returned as a plain copy.
   *
   * @return a new, normalized factor
   */
  public TableFactor normalize() {
    TableFactor result = deepCopy();
    double logSum = logValueSum();
    if (Double.isFinite(logSum)) {
      for (int i = 0; i < result.values.length; i++) {
        result.values[i] -= logSum;
      }
    }
    return result;
  }

  /**
   * Compares potentials rather than their logs, so entries that are both (near) zero count as equal.
   *
   * @param other     the factor to compare with, laid out over the same variables
   * @param tolerance the largest absolute difference allowed between two potentials
   * @return whether the two factors agree on every assignment
   */
  public boolean potentialsEqual(TableFactor other, double tolerance) {
    if (!Arrays.equals(neighborIndices, other.neighborIndices) || !Arrays.equals(dimensions, other.dimensions)) {
      return false;
    }
    for (int i = 0; i < values.length; i++) {
      if (Math.abs(Math.exp(values[i]) - Math.exp(other.values[i])) > tolerance) return false;
    }
    return true;
  }

  /**
   * @return the marginals of every neighbor variable, in the order of neighborIndices, each summing to 1
   */
  public double[][] getSummedMarginals() {
    double[][] results = new double[neighborIndices.length][];
    for (int i = 0; i < results.length; i++) {
      results[i] = new double[dimensions[i]];
    }

    double max = max(values);
    Iterator<int[]> fastPassByReferenceIterator = fastPassByReferenceIterator();
    int offset = 0;
    while (fastPassByReferenceIterator.hasNext()) {
      int[] assignment = fastPassByReferenceIterator.next();
      double logValue = values[offset++];
      double value = max == Double.NEGATIVE_INFINITY ? 0.0 : Math.exp(logValue - max);
      for (int i = 0; i < assignment.length; i++) {
        results[i][assignment[i]] += value;
      }
    }

    for (double[] marginal : results) {
      normalizeInPlace(marginal);
    }
    return results;
  }

  /**
   * @return the max-marginals of every neighbor variable, in the order of neighborIndices, scaled to sum to 1
   */
  public double[][] getMaxedMarginals() {
    double[][] results = new double[neighborIndices.length][];
    for (int i = 0; i < results.length; i++) {
      results[i] = new double[dimensions[i]];
    }

    double max = max(values);
    Iterator<int[]> fastPassByReferenceIterator = fastPassByReferenceIterator();
    int offset = 0;
    while (fastPassByReferenceIterator.hasNext()) {
      int[] assignment = fastPassByReferenceIterator.next();
      double logValue = values[offset++];
      double value = max == Double.NEGATIVE_INFINITY ? 0.0 : Math.exp(logValue - max);
      for (int i = 0; i < assignment.length; i++) {
        if (value > results[i][assignment[i]]) results[i][assignment[i]] = value;
      }
    }

    for (double[] marginal : results) {
      normalizeInPlace(marginal);
    }
    return results;
  }

  /**
   * Finds the highest-valued assignment of this factor that agrees with a partial assignment.
   *
   * @param partialAssignment indexed by variable, with -1 for variables that are free to be chosen
   * @return an assignment in the order of neighborIndices
   */
  public int[] argmaxConsistentWith(int[] partialAssignment) {
    int[] best = null;
    double bestValue = Double.NEGATIVE_INFINITY;

    Iterator<int[]> fastPassByReferenceIterator = fastPassByReferenceIterator();
    int offset = 0;
    outer:
    while (fastPassByReferenceIterator.hasNext()) {
      int[] assignment = fastPassByReferenceIterator.next();
      double value = values[offset++];
      for (int i = 0; i < assignment.length; i++) {
        int fixed = partialAssignment[neighborIndices[i]];
        if (fixed != -1 && fixed != assignment[i]) continue outer;
      }
      if (best == null || value > bestValue) {
        best = assignment.clone();
        bestValue = value;
      }
    }

    if (best == null) {
      throw new IllegalStateException("No assignment of " + Arrays.toString(neighborIndices) +
          " is consistent with the partial assignment");
    }
    return best;
  }

  @Override
  public String toString() {
    return "TableFactor" + Arrays.toString(neighborIndices) + Arrays.toString(dimensions);
  }

  ////////////////////////////////////////////////////////////////////////////
  // PRIVATE IMPLEMENTATION
  ////////////////////////////////////////////////////////////////////////////

  private TableFactor eliminate(int variable, boolean max) {
    int position = positionOf(variable);
    if (position == -1) {
      throw new IllegalArgumentException("Variable " + variable + " isn't in " + Arrays.toString(neighborIndices));
    }

    int[] resultNeighbors = new int[neighborIndices.length - 1];
    int[] resultDimensions = new int[resultNeighbors.length];
    for (int i = 0, j = 0; i < neighborIndices.length; i++) {
      if (i == position) continue;
      resultNeighbors[j] = neighborIndices[i];
      resultDimensions[j] = dimensions[i];
      j++;
    }

    TableFactor result = new TableFactor(resultNeighbors, resultDimensions);
    result.fill(Double.NEGATIVE_INFINITY);

    // Maxing out is done after the first pass. Summing out takes a second pass of exp(value - max) per target.

    int[] targets = new int[values.length];
    int[] reduced = new int[resultNeighbors.length];
    Iterator<int[]> fastPassByReferenceIterator = fastPassByReferenceIterator();
    int offset = 0;
    while (fastPassByReferenceIterator.hasNext()) {
      int[] assignment = fastPassByReferenceIterator.next();
      for (int i = 0, j = 0; i < assignment.length; i++) {
        if (i != position) reduced[j++] = assignment[i];
      }
      int target = result.getTableAccessOffset(reduced);
      targets[offset] = target;
      if (values[offset] > result.values[target]) result.values[target] = values[offset];
      offset++;
    }
    if (max) return result;

    double[] sums = new double[result.values.length];
    for (int i = 0; i < values.length; i++) {
      double targetMax = result.values[targets[i]];
      if (targetMax != Double.NEGATIVE_INFINITY) sums[targets[i]] += Math.exp(values[i] - targetMax);
    }
    for (int t = 0; t < sums.length; t++) {
      if (result.values[t] != Double.NEGATIVE_INFINITY) result.values[t] += Math.log(sums[t]);
    }

    return result;
  }

  private static double max(double[] arr) {
    double max = Double.NEGATIVE_INFINITY;
    for (double d : arr) {
      if (d > max) max = d;
    }
    return max;
  }

  /**
   * @return log(sum(exp(arr))), computed relative to the largest entry so that nothing under- or overflows
   */
  static double logSumExp(double[] arr) {
    double max = max(arr);
    if (max == Double.NEGATIVE_INFINITY || max == Double.POSITIVE_INFINITY) return max;
    double sum = 0.0;
    for (double d : arr) sum += Math.exp(d - max);
    return max + Math.log(sum);
  }

  private static void normalizeInPlace(double[] arr) {
    double sum = 0.0;
    for (double d : arr) sum += d;
    if (sum == 0.0) {
      // An all-zero table has no distribution to speak of, so we fall back to uniform
      Arrays.fill(arr, 1.0 / arr.length);
      return;
    }
    for (int i = 0; i < arr.length; i++) arr[i] /= sum;
  }
}
