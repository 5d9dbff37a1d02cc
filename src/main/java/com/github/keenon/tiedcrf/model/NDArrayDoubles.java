package com.github.keenon.tiedcrf.model;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Holds and provides access to an N-dimensional array of doubles.
 * <p>
 * Assignments are linearized mixed-radix, with the first dimension the most significant. Every table in the project
 * (factors, clique potentials, marginals) shares this convention, which is what lets {@link #assignmentToIndex} be
 * used interchangeably with {@link #getAssignmentValue}.
 */
public class NDArrayDoubles implements Iterable<int[]> {
  protected int[] dimensions;

  // OPTIMIZATION:
  // left protected so that TableFactor can run its products and sums directly over the flat table
  protected double[] values;

  /**
   * Constructor takes the sizes of each dimension. These must not change after construction.
   *
   * @param dimensions list of neighbor variables assignment range sizes
   */
  public NDArrayDoubles(int[] dimensions) {
    for (int size : dimensions) {
      assert (size > 0);
    }
    this.dimensions = dimensions;
    values = new double[combinatorialNeighborStatesCount()];
  }

  protected NDArrayDoubles(int[] dimensions, double[] values) {
    assert values.length == countStates(dimensions);
    this.dimensions = dimensions;
    this.values = values;
  }

  /**
   * Copy this array.
   */
  public NDArrayDoubles deepCopy() {
    return new NDArrayDoubles(dimensions.clone(), values.clone());
  }

  /**
   * Set a single value in the table.
   *
   * @param assignment a list of variable settings, in the same order as the dimensions
   * @param value      the value to put into the table
   */
  public void setAssignmentValue(int[] assignment, double value) {
    assert !Double.isNaN(value);
    values[getTableAccessOffset(assignment)] = value;
  }

  /**
   * Retrieve a single value for an assignment.
   *
   * @param assignment a list of variable settings, in the same order as the dimensions
   * @return the value for the given assignment
   */
  public double getAssignmentValue(int[] assignment) {
    return values[getTableAccessOffset(assignment)];
  }

  /**
   * @return the size array, passed by value to ensure immutability.
   */
  public int[] getDimensions() {
    return dimensions.clone();
  }

  /**
   * Fills every entry of the table with the same value.
   */
  public void fill(double value) {
    assert !Double.isNaN(value);
    Arrays.fill(values, value);
  }

  /**
   * @return the sum of every entry of the table
   */
  public double valueSum() {
    double sum = 0.0;
    for (double v : values) sum += v;
    return sum;
  }

  /**
   * WARNING: This is pass by value, and so creates an int[] per step. Use fastPassByReferenceIterator() in hot loops.
   *
   * @return an iterator over all possible assignments to this table
   */
  @Override
  public Iterator<int[]> iterator() {
    return new Iterator<int[]>() {
      Iterator<int[]> unsafe = fastPassByReferenceIterator();

      @Override
      public boolean hasNext() {
        return unsafe.hasNext();
      }

      @Override
      public int[] next() {
        return unsafe.next().clone();
      }
    };
  }

  /**
   * Iterates assignments in table order, so the k-th assignment returned lives at offset k. The returned array is
   * mutated in place on every call to next(), so you must clone if you want to keep a copy.
   *
   * @return an iterator that will mutate the value it returns to you
   */
  public Iterator<int[]> fastPassByReferenceIterator() {
    final int[] assignments = new int[dimensions.length];
    final int total = values.length;

    return new Iterator<int[]>() {
      int returned = 0;

      @Override
      public boolean hasNext() {
        return returned < total;
      }

      @Override
      public int[] next() {
        if (returned >= total) throw new NoSuchElementException();
        if (returned > 0) {
          // Add one to the last (least significant) position, and carry toward the front
          for (int i = assignments.length - 1; i >= 0; i--) {
            assignments[i]++;
            if (assignments[i] < dimensions[i]) break;
            assignments[i] = 0;
          }
        }
        returned++;
        return assignments;
      }
    };
  }

  /**
   * Does a deep comparison, using equality with tolerance checks against the table of values.
   *
   * @param other     the table to compare to
   * @param tolerance the tolerance to accept in differences
   * @return whether the two tables are within tolerance of one another
   */
  public boolean valueEquals(NDArrayDoubles other, double tolerance) {
    if (!Arrays.equals(dimensions, other.dimensions)) return false;
    for (int i = 0; i < values.length; i++) {
      if (Math.abs(values[i] - other.values[i]) > tolerance) return false;
    }
    return true;
  }

  /**
   * @return the total number of states this table must represent to include all dimensions.
   */
  public int combinatorialNeighborStatesCount() {
    return countStates(dimensions);
  }

  /**
   * Compute the offset into a flat table for an assignment, under the mixed-radix convention every table here uses.
   *
   * @param assignment   assignment indices, zero based, one per dimension
   * @param cardinalities the size of each dimension
   * @return the offset index
   */
  public static int assignmentToIndex(int[] assignment, int[] cardinalities) {
    if (assignment.length != cardinalities.length) {
      throw new IllegalArgumentException("Assignment of length " + assignment.length + " doesn't match " +
          cardinalities.length + " dimensions");
    }
    int offset = 0;
    for (int i = 0; i < assignment.length; i++) {
      if (assignment[i] < 0 || assignment[i] >= cardinalities[i]) {
        throw new IllegalArgumentException("Assignment " + Arrays.toString(assignment) +
            " is out of bounds for dimensions " + Arrays.toString(cardinalities));
      }
      offset = (offset * cardinalities[i]) + assignment[i];
    }
    return offset;
  }

  /**
   * Inverse of {@link #assignmentToIndex(int[], int[])}.
   *
   * @param index         the flat table offset
   * @param cardinalities the size of each dimension
   * @return the assignment stored at that offset
   */
  public static int[] indexToAssignment(int index, int[] cardinalities) {
    if (index < 0 || index >= countStates(cardinalities)) {
      throw new IllegalArgumentException("Index " + index + " is out of bounds for dimensions " +
          Arrays.toString(cardinalities));
    }
    int[] assignment = new int[cardinalities.length];
    for (int i = cardinalities.length - 1; i >= 0; i--) {
      assignment[i] = index % cardinalities[i];
      index /= cardinalities[i];
    }
    return assignment;
  }

  ////////////////////////////////////////////////////////////////////////////
  // PRIVATE IMPLEMENTATION
  ////////////////////////////////////////////////////////////////////////////

  static int countStates(int[] dimensions) {
    int c = 1;
    for (int n : dimensions) {
      c *= n;
    }
    return c;
  }

  /**
   * Compute the distance into the one dimensional table array that corresponds to an assignment.
   *
   * @param assignment assignment indices, in same order as dimensions array
   * @return the offset index
   */
  protected int getTableAccessOffset(int[] assignment) {
    assert (assignment.length == dimensions.length);
    int offset = 0;
    for (int i = 0; i < assignment.length; i++) {
      assert (assignment[i] >= 0 && assignment[i] < dimensions[i]);
      offset = (offset * dimensions[i]) + assignment[i];
    }
    return offset;
  }
}
