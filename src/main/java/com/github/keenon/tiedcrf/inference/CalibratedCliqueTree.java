package com.github.keenon.tiedcrf.inference;

import com.carrotsearch.hppc.IntArrayList;
import com.github.keenon.tiedcrf.model.TableFactor;

import java.util.Arrays;

/**
 * The result of calibrating a {@link CliqueTree}: one belief per clique, each proportional to the marginal of the
 * model over that clique's variables, and the log partition function.
 * <p>
 * Only meant to live for the duration of a single likelihood evaluation.
 */
public class CalibratedCliqueTree {
    final TableFactor[] beliefs;
    final int[][] neighbors;
    final int[] visitedOrder;
    private final double logPartitionFunction;

    CalibratedCliqueTree(TableFactor[] beliefs, int[][] neighbors, int[] visitedOrder, double logPartitionFunction) {
        this.beliefs = beliefs;
        this.neighbors = neighbors;
        this.visitedOrder = visitedOrder;
        this.logPartitionFunction = logPartitionFunction;
    }

    /**
     * @return log of the sum, over every joint assignment, of the product of the original factors
     */
    public double getLogPartitionFunction() {
        return logPartitionFunction;
    }

    public int numCliques() {
        return beliefs.length;
    }

    /**
     * @return the calibrated belief of clique i, by reference
     */
    public TableFactor getBelief(int i) {
        return beliefs[i];
    }

    /**
     * Finds a clique whose variables include all of scope, preferring the smallest such clique.
     *
     * @param scope the variables to cover
     * @return the index of the covering clique, or -1 if there isn't one
     */
    public int findCoveringClique(int[] scope) {
        int best = -1;
        for (int i = 0; i < beliefs.length; i++) {
            if (beliefs[i].contains(scope) &&
                    (best == -1 || beliefs[i].neighborIndices.length < beliefs[best].neighborIndices.length)) {
                best = i;
            }
        }
        return best;
    }

    /**
     * @return every clique whose variables include all of scope, in clique order
     */
    public IntArrayList findCoveringCliques(int[] scope) {
        IntArrayList result = new IntArrayList();
        for (int i = 0; i < beliefs.length; i++) {
            if (beliefs[i].contains(scope)) result.add(i);
        }
        return result;
    }

    /**
     * Computes P(scope) by marginalizing a clique's belief down to scope and normalizing.
     *
     * @param clique the clique to read from, which must cover scope
     * @param scope  the variables of the marginal, in the order the result should use
     * @return a distribution over scope that sums to 1
     */
    public TableFactor getMarginal(int clique, int[] scope) {
        return beliefs[clique].marginalizeTo(scope).normalize();
    }

    /**
     * Checks that every pair of adjacent cliques agrees on the distribution over the variables they share. This is what
     * calibration is supposed to guarantee, and what lets any covering clique stand in for any other.
     *
     * @param tolerance the largest absolute difference allowed between the two sepset marginals
     * @return whether every edge of the tree is calibrated
     */
    public boolean isCalibrated(double tolerance) {
        for (int i = 0; i < beliefs.length; i++) {
            for (int j : neighbors[i]) {
                if (j < i) continue;
                int[] sepset = sepset(beliefs[i], beliefs[j]);
                TableFactor fromI = getMarginal(i, sepset);
                TableFactor fromJ = getMarginal(j, sepset);
                if (!fromI.potentialsEqual(fromJ, tolerance)) return false;
            }
        }
        return true;
    }

    private static int[] sepset(TableFactor a, TableFactor b) {
        int[] shared = new int[a.neighborIndices.length];
        int numShared = 0;
        for (int v : a.neighborIndices) {
            if (b.positionOf(v) != -1) shared[numShared++] = v;
        }
        return Arrays.copyOf(shared, numShared);
    }
}
