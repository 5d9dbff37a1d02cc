package com.github.keenon.tiedcrf.inference;

import com.carrotsearch.hppc.IntIntHashMap;
import com.carrotsearch.hppc.IntIntMap;
import com.github.keenon.tiedcrf.model.TableFactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A clique tree (junction tree) over a list of table factors, built by variable elimination, and the message passing
 * that calibrates it.
 * <p>
 * This is built fresh for every set of factors, and holds nothing across calls: factors change every time the weights
 * do, so there's nothing worth cacheing. Models whose variables fall into disconnected groups get one tree per group,
 * and the partition function multiplies across them.
 */
public class CliqueTree {
    /**
     * An SLF4J Logger for this class.
     */
    private static final Logger log = LoggerFactory.getLogger(CliqueTree.class);

    final int[][] cliqueScopes;
    final int[][] cliqueDimensions;
    final int[][] neighbors;
    final TableFactor[] potentials;
    final int[] factorToClique;
    final int numVariables;

    private CliqueTree(int[][] cliqueScopes, int[][] cliqueDimensions, int[][] neighbors, TableFactor[] potentials,
                       int[] factorToClique, int numVariables) {
        this.cliqueScopes = cliqueScopes;
        this.cliqueDimensions = cliqueDimensions;
        this.neighbors = neighbors;
        this.potentials = potentials;
        this.factorToClique = factorToClique;
        this.numVariables = numVariables;
    }

    /**
     * Builds a clique tree whose cliques cover every factor's scope and satisfy the running intersection property.
     * <p>
     * Variables are eliminated greedily, fewest remaining neighbors first (lowest index breaks ties). Each elimination
     * produces a clique over the variable and its neighbors, linked to the clique of whichever of those neighbors is
     * eliminated next. Cliques contained in a neighbor are then folded into that neighbor. Each factor is multiplied
     * into the smallest clique that contains its scope.
     *
     * @param factors the factors of the model, which are not modified
     * @return an uncalibrated clique tree
     */
    public static CliqueTree build(List<TableFactor> factors) {
        // Collect variable sizes, and the interaction graph between variables

        IntIntMap cardinalities = new IntIntHashMap();
        TreeMap<Integer, TreeSet<Integer>> graph = new TreeMap<>();
        int numVariables = 0;

        for (TableFactor f : factors) {
            int[] dims = f.getDimensions();
            for (int i = 0; i < f.neighborIndices.length; i++) {
                int v = f.neighborIndices[i];
                if (cardinalities.containsKey(v) && cardinalities.get(v) != dims[i]) {
                    throw new IllegalArgumentException("Variable " + v + " has size " + cardinalities.get(v) +
                            " in one factor, and " + dims[i] + " in another");
                }
                cardinalities.put(v, dims[i]);
                if (v + 1 > numVariables) numVariables = v + 1;
                graph.computeIfAbsent(v, k -> new TreeSet<>());
            }
            for (int a : f.neighborIndices) {
                for (int b : f.neighborIndices) {
                    if (a != b) graph.get(a).add(b);
                }
            }
        }

        // Variable elimination, recording one clique per eliminated variable

        List<int[]> scopes = new ArrayList<>();
        List<Integer> eliminated = new ArrayList<>();
        List<TreeSet<Integer>> separators = new ArrayList<>();
        int[] eliminatedAt = new int[numVariables];
        Arrays.fill(eliminatedAt, -1);

        while (!graph.isEmpty()) {
            int best = -1;
            for (Map.Entry<Integer, TreeSet<Integer>> entry : graph.entrySet()) {
                if (best == -1 || entry.getValue().size() < graph.get(best).size()) best = entry.getKey();
            }

            TreeSet<Integer> remaining = graph.remove(best);
            TreeSet<Integer> scope = new TreeSet<>(remaining);
            scope.add(best);

            for (int a : remaining) {
                TreeSet<Integer> adjacent = graph.get(a);
                adjacent.remove(best);
                for (int b : remaining) {
                    if (a != b) adjacent.add(b);
                }
            }

            eliminatedAt[best] = scopes.size();
            scopes.add(toArray(scope));
            eliminated.add(best);
            separators.add(remaining);
        }

        // Link each clique to the clique of the next variable to go out of its separator

        int numCliques = scopes.size();
        List<TreeSet<Integer>> adjacency = new ArrayList<>();
        for (int i = 0; i < numCliques; i++) adjacency.add(new TreeSet<>());
        for (int i = 0; i < numCliques; i++) {
            int parent = -1;
            for (int v : separators.get(i)) {
                if (parent == -1 || eliminatedAt[v] < parent) parent = eliminatedAt[v];
            }
            if (parent != -1) {
                assert parent > i;
                adjacency.get(i).add(parent);
                adjacency.get(parent).add(i);
            }
        }

        // Fold away non-maximal cliques. Running intersection guarantees a non-maximal clique is contained in a neighbor.

        boolean[] removed = new boolean[numCliques];
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < numCliques; i++) {
                if (removed[i]) continue;
                for (int j : adjacency.get(i)) {
                    if (isSubset(scopes.get(i), scopes.get(j))) {
                        for (int k : adjacency.get(i)) {
                            if (k == j) continue;
                            adjacency.get(k).remove(i);
                            adjacency.get(k).add(j);
                            adjacency.get(j).add(k);
                        }
                        adjacency.get(j).remove(i);
                        adjacency.get(i).clear();
                        removed[i] = true;
                        changed = true;
                        break;
                    }
                }
            }
        }

        // Compact what's left

        int[] newIndex = new int[numCliques];
        int numKept = 0;
        for (int i = 0; i < numCliques; i++) {
            newIndex[i] = removed[i] ? -1 : numKept++;
        }

        int[][] cliqueScopes = new int[numKept][];
        int[][] cliqueDimensions = new int[numKept][];
        int[][] neighbors = new int[numKept][];
        for (int i = 0; i < numCliques; i++) {
            if (removed[i]) continue;
            int c = newIndex[i];
            cliqueScopes[c] = scopes.get(i);
            cliqueDimensions[c] = new int[cliqueScopes[c].length];
            for (int k = 0; k < cliqueScopes[c].length; k++) {
                cliqueDimensions[c][k] = cardinalities.get(cliqueScopes[c][k]);
            }
            neighbors[c] = new int[adjacency.get(i).size()];
            int k = 0;
            for (int j : adjacency.get(i)) {
                assert !removed[j];
                neighbors[c][k++] = newIndex[j];
            }
        }

        // Assign each factor to the smallest clique containing it, and multiply out the initial potentials

        TableFactor[] potentials = new TableFactor[numKept];
        for (int c = 0; c < numKept; c++) {
            potentials[c] = TableFactor.ones(cliqueScopes[c], cliqueDimensions[c]);
        }

        int[] factorToClique = new int[factors.size()];
        for (int f = 0; f < factors.size(); f++) {
            TableFactor factor = factors.get(f);
            int owner = -1;
            for (int c = 0; c < numKept; c++) {
                if (isSubset(factor.neighborIndices, cliqueScopes[c]) &&
                        (owner == -1 || cliqueScopes[c].length < cliqueScopes[owner].length)) {
                    owner = c;
                }
            }
            if (owner == -1) {
                throw new IllegalStateException("Clique tree construction left factor " + factor + " without a clique");
            }
            factorToClique[f] = owner;
            potentials[owner] = potentials[owner].multiply(factor);
        }

        if (log.isDebugEnabled()) {
            int maxWidth = 0;
            for (int[] s : cliqueScopes) maxWidth = Math.max(maxWidth, s.length);
            log.debug("Built clique tree with " + numKept + " cliques (max width " + maxWidth + ") from " +
                    factors.size() + " factors over " + cardinalities.size() + " variables");
        }

        CliqueTree tree = new CliqueTree(cliqueScopes, cliqueDimensions, neighbors, potentials, factorToClique, numVariables);
        assert tree.satisfiesRunningIntersection();
        return tree;
    }

    /**
     * Runs sum-product message passing until every clique holds its calibrated belief.
     *
     * @return the calibrated beliefs, and the log partition function of the model
     */
    public CalibratedCliqueTree calibrate() {
        return messagePassing(MarginalizationMethod.SUM);
    }

    /**
     * Runs max-product message passing, then decodes the most likely joint assignment by walking each tree from its
     * root, choosing each clique's best assignment consistent with what's already been fixed.
     *
     * @return an array, indexed by variable, of the MAP assignment. Variables that appear in no factor get -1.
     */
    public int[] calculateMAP() {
        CalibratedCliqueTree maxCalibrated = messagePassing(MarginalizationMethod.MAX);

        int[] result = new int[numVariables];
        Arrays.fill(result, -1);

        for (int c : maxCalibrated.visitedOrder) {
            TableFactor belief = maxCalibrated.beliefs[c];
            int[] best = belief.argmaxConsistentWith(result);
            for (int i = 0; i < best.length; i++) {
                result[belief.neighborIndices[i]] = best[i];
            }
        }

        return result;
    }

    /**
     * @return the number of cliques in the tree
     */
    public int numCliques() {
        return cliqueScopes.length;
    }

    /**
     * @return the variables of clique i, in increasing order. Passed by value.
     */
    public int[] getCliqueScope(int i) {
        return cliqueScopes[i].clone();
    }

    /**
     * @return the cliques adjacent to clique i. Passed by value.
     */
    public int[] getNeighbors(int i) {
        return neighbors[i].clone();
    }

    /**
     * @return the clique that the factor at this index (in the list the tree was built from) was multiplied into
     */
    public int getCliqueForFactor(int factorIndex) {
        return factorToClique[factorIndex];
    }

    /**
     * Checks that for every variable, the cliques containing it form a connected subtree.
     *
     * @return whether running intersection holds
     */
    public boolean satisfiesRunningIntersection() {
        for (int v = 0; v < numVariables; v++) {
            int start = -1;
            int containing = 0;
            for (int c = 0; c < cliqueScopes.length; c++) {
                if (Arrays.binarySearch(cliqueScopes[c], v) >= 0) {
                    containing++;
                    if (start == -1) start = c;
                }
            }
            if (containing == 0) continue;

            // Walk only through cliques containing v, and make sure we reach them all
            boolean[] seen = new boolean[cliqueScopes.length];
            Deque<Integer> toVisit = new ArrayDeque<>();
            toVisit.add(start);
            seen[start] = true;
            int reached = 0;
            while (!toVisit.isEmpty()) {
                int cursor = toVisit.poll();
                reached++;
                for (int n : neighbors[cursor]) {
                    if (!seen[n] && Arrays.binarySearch(cliqueScopes[n], v) >= 0) {
                        seen[n] = true;
                        toVisit.add(n);
                    }
                }
            }
            if (reached != containing) return false;
        }
        return true;
    }

    ////////////////////////////////////////////////////////////////////////////
    // PRIVATE IMPLEMENTATION
    ////////////////////////////////////////////////////////////////////////////

    private enum MarginalizationMethod {
        SUM,
        MAX
    }

    /**
     * Does tree shaped message passing. The algorithm calls for first passing up from the leaves to the root, then
     * passing back down to the leaves. Factors hold log potentials, so messages are left unnormalized: every belief then
     * sums to the partition function of its tree.
     *
     * @param marginalize the method for marginalization, controls MAP or marginals
     * @return the calibrated cliques
     */
    private CalibratedCliqueTree messagePassing(MarginalizationMethod marginalize) {
        int numCliques = cliqueScopes.length;

        // Indexed by (start-clique, end-clique), this array will remain mostly null in most graphs

        TableFactor[][] messages = new TableFactor[numCliques][numCliques];

        // Forward pass, record a BFS forest pattern that we can use for message passing

        boolean[] visited = new boolean[numCliques];
        int numVisited = 0;
        int[] visitedOrder = new int[numCliques];
        int[] parent = new int[numCliques];
        Arrays.fill(parent, -1);
        int[] trees = new int[numCliques];
        int treeIndex = -1;

        while (numVisited < numCliques) {
            treeIndex++;

            // Pick the largest clique remaining as the root for message passing

            int root = -1;
            for (int i = 0; i < numCliques; i++) {
                if (!visited[i] && (root == -1 || cliqueScopes[i].length > cliqueScopes[root].length)) {
                    root = i;
                }
            }
            assert (root != -1);

            Queue<Integer> toVisit = new ArrayDeque<>();
            toVisit.add(root);
            visited[root] = true;

            while (!toVisit.isEmpty()) {
                int cursor = toVisit.poll();
                trees[cursor] = treeIndex;
                visitedOrder[numVisited] = cursor;
                numVisited++;

                for (int n : neighbors[cursor]) {
                    if (n == parent[cursor]) continue;
                    if (visited[n]) {
                        throw new IllegalStateException("Clique " + n + " is reachable by two paths, so the cliques " +
                                "don't form a tree");
                    }
                    visited[n] = true;
                    parent[n] = cursor;
                    toVisit.add(n);
                }
            }
        }

        // Backward pass, run the visited list in reverse

        for (int i = numVisited - 1; i >= 0; i--) {
            int cursor = visitedOrder[i];
            if (parent[cursor] == -1) continue;

            TableFactor message = potentials[cursor];
            for (int k : neighbors[cursor]) {
                if (k == parent[cursor]) continue;
                message = message.multiply(messages[k][cursor]);
            }

            messages[cursor][parent[cursor]] = marginalizeMessage(message, cliqueScopes[parent[cursor]], marginalize);
        }

        // Forward pass, run the visited list forward

        for (int i = 0; i < numVisited; i++) {
            int cursor = visitedOrder[i];
            for (int j : neighbors[cursor]) {
                if (parent[j] != cursor) continue;

                TableFactor message = potentials[cursor];
                for (int k : neighbors[cursor]) {
                    if (k == j) continue;
                    message = message.multiply(messages[k][cursor]);
                }

                messages[cursor][j] = marginalizeMessage(message, cliqueScopes[j], marginalize);
            }
        }

        // Calculate the converged beliefs, reordered to the clique's own variable order

        TableFactor[] beliefs = new TableFactor[numCliques];
        for (int i = 0; i < numCliques; i++) {
            TableFactor belief = potentials[i];
            for (int j : neighbors[i]) {
                belief = belief.multiply(messages[j][i]);
            }
            beliefs[i] = belief.reorder(cliqueScopes[i]);
        }

        // The partition function needs one contribution per tree in our forest

        double logPartitionFunction = 0.0;
        if (marginalize == MarginalizationMethod.SUM) {
            boolean[] partitionIncludesTrees = new boolean[treeIndex + 1];
            double[] treeLogPartitionFunctions = new double[treeIndex + 1];

            for (int i = 0; i < numCliques; i++) {
                double logValueSum = beliefs[i].logValueSum();
                if (!partitionIncludesTrees[trees[i]]) {
                    partitionIncludesTrees[trees[i]] = true;
                    treeLogPartitionFunctions[trees[i]] = logValueSum;
                    logPartitionFunction += logValueSum;
                } else if (assertsEnabled()) {
                    // This is all just an elaborate assert: every clique in a tree should agree on the partition function
                    if (Double.isFinite(logValueSum) &&
                            Math.abs(treeLogPartitionFunctions[trees[i]] - logValueSum) >= 1.0e-6 * Math.max(1.0, Math.abs(logValueSum))) {
                        log.error("Different log partition functions for tree " + trees[i] + ": " +
                                treeLogPartitionFunctions[trees[i]] + " vs " + logValueSum + " at clique " + i);
                    }
                    assert (Math.abs(treeLogPartitionFunctions[trees[i]] - logValueSum) < 1.0e-6 * Math.max(1.0, Math.abs(logValueSum)));
                }
            }

            if (Double.isInfinite(logPartitionFunction) && logPartitionFunction < 0) {
                log.warn("Partition function is zero: every joint assignment has zero potential");
            }
            log.debug("Calibrated " + numCliques + " cliques in " + (treeIndex + 1) + " trees, logZ=" + logPartitionFunction);
        }

        return new CalibratedCliqueTree(beliefs, neighbors, visitedOrder, logPartitionFunction);
    }

    /**
     * This is a key step in message passing. When we are calculating a message, we want to marginalize out all variables
     * not relevant to the recipient of the message. This function does that.
     *
     * @param message     the message to marginalize
     * @param relevant    the variables that are relevant
     * @param marginalize whether to use sum of max marginalization, for marginal or MAP inference
     * @return the marginalized message
     */
    private TableFactor marginalizeMessage(TableFactor message, int[] relevant, MarginalizationMethod marginalize) {
        TableFactor result = message;

        for (int i : message.neighborIndices) {
            boolean contains = false;
            for (int j : relevant) {
                if (i == j) {
                    contains = true;
                    break;
                }
            }
            if (!contains) {
                switch (marginalize) {
                    case SUM:
                        result = result.sumOut(i);
                        break;
                    case MAX:
                        result = result.maxOut(i);
                        break;
                }
            }
        }

        return result;
    }

    private static boolean isSubset(int[] small, int[] large) {
        for (int s : small) {
            boolean found = false;
            for (int l : large) {
                if (s == l) {
                    found = true;
                    break;
                }
            }
            if (!found) return false;
        }
        return true;
    }

    private static int[] toArray(Collection<Integer> collection) {
        int[] arr = new int[collection.size()];
        int i = 0;
        for (int v : collection) arr[i++] = v;
        return arr;
    }

    @SuppressWarnings("*")
    static boolean assertsEnabled() {
        boolean assertsEnabled = false;
        assert (assertsEnabled = true); // intentional side effect
        return assertsEnabled;
    }
}
