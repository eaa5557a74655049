package com.signal.anomaly.engine.isolationforest;

/**
 * Node of a one-dimensional isolation tree. Internal nodes split on a value;
 * external (leaf) nodes remember how many training samples reached them.
 */
public class IsolationNode {

    private double splitValue;
    private IsolationNode left;
    private IsolationNode right;
    private int size; // samples that reached this leaf
    private boolean external;

    private IsolationNode() {}

    public static IsolationNode internalNode(double splitValue, IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        node.external = false;
        return node;
    }

    public static IsolationNode externalNode(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        node.external = true;
        return node;
    }

    public double pathLength(double value, int currentDepth) {
        if (external) {
            return currentDepth + averagePathLength(size);
        }
        if (value < splitValue) {
            return left.pathLength(value, currentDepth + 1);
        } else {
            return right.pathLength(value, currentDepth + 1);
        }
    }

    /**
     * Average path length of unsuccessful search in a BST (Equation 1 from the IF paper).
     * c(n) = 2H(n-1) - 2(n-1)/n where H(i) = ln(i) + Euler's constant (0.5772...)
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + 0.5772156649;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    public double getSplitValue() { return splitValue; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
    public boolean isExternal() { return external; }
}
