package com.wurgobes.sparsemedian;

// One distinct sample value of an OrderStatisticHistogram.
// left and right own their subtrees, parent is only a back reference for walking upwards.
final class HistogramNode {

    final int key; // Sample value, compared unsigned
    int count; // Occurrences of key itself, always > 0 while in the tree
    int subtreeCount; // Occurrences of all keys in the subtree rooted here

    HistogramNode parent;
    HistogramNode left;
    HistogramNode right;

    HistogramNode(int key, int count, HistogramNode parent) {
        this.key = key;
        this.count = count;
        // Deliberately not equal to count, so the first recompute always reports a change
        this.subtreeCount = 0;
        this.parent = parent;
    }

    static int subtreeCount(HistogramNode n) {
        return n == null ? 0 : n.subtreeCount;
    }

    // Recompute subtreeCount from the children, returns true if it changed
    boolean recompute() {
        final int old = subtreeCount;
        subtreeCount = count + subtreeCount(left) + subtreeCount(right);
        return old != subtreeCount;
    }

    // Leftmost node of the subtree rooted at n
    static HistogramNode minimum(HistogramNode n) {
        while (n.left != null) {
            n = n.left;
        }
        return n;
    }
}
