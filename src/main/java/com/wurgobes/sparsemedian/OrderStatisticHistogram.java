package com.wurgobes.sparsemedian;
/* Sparse histogram for median finding
(c) Hohlbein Lab, Wageningen University

Dynamic histogram stored as an augmented binary search tree.
Every node holds a (key, count) pair: there are count occurrences of key in the histogram.
Each node additionally records the number of occurrences in the subtree rooted at it,
which allows finding the median by descending the tree once.

The tree is NOT balanced. With the insert/delete pattern of a sliding window over noisy data
the height stays logarithmic on average, so:
 - insert  O(log n) on average
 - delete  O(log n) on average
 - median  O(log n) on average
where n is the number of distinct values in the histogram.

Keys are treated as unsigned 32 bit values, so 8, 16 and 32 bit samples can share one implementation.
A single instance is not thread safe; give every thread its own.

This software is released under the GPL v3. You may copy, distribute and modify
the software as long as you track changes/dates in source files. Any
modifications to or software including (via compiler) GPL-licensed code
must also be made available under the GPL along with build & install instructions.
https://www.gnu.org/licenses/gpl-3.0.en.html
 */

import java.util.ArrayDeque;
import java.util.Deque;

import org.apache.commons.lang3.Validate;

import static com.wurgobes.sparsemedian.HistogramNode.subtreeCount;


public class OrderStatisticHistogram {

    // Receives the (key, count) pairs of a histogram
    public interface EntryVisitor {
        void visit(int key, int count);
    }

    private HistogramNode root;
    private int distinctKeys; // Amount of nodes in the tree

    public OrderStatisticHistogram() {
    }

    // Add c >= 0 occurrences of key
    public void insert(final int key, final int c) {
        if (c < 0) throw new IllegalArgumentException("Cannot insert a negative amount (" + c + ") of " + Integer.toUnsignedString(key));
        if (c == 0) return;

        if (root == null) {
            root = new HistogramNode(key, c, null);
            distinctKeys++;
            repair(root);
            return;
        }

        HistogramNode n = root;
        while (true) {
            final int cmp = Integer.compareUnsigned(key, n.key);
            if (cmp == 0) {
                n.count += c;
                break;
            } else if (cmp < 0) {
                if (n.left == null) {
                    n.left = new HistogramNode(key, c, n);
                    n = n.left;
                    distinctKeys++;
                    break;
                }
                n = n.left;
            } else {
                if (n.right == null) {
                    n.right = new HistogramNode(key, c, n);
                    n = n.right;
                    distinctKeys++;
                    break;
                }
                n = n.right;
            }
        }
        repair(n);
    }

    // Remove c >= 0 occurrences of key, at least c of them must be present
    public void delete(final int key, final int c) {
        if (c < 0) throw new IllegalArgumentException("Cannot delete a negative amount (" + c + ") of " + Integer.toUnsignedString(key));

        final HistogramNode n = lookup(key);
        final int available = n == null ? 0 : n.count;
        if (available < c) throw new HistogramUnderflowException(key, c, available);
        if (c == 0) return;

        n.count -= c;
        if (n.count > 0) {
            repair(n);
            return;
        }

        // The node is gone, splice it out of the tree
        // updateFrom is the lowest node whose subtree changed
        HistogramNode updateFrom;
        if (n.left == null) {
            updateFrom = n.parent;
            transplant(n, n.right);
        } else if (n.right == null) {
            updateFrom = n.parent;
            transplant(n, n.left);
        } else {
            final HistogramNode successor = HistogramNode.minimum(n.right);
            updateFrom = successor;
            if (successor.parent != n) {
                updateFrom = successor.parent;
                transplant(successor, successor.right);
                successor.right = n.right;
                successor.right.parent = successor;
            }
            transplant(n, successor);
            successor.left = n.left;
            successor.left.parent = successor;
        }
        n.parent = n.left = n.right = null;
        distinctKeys--;

        repair(updateFrom);
    }

    // Number of occurrences of key, 0 if absent
    public int get(final int key) {
        final HistogramNode n = lookup(key);
        return n == null ? 0 : n.count;
    }

    public boolean isEmpty() {
        return root == null || root.subtreeCount == 0;
    }

    // Total amount of occurrences
    public int size() {
        return subtreeCount(root);
    }

    public int distinctKeys() {
        return distinctKeys;
    }

    // Dropping the root releases every node at once
    public void clear() {
        root = null;
        distinctKeys = 0;
    }

    // Value at position size()/2 of the sorted sequence of all occurrences.
    // For even sizes this is the upper of the two middle values.
    public int median() {
        if (isEmpty()) throw new IllegalStateException("Cannot compute the median of an empty histogram");
        return descend(root.subtreeCount / 2);
    }

    // Value at the 0-indexed rank of the sorted sequence of all occurrences
    public int select(final int rank) {
        Validate.validState(!isEmpty(), "Cannot select from an empty histogram");
        Validate.isTrue(rank >= 0 && rank < root.subtreeCount, "Rank %d outside of [0, %d)", rank, root.subtreeCount);
        return descend(rank);
    }

    // Walk down keeping target relative to the current subtree
    private int descend(int target) {
        HistogramNode n = root;
        while (true) {
            final int leftCount = subtreeCount(n.left);
            if (leftCount > target) {
                n = n.left;
            } else if (target < leftCount + n.count) {
                return n.key;
            } else {
                target -= leftCount + n.count;
                n = n.right;
            }
        }
    }

    // Visit every (key, count) pair, parents before children
    public void forEachEntry(final EntryVisitor visitor) {
        if (root == null) return;
        final Deque<HistogramNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final HistogramNode n = stack.pop();
            visitor.visit(n.key, n.count);
            if (n.right != null) stack.push(n.right);
            if (n.left != null) stack.push(n.left);
        }
    }

    // Lists all entries in ascending order
    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        final Deque<HistogramNode> stack = new ArrayDeque<>();
        HistogramNode n = root;
        while (n != null || !stack.isEmpty()) {
            while (n != null) {
                stack.push(n);
                n = n.left;
            }
            n = stack.pop();
            sb.append("val = ").append(Integer.toUnsignedString(n.key)).append(" count = ").append(n.count).append('\n');
            n = n.right;
        }
        return sb.toString();
    }

    // The tree lying on its side, right subtree on top, as key[count,subtreeCount]
    public String toTreeString() {
        final StringBuilder sb = new StringBuilder();
        final Deque<HistogramNode> nodes = new ArrayDeque<>();
        final Deque<Integer> depths = new ArrayDeque<>();
        HistogramNode n = root;
        int depth = 0;
        while (n != null || !nodes.isEmpty()) {
            while (n != null) {
                nodes.push(n);
                depths.push(depth++);
                n = n.right;
            }
            n = nodes.pop();
            depth = depths.pop();
            for (int i = 0; i < depth; i++) sb.append("   ");
            sb.append(Integer.toUnsignedString(n.key))
                    .append('[').append(n.count).append(',').append(n.subtreeCount).append("]\n");
            n = n.left;
            depth++;
        }
        return sb.toString();
    }

    // Check every invariant of the tree, throws IllegalStateException on the first violation
    void verify() {
        if (root == null) {
            Validate.validState(distinctKeys == 0, "Empty tree reports %d keys", distinctKeys);
            return;
        }
        Validate.validState(root.parent == null, "Root %s has a parent", root.key);

        int nodes = 0;
        final Deque<HistogramNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final HistogramNode n = stack.pop();
            nodes++;
            Validate.validState(n.count > 0, "Node %s has count %d", n.key, n.count);
            int c = n.count;
            if (n.left != null) {
                c += n.left.subtreeCount;
                Validate.validState(Integer.compareUnsigned(n.left.key, n.key) <= 0, "Left child %s of %s out of order", n.left.key, n.key);
                Validate.validState(n.left.parent == n, "Left child %s of %s has a wrong parent", n.left.key, n.key);
                stack.push(n.left);
            }
            if (n.right != null) {
                c += n.right.subtreeCount;
                Validate.validState(Integer.compareUnsigned(n.right.key, n.key) > 0, "Right child %s of %s out of order", n.right.key, n.key);
                Validate.validState(n.right.parent == n, "Right child %s of %s has a wrong parent", n.right.key, n.key);
                stack.push(n.right);
            }
            Validate.validState(c == n.subtreeCount, "Node %s has subtree count %d, expected %d", n.key, n.subtreeCount, c);
        }
        Validate.validState(nodes == distinctKeys, "Tree has %d nodes but reports %d keys", nodes, distinctKeys);
    }

    private HistogramNode lookup(final int key) {
        HistogramNode n = root;
        while (n != null && n.key != key) {
            n = Integer.compareUnsigned(key, n.key) < 0 ? n.left : n.right;
        }
        return n;
    }

    // Put v in the slot u occupies under its parent (or the root)
    private void transplant(final HistogramNode u, final HistogramNode v) {
        if (u.parent == null) {
            root = v;
        } else if (u == u.parent.left) {
            u.parent.left = v;
        } else {
            u.parent.right = v;
        }
        if (v != null) v.parent = u.parent;
    }

    // Once a node keeps its subtree count, all of its ancestors do too
    private static void repair(HistogramNode n) {
        while (n != null && n.recompute()) {
            n = n.parent;
        }
    }
}
