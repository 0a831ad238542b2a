package com.initialone.jdocgap.ast;

import java.util.Arrays;

/**
 * Flat, index-addressed copy of a parse tree. Node 0 is the root; every node keeps its kind,
 * its [start, end) character range in the analyzed content and the indexes of its children in
 * source order. Grammars fill it once, the engines only read it.
 */
public final class SyntaxArena {

    public static final int NO_PARENT = -1;

    private String[] kinds = new String[64];
    private int[] starts = new int[64];
    private int[] ends = new int[64];
    private int[][] children = new int[64][];
    private int[] childCounts = new int[64];
    private int size;

    /** Appends a node and links it as the last child of {@code parent}; returns its index. */
    public int add(String kind, int start, int end, int parent) {
        ensureCapacity(size + 1);
        int idx = size++;
        kinds[idx] = kind;
        starts[idx] = start;
        ends[idx] = end;
        children[idx] = null;
        childCounts[idx] = 0;
        if (parent != NO_PARENT) {
            if (parent < 0 || parent >= idx) {
                throw new IllegalArgumentException("parent " + parent + " not in arena");
            }
            int[] kids = children[parent];
            if (kids == null) {
                kids = new int[4];
            } else if (childCounts[parent] == kids.length) {
                kids = Arrays.copyOf(kids, kids.length * 2);
            }
            kids[childCounts[parent]++] = idx;
            children[parent] = kids;
        }
        return idx;
    }

    public int size()              { return size; }
    public boolean isEmpty()       { return size == 0; }
    public String kind(int node)   { return kinds[check(node)]; }
    public int start(int node)     { return starts[check(node)]; }
    public int end(int node)       { return ends[check(node)]; }
    public int childCount(int node){ return childCounts[check(node)]; }

    public int child(int node, int i) {
        check(node);
        if (i < 0 || i >= childCounts[node]) {
            throw new IndexOutOfBoundsException("child " + i + " of node " + node);
        }
        return children[node][i];
    }

    /** Source text covered by a node. */
    public String text(int node, String content) {
        int s = Math.max(0, Math.min(start(node), content.length()));
        int e = Math.max(s, Math.min(end(node), content.length()));
        return content.substring(s, e);
    }

    private int check(int node) {
        if (node < 0 || node >= size) {
            throw new IndexOutOfBoundsException("node " + node + " (size " + size + ")");
        }
        return node;
    }

    private void ensureCapacity(int want) {
        if (want <= kinds.length) return;
        int cap = Math.max(want, kinds.length * 2);
        kinds = Arrays.copyOf(kinds, cap);
        starts = Arrays.copyOf(starts, cap);
        ends = Arrays.copyOf(ends, cap);
        children = Arrays.copyOf(children, cap);
        childCounts = Arrays.copyOf(childCounts, cap);
    }
}
