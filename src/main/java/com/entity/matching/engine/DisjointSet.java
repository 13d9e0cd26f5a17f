package com.entity.matching.engine;

/**
 * Union-find over the integers {@code 0..size-1}, with path compression and union by rank.
 */
final class DisjointSet {

    private final int[] parent;
    private final byte[] rank;

    DisjointSet(int size) {
        parent = new int[size];
        rank = new byte[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    int find(int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    /**
     * Merges the sets of {@code a} and {@code b} and returns the root of the merged set.
     */
    int union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return rootA;
        }
        if (rank[rootA] < rank[rootB]) {
            parent[rootA] = rootB;
            return rootB;
        }
        if (rank[rootA] == rank[rootB]) {
            rank[rootA]++;
        }
        parent[rootB] = rootA;
        return rootA;
    }
}
