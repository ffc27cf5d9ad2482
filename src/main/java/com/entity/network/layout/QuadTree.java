package com.entity.network.layout;

import java.util.Arrays;

/**
 * Barnes-Hut quad-tree over weighted bodies. Distant cells act on a body as a
 * single mass at their center of mass.
 */
final class QuadTree {

    static final int MAX_DEPTH = 24;

    private final double[] x;
    private final double[] y;
    private final double[] mass;
    private final Cell root;

    private static final class Cell {
        final double centerX;
        final double centerY;
        final double half;
        final int depth;
        double totalMass;
        double massX;
        double massY;
        Cell[] children;
        int body = -1;
        // bodies sharing a cell at MAX_DEPTH
        int[] bucket;
        int bucketSize;

        Cell(double centerX, double centerY, double half, int depth) {
            this.centerX = centerX;
            this.centerY = centerY;
            this.half = half;
            this.depth = depth;
        }

        boolean isLeaf() {
            return children == null;
        }
    }

    QuadTree(double[] x, double[] y, double[] mass) {
        this.x = x;
        this.y = y;
        this.mass = mass;
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < x.length; i++) {
            minX = Math.min(minX, x[i]);
            maxX = Math.max(maxX, x[i]);
            minY = Math.min(minY, y[i]);
            maxY = Math.max(maxY, y[i]);
        }
        double half = Math.max(maxX - minX, maxY - minY) / 2.0 + 1e-6;
        this.root = new Cell((minX + maxX) / 2.0, (minY + maxY) / 2.0, half, 0);
        for (int i = 0; i < x.length; i++) {
            insert(root, i);
        }
    }

    private void insert(Cell cell, int body) {
        double m = mass[body];
        cell.massX += x[body] * m;
        cell.massY += y[body] * m;
        cell.totalMass += m;

        if (cell.isLeaf()) {
            if (cell.body < 0 && cell.bucket == null) {
                cell.body = body;
                return;
            }
            if (cell.depth >= MAX_DEPTH) {
                addToBucket(cell, body);
                return;
            }
            int existing = cell.body;
            cell.body = -1;
            cell.children = new Cell[4];
            insertIntoChild(cell, existing);
        }
        insertIntoChild(cell, body);
    }

    private void addToBucket(Cell cell, int body) {
        if (cell.bucket == null) {
            cell.bucket = new int[]{cell.body, body};
            cell.bucketSize = 2;
            cell.body = -1;
            return;
        }
        if (cell.bucketSize == cell.bucket.length) {
            cell.bucket = Arrays.copyOf(cell.bucket, cell.bucket.length * 2);
        }
        cell.bucket[cell.bucketSize++] = body;
    }

    private void insertIntoChild(Cell cell, int body) {
        int quadrant = (x[body] >= cell.centerX ? 1 : 0) + (y[body] >= cell.centerY ? 2 : 0);
        Cell child = cell.children[quadrant];
        if (child == null) {
            double quarter = cell.half / 2.0;
            double cx = cell.centerX + ((quadrant & 1) == 1 ? quarter : -quarter);
            double cy = cell.centerY + ((quadrant & 2) == 2 ? quarter : -quarter);
            child = new Cell(cx, cy, quarter, cell.depth + 1);
            cell.children[quadrant] = child;
        }
        insert(child, body);
    }

    /**
     * Adds the repulsion acting on {@code body} into {@code force[0..1]}.
     * Magnitude is {@code k * m_body * m_other / distance}.
     */
    void accumulateRepulsion(int body, double k, double theta, double[] force) {
        accumulate(root, body, k, theta, force);
    }

    private void accumulate(Cell cell, int body, double k, double theta, double[] force) {
        if (cell == null || cell.totalMass == 0.0) {
            return;
        }
        if (cell.isLeaf()) {
            if (cell.bucket != null) {
                for (int i = 0; i < cell.bucketSize; i++) {
                    int other = cell.bucket[i];
                    if (other != body) {
                        ForceDirectedLayout.addRepulsion(x[body], y[body], x[other], y[other],
                                k * mass[body] * mass[other], body, other, force);
                    }
                }
            } else if (cell.body >= 0 && cell.body != body) {
                int other = cell.body;
                ForceDirectedLayout.addRepulsion(x[body], y[body], x[other], y[other],
                        k * mass[body] * mass[other], body, other, force);
            }
            return;
        }
        double comX = cell.massX / cell.totalMass;
        double comY = cell.massY / cell.totalMass;
        double distance = Math.hypot(x[body] - comX, y[body] - comY);
        boolean contains = Math.abs(x[body] - cell.centerX) <= cell.half
                && Math.abs(y[body] - cell.centerY) <= cell.half;
        if (!contains && distance > 0.0 && (2.0 * cell.half) / distance < theta) {
            ForceDirectedLayout.addRepulsion(x[body], y[body], comX, comY,
                    k * mass[body] * cell.totalMass, body, -1, force);
            return;
        }
        for (Cell child : cell.children) {
            accumulate(child, body, k, theta, force);
        }
    }
}
