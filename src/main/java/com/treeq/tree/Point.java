package com.treeq.tree;

/**
 * Zero-based row/column position inside the source text.
 */
public record Point(int row, int column) {
    public Point {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Negative point: (" + row + "," + column + ")");
        }
    }

    @Override
    public String toString() {
        return "(" + row + "," + column + ")";
    }
}
