package com.trust.reputation.engine.clustering;

import com.trust.reputation.engine.graph.InputValidationException;

import java.util.stream.IntStream;

/**
 * Upper-triangular pairwise similarity store; the diagonal is implicitly 1.
 * Rows can be filled in parallel because every cell is written by exactly one row.
 */
public final class SimilarityMatrix {

    // Largest array length the JVM reliably allocates
    static final long MAX_CELLS = Integer.MAX_VALUE - 8;

    private final int size;
    private final double[] cells;

    private SimilarityMatrix(int size, double[] cells) {
        this.size = size;
        this.cells = cells;
    }

    public interface PairFunction {
        double apply(int i, int j);
    }

    public static SimilarityMatrix compute(int size, PairFunction similarity, boolean parallel) {
        long cellCount = (long) size * (size - 1) / 2;
        if (cellCount > MAX_CELLS) {
            throw new InputValidationException("too many accounts for one pairwise run: " + size
                    + " accounts need " + cellCount + " similarity cells, limit is " + MAX_CELLS,
                    "accounts", "accounts");
        }
        double[] cells = new double[(int) cellCount];
        SimilarityMatrix matrix = new SimilarityMatrix(size, cells);
        IntStream rows = IntStream.range(0, size);
        if (parallel) {
            rows = rows.parallel();
        }
        rows.forEach(i -> {
            for (int j = i + 1; j < size; j++) {
                cells[matrix.offset(i, j)] = similarity.apply(i, j);
            }
        });
        return matrix;
    }

    public int size() {
        return size;
    }

    public double get(int i, int j) {
        if (i == j) {
            return 1.0;
        }
        return i < j ? cells[offset(i, j)] : cells[offset(j, i)];
    }

    /** Mutable copy, used as the working matrix of agglomerative clustering. */
    double[] copyCells() {
        return cells.clone();
    }

    int offset(int i, int j) {
        // rows 0..i-1 hold (size-1) + (size-2) + ... + (size-i) cells
        return (int) ((long) i * (2L * size - i - 1) / 2 + (j - i - 1));
    }
}
