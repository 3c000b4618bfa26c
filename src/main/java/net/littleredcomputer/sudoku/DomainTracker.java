// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import gnu.trove.list.array.TIntArrayList;

/**
 * Answers "which values may still go in this empty cell?" for a board. Domains
 * are reported as bit vectors: value v is present iff bit (v-1) is set.
 * <p>
 * The board informs its tracker of every assignment and retraction. Whatever
 * the strategy, the domain of an empty cell is always exactly the set of values
 * in 1..9 not held by any of its peers.
 */
public abstract class DomainTracker {
    public enum Strategy {
        /** Free-value masks per row, column and box, maintained on every change. */
        INCREMENTAL,
        /** Nothing cached; each query scans the cell's 20 peers. */
        SCAN,
    }

    static final int ALL_VALUES = (1 << Cell.SIZE) - 1;

    /** The domain of an empty cell. The result is unspecified for filled cells. */
    abstract int domain(Cell cell);

    abstract void assigned(Cell cell, int value);

    abstract void unassigned(Cell cell, int value);

    /**
     * @param strategy how domains are to be maintained
     * @param grid row-major cell values, shared with (and owned by) the board
     * @return a tracker consistent with the current contents of grid
     */
    static DomainTracker create(Strategy strategy, int[] grid) {
        switch (strategy) {
            case INCREMENTAL: return new Incremental(grid);
            case SCAN: return new Scan(grid);
            default: throw new IllegalArgumentException("unknown strategy: " + strategy);
        }
    }

    public static int bit(int value) { return 1 << (value - 1); }

    public static int size(int domain) { return Integer.bitCount(domain); }

    public static boolean contains(int domain, int value) {
        return value >= 1 && value <= Cell.SIZE && (domain & bit(value)) != 0;
    }

    /** The members of a domain in increasing order. */
    public static TIntArrayList values(int domain) {
        TIntArrayList vs = new TIntArrayList(size(domain));
        for (int v = 1; v <= Cell.SIZE; ++v) {
            if ((domain & bit(v)) != 0) vs.add(v);
        }
        return vs;
    }

    private static final class Incremental extends DomainTracker {
        private final int[] rows = new int[Cell.SIZE];     // What numbers are free in row i?
        private final int[] columns = new int[Cell.SIZE];  // What numbers are free in column j?
        private final int[] boxes = new int[Cell.SIZE];    // What numbers are free in box k?

        Incremental(int[] grid) {
            for (int i = 0; i < Cell.SIZE; ++i) rows[i] = columns[i] = boxes[i] = ALL_VALUES;
            for (Cell c : Cell.ALL) {
                int v = grid[c.index()];
                if (v != 0) assigned(c, v);
            }
        }

        @Override
        int domain(Cell cell) {
            return rows[cell.row()] & columns[cell.column()] & boxes[cell.box()];
        }

        @Override
        void assigned(Cell cell, int value) {
            int mask = ~bit(value);
            rows[cell.row()] &= mask;
            columns[cell.column()] &= mask;
            boxes[cell.box()] &= mask;
        }

        @Override
        void unassigned(Cell cell, int value) {
            // Sound only because no peer of cell can hold the same value.
            int mask = bit(value);
            rows[cell.row()] |= mask;
            columns[cell.column()] |= mask;
            boxes[cell.box()] |= mask;
        }
    }

    private static final class Scan extends DomainTracker {
        private final int[] grid;

        Scan(int[] grid) {
            this.grid = grid;
        }

        @Override
        int domain(Cell cell) {
            int d = ALL_VALUES;
            for (Cell p : cell.peers()) {
                int v = grid[p.index()];
                if (v != 0) d &= ~bit(v);
            }
            return d;
        }

        @Override
        void assigned(Cell cell, int value) {}

        @Override
        void unassigned(Cell cell, int value) {}
    }
}
