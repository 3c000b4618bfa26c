// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Joiner;

import java.util.ArrayList;
import java.util.List;

/**
 * A 9x9 Sudoku grid together with the candidate domains of its empty cells.
 * Cells hold 0 (empty) or 1..9. Cells filled at construction are givens and
 * can never be cleared; all other changes go through {@link #assign} and
 * {@link #unassign}, which keep the domain tracker in step with the grid.
 * <p>
 * Not thread safe.
 */
public class Board {
    private static final Joiner spaceJoiner = Joiner.on(' ');

    private final int[] grid = new int[Cell.COUNT];
    private final boolean[] given = new boolean[Cell.COUNT];
    private final DomainTracker.Strategy strategy;
    private final DomainTracker tracker;
    private int emptyCount = Cell.COUNT;

    private Board(DomainTracker.Strategy strategy) {
        this.strategy = strategy;
        this.tracker = DomainTracker.create(strategy, grid);
    }

    private Board(Board other, DomainTracker.Strategy strategy) {
        System.arraycopy(other.grid, 0, grid, 0, grid.length);
        System.arraycopy(other.given, 0, given, 0, given.length);
        this.emptyCount = other.emptyCount;
        this.strategy = strategy;
        this.tracker = DomainTracker.create(strategy, grid);
    }

    public static Board empty() {
        return new Board(DomainTracker.Strategy.INCREMENTAL);
    }

    public static Board copyOf(Board other) {
        return new Board(other, other.strategy);
    }

    /** A copy of other whose domains are maintained by the given strategy. */
    public static Board copyOf(Board other, DomainTracker.Strategy strategy) {
        return new Board(other, strategy);
    }

    /**
     * Construct a board from a board string. The string uses the digits 1-9 in
     * row by row, left to right order. A '.' or '0' indicates an empty cell.
     * Other characters are ignored. Knuth's example 28(a) would begin:
     * "..3 .1. ... 415" (etc.)
     *
     * @param boardString board representation with empty cells recorded as '.'
     * @return the board, whose non-empty cells are givens
     */
    public static Board fromBoardString(String boardString) {
        Board board = new Board(DomainTracker.Strategy.INCREMENTAL);
        int p = 0;
        for (int j = 0; j < boardString.length(); ++j) {
            char ch = boardString.charAt(j);
            if (ch >= '0' && ch <= '9' || ch == '.') {
                if (p >= Cell.COUNT) throw new IllegalArgumentException("too many cells in board string");
                if (ch > '0' && ch <= '9') board.addGiven(Cell.ofIndex(p), ch - '0');
                ++p;
            }
        }
        if (p != Cell.COUNT) {
            throw new IllegalArgumentException(String.format("board string has %d cells, expected %d", p, Cell.COUNT));
        }
        return board;
    }

    /**
     * @param rows nine rows of nine values each, 0 for an empty cell
     * @return the board, whose non-empty cells are givens
     */
    public static Board fromRows(int[][] rows) {
        if (rows.length != Cell.SIZE) throw new IllegalArgumentException("expected 9 rows, got " + rows.length);
        Board board = new Board(DomainTracker.Strategy.INCREMENTAL);
        for (int r = 0; r < Cell.SIZE; ++r) {
            if (rows[r].length != Cell.SIZE) {
                throw new IllegalArgumentException(String.format("row %d has %d values, expected 9", r, rows[r].length));
            }
            for (int c = 0; c < Cell.SIZE; ++c) {
                int v = rows[r][c];
                if (v < 0 || v > Cell.SIZE) {
                    throw new IllegalArgumentException(String.format("value %d out of range @ %d,%d", v, r, c));
                }
                if (v != 0) board.addGiven(Cell.of(r, c), v);
            }
        }
        return board;
    }

    private void addGiven(Cell cell, int value) {
        // Make sure this placement is valid against the givens seen so far.
        if (!DomainTracker.contains(tracker.domain(cell), value)) {
            throw new IllegalArgumentException(
                    String.format("uniqueness violation for entry %d @ %d,%d", value, cell.row(), cell.column()));
        }
        set(cell, value);
        given[cell.index()] = true;
    }

    public DomainTracker.Strategy strategy() { return strategy; }

    public int get(Cell cell) { return grid[cell.index()]; }

    public boolean isEmpty(Cell cell) { return grid[cell.index()] == 0; }

    public boolean isGiven(Cell cell) { return given[cell.index()]; }

    public int emptyCount() { return emptyCount; }

    public boolean isComplete() { return emptyCount == 0; }

    /** Bit vector of legal values for cell (bit v-1 for value v); 0 if the cell is filled. */
    public int domain(Cell cell) {
        return isEmpty(cell) ? tracker.domain(cell) : 0;
    }

    public int domainSize(Cell cell) {
        return DomainTracker.size(domain(cell));
    }

    /** The number of peers of cell that are currently empty. */
    public int degree(Cell cell) {
        int d = 0;
        for (Cell p : cell.peers()) {
            if (grid[p.index()] == 0) ++d;
        }
        return d;
    }

    /**
     * Place value in an empty cell. The value must be in the cell's domain;
     * anything else is a bug in the caller.
     */
    public void assign(Cell cell, int value) {
        if (!isEmpty(cell)) {
            throw new IllegalStateException(String.format("assign %d to filled cell %s (holds %d)", value, cell, get(cell)));
        }
        int d = tracker.domain(cell);
        if (!DomainTracker.contains(d, value)) {
            throw new IllegalStateException(String.format("assign %d to %s outside its domain %s", value, cell, DomainTracker.values(d)));
        }
        set(cell, value);
    }

    /** Empty a cell previously filled by {@link #assign}. Givens cannot be cleared. */
    public void unassign(Cell cell) {
        int v = grid[cell.index()];
        if (v == 0) throw new IllegalStateException("unassign of empty cell " + cell);
        if (given[cell.index()]) throw new IllegalStateException("unassign of given cell " + cell);
        grid[cell.index()] = 0;
        ++emptyCount;
        tracker.unassigned(cell, v);
    }

    private void set(Cell cell, int value) {
        grid[cell.index()] = value;
        --emptyCount;
        tracker.assigned(cell, value);
    }

    /** True if two peers hold the same nonzero value. */
    public boolean hasConflicts() {
        for (Cell c : Cell.ALL) {
            int v = grid[c.index()];
            if (v == 0) continue;
            for (Cell p : c.peers()) {
                if (grid[p.index()] == v) return true;
            }
        }
        return false;
    }

    /** True if every row, column and box holds each of 1..9 exactly once. */
    public boolean isSolved() {
        return isComplete() && !hasConflicts();
    }

    /** Row-major copy of the cell values. */
    public int[] toArray() {
        return grid.clone();
    }

    /**
     * Nine lines of nine space-separated values; empty cells are shown as '.'.
     */
    public String toGridString() {
        StringBuilder sb = new StringBuilder();
        List<String> row = new ArrayList<>(Cell.SIZE);
        for (int r = 0; r < Cell.SIZE; ++r) {
            row.clear();
            for (int c = 0; c < Cell.SIZE; ++c) {
                int v = grid[r * Cell.SIZE + c];
                row.add(v == 0 ? "." : Integer.toString(v));
            }
            sb.append(spaceJoiner.join(row)).append('\n');
        }
        return sb.toString();
    }

    /**
     * Row by row, in groups of three cells: "793 412 685 415 638 ..." with a
     * trailing space. Empty cells are shown as '.'.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Cell.COUNT; ++i) {
            sb.append(grid[i] == 0 ? '.' : (char) ('0' + grid[i]));
            if (i % 3 == 2) sb.append(' ');
        }
        return sb.toString();
    }
}
