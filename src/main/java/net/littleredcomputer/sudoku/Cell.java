// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.collect.ImmutableList;

/**
 * A position on the 9x9 board. Instances are interned, so identity comparison
 * is safe; cells are ordered row-major by {@link #index()}.
 */
public final class Cell implements Comparable<Cell> {
    public static final int SIZE = 9;
    public static final int COUNT = SIZE * SIZE;

    private static final Cell[] cells = new Cell[COUNT];
    static {
        for (int i = 0; i < COUNT; ++i) cells[i] = new Cell(i);
    }

    /** Every cell, in row-major order. */
    public static final ImmutableList<Cell> ALL = ImmutableList.copyOf(cells);

    // The peers table is filled in once all cells exist; it never changes afterwards.
    private static final ImmutableList<ImmutableList<Cell>> peers;
    static {
        ImmutableList.Builder<ImmutableList<Cell>> b = ImmutableList.builder();
        for (Cell c : cells) b.add(c.computePeers());
        peers = b.build();
    }

    private final int index;
    private final int row;
    private final int column;

    private Cell(int index) {
        this.index = index;
        this.row = index / SIZE;
        this.column = index % SIZE;
    }

    /**
     * @param row row index [0..9)
     * @param column column index [0..9)
     * @return the cell at that position
     */
    public static Cell of(int row, int column) {
        if (row < 0 || row >= SIZE || column < 0 || column >= SIZE) {
            throw new IllegalArgumentException(String.format("no such cell (%d,%d)", row, column));
        }
        return cells[row * SIZE + column];
    }

    public static Cell ofIndex(int index) {
        if (index < 0 || index >= COUNT) throw new IllegalArgumentException("no such cell index " + index);
        return cells[index];
    }

    public int row() { return row; }
    public int column() { return column; }
    public int index() { return index; }

    /** Index [0..9) of the 3x3 box containing this cell, numbered row-major. */
    public int box() { return 3 * (row / 3) + column / 3; }

    /** The 20 cells sharing a row, column or box with this one, in row-major order. */
    public ImmutableList<Cell> peers() { return peers.get(index); }

    public boolean isPeerOf(Cell other) {
        return other != this && (other.row == row || other.column == column || other.box() == box());
    }

    private ImmutableList<Cell> computePeers() {
        ImmutableList.Builder<Cell> b = ImmutableList.builder();
        for (Cell c : cells) {
            if (isPeerOf(c)) b.add(c);
        }
        return b.build();
    }

    @Override
    public int compareTo(Cell o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public String toString() {
        return "(" + row + "," + column + ")";
    }
}
