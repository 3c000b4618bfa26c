// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import java.util.Objects;

/**
 * One assignment attempted by the solver, with the measurements of its cell
 * at the time the cell was selected.
 */
public final class Move {
    private final int order;
    private final Cell cell;
    private final int domainSize;
    private final int degree;
    private final int value;

    public Move(int order, Cell cell, int domainSize, int degree, int value) {
        this.order = order;
        this.cell = cell;
        this.domainSize = domainSize;
        this.degree = degree;
        this.value = value;
    }

    /** One-based position of this move in the order the solver attempted them. */
    public int order() { return order; }
    public Cell cell() { return cell; }
    public int domainSize() { return domainSize; }
    public int degree() { return degree; }
    public int value() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Move)) return false;
        Move m = (Move) o;
        return order == m.order && cell == m.cell && domainSize == m.domainSize && degree == m.degree && value == m.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(order, cell, domainSize, degree, value);
    }

    @Override
    public String toString() {
        return String.format("%d) var=(%d,%d), domain=%d, degree=%d, value=%d",
                order, cell.row(), cell.column(), domainSize, degree, value);
    }
}
