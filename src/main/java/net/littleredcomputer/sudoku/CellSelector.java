// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import java.util.Optional;

/**
 * Chooses the cell to branch on next. The ranking is: fewest remaining values
 * (MRV); then most empty peers (degree); then lowest row, then lowest column.
 * The choice depends only on the board's current contents.
 */
public class CellSelector {

    /** A chosen cell together with the measurements that ranked it. */
    public static final class Selection {
        private final Cell cell;
        private final int domain;
        private final int degree;

        Selection(Cell cell, int domain, int degree) {
            this.cell = cell;
            this.domain = domain;
            this.degree = degree;
        }

        public Cell cell() { return cell; }
        public int domain() { return domain; }
        public int domainSize() { return DomainTracker.size(domain); }
        public int degree() { return degree; }

        @Override
        public String toString() {
            return String.format("%s domain=%s degree=%d", cell, DomainTracker.values(domain), degree);
        }
    }

    /**
     * @param board the board to inspect; it is not modified
     * @return the best empty cell, or empty if the board is complete
     */
    public Optional<Selection> selectNext(Board board) {
        Cell best = null;
        int bestDomain = 0;
        int bestSize = Integer.MAX_VALUE;
        int bestDegree = -1;
        // Cells are visited in row-major order and only strictly better cells
        // displace the incumbent, so position breaks any remaining tie.
        for (Cell c : Cell.ALL) {
            if (!board.isEmpty(c)) continue;
            int d = board.domain(c);
            int size = DomainTracker.size(d);
            if (size > bestSize) continue;
            int degree = board.degree(c);
            if (size < bestSize || degree > bestDegree) {
                best = c;
                bestDomain = d;
                bestSize = size;
                bestDegree = degree;
            }
        }
        return best == null ? Optional.empty() : Optional.of(new Selection(best, bestDomain, bestDegree));
    }
}
