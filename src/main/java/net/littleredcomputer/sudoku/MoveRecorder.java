// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the first few assignments of a search, in the order they were made.
 * Moves are never removed, even if the search later retracts them.
 */
public class MoveRecorder {
    public static final int DEFAULT_CAPACITY = 4;

    private final int capacity;
    private final List<Move> moves;

    public MoveRecorder() {
        this(DEFAULT_CAPACITY);
    }

    public MoveRecorder(int capacity) {
        if (capacity < 0) throw new IllegalArgumentException("negative capacity " + capacity);
        this.capacity = capacity;
        this.moves = new ArrayList<>(capacity);
    }

    /**
     * Note an assignment. Ignored once the recorder is full.
     * @return true if the move was kept
     */
    public boolean record(Cell cell, int domainSize, int degree, int value) {
        if (isFull()) return false;
        moves.add(new Move(moves.size() + 1, cell, domainSize, degree, value));
        return true;
    }

    public boolean isFull() { return moves.size() >= capacity; }

    public int size() { return moves.size(); }

    public ImmutableList<Move> moves() { return ImmutableList.copyOf(moves); }
}
