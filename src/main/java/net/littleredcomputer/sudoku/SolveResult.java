// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.collect.ImmutableList;

import java.time.Duration;

/**
 * What a call to {@link Solver#solve} produced.
 */
public final class SolveResult {
    public enum Outcome {
        /** The board is a complete, valid solution. */
        SOLVED,
        /** The search was exhausted: the puzzle has no completion. */
        UNSOLVABLE,
        /** The time budget ran out before the search could decide. */
        TIMED_OUT,
    }

    private final Outcome outcome;
    private final Board board;
    private final ImmutableList<Move> moves;
    private final Duration elapsed;
    private final long assignments;

    SolveResult(Outcome outcome, Board board, ImmutableList<Move> moves, Duration elapsed, long assignments) {
        this.outcome = outcome;
        this.board = board;
        this.moves = moves;
        this.elapsed = elapsed;
        this.assignments = assignments;
    }

    public Outcome outcome() { return outcome; }

    public boolean isSolved() { return outcome == Outcome.SOLVED; }

    /** The final board: a solution if solved, otherwise whatever state the search left. */
    public Board board() { return board; }

    /** The first assignments the search attempted (at most four). */
    public ImmutableList<Move> moves() { return moves; }

    public Duration elapsed() { return elapsed; }

    /** Total number of assignments made, including those later undone. */
    public long assignments() { return assignments; }

    @Override
    public String toString() {
        return String.format("%s after %d assignments in %s", outcome, assignments, elapsed);
    }
}
