// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.util.Optional;

/**
 * Depth-first backtracking search for a Sudoku completion. At each level the
 * {@link CellSelector} picks a cell, and that cell's candidates are tried in
 * increasing order. Every assignment made at a level is undone before the
 * level reports failure to its parent.
 * <p>
 * A Solver holds only configuration; each call to {@link #solve} works on its
 * own copy of the board, so one instance may be reused.
 */
public class Solver {
    private static final Logger log = LogManager.getFormatterLogger(Solver.class);
    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofHours(1);
    private static final int logCheckSteps = 1000;

    private final CellSelector selector = new CellSelector();
    private Duration timeLimit = DEFAULT_TIME_LIMIT;
    private Duration logInterval = Duration.ofMillis(1000);
    private Ticker ticker = Ticker.systemTicker();
    private DomainTracker.Strategy strategy = null;

    public Solver setTimeLimit(Duration timeLimit) {
        if (timeLimit.isNegative()) throw new IllegalArgumentException("negative time limit " + timeLimit);
        this.timeLimit = timeLimit;
        return this;
    }

    public Solver setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    /** The clock used for the time limit and for elapsed time. */
    public Solver setTicker(Ticker ticker) {
        this.ticker = ticker;
        return this;
    }

    /** Overrides the domain tracking strategy of boards given to {@link #solve}. */
    public Solver setStrategy(DomainTracker.Strategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public Duration getTimeLimit() { return timeLimit; }

    /**
     * Search for a completion of puzzle. The puzzle itself is not modified.
     *
     * @param puzzle a board free of conflicts between givens
     * @return the outcome, the final board and the first moves attempted
     */
    public SolveResult solve(Board puzzle) {
        Board board = strategy == null ? Board.copyOf(puzzle) : Board.copyOf(puzzle, strategy);
        return new Search(board).run();
    }

    private enum Status {
        SOLVED,
        DEAD_END,
        TIMED_OUT,
    }

    /** The state of one solve invocation. */
    private class Search {
        private final Board board;
        private final MoveRecorder recorder = new MoveRecorder();
        private final Stopwatch stopwatch;
        private final TimeGuard guard;
        private long stepCount = 0;
        private long assignments = 0;
        private Duration lastLogTime = Duration.ZERO;
        private long lastAssignments = 0;

        Search(Board board) {
            this.board = board;
            this.stopwatch = Stopwatch.createStarted(ticker);
            this.guard = TimeGuard.start(timeLimit, ticker);
        }

        SolveResult run() {
            log.info("solving %d empty cells, %s domains, limit %s", board.emptyCount(), board.strategy(), timeLimit);
            Status status = search(0);
            stopwatch.stop();
            SolveResult.Outcome outcome;
            switch (status) {
                case SOLVED:
                    if (!board.isSolved()) throw new IllegalStateException("search reported an invalid solution " + board);
                    outcome = SolveResult.Outcome.SOLVED;
                    break;
                case TIMED_OUT:
                    outcome = SolveResult.Outcome.TIMED_OUT;
                    break;
                case DEAD_END:
                    outcome = SolveResult.Outcome.UNSOLVABLE;
                    break;
                default:
                    throw new IllegalStateException("unexpected status " + status);
            }
            log.info("%s after %d assignments in %s", outcome, assignments, stopwatch);
            return new SolveResult(outcome, board, recorder.moves(), stopwatch.elapsed(), assignments);
        }

        private Status search(int depth) {
            if (guard.expired()) return Status.TIMED_OUT;
            if (++stepCount % logCheckSteps == 0) maybeReportProgress(depth);

            Optional<CellSelector.Selection> next = selector.selectNext(board);
            if (!next.isPresent()) return Status.SOLVED;
            CellSelector.Selection s = next.get();
            // An empty domain means no value can go here: fail without assigning.
            if (s.domainSize() == 0) return Status.DEAD_END;

            Cell cell = s.cell();
            TIntArrayList candidates = DomainTracker.values(s.domain());
            for (int k = 0; k < candidates.size(); ++k) {
                int v = candidates.get(k);
                board.assign(cell, v);
                ++assignments;
                if (recorder.record(cell, s.domainSize(), s.degree(), v)) {
                    log.debug("move %d: %s = %d at depth %d", recorder.size(), s, v, depth);
                }
                Status status = search(depth + 1);
                if (status != Status.DEAD_END) return status;
                board.unassign(cell);
            }
            return Status.DEAD_END;
        }

        private void maybeReportProgress(int depth) {
            Duration now = stopwatch.elapsed();
            Duration tween = now.minus(lastLogTime);
            if (tween.compareTo(logInterval) < 0) return;
            final double perSec = 1e3 * (assignments - lastAssignments) / Math.max(1, tween.toMillis());
            log.info(() -> new FormattedMessage("%d assignments %s %.0f/sec depth %d remaining %s %s",
                    assignments, stopwatch, perSec, depth, guard.remaining(), board));
            lastLogTime = now;
            lastAssignments = assignments;
        }
    }
}
