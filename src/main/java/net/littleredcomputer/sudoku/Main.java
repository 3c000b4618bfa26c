// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;

public class Main {
    static Options options() {
        return new Options()
                .addOption("problem", true, "filename of puzzle: 9 lines of 9 numbers, 0 for empty ('-' for stdin)")
                .addOption("board", true, "sudoku board [1-9.]{81}")
                .addOption("timelimit", true, "search time budget in ISO-8601 format (default PT1H)")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format")
                .addOption("domains", true, "domain tracking: incremental or scan");
    }

    private static Board puzzle(CommandLine cmd) {
        if (cmd.hasOption("board")) return Board.fromBoardString(cmd.getOptionValue("board"));
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem or -board");
        String p = cmd.getOptionValue("problem");
        return p.equals("-")
                ? PuzzleReader.read(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)))
                : PuzzleReader.read(Paths.get(p));
    }

    static Solver solver(CommandLine cmd) {
        Solver s = new Solver()
                .setTimeLimit(Duration.parse(cmd.getOptionValue("timelimit", "PT1H")))
                .setLogInterval(Duration.parse(cmd.getOptionValue("loginterval", "PT1S")));
        if (cmd.hasOption("domains")) {
            String d = cmd.getOptionValue("domains");
            switch (d) {
                case "incremental": s.setStrategy(DomainTracker.Strategy.INCREMENTAL); break;
                case "scan": s.setStrategy(DomainTracker.Strategy.SCAN); break;
                default: throw new IllegalArgumentException("unknown domain strategy: " + d);
            }
        }
        return s;
    }

    static void report(Board puzzle, SolveResult result, PrintStream out) {
        out.println("Initial:");
        out.print(puzzle.toGridString());
        out.printf(Locale.ROOT, "%nSolved: %s Time: %.3fs%s%n",
                result.isSolved() ? "True" : "False",
                result.elapsed().toNanos() / 1e9,
                result.outcome() == SolveResult.Outcome.TIMED_OUT ? " Timed out" : "");
        out.println();
        out.println("Final:");
        out.print(result.board().toGridString());
        out.println();
        out.println("First 4 assignments:");
        result.moves().forEach(out::println);
    }

    public static void main(String[] args) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Board puzzle = puzzle(cmd);
        SolveResult result = solver(cmd).solve(puzzle);
        report(puzzle, result, System.out);
    }
}
