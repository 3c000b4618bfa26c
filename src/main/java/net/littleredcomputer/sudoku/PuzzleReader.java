// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads puzzles written as nine lines of nine whitespace-separated integers,
 * 0 standing for an empty cell. Blank lines are ignored. For example:
 * <pre>
 * 0 0 0 2 6 0 7 0 1
 * 6 8 0 0 7 0 0 9 0
 * ...
 * </pre>
 */
public final class PuzzleReader {
    private static final Splitter whitespaceSplitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private PuzzleReader() {}

    public static Board parse(String puzzle) {
        return read(new StringReader(puzzle));
    }

    public static Board read(Path path) {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(r);
        } catch (IOException e) {
            throw new UncheckedIOException("reading " + path, e);
        }
    }

    /**
     * @param puzzle the puzzle text; not closed by this method
     * @return the board, with a given for every nonzero entry
     * @throws IllegalArgumentException if the text is malformed or two givens conflict
     */
    public static Board read(Reader puzzle) {
        BufferedReader in = puzzle instanceof BufferedReader ? (BufferedReader) puzzle : new BufferedReader(puzzle);
        int[][] rows = new int[Cell.SIZE][];
        int r = 0;
        int lineNumber = 0;
        try {
            String line;
            while ((line = in.readLine()) != null) {
                ++lineNumber;
                if (CharMatcher.whitespace().matchesAllOf(line)) continue;
                if (r >= Cell.SIZE) throw new IllegalArgumentException("line " + lineNumber + ": more than 9 rows");
                rows[r++] = parseRow(line, lineNumber);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("reading puzzle", e);
        }
        if (r != Cell.SIZE) throw new IllegalArgumentException("expected 9 rows, got " + r);
        return Board.fromRows(rows);
    }

    private static int[] parseRow(String line, int lineNumber) {
        List<String> tokens = whitespaceSplitter.splitToList(line);
        if (tokens.size() != Cell.SIZE) {
            throw new IllegalArgumentException(
                    String.format("line %d: expected 9 values, got %d", lineNumber, tokens.size()));
        }
        int[] row = new int[Cell.SIZE];
        for (int c = 0; c < Cell.SIZE; ++c) {
            String t = tokens.get(c);
            int v;
            try {
                v = Integer.parseInt(t);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format("line %d: not a number: %s", lineNumber, t), e);
            }
            if (v < 0 || v > Cell.SIZE) {
                throw new IllegalArgumentException(String.format("line %d: value %d out of range [0..9]", lineNumber, v));
            }
            row[c] = v;
        }
        return row;
    }
}
