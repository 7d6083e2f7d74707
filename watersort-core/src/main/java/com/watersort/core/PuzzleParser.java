package com.watersort.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Reads puzzles from a line-oriented text format:
 *
 * <pre>
 * # comment
 * capacity 4
 * empty 2
 * red blue red blue
 * blue red blue red
 * -
 * -
 * </pre>
 *
 * Every line that is not a directive describes one tube, bottom unit first. Units are separated by
 * whitespace or commas and a single {@code -} marks an empty tube. The parser only checks syntax;
 * structural problems are reported by {@link PuzzleValidator}.
 */
public final class PuzzleParser {

    public static final int DEFAULT_CAPACITY = 4;

    private static final String EMPTY_TUBE = "-";

    private PuzzleParser() {
    }

    public static PuzzleInput parse(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static PuzzleInput parse(String text) {
        Objects.requireNonNull(text, "text");
        return parse(Arrays.asList(text.split("\\R", -1)));
    }

    public static PuzzleInput parse(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        int capacity = DEFAULT_CAPACITY;
        boolean capacitySeen = false;
        OptionalInt declaredEmpty = OptionalInt.empty();
        List<List<String>> tubes = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            String line = stripComment(lines.get(i)).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] tokens = line.split("[\\s,]+");
            String keyword = tokens[0].toLowerCase(Locale.ROOT);
            if ("capacity".equals(keyword)) {
                if (capacitySeen) {
                    throw new IllegalArgumentException("Line " + lineNumber + ": capacity specified more than once");
                }
                capacity = parseDirective(tokens, lineNumber);
                capacitySeen = true;
            } else if ("empty".equals(keyword)) {
                if (declaredEmpty.isPresent()) {
                    throw new IllegalArgumentException("Line " + lineNumber + ": empty count specified more than once");
                }
                declaredEmpty = OptionalInt.of(parseDirective(tokens, lineNumber));
            } else if (tokens.length == 1 && EMPTY_TUBE.equals(tokens[0])) {
                tubes.add(List.of());
            } else {
                for (String token : tokens) {
                    if (EMPTY_TUBE.equals(token)) {
                        throw new IllegalArgumentException("Line " + lineNumber
                                + ": '-' must stand alone to mark an empty tube");
                    }
                }
                tubes.add(List.of(tokens));
            }
        }

        if (tubes.isEmpty()) {
            throw new IllegalArgumentException("Puzzle does not describe any tube");
        }
        return new PuzzleInput(tubes.size(), capacity, tubes, declaredEmpty);
    }

    /**
     * Formats the input in the syntax accepted by {@link #parse(List)}.
     */
    public static String format(PuzzleInput input) {
        Objects.requireNonNull(input, "input");
        StringBuilder builder = new StringBuilder();
        builder.append("capacity ").append(input.capacity()).append(System.lineSeparator());
        if (input.declaredEmptyTubes().isPresent()) {
            builder.append("empty ").append(input.declaredEmptyTubes().getAsInt()).append(System.lineSeparator());
        }
        for (List<String> tube : input.tubes()) {
            builder.append(tube.isEmpty() ? EMPTY_TUBE : String.join(" ", tube)).append(System.lineSeparator());
        }
        return builder.toString();
    }

    private static int parseDirective(String[] tokens, int lineNumber) {
        if (tokens.length != 2) {
            throw new IllegalArgumentException("Line " + lineNumber + ": expected '" + tokens[0] + " <number>'");
        }
        try {
            return Integer.parseInt(tokens[1]);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Line " + lineNumber + ": '" + tokens[1] + "' is not a number", ex);
        }
    }

    private static String stripComment(String line) {
        if (line == null) {
            return "";
        }
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }
}
