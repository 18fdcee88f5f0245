package langfst.fst;

import langfst.MalformedFileException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The arc list text format: one {@code SRC DST ILABEL OLABEL WEIGHT} line per arc, sorted by {@code SRC}, followed
 * by a line holding only the final state.
 */
public final class ArcListFormat {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ArcListFormat() {
    }

    public static void write(Path path, LexiconFst fst) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer, fst);
        }
    }

    public static void write(Writer writer, LexiconFst fst) throws IOException {
        for (Arc arc : fst.arcs()) {
            writer.write(arc.source() + " " + arc.dest() + " " + arc.inputLabel() + " " + arc.outputLabel() + " "
                    + formatWeight(arc.weight()) + "\n");
        }
        writer.write(fst.finalState() + "\n");
    }

    public static String toString(LexiconFst fst) {
        StringWriter writer = new StringWriter();
        try {
            write(writer, fst);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    public static LexiconFst read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    /**
     * @throws MalformedFileException if a line is neither an arc nor the final state, arcs follow the final state,
     *                                the arcs are not sorted by source, or the final state is missing
     */
    public static LexiconFst read(BufferedReader reader, String resource) throws IOException {
        List<Arc> arcs = new ArrayList<>();
        int finalState = -1;
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (finalState != -1) {
                throw new MalformedFileException("content after the final state line", resource, lineNumber);
            }
            String[] fields = WHITESPACE.split(trimmed);
            try {
                if (fields.length == 1) {
                    finalState = Integer.parseInt(fields[0]);
                } else if (fields.length == 5) {
                    Arc arc = new Arc(Integer.parseInt(fields[0]), Integer.parseInt(fields[1]),
                            Integer.parseInt(fields[2]), Integer.parseInt(fields[3]), Float.parseFloat(fields[4]));
                    if (arcs.isEmpty() == false && arcs.get(arcs.size() - 1).source() > arc.source()) {
                        throw new MalformedFileException("arcs are not sorted by source state", resource, lineNumber);
                    }
                    arcs.add(arc);
                } else {
                    throw new MalformedFileException("expected SRC DST ILABEL OLABEL WEIGHT or FINAL but got '"
                            + line + "'", resource, lineNumber);
                }
            } catch (NumberFormatException e) {
                MalformedFileException malformed = new MalformedFileException("not a number in '" + line + "'",
                        resource, lineNumber);
                malformed.initCause(e);
                throw malformed;
            }
        }
        if (finalState < 0) {
            throw new MalformedFileException("missing final state line", resource, lineNumber);
        }
        try {
            return LexiconFst.of(arcs, finalState);
        } catch (IllegalArgumentException e) {
            MalformedFileException malformed = new MalformedFileException(e.getMessage(), resource, lineNumber);
            malformed.initCause(e);
            throw malformed;
        }
    }

    private static String formatWeight(float weight) {
        return weight == 0f ? "0" : Float.toString(weight);
    }
}
