package langfst.lexicon;

import langfst.MalformedFileException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads and writes the lexicon text format: one entry per line, {@code WORD TOKEN1 TOKEN2 ... TOKENk}.
 */
public final class LexiconIO {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private LexiconIO() {
    }

    public static Lexicon read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    /**
     * Parses a lexicon. Blank lines are skipped.
     *
     * @throws MalformedFileException if a line has a word but no tokens
     */
    public static Lexicon read(BufferedReader reader, String resource) throws IOException {
        List<LexiconEntry> entries = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] fields = WHITESPACE.split(trimmed);
            if (fields.length < 2) {
                throw new MalformedFileException("expected WORD TOKEN1 ... TOKENk but got '" + line + "'",
                        resource, lineNumber);
            }
            entries.add(new LexiconEntry(fields[0], Arrays.asList(fields).subList(1, fields.length)));
        }
        return new Lexicon(entries);
    }

    public static void write(Path path, Lexicon lexicon) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer, lexicon);
        }
    }

    public static void write(Writer writer, Lexicon lexicon) throws IOException {
        for (LexiconEntry entry : lexicon) {
            writer.write(entry.word());
            for (String token : entry.tokens()) {
                writer.write(' ');
                writer.write(token);
            }
            writer.write('\n');
        }
    }
}
