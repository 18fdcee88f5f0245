package langfst.symbols;

import langfst.MalformedFileException;
import langfst.SymbolContractException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Reads and writes the symbol table text format: one {@code SYMBOL ID} pair per line.
 */
public final class SymbolTableIO {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SymbolTableIO() {
    }

    public static SymbolTable read(Path path, String name) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, name, path.toString());
        }
    }

    /**
     * @throws MalformedFileException if a line is not {@code SYMBOL ID}, or repeats a symbol or an id
     */
    public static SymbolTable read(BufferedReader reader, String name, String resource) throws IOException {
        SymbolTable table = new SymbolTable(name);
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] fields = WHITESPACE.split(trimmed);
            if (fields.length != 2) {
                throw new MalformedFileException("expected SYMBOL ID but got '" + line + "'", resource, lineNumber);
            }
            int id;
            try {
                id = Integer.parseInt(fields[1]);
            } catch (NumberFormatException e) {
                MalformedFileException malformed =
                        new MalformedFileException("id is not an integer: '" + fields[1] + "'", resource, lineNumber);
                malformed.initCause(e);
                throw malformed;
            }
            if (id < 0) {
                throw new MalformedFileException("negative id " + id, resource, lineNumber);
            }
            try {
                table.add(fields[0], id);
            } catch (SymbolContractException e) {
                MalformedFileException malformed = new MalformedFileException(e.getMessage(), resource, lineNumber);
                malformed.initCause(e);
                throw malformed;
            }
        }
        return table;
    }

    public static void write(Path path, SymbolTable table) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer, table);
        }
    }

    /** Writes the symbols in insertion order. */
    public static void write(Writer writer, SymbolTable table) throws IOException {
        for (String symbol : table.symbols()) {
            writer.write(symbol);
            writer.write(' ');
            writer.write(Integer.toString(table.id(symbol)));
            writer.write('\n');
        }
    }
}
