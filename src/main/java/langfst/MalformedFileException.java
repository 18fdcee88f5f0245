package langfst;

import java.io.IOException;

/**
 * Thrown when a lexicon, symbol table or arc list file does not follow its line format.
 */
public class MalformedFileException extends IOException {
    private final String resource;
    private final int lineNumber;

    public MalformedFileException(String message, String resource, int lineNumber) {
        super(message + " (resource=" + resource + ", line=" + lineNumber + ")");
        this.resource = resource;
        this.lineNumber = lineNumber;
    }

    public String getResource() {
        return resource;
    }

    /** 1-based line number of the offending line. */
    public int getLineNumber() {
        return lineNumber;
    }
}
