package langfst;

/**
 * Thrown when a lexicon entry cannot be compiled, e.g. because its pronunciation is empty.
 */
public class InvalidLexiconException extends IllegalArgumentException {
    private final String word;

    public InvalidLexiconException(String word, String message) {
        super(message + " (word=" + word + ")");
        this.word = word;
    }

    /** The word of the offending lexicon entry. */
    public String getWord() {
        return word;
    }
}
