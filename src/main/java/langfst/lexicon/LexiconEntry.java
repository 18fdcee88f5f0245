package langfst.lexicon;

import java.util.List;
import java.util.Objects;

/**
 * One word and its pronunciation, the ordered tokens that spell it.
 * <p>
 * An empty pronunciation can be represented, but it is rejected when the lexicon is compiled.
 */
public record LexiconEntry(String word, List<String> tokens) {

    public LexiconEntry {
        Objects.requireNonNull(word, "word");
        tokens = List.copyOf(tokens);
    }

    public static LexiconEntry of(String word, String... tokens) {
        return new LexiconEntry(word, List.of(tokens));
    }

    /** The tokens joined by a single space, the key used to compare pronunciations. */
    public String pronunciationKey() {
        return String.join(" ", tokens);
    }

    @Override
    public String toString() {
        return tokens.isEmpty() ? word : word + " " + pronunciationKey();
    }
}
