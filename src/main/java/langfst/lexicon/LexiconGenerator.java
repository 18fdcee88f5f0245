package langfst.lexicon;

import langfst.InvalidLexiconException;
import langfst.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the initial lexicon by segmenting every word, then appends the fallback entry that maps the unknown-word
 * placeholder to {@link SymbolTable#UNK}.
 */
public final class LexiconGenerator {
    private final WordSegmenter segmenter;
    private final String unknownWord;

    public LexiconGenerator(WordSegmenter segmenter, String unknownWord) {
        this.segmenter = segmenter;
        this.unknownWord = unknownWord;
    }

    public Lexicon generate(Collection<String> words) {
        List<LexiconEntry> entries = new ArrayList<>(words.size() + 1);
        for (String word : words) {
            List<String> pieces = segmenter.segment(word);
            if (pieces.isEmpty()) {
                throw new InvalidLexiconException(word, "segmenter produced no tokens");
            }
            entries.add(new LexiconEntry(word, pieces));
        }
        entries.add(LexiconEntry.of(unknownWord, SymbolTable.UNK));
        return new Lexicon(entries);
    }

    /** The symbols of {@code wordTable} in table order, minus {@code excluded}. */
    public static List<String> selectWords(SymbolTable wordTable, Collection<String> excluded) {
        Set<String> skip = new HashSet<>(excluded);
        List<String> words = new ArrayList<>();
        for (String symbol : wordTable.symbols()) {
            if (skip.contains(symbol) == false) {
                words.add(symbol);
            }
        }
        return words;
    }
}
