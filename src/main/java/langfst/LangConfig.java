// # Language preparation settings
//
// Holds the knobs of the language-directory pipeline. Like Lucene's `IndexWriterConfig`, every setter returns
// `this`, so a configuration reads as one chained expression:
//
// ```
// LangConfig config = new LangConfig()
//         .setUnknownWord("<UNK>")
//         .setInfoStream(new PrintStreamInfoStream(System.out));
// ```
package langfst;

import org.apache.lucene.util.InfoStream;

import java.util.List;
import java.util.Objects;

public class LangConfig {

    public static final String DEFAULT_UNKNOWN_WORD = "<UNK>";

    public static final List<String> DEFAULT_EXCLUDED_WORDS =
            List.of("<eps>", "!SIL", "<SPOKEN_NOISE>", "<UNK>", "#0", "<s>", "</s>");

    public static final List<String> DEFAULT_SENTENCE_SYMBOLS = List.of("<s>", "</s>");

    private InfoStream infoStream = InfoStream.NO_OUTPUT;
    private String unknownWord = DEFAULT_UNKNOWN_WORD;
    private List<String> excludedWords = DEFAULT_EXCLUDED_WORDS;
    private List<String> sentenceSymbols = DEFAULT_SENTENCE_SYMBOLS;

    public InfoStream getInfoStream() {
        return infoStream;
    }

    public LangConfig setInfoStream(InfoStream infoStream) {
        this.infoStream = Objects.requireNonNull(infoStream, "infoStream");
        return this;
    }

    /** The word mapped to the unknown token by the fallback lexicon entry. */
    public String getUnknownWord() {
        return unknownWord;
    }

    public LangConfig setUnknownWord(String unknownWord) {
        this.unknownWord = Objects.requireNonNull(unknownWord, "unknownWord");
        return this;
    }

    /** Word-table symbols that are never segmented into the lexicon. */
    public List<String> getExcludedWords() {
        return excludedWords;
    }

    public LangConfig setExcludedWords(List<String> excludedWords) {
        this.excludedWords = List.copyOf(excludedWords);
        return this;
    }

    /** Symbols appended to the word table after {@code #0}. */
    public List<String> getSentenceSymbols() {
        return sentenceSymbols;
    }

    public LangConfig setSentenceSymbols(List<String> sentenceSymbols) {
        this.sentenceSymbols = List.copyOf(sentenceSymbols);
        return this;
    }
}
