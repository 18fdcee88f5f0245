// # Preparing a language directory
//
// This ties the pieces together the way a decoding-graph recipe does:
//
// 1. Pick the words to spell out from the word table and segment each into tokens.
// 2. Add disambiguation symbols to a copy of the lexicon.
// 3. Add `#0` through `#max` to the token table. A token table that already has one of them is rejected, because the
//    transducer could no longer tell a real token from a disambiguation symbol.
// 4. Add `#0` and the sentence boundary symbols to the word table.
// 5. Build `L` from the plain lexicon and `L_disambig` (with `#0` self-loops) from the disambiguated one.
//
// The caller's tables are never modified; the extended tables are copies.
package langfst;

import langfst.fst.FstBuilder;
import langfst.fst.LexiconFst;
import langfst.lexicon.DisambiguatedLexicon;
import langfst.lexicon.DisambiguationAssigner;
import langfst.lexicon.Lexicon;
import langfst.lexicon.LexiconGenerator;
import langfst.lexicon.WordSegmenter;
import langfst.symbols.SymbolTable;
import org.apache.lucene.util.InfoStream;

import java.util.List;

public class LangPreparer {
    private final LangConfig config;

    public LangPreparer(LangConfig config) {
        this.config = config;
    }

    public PreparedLang prepare(SymbolTable wordTable, SymbolTable tokenTable, WordSegmenter segmenter) {
        List<String> words = LexiconGenerator.selectWords(wordTable, config.getExcludedWords());
        Lexicon lexicon = new LexiconGenerator(segmenter, config.getUnknownWord()).generate(words);
        return prepare(lexicon, wordTable, tokenTable);
    }

    /** Same as {@link #prepare(SymbolTable, SymbolTable, WordSegmenter)}, for a lexicon that already exists. */
    public PreparedLang prepare(Lexicon lexicon, SymbolTable wordTable, SymbolTable tokenTable) {
        InfoStream infoStream = config.getInfoStream();
        DisambiguatedLexicon disambiguated = DisambiguationAssigner.assign(lexicon, infoStream);

        SymbolTable tokens = tokenTable.copy();
        for (int i = 0; i <= disambiguated.maxDisambigIndex(); i++) {
            String disambig = DisambiguationAssigner.disambigSymbol(i);
            if (tokens.contains(disambig)) {
                throw new SymbolContractException(disambig, "token table '" + tokens.getName()
                        + "' already contains disambiguation symbol '" + disambig + "'");
            }
            tokens.add(disambig);
        }

        SymbolTable words = wordTable.copy();
        words.getOrAdd(SymbolTable.GLOBAL_DISAMBIG);
        for (String symbol : config.getSentenceSymbols()) {
            words.getOrAdd(symbol);
        }

        FstBuilder builder = new FstBuilder(infoStream);
        LexiconFst lexiconFst = builder.build(lexicon, tokens, words, false);
        LexiconFst disambigFst = builder.build(disambiguated.lexicon(), tokens, words, true);

        if (infoStream.isEnabled("LANG")) {
            infoStream.message("LANG", "lexicon entries=" + lexicon.size() + " tokens=" + tokens.size()
                    + " words=" + words.size() + " maxDisambig=" + disambiguated.maxDisambigIndex()
                    + " L states=" + lexiconFst.numStates() + " arcs=" + lexiconFst.numArcs()
                    + " L_disambig states=" + disambigFst.numStates() + " arcs=" + disambigFst.numArcs());
        }
        return new PreparedLang(tokens, words, lexicon, disambiguated.lexicon(),
                disambiguated.maxDisambigIndex(), lexiconFst, disambigFst);
    }
}
