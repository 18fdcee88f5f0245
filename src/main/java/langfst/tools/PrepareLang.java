// # Prepare a language directory
//
// Reads `words.txt` and `tokens.txt` from a language directory and writes:
//
// * `lexicon.txt` and `lexicon_disambig.txt`, in the lexicon text format,
// * `phones.txt`, the token table extended with the disambiguation symbols,
// * `words_disambig.txt`, the word table extended with `#0`, `<s>` and `</s>`,
// * `L.fst.txt` and `L_disambig.fst.txt`, the two lexicon transducers as arc lists.
//
// Words are segmented greedily against the token vocabulary (see `VocabularySegmenter`). The two input files are
// never rewritten, so running the tool again on the same directory gives the same outputs.
//
// Usage: `PrepareLang <langDir> [-verbose]`
package langfst.tools;

import langfst.LangConfig;
import langfst.LangPreparer;
import langfst.PreparedLang;
import langfst.fst.ArcListFormat;
import langfst.lexicon.LexiconIO;
import langfst.lexicon.VocabularySegmenter;
import langfst.symbols.SymbolTable;
import langfst.symbols.SymbolTableIO;
import org.apache.lucene.util.PrintStreamInfoStream;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class PrepareLang {

    public static void main(String[] args) throws IOException {
        if (args.length < 1 || args.length > 2 || (args.length == 2 && args[1].equals("-verbose") == false)) {
            System.err.println("Usage: PrepareLang <langDir> [-verbose]");
            System.exit(1);
        }
        Path langDir = Paths.get(args[0]);
        LangConfig config = new LangConfig();
        if (args.length == 2) {
            config.setInfoStream(new PrintStreamInfoStream(System.out));
        }
        prepare(langDir, config);
    }

    public static PreparedLang prepare(Path langDir, LangConfig config) throws IOException {
        SymbolTable words = SymbolTableIO.read(langDir.resolve("words.txt"), "words");
        SymbolTable tokens = SymbolTableIO.read(langDir.resolve("tokens.txt"), "tokens");

        VocabularySegmenter segmenter = new VocabularySegmenter(vocabulary(tokens), SymbolTable.UNK);
        PreparedLang lang = new LangPreparer(config).prepare(words, tokens, segmenter);

        SymbolTableIO.write(langDir.resolve("phones.txt"), lang.tokens());
        SymbolTableIO.write(langDir.resolve("words_disambig.txt"), lang.words());
        LexiconIO.write(langDir.resolve("lexicon.txt"), lang.lexicon());
        LexiconIO.write(langDir.resolve("lexicon_disambig.txt"), lang.disambigLexicon());
        ArcListFormat.write(langDir.resolve("L.fst.txt"), lang.lexiconFst());
        ArcListFormat.write(langDir.resolve("L_disambig.fst.txt"), lang.disambigFst());

        if (config.getInfoStream().isEnabled("LANG")) {
            config.getInfoStream().message("LANG", "wrote " + langDir.toAbsolutePath());
        }
        return lang;
    }

    // Special symbols such as <unk> or <blk> and disambiguation symbols are not pieces of words.
    static List<String> vocabulary(SymbolTable tokens) {
        List<String> pieces = new ArrayList<>();
        for (String symbol : tokens.symbols()) {
            boolean special = symbol.startsWith("<") && symbol.endsWith(">");
            if (special == false && symbol.startsWith("#") == false) {
                pieces.add(symbol);
            }
        }
        return pieces;
    }
}
