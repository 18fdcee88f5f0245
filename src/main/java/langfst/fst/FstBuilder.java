// # Building the lexicon transducer
//
// The transducer reads tokens and writes words. Every pronunciation is a private chain of states that starts and
// ends in the loop state 0:
//
// ```
// CAT = k a t
//
//        k:CAT        a:<eps>        t:<eps>
//   0 ----------> 1 ----------> 2 ----------> 0
// ```
//
// The first arc of a chain outputs the word, the rest output epsilon, and the last arc goes back to state 0 instead
// of a fresh state. Chains never share states, so no prefix sharing or minimization happens here. That is left to
// the automaton library that determinizes the composed graph.
//
// When every chain is emitted, one final state is allocated and the terminating arc `0 -> final` with label -1 on
// both sides is added. The arcs are then sorted by source state, which the consuming automaton representation
// requires.
package langfst.fst;

import langfst.InvalidLexiconException;
import langfst.SymbolContractException;
import langfst.lexicon.Lexicon;
import langfst.lexicon.LexiconEntry;
import langfst.symbols.SymbolTable;
import org.apache.lucene.util.InfoStream;

import java.util.ArrayList;
import java.util.List;

public class FstBuilder {
    private final InfoStream infoStream;

    public FstBuilder() {
        this(InfoStream.NO_OUTPUT);
    }

    public FstBuilder(InfoStream infoStream) {
        this.infoStream = infoStream;
    }

    /**
     * Compiles {@code lexicon} into a transducer from token ids to word ids.
     *
     * @param addSelfLoops whether to add {@code #0} self-loops (see {@link SelfLoopInjector}); both tables must then
     *                     contain {@link SymbolTable#GLOBAL_DISAMBIG}
     * @throws SymbolContractException if {@code <unk>} is not token 0 or {@code <eps>} is not word 0
     * @throws langfst.UnknownSymbolException if the lexicon uses a token or word missing from its table
     * @throws InvalidLexiconException if an entry has an empty pronunciation
     */
    public LexiconFst build(Lexicon lexicon, SymbolTable tokens, SymbolTable words, boolean addSelfLoops) {
        requireReserved(tokens, SymbolTable.UNK);
        requireReserved(words, SymbolTable.EPSILON);

        final int loopState = LexiconFst.LOOP_STATE;
        int nextState = loopState + 1;
        List<Arc> arcs = new ArrayList<>();

        for (LexiconEntry entry : lexicon) {
            List<String> pronunciation = entry.tokens();
            if (pronunciation.isEmpty()) {
                throw new InvalidLexiconException(entry.word(), "empty pronunciation");
            }
            int word = words.id(entry.word());
            int[] labels = new int[pronunciation.size()];
            for (int i = 0; i < labels.length; i++) {
                labels[i] = tokens.id(pronunciation.get(i));
            }

            int curState = loopState;
            for (int i = 0; i < labels.length - 1; i++) {
                arcs.add(Arc.of(curState, nextState, labels[i], i == 0 ? word : Arc.EPSILON));
                curState = nextState++;
            }
            int last = labels.length - 1;
            arcs.add(Arc.of(curState, loopState, labels[last], last == 0 ? word : Arc.EPSILON));
        }

        if (addSelfLoops) {
            int disambigToken = tokens.id(SymbolTable.GLOBAL_DISAMBIG);
            int disambigWord = words.id(SymbolTable.GLOBAL_DISAMBIG);
            int before = arcs.size();
            arcs = SelfLoopInjector.inject(arcs, disambigToken, disambigWord);
            if (infoStream.isEnabled("FST")) {
                infoStream.message("FST", "added " + (arcs.size() - before) + " #0 self-loops");
            }
        }

        final int finalState = nextState;
        arcs.add(Arc.of(loopState, finalState, Arc.FINAL_LABEL, Arc.FINAL_LABEL));

        if (infoStream.isEnabled("FST")) {
            infoStream.message("FST", "built lexicon transducer: entries=" + lexicon.size() + " states="
                    + (finalState + 1) + " arcs=" + arcs.size());
        }
        return new LexiconFst(arcs, finalState);
    }

    private static void requireReserved(SymbolTable table, String symbol) {
        if (table.contains(symbol) == false) {
            throw new SymbolContractException(symbol, "symbol table '" + table.getName() + "' has no '" + symbol
                    + "', which must have id 0");
        }
        int id = table.id(symbol);
        if (id != 0) {
            throw new SymbolContractException(symbol, "'" + symbol + "' must have id 0 in symbol table '"
                    + table.getName() + "', got " + id);
        }
    }
}
