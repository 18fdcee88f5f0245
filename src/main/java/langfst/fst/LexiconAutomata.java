// # Handing the lexicon to Lucene's automaton library
//
// Lucene's `Automaton` is an acceptor over int labels, so it can represent the input (token) side of our
// transducer. We project onto the input labels and turn the terminating `-1` arc into an accept flag on its source
// state, the loop state.
//
// `Automaton.addTransition` expects all transitions of a state to be added together, one state after another. That
// is the reason `LexiconFst` keeps its arcs sorted by source state.
package langfst.fst;

import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.Operations;

public final class LexiconAutomata {

    private LexiconAutomata() {
    }

    /** Returns an (in general non-deterministic) acceptor for the token sequences the transducer reads. */
    public static Automaton toInputAutomaton(LexiconFst fst) {
        Automaton automaton = new Automaton();
        for (int state = 0; state < fst.numStates(); state++) {
            automaton.createState();
        }
        for (Arc arc : fst.arcs()) {
            if (arc.isFinal()) {
                automaton.setAccept(arc.source(), true);
            } else {
                automaton.addTransition(arc.source(), arc.dest(), arc.inputLabel());
            }
        }
        automaton.finishState();
        return automaton;
    }

    /**
     * Determinizes the input side of {@code fst}.
     *
     * @throws org.apache.lucene.util.automaton.TooComplexToDeterminizeException if {@code workLimit} is exceeded
     */
    public static Automaton determinizeInput(LexiconFst fst, int workLimit) {
        return Operations.determinize(toInputAutomaton(fst), workLimit);
    }
}
