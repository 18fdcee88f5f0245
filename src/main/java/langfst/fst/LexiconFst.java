package langfst.fst;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The compiled lexicon transducer: arcs sorted by source state plus the single final state.
 * <p>
 * State {@link #LOOP_STATE} is both the start state and the state every pronunciation returns to. States are dense,
 * {@code 0} through {@link #finalState()}.
 */
public final class LexiconFst {

    public static final int LOOP_STATE = 0;

    private final List<Arc> arcs;
    private final int finalState;

    LexiconFst(List<Arc> arcs, int finalState) {
        List<Arc> sorted = new ArrayList<>(arcs);
        // List.sort is stable, so arcs leaving the same state keep their emission order.
        sorted.sort(Comparator.comparingInt(Arc::source));
        this.arcs = List.copyOf(sorted);
        this.finalState = finalState;
    }

    /** Creates an automaton from arcs that were built elsewhere, e.g. read back from an arc list. */
    public static LexiconFst of(List<Arc> arcs, int finalState) {
        for (Arc arc : arcs) {
            if (arc.source() < 0 || arc.source() > finalState || arc.dest() < 0 || arc.dest() > finalState) {
                throw new IllegalArgumentException("arc " + arc + " refers to a state outside 0.." + finalState);
            }
        }
        return new LexiconFst(arcs, finalState);
    }

    public List<Arc> arcs() {
        return arcs;
    }

    public int finalState() {
        return finalState;
    }

    public int numStates() {
        return finalState + 1;
    }

    public int numArcs() {
        return arcs.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LexiconFst other = (LexiconFst) o;
        return finalState == other.finalState && arcs.equals(other.arcs);
    }

    @Override
    public int hashCode() {
        return 31 * arcs.hashCode() + finalState;
    }

    @Override
    public String toString() {
        return "LexiconFst(states=" + numStates() + ", arcs=" + arcs.size() + ")";
    }
}
