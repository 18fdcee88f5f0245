package langfst.fst;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Adds {@code #0} self-loops so the global disambiguation symbol can pass through the lexicon when it is composed
 * with a grammar. A loop goes on every state that has an arc with a non-epsilon output label, i.e. every state where
 * a word can start. Loops are emitted in ascending state order.
 */
public final class SelfLoopInjector {

    private SelfLoopInjector() {
    }

    public static List<Arc> inject(List<Arc> arcs, int disambigToken, int disambigWord) {
        SortedSet<Integer> states = new TreeSet<>();
        for (Arc arc : arcs) {
            if (arc.isFinal() == false && arc.outputLabel() != Arc.EPSILON) {
                states.add(arc.source());
            }
        }
        List<Arc> result = new ArrayList<>(arcs.size() + states.size());
        result.addAll(arcs);
        for (int state : states) {
            result.add(Arc.of(state, state, disambigToken, disambigWord));
        }
        return result;
    }
}
