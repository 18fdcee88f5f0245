package langfst.fst;

import org.apache.lucene.tests.util.LuceneTestCase;

import java.util.List;

public class TestSelfLoopInjector extends LuceneTestCase {

    public void testLoopsOnWordStartStatesInStateOrder() {
        List<Arc> arcs = List.of(
                Arc.of(7, 8, 1, 3),
                Arc.of(0, 1, 1, 1),
                Arc.of(1, 0, 2, 0),
                Arc.of(0, 2, 2, 2),
                Arc.of(2, 0, 1, 0),
                Arc.of(4, 0, 1, 5));

        List<Arc> result = SelfLoopInjector.inject(arcs, 9, 6);

        assertEquals(arcs, result.subList(0, arcs.size()));
        assertEquals(List.of(Arc.of(0, 0, 9, 6), Arc.of(4, 4, 9, 6), Arc.of(7, 7, 9, 6)),
                result.subList(arcs.size(), result.size()));
    }

    public void testFinalArcIsIgnored() {
        List<Arc> arcs = List.of(Arc.of(1, 0, 2, 0), Arc.of(3, 4, Arc.FINAL_LABEL, Arc.FINAL_LABEL));

        assertEquals(arcs, SelfLoopInjector.inject(arcs, 5, 5));
    }
}
