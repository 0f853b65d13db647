package com.causalloops.graph;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static com.causalloops.graph.GraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class CycleFinderTest {

    private static List<List<String>> loops(List<Edge> es) {
        return CycleFinder.loops(EdgeList.of(es));
    }

    @Test
    void revolutionFixture_yieldsExactlyFourLoops_inOrder() {
        assertEquals(REVOLUTION_LOOPS, loops(REVOLUTION));
    }

    @Test
    void revolutionFixture_doesNotDependOnEdgeOrder() {
        assertEquals(REVOLUTION_LOOPS, loops(reversed(REVOLUTION)));
        for (int i = 1; i < REVOLUTION.size(); i++) {
            assertEquals(REVOLUTION_LOOPS, loops(rotated(REVOLUTION, i)), "rotation " + i);
        }
    }

    @Test
    void triangle_isOneLoopStartingAtSmallestVertex() {
        assertEquals(List.of(loop("a", "b", "c", "a")), loops(TRIANGLE));
        assertEquals(List.of(loop("a", "b", "c", "a")), loops(edges(e("B", "C"), e("C", "A"), e("A", "B"))));
    }

    @Test
    void acyclicGraph_hasNoLoops() {
        assertEquals(List.of(), loops(ACYCLIC));
    }

    @Test
    void emptyGraph_hasNoLoops() {
        assertEquals(List.of(), loops(List.of()));
    }

    @Test
    void selfLoop_closesOnItself() {
        assertEquals(List.of(loop("v", "v")), loops(edges(e("V", "V"))));
    }

    @Test
    void sharedVertex_surfacesBothOverlappingLoops() {
        var out = loops(edges(e("a", "b"), e("b", "a"), e("b", "c"), e("c", "a")));
        assertEquals(List.of(loop("a", "b", "a"), loop("a", "b", "c", "a")), out);
    }

    @Test
    void multiEdges_doNotDuplicateLoops() {
        assertEquals(List.of(loop("a", "b", "a")), loops(edges(e("a", "b"), e("a", "b"), e("b", "a"))));
    }

    @Test
    void spellingVariants_collapseToOneVertex() {
        assertEquals(List.of(loop("a", "b", "a")), loops(edges(e(" A ", "b"), e("B", "a "))));
    }

    @Test
    void blankNames_areLiteralEmptyVertices() {
        assertEquals(List.of(loop("", "x", "")), loops(edges(e("", "x"), e("x", " "))));
    }

    @Test
    void everyLoopIsClosed_andHasNoRepeatedInnerVertex() {
        for (List<String> l : loops(REVOLUTION)) {
            assertEquals(l.get(0), l.get(l.size() - 1));
            var inner = l.subList(0, l.size() - 1);
            assertEquals(inner.size(), new HashSet<>(inner).size(), "repeated vertex in " + l);
        }
    }

    @Test
    void noDuplicateLoops() {
        var out = loops(REVOLUTION);
        assertEquals(out.size(), new HashSet<>(out).size());
    }

    @Test
    void repeatedCalls_giveIdenticalOutput() {
        var edges = EdgeList.of(REVOLUTION);
        assertEquals(CycleFinder.loops(edges), CycleFinder.loops(edges));
    }

    @Test
    void deepRing_isWalkedWithoutRecursion() {
        int n = 5_000;
        List<Edge> es = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            es.add(e(String.format("v%05d", i), String.format("v%05d", (i + 1) % n)));
        }
        var out = loops(es);
        assertEquals(1, out.size());
        assertEquals(n + 1, out.get(0).size());
        assertEquals("v00000", out.get(0).get(0));
        assertEquals("v00001", out.get(0).get(1));
    }
}
