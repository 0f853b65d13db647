package com.causalloops.causal;

import com.causalloops.graph.UniqueSet;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.causalloops.causal.CausalFixture.*;
import static com.causalloops.causal.Polarity.NEGATIVE;
import static com.causalloops.causal.Polarity.POSITIVE;
import static org.junit.jupiter.api.Assertions.*;

class CausalMapTest {

    private static CausalMap map(Relationship... rs) {
        return CausalMap.fromRelationships(List.of(rs));
    }

    @Nested
    class Variables {

        @Test
        void areTheNormalizedEndpoints() {
            CausalMap m = CausalMap.fromRelationships(REVOLUTION);
            assertEquals(UniqueSet.of("clashes", "resistance", "taxburden", "tensions"), m.variables());
            assertEquals(List.of("clashes", "resistance", "taxburden", "tensions"), m.variables().slice());
        }

        @Test
        void mergeNamesThatDifferOnlyInCaseOrOuterWhitespace() {
            CausalMap m = map(Relationship.of("  Cost ", "Demand", NEGATIVE), Relationship.of("demand", "COST", POSITIVE));
            assertEquals(List.of("cost", "demand"), m.variables().slice());
        }

        @Test
        void emptyMap_hasNoVariables() {
            assertTrue(CausalMap.fromRelationships(List.of()).variables().isEmpty());
            assertTrue(new CausalMap(null, null, null).variables().isEmpty());
        }

        @Test
        void chainWithoutSteps_contributesNothing() {
            CausalMap m = new CausalMap("t", "e", List.of(new CausalChain("Lonely", List.of(), "")));
            assertTrue(m.variables().isEmpty());
            assertEquals(List.of(), m.loops());
        }
    }

    @Nested
    class Loops {

        @Test
        void revolution_yieldsTheFourLoopsInOrder() {
            assertEquals(REVOLUTION_LOOPS, CausalMap.fromRelationships(REVOLUTION).loops());
        }

        @Test
        void revolution_doesNotDependOnRelationshipOrder() {
            for (int i = 0; i < REVOLUTION.size(); i++) {
                List<Relationship> rotated = new ArrayList<>(REVOLUTION);
                Collections.rotate(rotated, i);
                assertEquals(REVOLUTION_LOOPS, CausalMap.fromRelationships(rotated).loops(), "rotation " + i);
            }
        }

        @Test
        void areIdempotent() {
            CausalMap m = CausalMap.fromRelationships(REVOLUTION);
            assertEquals(m.loops(), m.loops());
        }

        @Test
        void triangle() {
            CausalMap m = map(Relationship.of("A", "B", POSITIVE), Relationship.of("B", "C", POSITIVE),
                    Relationship.of("C", "A", NEGATIVE));
            assertEquals(List.of(List.of("a", "b", "c", "a")), m.loops());
        }

        @Test
        void selfLoop() {
            assertEquals(List.of(List.of("v", "v")), map(Relationship.of("V", "V", POSITIVE)).loops());
        }

        @Test
        void acyclicMap_hasNoLoops() {
            CausalMap m = map(Relationship.of("a", "b", POSITIVE), Relationship.of("b", "c", POSITIVE));
            assertEquals(List.of(), m.loops());
        }

        @Test
        void sharedMap_canBeQueriedFromManyThreadsAtOnce() throws Exception {
            CausalMap shared = CausalMap.fromRelationships(REVOLUTION);
            UniqueSet<String> expectedVariables = UniqueSet.of("clashes", "resistance", "taxburden", "tensions");
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < 8 * 200; i++) {
                    boolean askLoops = i % 2 == 0;
                    results.add(pool.submit(() -> askLoops
                            ? REVOLUTION_LOOPS.equals(shared.loops())
                            : expectedVariables.equals(shared.variables())));
                }
                for (Future<Boolean> r : results) {
                    assertTrue(r.get(30, TimeUnit.SECONDS));
                }
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void areUnmodifiable() {
            List<List<String>> loops = CausalMap.fromRelationships(REVOLUTION).loops();
            assertThrows(UnsupportedOperationException.class, () -> loops.add(List.of()));
        }
    }

    @Nested
    class Chains {

        @Test
        void chainExpandsToConsecutiveHops() {
            CausalChain chain = new CausalChain("Stress", List.of(
                    new RelationshipEntry("Aggression", POSITIVE, "p1"),
                    new RelationshipEntry("Incidents", POSITIVE, "p2")), "why");

            assertEquals(List.of(
                    new Relationship("Stress", "Aggression", POSITIVE, "why", "p1"),
                    new Relationship("Aggression", "Incidents", POSITIVE, "why", "p2")), chain.toRelationships());
        }

        @Test
        void fromRelationships_keepsEveryField() {
            Relationship r = new Relationship("a", "b", NEGATIVE, "because", "inverse");
            CausalMap m = CausalMap.fromRelationships("title", "explanation", List.of(r));

            assertEquals("title", m.title());
            assertEquals("explanation", m.explanation());
            assertEquals(List.of(r), m.relationships());
        }

        @Test
        void chainMap_andRelationshipMap_agree() {
            CausalMap flat = CausalMap.fromRelationships(REVOLUTION);
            CausalMap chained = new CausalMap("", "", List.of(
                    new CausalChain("TaxBurden", List.of(
                            new RelationshipEntry("Tensions", POSITIVE, ""),
                            new RelationshipEntry("Clashes", POSITIVE, ""),
                            new RelationshipEntry("Resistance", POSITIVE, ""),
                            new RelationshipEntry("Clashes", POSITIVE, "")), ""),
                    new CausalChain("Clashes", List.of(
                            new RelationshipEntry("Tensions", POSITIVE, ""),
                            new RelationshipEntry("TaxBurden", POSITIVE, ""),
                            new RelationshipEntry("Resistance", POSITIVE, "")), "")));

            assertEquals(flat.variables(), chained.variables());
            assertEquals(flat.loops(), chained.loops());
        }
    }

    @Test
    void nullPolarity_isAllowed() {
        CausalMap m = map(new Relationship("a", "b", null, null, null), new Relationship("b", "a", null, null, null));
        assertNull(m.relationships().get(0).polarity());
        assertEquals(List.of(List.of("a", "b", "a")), m.loops());
    }
}
