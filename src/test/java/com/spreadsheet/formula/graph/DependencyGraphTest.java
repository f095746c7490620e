package com.spreadsheet.formula.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DependencyGraph.
 */
class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    /**
     * Test that the reverse map mirrors the forward map.
     */
    @Test
    void testSetPrecedentsMirrorsDependents() {
        graph.setPrecedents("C1", Set.of("A1", "B1"));

        assertEquals(Set.of("A1", "B1"), graph.getPrecedents("C1"));
        assertEquals(Set.of("C1"), graph.getDependents("A1"));
        assertEquals(Set.of("C1"), graph.getDependents("B1"));
    }

    /**
     * Test that replacing precedents removes stale reverse edges.
     */
    @Test
    void testReplacePrecedents() {
        graph.setPrecedents("C1", Set.of("A1", "B1"));
        graph.setPrecedents("C1", Set.of("B1", "D1"));

        assertTrue(graph.getDependents("A1").isEmpty());
        assertEquals(Set.of("C1"), graph.getDependents("D1"));
        assertFalse(graph.getDependentGraph().containsKey("A1"));
    }

    /**
     * Test that clearing a cell's precedents leaves cells that read it alone.
     */
    @Test
    void testClearPrecedents() {
        graph.setPrecedents("B1", Set.of("A1"));
        graph.setPrecedents("C1", Set.of("B1"));
        graph.clearPrecedents("B1");

        assertTrue(graph.getPrecedents("B1").isEmpty());
        assertEquals(Set.of("C1"), graph.getDependents("B1"));
        assertFalse(graph.getPrecedentGraph().containsKey("B1"));
    }

    /**
     * Test that a chain is ordered precedents first.
     */
    @Test
    void testChainOrder() {
        graph.setPrecedents("B1", Set.of("A1"));
        graph.setPrecedents("C1", Set.of("B1"));
        graph.setPrecedents("D1", Set.of("C1"));

        RecalculationPlan plan = graph.planRecalculation(List.of("A1"));

        assertEquals(List.of("A1", "B1", "C1", "D1"), plan.getOrder());
        assertTrue(plan.getCircular().isEmpty());
    }

    /**
     * Test that a diamond evaluates its join once, after both branches.
     */
    @Test
    void testDiamondOrder() {
        graph.setPrecedents("B1", Set.of("A1"));
        graph.setPrecedents("C1", Set.of("A1"));
        graph.setPrecedents("D1", Set.of("B1", "C1"));

        List<String> order = graph.planRecalculation(List.of("A1")).getOrder();

        assertEquals(4, order.size());
        assertEquals("A1", order.get(0));
        assertEquals("D1", order.get(3));
    }

    /**
     * Test that only cells downstream of the change are planned.
     */
    @Test
    void testOnlyAffectedCells() {
        graph.setPrecedents("B1", Set.of("A1"));
        graph.setPrecedents("B2", Set.of("A2"));

        assertEquals(List.of("A2", "B2"), graph.planRecalculation(List.of("A2")).getOrder());
    }

    /**
     * Test that cycle members are split out and their dependents still get ordered.
     */
    @Test
    void testCycleDetection() {
        graph.setPrecedents("A1", Set.of("B1"));
        graph.setPrecedents("B1", Set.of("A1"));
        graph.setPrecedents("C1", Set.of("A1"));

        RecalculationPlan plan = graph.planRecalculation(List.of("A1"));

        assertEquals(Set.of("A1", "B1"), plan.getCircular());
        assertEquals(List.of("C1"), plan.getOrder());
    }

    /**
     * Test that a cell reading itself is circular.
     */
    @Test
    void testSelfReference() {
        graph.setPrecedents("A1", Set.of("A1"));

        RecalculationPlan plan = graph.planRecalculation(List.of("A1"));

        assertEquals(Set.of("A1"), plan.getCircular());
        assertTrue(plan.getOrder().isEmpty());
    }

    /**
     * Test that a long chain does not overflow the stack.
     */
    @Test
    void testLongChain() {
        for (int row = 2; row <= 5000; row++) {
            graph.setPrecedents("A" + row, Set.of("A" + (row - 1)));
        }

        RecalculationPlan plan = graph.planRecalculation(List.of("A1"));

        assertEquals(5000, plan.getOrder().size());
        assertEquals("A5000", plan.getOrder().get(4999));
    }
}
