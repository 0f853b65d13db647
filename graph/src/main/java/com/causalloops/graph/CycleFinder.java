package com.causalloops.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Depth-first search for the feedback loops of a directed graph.
 * <p>
 * Every vertex with outgoing edges is used as a root, in {@link EdgeList#sources()} order, each with
 * its own visited set. While expanding a vertex, each neighbour is first descended into if unvisited;
 * then, whether or not it was descended into, a neighbour already on the current path closes a cycle
 * made of the path suffix starting at that neighbour. Neighbours are taken in adjacency order.
 * <p>
 * The traversal runs on an explicit stack, so graph depth is not limited by the thread stack.
 * Instances hold no state; every call allocates its own.
 */
public final class CycleFinder {
    private static final Logger log = LoggerFactory.getLogger(CycleFinder.class);

    private CycleFinder() {}

    /** Closed loops, each starting (and ending) at its smallest vertex, ordered by {@link LoopOrder}. */
    public static List<List<String>> loops(EdgeList edges) {
        return findCycles(edges).loops();
    }

    public static Cycles findCycles(EdgeList edges) {
        Objects.requireNonNull(edges, "edges");
        Cycles cycles = new Cycles();
        for (String root : edges.sources()) {
            new Search(edges, cycles).run(root);
        }
        log.debug("Found {} distinct cycles from {} source vertices", cycles.size(), edges.sources().size());
        return cycles;
    }

    /** One stack frame: the neighbours of the vertex being expanded and how far through them we are. */
    private static final class Frame {
        final List<String> neighbours;
        int next;
        /** neighbour we descended into; checked against the path once its subtree is done */
        String pending;

        Frame(List<String> neighbours) {
            this.neighbours = neighbours;
        }
    }

    /** Working state of the search from one root. */
    private static final class Search {
        final EdgeList edges;
        final Cycles cycles;
        final Set<String> visited = new HashSet<>();
        final List<String> path = new ArrayList<>();
        // vertices on a path are distinct, so a position per vertex is enough
        final Map<String, Integer> positionOnPath = new HashMap<>();
        final Deque<Frame> stack = new ArrayDeque<>();

        Search(EdgeList edges, Cycles cycles) {
            this.edges = edges;
            this.cycles = cycles;
        }

        void run(String root) {
            enter(root);
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.pending != null) {
                    closeCycleIfOnPath(top.pending);
                    top.pending = null;
                    continue;
                }
                if (top.next >= top.neighbours.size()) {
                    stack.pop();
                    positionOnPath.remove(path.remove(path.size() - 1));
                    continue;
                }
                String w = top.neighbours.get(top.next++);
                if (!visited.contains(w)) {
                    top.pending = w;
                    enter(w);
                } else {
                    closeCycleIfOnPath(w);
                }
            }
        }

        void enter(String v) {
            visited.add(v);
            positionOnPath.put(v, path.size());
            path.add(v);
            stack.push(new Frame(edges.neighbours(v)));
        }

        // path here is exactly the path of the frame on top of the stack
        void closeCycleIfOnPath(String w) {
            Integer i = positionOnPath.get(w);
            if (i != null) {
                cycles.add(path.subList(i, path.size()));
            }
        }
    }
}
