package com.formulagrid.app.graph;

import com.formulagrid.app.exceptions.CircularReferenceException;
import com.formulagrid.app.models.CellId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Tracks which cells reference which, in both directions.
 * <p>
 * {@code refersTo} maps a cell to the cells its formula reads; {@code referredFrom} is its exact
 * inverse. The only mutation is {@link #replaceOutgoingEdges}, which keeps the two maps
 * consistent. Empty sets are dropped so that a cell without edges has no entry at all.
 * <p>
 * Not thread-safe; the owning {@code Sheet} guards it with its lock.
 */
public class DependencyGraph {

    // Forward adjacency: "sourceCell" -> setOfCellsReferenced
    private final Map<CellId, Set<CellId>> refersTo = new HashMap<>();
    // Reverse adjacency: "targetCell" -> setOfCellsThatReferenceIt
    private final Map<CellId, Set<CellId>> referredFrom = new HashMap<>();

    /**
     * Makes {@code targets} the complete set of cells {@code source} references.
     *
     * @return the previous targets, so a failed mutation can put them back
     */
    public Set<CellId> replaceOutgoingEdges(CellId source, Collection<CellId> targets) {
        Set<CellId> previous = refersTo.remove(source);
        if (previous == null) {
            previous = Collections.emptySet();
        }
        for (CellId oldTarget : previous) {
            Set<CellId> referrers = referredFrom.get(oldTarget);
            if (referrers != null) {
                referrers.remove(source);
                if (referrers.isEmpty()) {
                    referredFrom.remove(oldTarget);
                }
            }
        }

        if (!targets.isEmpty()) {
            Set<CellId> newTargets = new LinkedHashSet<>(targets);
            refersTo.put(source, newTargets);
            for (CellId target : newTargets) {
                referredFrom.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(source);
            }
        }
        return previous;
    }

    /**
     * Cells whose formulas reference {@code cell} directly.
     */
    public Set<CellId> dependentsOf(CellId cell) {
        return Collections.unmodifiableSet(referredFrom.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Cells that {@code cell}'s formula references directly.
     */
    public Set<CellId> referencesOf(CellId cell) {
        return Collections.unmodifiableSet(refersTo.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Walks {@code referredFrom} breadth-first from {@code cell} and returns every visited cell
     * that nothing else depends on. These are the entry points for a topological sort that
     * covers everything affected by a change to {@code cell}. When every visited cell has a
     * dependent (the change closed a loop), {@code cell} itself is the only root.
     */
    public List<CellId> rootsAbove(CellId cell) {
        Deque<CellId> frontier = new ArrayDeque<>();
        Set<CellId> seen = new LinkedHashSet<>();
        List<CellId> roots = new ArrayList<>();
        frontier.add(cell);
        seen.add(cell);

        while (!frontier.isEmpty()) {
            CellId current = frontier.poll();
            Set<CellId> referrers = referredFrom.getOrDefault(current, Collections.emptySet());
            if (referrers.isEmpty()) {
                roots.add(current);
            }
            for (CellId referrer : referrers) {
                if (seen.add(referrer)) {
                    frontier.add(referrer);
                }
            }
        }
        if (roots.isEmpty()) {
            return Collections.singletonList(cell);
        }
        return roots;
    }

    /**
     * Depth-first topological sort over {@code refersTo}, starting from each root in turn.
     * Every cell appears after all the cells it references. Only cells reachable from the
     * roots are included.
     *
     * @throws CircularReferenceException if a cell is reached again while still in progress
     */
    public List<CellId> topologicalOrderFrom(Collection<CellId> roots) {
        Map<CellId, Mark> marks = new HashMap<>();
        List<CellId> order = new ArrayList<>();
        // Each frame holds a cell and an iterator over the references still to visit
        Deque<Map.Entry<CellId, Iterator<CellId>>> stack = new ArrayDeque<>();

        for (CellId root : roots) {
            if (markOf(marks, root) == Mark.DONE) {
                continue;
            }
            marks.put(root, Mark.IN_PROGRESS);
            stack.push(Map.entry(root, referencesOf(root).iterator()));

            while (!stack.isEmpty()) {
                Map.Entry<CellId, Iterator<CellId>> frame = stack.peek();
                Iterator<CellId> pending = frame.getValue();
                if (!pending.hasNext()) {
                    stack.pop();
                    marks.put(frame.getKey(), Mark.DONE);
                    order.add(frame.getKey());
                    continue;
                }
                CellId next = pending.next();
                Mark mark = markOf(marks, next);
                if (mark == Mark.IN_PROGRESS) {
                    throw new CircularReferenceException(next);
                }
                if (mark == Mark.UNVISITED) {
                    marks.put(next, Mark.IN_PROGRESS);
                    stack.push(Map.entry(next, referencesOf(next).iterator()));
                }
            }
        }
        return order;
    }

    /**
     * Snapshot of {@code refersTo} keyed by address text, sorted for stable output.
     * Cells that are only referenced appear with an empty set.
     */
    public Map<String, Set<String>> forwardSnapshot() {
        return snapshot(refersTo, referredFrom.keySet());
    }

    /**
     * Snapshot of {@code referredFrom}, the inverse of {@link #forwardSnapshot()}.
     */
    public Map<String, Set<String>> reverseSnapshot() {
        return snapshot(referredFrom, refersTo.keySet());
    }

    private static Mark markOf(Map<CellId, Mark> marks, CellId cell) {
        return marks.getOrDefault(cell, Mark.UNVISITED);
    }

    private static Map<String, Set<String>> snapshot(Map<CellId, Set<CellId>> adjacency, Set<CellId> otherEnds) {
        Map<CellId, Set<String>> sorted = new TreeMap<>();
        for (CellId cell : otherEnds) {
            sorted.put(cell, new TreeSet<>());
        }
        for (Map.Entry<CellId, Set<CellId>> entry : adjacency.entrySet()) {
            Set<String> targets = sorted.computeIfAbsent(entry.getKey(), k -> new TreeSet<>());
            for (CellId target : entry.getValue()) {
                targets.add(target.toString());
            }
        }
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (Map.Entry<CellId, Set<String>> entry : sorted.entrySet()) {
            result.put(entry.getKey().toString(), entry.getValue());
        }
        return result;
    }

    private enum Mark {
        UNVISITED,
        IN_PROGRESS,
        DONE
    }
}
