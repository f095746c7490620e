package com.spreadsheet.formula.graph;

import java.util.*;

/**
 * Two adjacency maps tracking formula references between cells:
 * - precedents: "cell" -> cells its formula reads
 * - dependents: "cell" -> cells whose formulas read it
 * The maps always mirror each other. Not thread-safe: owned by one engine.
 */
public class DependencyGraph {

    // Forward adjacency: "formulaCell" -> setOfCellsReferenced
    private final Map<String, Set<String>> precedents = new HashMap<>();
    // Reverse adjacency: "referencedCell" -> setOfCellsThatReferenceIt
    private final Map<String, Set<String>> dependents = new HashMap<>();

    /**
     * Replaces the precedents of {@code cellId}, adding and removing only the edges
     * that actually changed.
     */
    public void setPrecedents(String cellId, Set<String> newPrecedents) {
        Set<String> old = precedents.getOrDefault(cellId, Collections.emptySet());
        for (String target : old) {
            if (!newPrecedents.contains(target)) {
                removeDependent(target, cellId);
            }
        }
        for (String target : newPrecedents) {
            if (!old.contains(target)) {
                dependents.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(cellId);
            }
        }
        if (newPrecedents.isEmpty()) {
            precedents.remove(cellId);
        } else {
            precedents.put(cellId, new LinkedHashSet<>(newPrecedents));
        }
    }

    /**
     * Removes all outgoing references of {@code cellId}. Cells referencing it keep their edges.
     */
    public void clearPrecedents(String cellId) {
        setPrecedents(cellId, Collections.emptySet());
    }

    public Set<String> getPrecedents(String cellId) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(
                precedents.getOrDefault(cellId, Collections.emptySet())));
    }

    public Set<String> getDependents(String cellId) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(
                dependents.getOrDefault(cellId, Collections.emptySet())));
    }

    /**
     * Plans the recalculation after {@code changed} cells were edited: the changed cells plus
     * everything that transitively depends on them, with cycles split out and the rest
     * topologically ordered (Kahn's algorithm; cycle members count as already resolved).
     */
    public RecalculationPlan planRecalculation(Collection<String> changed) {
        Set<String> affected = collectAffected(changed);
        Set<String> circular = findCycles(affected);

        // in-degree counts only unresolved precedents inside the affected set
        Map<String, Integer> pending = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String cell : affected) {
            if (circular.contains(cell)) {
                continue;
            }
            int count = 0;
            for (String precedent : precedents.getOrDefault(cell, Collections.emptySet())) {
                if (affected.contains(precedent) && !circular.contains(precedent)) {
                    count++;
                }
            }
            pending.put(cell, count);
            if (count == 0) {
                ready.add(cell);
            }
        }

        List<String> order = new ArrayList<>(pending.size());
        while (!ready.isEmpty()) {
            String cell = ready.poll();
            order.add(cell);
            for (String dependent : dependents.getOrDefault(cell, Collections.emptySet())) {
                Integer remaining = pending.get(dependent);
                if (remaining == null) {
                    continue;
                }
                pending.put(dependent, remaining - 1);
                if (remaining - 1 == 0) {
                    ready.add(dependent);
                }
            }
        }
        return new RecalculationPlan(order, circular);
    }

    // Basic getters for the adjacency maps
    public Map<String, Set<String>> getPrecedentGraph() {
        return Collections.unmodifiableMap(precedents);
    }

    public Map<String, Set<String>> getDependentGraph() {
        return Collections.unmodifiableMap(dependents);
    }

    private void removeDependent(String target, String cellId) {
        Set<String> set = dependents.get(target);
        if (set != null) {
            set.remove(cellId);
            if (set.isEmpty()) {
                dependents.remove(target);
            }
        }
    }

    private Set<String> collectAffected(Collection<String> changed) {
        Set<String> affected = new LinkedHashSet<>(changed);
        Deque<String> queue = new ArrayDeque<>(changed);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dependent : dependents.getOrDefault(current, Collections.emptySet())) {
                if (affected.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return affected;
    }

    /**
     * Tarjan's strongly connected components over the precedent edges inside
     * {@code scope}, iterative so long reference chains cannot overflow the stack.
     * Members of a component larger than one cell, and cells that read themselves,
     * are circular.
     */
    private Set<String> findCycles(Set<String> scope) {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        Set<String> circular = new LinkedHashSet<>();
        int counter = 0;

        for (String root : scope) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Iterator<String>> iterators = new ArrayDeque<>();
            Deque<String> path = new ArrayDeque<>();

            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            path.push(root);
            iterators.push(edgesWithin(root, scope));

            while (!path.isEmpty()) {
                String node = path.peek();
                Iterator<String> edges = iterators.peek();
                if (edges.hasNext()) {
                    String next = edges.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        path.push(next);
                        iterators.push(edgesWithin(next, scope));
                    } else if (onStack.contains(next)) {
                        lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                    }
                    continue;
                }

                path.pop();
                iterators.pop();
                if (!path.isEmpty()) {
                    String parent = path.peek();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(node)));
                }
                if (lowLink.get(node).equals(index.get(node))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(node));
                    if (component.size() > 1 || readsItself(node)) {
                        circular.addAll(component);
                    }
                }
            }
        }
        return circular;
    }

    private Iterator<String> edgesWithin(String cell, Set<String> scope) {
        List<String> edges = new ArrayList<>();
        for (String precedent : precedents.getOrDefault(cell, Collections.emptySet())) {
            if (scope.contains(precedent)) {
                edges.add(precedent);
            }
        }
        return edges.iterator();
    }

    private boolean readsItself(String cell) {
        return precedents.getOrDefault(cell, Collections.emptySet()).contains(cell);
    }
}
