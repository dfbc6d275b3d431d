package com.depintel.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only dependency graph of one project.
 *
 * <p>The root is the synthetic node {@value #ROOT_ID}; edges run from requiring package to
 * required package. Edges that would have closed a cycle are not part of {@link #edges()}
 * and are listed in {@link #discardedEdges()} instead, so the graph is always acyclic.
 *
 * @param nodes node id to node
 * @param edges node id (or root id) to ids of its children
 * @param discardedEdges back-edges dropped to keep the graph acyclic
 * @param maxDepth maximum expansion depth used when building
 */
public record DependencyGraph(
    Map<String, DependencyNode> nodes,
    Map<String, Set<String>> edges,
    List<Edge> discardedEdges,
    int maxDepth
) {
    /** Id of the synthetic project root. */
    public static final String ROOT_ID = "project";

    private static final Comparator<DependencyNode> BY_NAME =
        Comparator.comparing(DependencyNode::name).thenComparing(DependencyNode::ecosystem);

    /**
     * Compact constructor with validation.
     */
    public DependencyGraph {
        nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        if (edges == null) {
            edges = Map.of();
        } else {
            Map<String, Set<String>> copy = new LinkedHashMap<>();
            edges.forEach((from, to) -> copy.put(from, Collections.unmodifiableSet(new TreeSet<>(to))));
            edges = Collections.unmodifiableMap(copy);
        }
        discardedEdges = discardedEdges == null ? List.of() : List.copyOf(discardedEdges);
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
    }

    /**
     * Creates an empty graph.
     *
     * @param maxDepth expansion depth the graph would have been built with
     * @return graph with no nodes
     */
    public static DependencyGraph empty(int maxDepth) {
        return new DependencyGraph(Map.of(), Map.of(), List.of(), maxDepth);
    }

    public Optional<DependencyNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @return every node, ordered by name then ecosystem
     */
    public List<DependencyNode> allNodes() {
        return nodes.values().stream().sorted(BY_NAME).toList();
    }

    /**
     * @return depth-0 nodes, ordered by name then ecosystem
     */
    public List<DependencyNode> directDependencies() {
        return nodes.values().stream().filter(DependencyNode::isDirect).sorted(BY_NAME).toList();
    }

    /**
     * @return nodes reachable only through other packages, ordered by name then ecosystem
     */
    public List<DependencyNode> transitiveDependencies() {
        return nodes.values().stream().filter(node -> !node.isDirect()).sorted(BY_NAME).toList();
    }

    /**
     * Returns the ids of a node's immediate children.
     *
     * @param id node id or {@value #ROOT_ID}
     * @return child ids (empty for leaves and unknown ids)
     */
    public Set<String> children(String id) {
        return edges.getOrDefault(id, Set.of());
    }

    /**
     * Returns every node reachable from {@code id}, excluding {@code id} itself.
     *
     * @param id node id
     * @return ids of all descendants
     */
    public Set<String> descendants(String id) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(children(id));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!current.equals(id) && seen.add(current)) {
                queue.addAll(children(current));
            }
        }
        return seen;
    }

    /**
     * Returns the direct dependencies through which a node is reachable.
     *
     * @param id node id
     * @return ids of direct nodes having {@code id} as a descendant
     */
    public Set<String> directAncestors(String id) {
        Set<String> result = new TreeSet<>();
        for (DependencyNode direct : directDependencies()) {
            if (!direct.id().equals(id) && descendants(direct.id()).contains(id)) {
                result.add(direct.id());
            }
        }
        return result;
    }

    /**
     * Returns a shortest chain of node ids from a direct dependency down to {@code id}.
     *
     * @param id target node id
     * @return ids from the direct dependency to the target, empty when unreachable
     */
    public List<String> shortestPathFromRoot(String id) {
        Map<String, String> previous = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(ROOT_ID);
        previous.put(ROOT_ID, null);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(id)) {
                LinkedList<String> path = new LinkedList<>();
                for (String step = id; step != null && !step.equals(ROOT_ID); step = previous.get(step)) {
                    path.addFirst(step);
                }
                return List.copyOf(path);
            }
            for (String child : children(current)) {
                if (!previous.containsKey(child)) {
                    previous.put(child, current);
                    queue.add(child);
                }
            }
        }
        return List.of();
    }

    /**
     * @return count of all edges, including the root edges
     */
    public int edgeCount() {
        return edges.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * @return ecosystem to node count, sorted by ecosystem
     */
    public Map<String, Integer> ecosystemCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        for (DependencyNode node : nodes.values()) {
            counts.merge(node.ecosystem(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Looks up nodes by name across ecosystems.
     *
     * @param name package name
     * @return matching nodes
     */
    public List<DependencyNode> findByName(String name) {
        List<DependencyNode> matches = new ArrayList<>();
        for (DependencyNode node : nodes.values()) {
            if (node.name().equals(name)) {
                matches.add(node);
            }
        }
        matches.sort(BY_NAME);
        return matches;
    }

    /**
     * A directed edge between two node ids.
     *
     * @param from requiring node id
     * @param to required node id
     */
    public record Edge(String from, String to) {
        public Edge {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
        }
    }
}
