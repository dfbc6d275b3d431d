package com.depintel.core.graph;

import com.depintel.core.config.EngineConfig;
import com.depintel.core.exception.UnresolvedDependencyException;
import com.depintel.core.metadata.MetadataProvider;
import com.depintel.core.model.DeclaredDependency;
import com.depintel.core.model.DependencyGraph;
import com.depintel.core.model.DependencyGraph.Edge;
import com.depintel.core.model.DependencyNode;
import com.depintel.core.model.PackageMetadata;
import com.depintel.core.model.ReleaseRecord;
import com.depintel.core.model.UsageSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link DependencyGraph} from a flat list of declared dependencies.
 *
 * <p>Expansion is breadth-first, so the first time a package is reached is along a shortest
 * path and its depth is final. Requirements of a node are expanded while its depth is below
 * the configured maximum. A package requested again merges into the existing node: the
 * requesting parent and constraint are added to its version-usage set. An edge that would
 * close a cycle is discarded; the edge seen first stays.
 *
 * <p>In strict mode a declared dependency without a latest version and without license
 * information fails the build with {@link UnresolvedDependencyException}. In lenient mode it
 * is kept with whatever metadata exists. Transitive lookups are always lenient.
 *
 * <p>Instances are immutable and can be shared between threads.
 */
public final class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final int maxDepth;
    private final boolean allowPartialMetadata;

    /**
     * Creates a builder.
     *
     * @param maxDepth deepest level expanded into (direct = 0)
     * @param allowPartialMetadata keep unresolvable direct dependencies instead of failing
     */
    public DependencyGraphBuilder(int maxDepth, boolean allowPartialMetadata) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.allowPartialMetadata = allowPartialMetadata;
    }

    /**
     * Creates a builder from the graph section of the engine configuration.
     *
     * @param settings graph settings
     * @return builder
     */
    public static DependencyGraphBuilder fromConfig(EngineConfig.GraphSettings settings) {
        return new DependencyGraphBuilder(settings.maxDepth(), settings.allowPartialMetadata());
    }

    /**
     * Returns a copy of this builder with a different metadata policy.
     *
     * @param allowPartial keep unresolvable direct dependencies instead of failing
     * @return builder
     */
    public DependencyGraphBuilder withPartialMetadata(boolean allowPartial) {
        return new DependencyGraphBuilder(maxDepth, allowPartial);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Builds the graph.
     *
     * @param declared declared dependencies in manifest order
     * @param provider metadata source
     * @return immutable graph
     * @throws UnresolvedDependencyException in strict mode, for an unresolvable declared dependency
     */
    public DependencyGraph build(List<DeclaredDependency> declared, MetadataProvider provider) {
        Objects.requireNonNull(declared, "declared must not be null");
        Objects.requireNonNull(provider, "provider must not be null");

        Map<String, Draft> drafts = new LinkedHashMap<>();
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        List<Edge> discarded = new ArrayList<>();
        Deque<Draft> queue = new ArrayDeque<>();

        for (DeclaredDependency dependency : declared) {
            String id = DependencyNode.idOf(dependency.ecosystem(), dependency.name());
            Draft existing = drafts.get(id);
            if (existing != null) {
                existing.requestedBy(DependencyGraph.ROOT_ID, dependency.versionConstraint());
                continue;
            }
            Draft draft = new Draft(dependency.name(), dependency.ecosystem(), dependency.versionConstraint(), 0);
            draft.usage = dependency.usage();
            draft.requestedBy(DependencyGraph.ROOT_ID, dependency.versionConstraint());
            draft.metadata = resolveDirect(dependency, provider);
            draft.releases = provider.versionHistory(dependency.name(), dependency.ecosystem());
            drafts.put(id, draft);
            edges.computeIfAbsent(DependencyGraph.ROOT_ID, k -> new LinkedHashSet<>()).add(id);
            queue.add(draft);
        }

        while (!queue.isEmpty()) {
            Draft current = queue.poll();
            if (current.depth >= maxDepth || current.metadata == null) {
                continue;
            }
            for (Map.Entry<String, String> requirement : current.metadata.requirements().entrySet()) {
                String childId = DependencyNode.idOf(current.ecosystem, requirement.getKey());
                Draft child = drafts.get(childId);
                if (child != null) {
                    if (childId.equals(current.id()) || reaches(edges, childId, current.id())) {
                        log.debug("Discarding back-edge {} -> {} to keep the graph acyclic", current.id(), childId);
                        discarded.add(new Edge(current.id(), childId));
                        continue;
                    }
                    child.requestedBy(current.id(), requirement.getValue());
                } else {
                    child = new Draft(requirement.getKey(), current.ecosystem, requirement.getValue(), current.depth + 1);
                    child.requestedBy(current.id(), requirement.getValue());
                    child.metadata = resolveTransitive(child, provider);
                    child.releases = historyOf(child, provider);
                    drafts.put(childId, child);
                    queue.add(child);
                }
                edges.computeIfAbsent(current.id(), k -> new LinkedHashSet<>()).add(childId);
            }
        }

        Map<String, DependencyNode> nodes = new LinkedHashMap<>();
        drafts.forEach((id, draft) -> nodes.put(id, draft.toNode()));
        log.debug("Built dependency graph: {} nodes ({} direct), {} discarded back-edges",
            nodes.size(), declared.size(), discarded.size());
        return new DependencyGraph(nodes, edges, discarded, maxDepth);
    }

    private PackageMetadata resolveDirect(DeclaredDependency dependency, MetadataProvider provider) {
        Optional<PackageMetadata> metadata = provider.lookup(dependency.name(), dependency.ecosystem());
        if (metadata.isPresent() && metadata.get().isResolved()) {
            return metadata.get();
        }
        if (!allowPartialMetadata) {
            throw new UnresolvedDependencyException(dependency.name(), dependency.ecosystem());
        }
        log.warn("Proceeding with partial metadata for {}:{}", dependency.ecosystem(), dependency.name());
        return metadata.orElse(null);
    }

    private static PackageMetadata resolveTransitive(Draft draft, MetadataProvider provider) {
        try {
            return provider.lookup(draft.name, draft.ecosystem).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Metadata lookup failed for transitive dependency {}: {}", draft.id(), e.getMessage());
            return null;
        }
    }

    private static List<ReleaseRecord> historyOf(Draft draft, MetadataProvider provider) {
        try {
            return provider.versionHistory(draft.name, draft.ecosystem);
        } catch (RuntimeException e) {
            log.warn("Release history lookup failed for transitive dependency {}: {}", draft.id(), e.getMessage());
            return List.of();
        }
    }

    // True when 'to' is reachable from 'from' over the edges added so far.
    private static boolean reaches(Map<String, Set<String>> edges, String from, String to) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        stack.push(from);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(to)) {
                return true;
            }
            if (seen.add(current)) {
                edges.getOrDefault(current, Set.of()).forEach(stack::push);
            }
        }
        return false;
    }

    private static final class Draft {
        private final String name;
        private final String ecosystem;
        private final String constraint;
        private final int depth;
        private final Set<String> parents = new LinkedHashSet<>();
        private final Map<String, Set<String>> versionUsage = new LinkedHashMap<>();
        private UsageSignals usage;
        private PackageMetadata metadata;
        private List<ReleaseRecord> releases = List.of();

        private Draft(String name, String ecosystem, String constraint, int depth) {
            this.name = name;
            this.ecosystem = ecosystem;
            this.constraint = constraint == null || constraint.isBlank() ? "*" : constraint;
            this.depth = depth;
        }

        private String id() {
            return DependencyNode.idOf(ecosystem, name);
        }

        private void requestedBy(String parentId, String requested) {
            String key = requested == null || requested.isBlank() ? "*" : requested.trim();
            parents.add(parentId);
            versionUsage.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(parentId);
        }

        private DependencyNode toNode() {
            return new DependencyNode(name, ecosystem, constraint,
                metadata == null ? null : metadata.latestVersion(),
                depth, parents, versionUsage, usage, metadata, releases);
        }
    }
}
