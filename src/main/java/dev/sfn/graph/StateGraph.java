package dev.sfn.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * The states and transitions of one function, before serialization.
 * <p>
 * Nodes live in an arena and are addressed by stable integer ids; removing a node leaves
 * its slot empty so other ids stay valid. Edges are kept in insertion order and never
 * duplicated.
 * <p>
 * Graphs inlined into one state machine (Parallel branches, Map iterators) share a name
 * registry, so state names stay unique across the whole definition.
 */
public final class StateGraph {

    public static final int NO_START = -1;

    private final List<StateNode> nodes = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final Set<String> usedNames;
    private Set<Edge> edges = new LinkedHashSet<>();
    private int start = NO_START;

    public StateGraph() {
        this(new HashSet<>());
    }

    /**
     * @param usedNames names already taken elsewhere in the same state machine; updated as states are added
     */
    public StateGraph(Set<String> usedNames) {
        this.usedNames = usedNames;
    }

    /**
     * Add a node and return its id. The node is named after its type and origin position.
     */
    public int add(StateNode node) {
        var position = node.origin().position();
        String base = "%s (%d:%d)".formatted(node.type(), position.line(), position.column());
        String name = base;
        for (int n = 2; usedNames.contains(name); n++) {
            name = base + " #" + n;
        }
        usedNames.add(name);
        nodes.add(node);
        names.add(name);
        return nodes.size() - 1;
    }

    public void connect(int from, int to, EdgeAttrs attrs) {
        requireLive(from);
        requireLive(to);
        edges.add(new Edge(from, to, attrs));
    }

    /**
     * Replace the whole edge set.
     */
    public void replaceEdges(Collection<Edge> replacement) {
        for (Edge edge : replacement) {
            requireLive(edge.from());
            requireLive(edge.to());
        }
        edges = new LinkedHashSet<>(replacement);
    }

    /**
     * Remove a node that no edge refers to any more.
     */
    public void remove(int id) {
        requireLive(id);
        for (Edge edge : edges) {
            if (edge.from() == id || edge.to() == id) {
                throw new IllegalStateException("Cannot remove " + names.get(id) + ": it still has edges");
            }
        }
        nodes.set(id, null);
        if (start == id) {
            start = NO_START;
        }
    }

    public StateNode node(int id) {
        requireLive(id);
        return nodes.get(id);
    }

    public String name(int id) {
        requireLive(id);
        return names.get(id);
    }

    public boolean contains(int id) {
        return id >= 0 && id < nodes.size() && nodes.get(id) != null;
    }

    /** Live node ids in creation order, which follows source order. */
    public List<Integer> ids() {
        return IntStream.range(0, nodes.size()).filter(this::contains).boxed().toList();
    }

    public int size() {
        return (int) nodes.stream().filter(n -> n != null).count();
    }

    public Set<Edge> edges() {
        return Collections.unmodifiableSet(edges);
    }

    public List<Edge> outgoing(int id) {
        return edges.stream().filter(e -> e.from() == id).toList();
    }

    public List<Edge> incoming(int id) {
        return edges.stream().filter(e -> e.to() == id).toList();
    }

    public int start() {
        return start;
    }

    public void setStart(int id) {
        requireLive(id);
        this.start = id;
    }

    private void requireLive(int id) {
        if (!contains(id)) {
            throw new IllegalArgumentException("No state with id " + id);
        }
    }
}
