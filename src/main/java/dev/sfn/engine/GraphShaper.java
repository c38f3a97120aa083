package dev.sfn.engine;

import dev.sfn.graph.Edge;
import dev.sfn.graph.StateGraph;
import dev.sfn.graph.StateNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Removes the placeholder Pass states that {@code pass} statements leave in a raw graph.
 * <p>
 * A placeholder with outgoing edges is elided: every incoming edge is redirected to each
 * of its successors, keeping the incoming edge's attributes (a branch condition or a
 * catcher). A placeholder without outgoing edges is the terminal state of its branch and
 * is kept. Elision repeats until no elidable placeholder remains, so chains of
 * placeholders collapse into a single edge.
 */
public final class GraphShaper {

    private static final Logger log = LoggerFactory.getLogger(GraphShaper.class);

    private GraphShaper() {}

    /**
     * Shape {@code graph} in place.
     *
     * @return the number of states removed
     */
    public static int shape(StateGraph graph) {
        int removed = 0;
        Optional<Integer> elidable;
        while ((elidable = nextElidable(graph)).isPresent()) {
            elide(graph, elidable.get());
            removed++;
        }
        return removed;
    }

    public static boolean isElidable(StateGraph graph, int id) {
        return graph.node(id) instanceof StateNode.PassState pass
            && pass.isPlaceholder()
            && !graph.outgoing(id).isEmpty();
    }

    private static Optional<Integer> nextElidable(StateGraph graph) {
        return graph.ids().stream().filter(id -> isElidable(graph, id)).findFirst();
    }

    private static void elide(StateGraph graph, int id) {
        List<Edge> outgoing = graph.outgoing(id);
        List<Edge> incoming = graph.incoming(id);
        log.trace("Eliding {}: {} incoming, {} outgoing", graph.name(id), incoming.size(), outgoing.size());

        Set<Edge> rewired = new LinkedHashSet<>();
        for (Edge edge : graph.edges()) {
            if (edge.to() == id) {
                for (Edge out : outgoing) {
                    rewired.add(new Edge(edge.from(), out.to(), edge.attrs()));
                }
            } else if (edge.from() != id) {
                rewired.add(edge);
            }
        }

        if (graph.start() == id) {
            if (outgoing.size() != 1) {
                throw new IllegalStateException(
                    "Start state " + graph.name(id) + " has " + outgoing.size() + " successors");
            }
            graph.setStart(outgoing.get(0).to());
        }
        graph.replaceEdges(rewired);
        graph.remove(id);
    }
}
