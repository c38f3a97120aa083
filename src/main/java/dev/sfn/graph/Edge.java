package dev.sfn.graph;

/**
 * Directed edge between two node ids of a {@link StateGraph}.
 */
public record Edge(int from, int to, EdgeAttrs attrs) {

    public boolean isNext() {
        return attrs instanceof EdgeAttrs.Next;
    }
}
