package eu.virtualparadox.incidentkb.knowledge.context;

import java.util.List;

public record CitedContext(String text, List<Citation> citations) {

    public static final CitedContext EMPTY = new CitedContext("", List.of());

    public CitedContext {
        citations = List.copyOf(citations);
    }
}
