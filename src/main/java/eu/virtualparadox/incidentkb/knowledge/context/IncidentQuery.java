package eu.virtualparadox.incidentkb.knowledge.context;

/**
 * The parts of an incident report used to look up knowledge.
 *
 * @param title           incident title
 * @param description     free-text description
 * @param initialCategory category suggested by the reporter, may be {@code null}
 */
public record IncidentQuery(String title, String description, String initialCategory) {
}
