package org.tanzu.openstackmcp.inventory;

/**
 * Fields shared by every normalized resource.
 */
public interface ResourceRecord {

    /** Unique within the resource kind; {@code null} when the service omitted it. */
    String getId();

    /** Display name; may be {@code null} or empty. */
    String getName();

    /**
     * Name for human-facing lists, falling back to the id when the resource is unnamed
     * and to {@value ResourceNormalizer#UNKNOWN_STATUS} when it has neither.
     */
    static String displayName(ResourceRecord resource) {
        String name = resource.getName();
        if (name != null && !name.isBlank()) {
            return name;
        }
        String id = resource.getId();
        return id == null || id.isBlank() ? ResourceNormalizer.UNKNOWN_STATUS : id;
    }
}
