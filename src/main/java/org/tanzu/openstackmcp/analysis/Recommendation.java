package org.tanzu.openstackmcp.analysis;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One advisory entry produced by the {@link RecommendationEngine}.
 *
 * The affected identifiers are written under a rule-specific key such as
 * {@code affected_servers} or {@code unused_flavors}; capacity warnings carry none.
 */
@JsonPropertyOrder({"type", "resource", "message", "priority"})
public class Recommendation {

    private final RecommendationType type;
    private final String resource;
    private final String message;
    private final Priority priority;
    private final String affectedKey;
    private final List<String> affected;

    public Recommendation(RecommendationType type, String resource, String message, Priority priority) {
        this(type, resource, message, priority, null, null);
    }

    public Recommendation(RecommendationType type, String resource, String message, Priority priority,
                          String affectedKey, List<String> affected) {
        this.type = type;
        this.resource = resource;
        this.message = message;
        this.priority = priority;
        this.affectedKey = affectedKey;
        this.affected = affected == null ? null : Collections.unmodifiableList(affected);
    }

    public RecommendationType getType() { return type; }
    public String getResource() { return resource; }
    public String getMessage() { return message; }
    public Priority getPriority() { return priority; }

    @JsonIgnore
    public String getAffectedKey() { return affectedKey; }

    @JsonIgnore
    public List<String> getAffected() { return affected == null ? Collections.emptyList() : affected; }

    @JsonAnyGetter
    Map<String, Object> affectedEntry() {
        return affectedKey == null || affected == null
            ? Collections.emptyMap()
            : Collections.singletonMap(affectedKey, affected);
    }

    @Override
    public String toString() {
        return priority + " " + type + " [" + resource + "]: " + message;
    }
}
