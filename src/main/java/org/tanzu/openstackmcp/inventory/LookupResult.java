package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.tanzu.openstackmcp.openstack.ResourceKind;

/**
 * Result of looking up a single resource by id.
 *
 * An unknown id is an ordinary {@link Status#NOT_FOUND} result; {@link Status#UNAVAILABLE}
 * means the service could not answer.
 *
 * @param <T> the record type
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LookupResult<T> {

    public enum Status {
        FOUND, NOT_FOUND, UNAVAILABLE;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }

    private final Status status;
    private final String resourceType;
    private final String id;
    private final T resource;
    private final String message;

    private LookupResult(Status status, ResourceKind kind, String id, T resource, String message) {
        this.status = status;
        this.resourceType = kind.getDetailKey() != null ? kind.getDetailKey() : kind.getLabel();
        this.id = id;
        this.resource = resource;
        this.message = message;
    }

    public static <T> LookupResult<T> found(ResourceKind kind, String id, T resource) {
        return new LookupResult<>(Status.FOUND, kind, id, resource, null);
    }

    public static <T> LookupResult<T> notFound(ResourceKind kind, String id) {
        return new LookupResult<>(Status.NOT_FOUND, kind, id, null,
            "No " + kind.getDetailKey() + " found with id " + id);
    }

    public static <T> LookupResult<T> unavailable(ResourceKind kind, String id, String message) {
        return new LookupResult<>(Status.UNAVAILABLE, kind, id, null, message);
    }

    public Status getStatus() { return status; }
    public String getResourceType() { return resourceType; }
    public String getId() { return id; }
    public T getResource() { return resource; }
    public String getMessage() { return message; }

    @JsonIgnore
    public boolean isFound() {
        return status == Status.FOUND;
    }
}
