package org.tanzu.openstackmcp.inventory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.tanzu.openstackmcp.openstack.ResourceKind;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of fetching one resource collection: either the normalized records or a
 * diagnostic explaining why there are none.
 *
 * This is also the result of the listing tools, where it serializes as
 * {@code resource_type}, {@code count}, {@code records} and, on failure, {@code diagnostic}.
 *
 * @param <T> the record type of the collection
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"resource_type", "count", "records", "diagnostic"})
public final class FetchResult<T> {
    private final ResourceKind kind;
    private final List<T> records;
    private final Diagnostic diagnostic;

    private FetchResult(ResourceKind kind, List<T> records, Diagnostic diagnostic) {
        this.kind = kind;
        this.records = records;
        this.diagnostic = diagnostic;
    }

    public static <T> FetchResult<T> success(ResourceKind kind, List<T> records) {
        return new FetchResult<>(kind, Collections.unmodifiableList(records), null);
    }

    public static <T> FetchResult<T> failure(ResourceKind kind, String message) {
        return new FetchResult<>(kind, Collections.emptyList(), new Diagnostic(kind.getLabel(), message));
    }

    @JsonIgnore
    public ResourceKind getKind() { return kind; }

    public String getResourceType() { return kind.getLabel(); }

    public int getCount() { return records.size(); }

    /** The records, empty on failure. */
    public List<T> getRecords() { return records; }

    /** Null on success. */
    public Diagnostic getDiagnostic() { return diagnostic; }

    @JsonIgnore
    public boolean isSuccess() {
        return diagnostic == null;
    }
}
