package org.tanzu.openstackmcp.inventory;

/**
 * Why one resource collection is missing from a snapshot.
 */
public class Diagnostic {
    private final String resource;
    private final String message;

    public Diagnostic(String resource, String message) {
        this.resource = resource;
        this.message = message;
    }

    public String getResource() { return resource; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return resource + ": " + message;
    }
}
