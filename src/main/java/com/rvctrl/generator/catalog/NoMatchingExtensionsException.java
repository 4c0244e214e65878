package com.rvctrl.generator.catalog;

import java.util.Set;

/**
 * None of the requested extension tags is known to the catalog.
 */
public class NoMatchingExtensionsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Set<String> requested;
    private final Set<String> available;

    public NoMatchingExtensionsException(Set<String> requested, Set<String> available) {
        super("No valid extensions in " + String.join(", ", requested)
                + ". Available extensions: " + String.join(", ", available));
        this.requested = Set.copyOf(requested);
        this.available = Set.copyOf(available);
    }

    public Set<String> getRequested() {
        return requested;
    }

    public Set<String> getAvailable() {
        return available;
    }
}
