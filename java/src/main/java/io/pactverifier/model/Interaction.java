package io.pactverifier.model;

/**
 * One recorded request/response pair. Descriptions are not required to be unique.
 */
public record Interaction(
    String description,
    String providerState,
    ExpectedRequest request,
    ExpectedResponse response
) {
    public boolean hasProviderState() {
        return providerState != null && !providerState.isEmpty();
    }

    /**
     * Short label used in logs and reports.
     */
    public String label() {
        if (hasProviderState()) {
            return "'" + description + "' given '" + providerState + "'";
        }
        return "'" + description + "'";
    }
}
