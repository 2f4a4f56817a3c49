package io.pactverifier;

import java.net.URI;
import java.net.http.HttpClient;

/**
 * Verifies that a provider honours the interactions a consumer recorded in a pact.
 *
 * <p>
 * Configuration calls can be chained in any order; nothing is validated until {@link #verify()} or
 * {@link #verifyState(String, String)} runs, so the same verifier can be reused with different filters.
 * </p>
 */
public interface Verifier {

    /**
     * Registers callbacks run before and after every interaction recorded with the given provider state.
     * An empty state is ignored; registering the same state again replaces the earlier callbacks.
     */
    Verifier providerState(String state, Action setup, Action teardown);

    /**
     * Names the provider and tells the verifier how to reach it.
     */
    Verifier serviceProvider(String providerName, HttpClient httpClient, URI baseUrl);

    /**
     * Names the consumer whose pact is being honoured.
     */
    Verifier honoursPactWith(String consumerName);

    /**
     * Sets where the pact is read from: a local path, a {@code file:} URI or an {@code http(s)} URL.
     *
     * @param config basic-auth credentials for remote pacts; {@code null} means none.
     */
    Verifier pactUri(String uri, PactUriConfig config);

    default Verifier pactUri(String uri) {
        return pactUri(uri, null);
    }

    /**
     * Verifies every interaction in the pact.
     */
    VerificationResult verify() throws VerifierException;

    /**
     * Verifies the interactions matching the description and/or provider state. Empty values do not filter.
     *
     * @throws VerificationFailedException when any selected interaction failed.
     * @throws VerifierException           for configuration, source or selection errors, before any provider call.
     */
    VerificationResult verifyState(String description, String state) throws VerifierException;
}
