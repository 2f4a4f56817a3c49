package io.pactverifier.state;

import io.pactverifier.Action;

/**
 * Setup and teardown callbacks for one provider state. Either callback may be {@code null}.
 */
public record StateAction(Action setup, Action teardown) {
}
