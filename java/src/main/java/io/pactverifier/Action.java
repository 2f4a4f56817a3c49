package io.pactverifier;

/**
 * A side-effecting callback run around an interaction, typically to arrange or clean up provider fixtures.
 */
@FunctionalInterface
public interface Action {

    void run() throws Exception;
}
