package io.pactverifier;

import io.pactverifier.model.Interaction;

import java.util.ArrayList;
import java.util.List;

/**
 * Narrows a pact's interactions down to those a run should verify.
 */
public final class InteractionSelector {

    static final String NO_MATCHES_MESSAGE =
        "The specified description and/or providerState filter yielded no interactions.";

    private InteractionSelector() {
    }

    /**
     * Keeps the interactions whose description equals {@code description} and whose provider state equals
     * {@code state}. A {@code null} or empty filter does not restrict its dimension. Document order is preserved.
     *
     * @throws VerifierException {@link ErrorCode#NO_MATCHING_INTERACTIONS} when a filter was given and nothing matched.
     */
    public static List<Interaction> select(List<Interaction> interactions, String description, String state)
        throws VerifierException {
        boolean byDescription = description != null && !description.isEmpty();
        boolean byState = state != null && !state.isEmpty();
        List<Interaction> source = interactions == null ? List.of() : interactions;
        if (!byDescription && !byState) {
            return List.copyOf(source);
        }

        List<Interaction> selected = new ArrayList<>();
        for (Interaction interaction : source) {
            if (byDescription && !description.equals(interaction.description())) {
                continue;
            }
            if (byState && !state.equals(interaction.providerState())) {
                continue;
            }
            selected.add(interaction);
        }

        if (selected.isEmpty()) {
            throw new VerifierException(ErrorCode.NO_MATCHING_INTERACTIONS, NO_MATCHES_MESSAGE);
        }
        return List.copyOf(selected);
    }
}
