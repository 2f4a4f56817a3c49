package io.pactverifier;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.pactverifier.model.Interaction;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of verifying a single interaction.
 *
 * @param description interaction description.
 * @param providerState provider state label, or {@code null}.
 * @param failure     first failure recorded, or {@code null} when the interaction passed.
 * @param mismatches  every response mismatch found; empty unless the response was compared.
 * @param errors      setup, transport and teardown error messages, in the order they happened.
 */
public record InteractionVerdict(
    String description,
    String providerState,
    ErrorCode failure,
    List<Mismatch> mismatches,
    List<String> errors
) {
    public InteractionVerdict {
        mismatches = mismatches == null ? List.of() : List.copyOf(mismatches);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static InteractionVerdict compared(Interaction interaction, List<Mismatch> mismatches) {
        ErrorCode failure = mismatches == null || mismatches.isEmpty() ? null : ErrorCode.MISMATCH_FOUND;
        return new InteractionVerdict(interaction.description(), interaction.providerState(), failure, mismatches, List.of());
    }

    public static InteractionVerdict failed(Interaction interaction, ErrorCode failure, String error) {
        return new InteractionVerdict(interaction.description(), interaction.providerState(), failure, List.of(), List.of(error));
    }

    /**
     * Records a teardown failure. An earlier failure keeps precedence; the teardown error is appended either way.
     */
    public InteractionVerdict withTeardownFailure(String error) {
        List<String> allErrors = new ArrayList<>(errors);
        allErrors.add(error);
        ErrorCode resolved = failure == null ? ErrorCode.TEARDOWN_FAILED : failure;
        return new InteractionVerdict(description, providerState, resolved, mismatches, allErrors);
    }

    @JsonProperty("matched")
    public boolean matched() {
        return failure == null;
    }
}
