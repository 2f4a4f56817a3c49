package io.pactverifier;

import io.pactverifier.matching.ResponseMatcher;
import io.pactverifier.model.Interaction;
import io.pactverifier.model.PactDocument;
import io.pactverifier.provider.ProviderInvoker;
import io.pactverifier.provider.ProviderResponse;
import io.pactverifier.source.PactSources;
import io.pactverifier.state.StateCoordinator;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * <p>
 * Default {@link Verifier}. A run validates the configuration, fetches and validates the pact, applies the filters and
 * then replays the selected interactions one at a time, in document order:
 * </p>
 *
 * <ol>
 *   <li>global setup, then the setup registered for the interaction's provider state (if any);</li>
 *   <li>the recorded request, sent once to the provider;</li>
 *   <li>comparison of the actual response with the recorded one;</li>
 *   <li>state teardown, then global teardown; skipped only when setup failed.</li>
 * </ol>
 *
 * <p>
 * Configuration, source and selection errors abort the run before the provider is contacted. Interaction failures
 * are collected, logged, and reported together as a {@link VerificationFailedException} once every interaction has
 * been attempted.
 * </p>
 *
 * <p>
 * Instances are not thread-safe. Configure a verifier before running it and do not run it concurrently.
 * </p>
 */
public final class PactVerifier implements Verifier {

    static final String EMPTY_PROVIDER_MESSAGE =
        "Provider name cannot be empty, please provide a valid value using ServiceProvider function.";
    static final String EMPTY_CONSUMER_MESSAGE =
        "Consumer name cannot be empty, please provide a valid value using HonoursPactWith function.";

    private final VerifierConfig config;
    private final Logger logger;
    private final StateCoordinator coordinator;
    private final ResponseMatcher matcher = new ResponseMatcher();

    private String provider;
    private String consumer;
    private String pactUri;
    private PactUriConfig pactUriConfig = PactUriConfig.NONE;

    public PactVerifier() {
        this(null, null, null);
    }

    public PactVerifier(VerifierConfig config) {
        this(null, null, config);
    }

    /**
     * @param setup    run before every interaction, ahead of any provider state setup; may be {@code null}.
     * @param teardown run after every interaction, after any provider state teardown; may be {@code null}.
     * @param config   verifier settings; {@code null} applies the defaults.
     */
    public PactVerifier(Action setup, Action teardown, VerifierConfig config) {
        this.config = config == null ? VerifierConfig.defaults() : config.withDefaults();
        this.logger = this.config.getLogger();
        this.coordinator = new StateCoordinator(setup, teardown);
    }

    @Override
    public Verifier serviceProvider(String providerName, HttpClient httpClient, URI baseUrl) {
        this.provider = providerName;
        coordinator.bind(new ProviderInvoker(httpClient, baseUrl, config.getHttpTimeout()));
        return this;
    }

    @Override
    public Verifier providerState(String state, Action setup, Action teardown) {
        coordinator.register(state, setup, teardown);
        return this;
    }

    @Override
    public Verifier honoursPactWith(String consumerName) {
        this.consumer = consumerName;
        return this;
    }

    @Override
    public Verifier pactUri(String uri, PactUriConfig config) {
        this.pactUri = uri;
        this.pactUriConfig = config == null ? PactUriConfig.NONE : config;
        return this;
    }

    @Override
    public VerificationResult verify() throws VerifierException {
        return verifyState("", "");
    }

    @Override
    public VerificationResult verifyState(String description, String state) throws VerifierException {
        Instant startedAt = Instant.now();
        verifyInternalState();
        logger.info(() -> String.format(Locale.ROOT,
            "[pact-verifier] verifying pact between %s and %s from %s (description: %s, state: %s)",
            consumer, provider, pactUri, filterLabel(description), filterLabel(state)));

        PactDocument document = PactSources.fetch(pactUri, pactUriConfig, config);
        logger.info(() -> String.format(Locale.ROOT,
            "[pact-verifier] loaded pact between %s and %s with %d interactions",
            document.consumer(), document.provider(), document.interactions().size()));
        if (!consumer.equals(document.consumer()) || !provider.equals(document.provider())) {
            logger.warning(() -> String.format(Locale.ROOT,
                "[pact-verifier] pact is between %s and %s but verifier is configured for %s and %s",
                document.consumer(), document.provider(), consumer, provider));
        }

        PactDocument selected = document.withInteractions(
            InteractionSelector.select(document.interactions(), description, state));

        List<InteractionVerdict> verdicts = new ArrayList<>(selected.interactions().size());
        for (Interaction interaction : selected.interactions()) {
            verdicts.add(verifyInteraction(interaction));
        }

        VerificationResult result = new VerificationResult(
            selected.consumer(), selected.provider(), startedAt, Instant.now(), verdicts);
        logSummary(result);
        if (!result.success()) {
            throw new VerificationFailedException(result);
        }
        return result;
    }

    private void verifyInternalState() throws VerifierException {
        if (consumer == null || consumer.isEmpty()) {
            throw new VerifierException(ErrorCode.EMPTY_CONSUMER, EMPTY_CONSUMER_MESSAGE);
        }
        if (provider == null || provider.isEmpty()) {
            throw new VerifierException(ErrorCode.EMPTY_PROVIDER, EMPTY_PROVIDER_MESSAGE);
        }
        coordinator.canValidate();
    }

    private static String filterLabel(String filter) {
        return filter == null || filter.isEmpty() ? "any" : "'" + filter + "'";
    }

    private InteractionVerdict verifyInteraction(Interaction interaction) {
        logger.info(() -> "[pact-verifier] verifying " + interaction.label());
        String state = interaction.providerState();

        try {
            coordinator.setup(state);
        } catch (VerifierException ex) {
            InteractionVerdict verdict = InteractionVerdict.failed(interaction, ex.getCode(), ex.getMessage());
            logVerdict(interaction, verdict);
            return verdict;
        }

        InteractionVerdict verdict = null;
        try {
            verdict = replay(interaction);
        } finally {
            try {
                coordinator.teardown(state);
            } catch (VerifierException ex) {
                if (verdict != null) {
                    verdict = verdict.withTeardownFailure(ex.getMessage());
                } else {
                    logger.warning(() -> "[pact-verifier] " + ex.getMessage());
                }
            }
        }
        logVerdict(interaction, verdict);
        return verdict;
    }

    private InteractionVerdict replay(Interaction interaction) {
        ProviderResponse response;
        try {
            response = coordinator.provider().invoke(interaction.request());
        } catch (VerifierException ex) {
            return InteractionVerdict.failed(interaction, ex.getCode(), ex.getMessage());
        }
        return matcher.match(interaction, response);
    }

    private void logVerdict(Interaction interaction, InteractionVerdict verdict) {
        if (verdict.matched()) {
            logger.info(() -> "[pact-verifier] " + interaction.label() + " passed");
            return;
        }
        logger.warning(() -> "[pact-verifier] " + interaction.label() + " failed (" + verdict.failure() + ")");
        for (String error : verdict.errors()) {
            logger.warning(() -> "[pact-verifier]   " + error);
        }
        for (Mismatch mismatch : verdict.mismatches()) {
            logger.warning(() -> "[pact-verifier]   " + mismatch);
        }
    }

    private void logSummary(VerificationResult result) {
        int failed = result.failures().size();
        logger.info(() -> String.format(Locale.ROOT,
            "[pact-verifier] verified %d interactions between %s and %s: %d passed, %d failed",
            result.verdicts().size(), result.consumer(), result.provider(),
            result.verdicts().size() - failed, failed));
    }
}
