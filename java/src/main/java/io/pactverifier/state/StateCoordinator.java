package io.pactverifier.state;

import io.pactverifier.Action;
import io.pactverifier.ErrorCode;
import io.pactverifier.VerifierException;
import io.pactverifier.provider.ProviderInvoker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Runs fixture callbacks around each interaction: the global setup/teardown pair for every interaction, and the
 * registered pair for the interaction's provider state when there is one.
 *
 * <p>
 * Setup order is global then state; teardown order is state then global. A failing setup rolls back whatever part
 * already succeeded and is reported to the caller, which must then skip both the request and {@link #teardown}.
 * </p>
 *
 * <p>
 * Registration happens before a run starts. The coordinator is not safe for concurrent runs.
 * </p>
 */
public final class StateCoordinator {

    private static final Logger LOGGER = Logger.getLogger(StateCoordinator.class.getName());

    private final Action globalSetup;
    private final Action globalTeardown;
    private final Map<String, StateAction> stateActions = new LinkedHashMap<>();
    private ProviderInvoker provider;

    public StateCoordinator(Action globalSetup, Action globalTeardown) {
        this.globalSetup = globalSetup;
        this.globalTeardown = globalTeardown;
    }

    /**
     * Registers the callbacks for a provider state. Empty labels are ignored so that registration can be chained
     * without validation; a repeated label replaces the earlier registration.
     */
    public void register(String state, Action setup, Action teardown) {
        if (state == null || state.isEmpty()) {
            return;
        }
        stateActions.put(state, new StateAction(setup, teardown));
    }

    public Map<String, StateAction> stateActions() {
        return Collections.unmodifiableMap(stateActions);
    }

    public boolean hasAction(String state) {
        return state != null && stateActions.containsKey(state);
    }

    /**
     * Binds the provider the interactions are replayed against.
     */
    public void bind(ProviderInvoker provider) {
        this.provider = provider;
    }

    public ProviderInvoker provider() {
        return provider;
    }

    /**
     * Checked once per run, before any interaction is processed.
     *
     * @throws VerifierException {@link ErrorCode#PROVIDER_NOT_CONFIGURED} when there is nothing to invoke.
     */
    public void canValidate() throws VerifierException {
        if (provider == null || provider.httpClient() == null || provider.baseUrl() == null) {
            throw new VerifierException(ErrorCode.PROVIDER_NOT_CONFIGURED,
                "Provider http client and base url must be set, please provide valid values using ServiceProvider function.");
        }
    }

    /**
     * @throws VerifierException {@link ErrorCode#SETUP_FAILED}; any part of the setup that had already run has been
     *                           torn down again.
     */
    public void setup(String state) throws VerifierException {
        try {
            run(globalSetup);
        } catch (Exception ex) {
            throw new VerifierException(ErrorCode.SETUP_FAILED, "setup failed: " + describe(ex), ex);
        }

        StateAction action = lookup(state);
        if (action == null) {
            return;
        }
        LOGGER.fine(() -> "[pact-verifier] running setup for provider state '" + state + "'");
        try {
            run(action.setup());
        } catch (Exception ex) {
            VerifierException failure = new VerifierException(ErrorCode.SETUP_FAILED,
                "setup for provider state '" + state + "' failed: " + describe(ex), ex);
            try {
                run(globalTeardown);
            } catch (Exception rollback) {
                failure.addSuppressed(rollback);
            }
            throw failure;
        }
    }

    /**
     * Runs both teardown stages even when the first one fails.
     *
     * @throws VerifierException {@link ErrorCode#TEARDOWN_FAILED} for the first failing stage.
     */
    public void teardown(String state) throws VerifierException {
        VerifierException failure = null;

        StateAction action = lookup(state);
        if (action != null) {
            LOGGER.fine(() -> "[pact-verifier] running teardown for provider state '" + state + "'");
            try {
                run(action.teardown());
            } catch (Exception ex) {
                failure = new VerifierException(ErrorCode.TEARDOWN_FAILED,
                    "teardown for provider state '" + state + "' failed: " + describe(ex), ex);
            }
        }

        try {
            run(globalTeardown);
        } catch (Exception ex) {
            if (failure == null) {
                failure = new VerifierException(ErrorCode.TEARDOWN_FAILED, "teardown failed: " + describe(ex), ex);
            } else {
                failure.addSuppressed(ex);
            }
        }

        if (failure != null) {
            throw failure;
        }
    }

    private StateAction lookup(String state) {
        if (state == null || state.isEmpty()) {
            return null;
        }
        StateAction action = stateActions.get(state);
        if (action == null) {
            LOGGER.fine(() -> "[pact-verifier] no action registered for provider state '" + state + "'");
        }
        return action;
    }

    private static void run(Action action) throws Exception {
        if (action != null) {
            action.run();
        }
    }

    private static String describe(Exception ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
