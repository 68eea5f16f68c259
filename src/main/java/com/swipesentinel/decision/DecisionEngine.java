package com.swipesentinel.decision;

import com.swipesentinel.api.ModelApiGateway;
import com.swipesentinel.api.ModelClient;
import com.swipesentinel.model.ActionPlan;
import com.swipesentinel.model.PacketContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single entry point for decisions, live and replayed.
 *
 * With the deterministic engine every decision is OK. With the model-driven
 * engine a failed call or rejected answer is either reported as ERROR
 * ({@code llm_failure_mode=fail}) or replaced by the deterministic plan and
 * reported as FALLBACK ({@code fallback_deterministic}).
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final DecisionEngineConfig config;
    private final DeterministicPolicy  deterministic;
    private final DecisionPolicy       model;   // null for the deterministic engine

    public DecisionEngine(DecisionEngineConfig config, DeterministicPolicy deterministic, DecisionPolicy model) {
        if (config.isLlm() && model == null) {
            throw new IllegalArgumentException("Model-driven engine requires a model policy");
        }
        this.config        = config;
        this.deterministic = deterministic;
        this.model         = model;
    }

    /** Wires the engine from config, creating a {@link ModelApiGateway} when the model is selected. */
    public static DecisionEngine create(DecisionEngineConfig config, PolicyProfile profile) {
        ModelClient client = config.isLlm()
            ? new ModelApiGateway(config.getBaseUrl(), config.getApiKey(), config.getTimeoutSeconds(),
                                  config.getRetryBackoffMs(), config.isLogPrompts())
            : null;
        return create(config, profile, client);
    }

    public static DecisionEngine create(DecisionEngineConfig config, PolicyProfile profile, ModelClient client) {
        DeterministicPolicy deterministic = new DeterministicPolicy(profile);
        DecisionPolicy model = config.isLlm() ? new ModelDrivenPolicy(client, profile, config) : null;
        return new DecisionEngine(config, deterministic, model);
    }

    public DecisionOutcome decide(PacketContext ctx, Directive directive) {
        if (model == null) return deterministic.decide(ctx, directive);

        DecisionOutcome outcome = model.decide(ctx, directive);
        if (!outcome.isError()) return outcome;

        if (config.getFailureMode() == DecisionEngineConfig.FailureMode.FALLBACK_DETERMINISTIC) {
            ActionPlan plan = deterministic.plan(ctx, directive);
            log.warn("DecisionEngine: model failed ({}), falling back to deterministic '{}'",
                outcome.getErrorKind(), plan.actionId());
            return DecisionOutcome.fallback(plan, outcome.getErrorKind(), outcome.getDetail(), outcome.getLlmTrace());
        }
        log.error("DecisionEngine: model failed ({}: {}) and failure mode is 'fail'",
            outcome.getErrorKind(), outcome.getDetail());
        return outcome;
    }

    public DecisionEngineConfig getConfig() { return config; }

    public String label() { return config.label(); }
}
