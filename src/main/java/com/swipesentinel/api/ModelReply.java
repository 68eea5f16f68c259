package com.swipesentinel.api;

import com.swipesentinel.model.LlmTrace;

/**
 * Outcome of one chat-completions exchange, retries included.
 *
 * Immutable - use {@link #success} or {@link #error}.
 */
public final class ModelReply {

    private final boolean        ok;
    private final String         content;       // assistant message text, null on error
    private final String         model;
    private final int            inputTokens;
    private final int            outputTokens;
    private final long           latencyMs;
    private final int            attempts;
    private final ModelErrorKind errorKind;     // null on success
    private final String         errorMessage;

    private ModelReply(boolean ok, String content, String model, int inputTokens, int outputTokens,
                       long latencyMs, int attempts, ModelErrorKind errorKind, String errorMessage) {
        this.ok           = ok;
        this.content      = content;
        this.model        = model;
        this.inputTokens  = inputTokens;
        this.outputTokens = outputTokens;
        this.latencyMs    = latencyMs;
        this.attempts     = attempts;
        this.errorKind    = errorKind;
        this.errorMessage = errorMessage;
    }

    public static ModelReply success(String content, String model, int inputTokens, int outputTokens,
                                     long latencyMs, int attempts) {
        return new ModelReply(true, content, model, inputTokens, outputTokens, latencyMs, attempts, null, null);
    }

    public static ModelReply error(ModelErrorKind kind, String message, String model, long latencyMs, int attempts) {
        return new ModelReply(false, null, model, 0, 0, latencyMs, attempts, kind, message);
    }

    public boolean        isOk()            { return ok; }
    public String         getContent()      { return content; }
    public String         getModel()        { return model; }
    public int            getInputTokens()  { return inputTokens; }
    public int            getOutputTokens() { return outputTokens; }
    public long           getLatencyMs()    { return latencyMs; }
    public int            getAttempts()     { return attempts; }
    public ModelErrorKind getErrorKind()    { return errorKind; }
    public String         getErrorMessage() { return errorMessage; }

    /** Packet-log view of this exchange. */
    public LlmTrace toTrace() {
        return ok
            ? LlmTrace.success(model, latencyMs, inputTokens, outputTokens, attempts)
            : LlmTrace.failure(model, latencyMs, attempts, errorKind.wireName(), errorMessage);
    }

    /** Same exchange, re-labelled as rejected after parsing or validation. */
    public LlmTrace toRejectedTrace(ModelErrorKind kind, String message) {
        return new LlmTrace(false, model, latencyMs, inputTokens, outputTokens, attempts, kind.wireName(), message);
    }

    @Override
    public String toString() {
        return ok
            ? String.format("ModelReply{ok, model=%s, latency=%dms, attempts=%d}", model, latencyMs, attempts)
            : String.format("ModelReply{error=%s, attempts=%d, message='%s'}", errorKind, attempts, errorMessage);
    }
}
