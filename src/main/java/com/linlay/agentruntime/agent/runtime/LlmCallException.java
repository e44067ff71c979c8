package com.linlay.agentruntime.agent.runtime;

import com.linlay.agentruntime.llm.FailoverReason;

/**
 * A model call that failed after the loop's retry policy gave up.
 */
public class LlmCallException extends RuntimeException {

    private final FailoverReason reason;

    public LlmCallException(FailoverReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason == null ? FailoverReason.UNKNOWN : reason;
    }

    public FailoverReason reason() {
        return reason;
    }
}
