package com.framegate.domain.frame.model;

/**
 * Output of the retry ladder.
 *
 * @param action         next action, or ACCEPT / REJECT for terminal verdicts
 * @param promptOverride directive appended to the prompt for the next attempt (nullable)
 * @param terminal       true when the frame is finalized by this decision
 * @param primaryReason  reason code that drove the decision (null on ACCEPT)
 * @param rationale      human-readable explanation, persisted for diagnostics
 */
public record RetryDecision(
        RetryAction action,
        String promptOverride,
        boolean terminal,
        ReasonCode primaryReason,
        String rationale
) {

    public static RetryDecision accept() {
        return new RetryDecision(RetryAction.ACCEPT, null, true, null, "All gates passed");
    }

    public static RetryDecision reject(ReasonCode reason, String rationale) {
        return new RetryDecision(RetryAction.REJECT, null, true, reason, rationale);
    }

    public static RetryDecision retry(RetryAction action, ReasonCode reason, String rationale) {
        return new RetryDecision(action, action.getPromptDirective(), false, reason, rationale);
    }

    public boolean isApproval() {
        return action == RetryAction.ACCEPT;
    }
}
