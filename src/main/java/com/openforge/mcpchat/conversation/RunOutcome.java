package com.openforge.mcpchat.conversation;

/**
 * Summary of a finished run.
 *
 * @param iterations      model calls made
 * @param toolInvocations tool calls dispatched, failed ones included
 * @param finalAnswer     the answer text for COMPLETED, otherwise null
 * @param errorMessage    set for ABORTED
 */
public record RunOutcome(
        Status status,
        int iterations,
        int toolInvocations,
        String finalAnswer,
        String errorMessage
) {

    public enum Status {
        /** The model answered without requesting further tools. */
        COMPLETED,
        /** Stopped after the last allowed iteration still requested tools. */
        ITERATION_LIMIT,
        /** Cancelled by the user. */
        CANCELLED,
        /** The provider stream failed. */
        ABORTED
    }

    public static RunOutcome completed(int iterations, int toolInvocations, String answer) {
        return new RunOutcome(Status.COMPLETED, iterations, toolInvocations, answer, null);
    }

    public static RunOutcome iterationLimit(int iterations, int toolInvocations) {
        return new RunOutcome(Status.ITERATION_LIMIT, iterations, toolInvocations, null, null);
    }

    public static RunOutcome cancelled(int iterations, int toolInvocations) {
        return new RunOutcome(Status.CANCELLED, iterations, toolInvocations, null, null);
    }

    public static RunOutcome aborted(int iterations, int toolInvocations, String errorMessage) {
        return new RunOutcome(Status.ABORTED, iterations, toolInvocations, null, errorMessage);
    }
}
