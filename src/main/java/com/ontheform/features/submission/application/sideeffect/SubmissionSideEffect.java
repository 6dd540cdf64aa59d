package com.ontheform.features.submission.application.sideeffect;

/**
 * A best-effort action run after a submission has been committed. Hooks run in {@code @Order}
 * sequence; a failing hook never affects the stored submission or the hooks after it.
 */
public interface SubmissionSideEffect {

    String name();

    boolean appliesTo(SideEffectContext context);

    void apply(SideEffectContext context) throws Exception;

    /**
     * Records the failure in the context so it can be reported back to the submitter.
     */
    default void onFailure(SideEffectContext context, Exception failure) {
    }
}
