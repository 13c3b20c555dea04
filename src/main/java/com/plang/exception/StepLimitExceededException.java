package com.plang.exception;

/**
 * Exception thrown when a policy runs more instructions than the context's step budget allows.
 */
public class StepLimitExceededException extends PolicyExecutionException {

    private final int maxSteps;

    public StepLimitExceededException(String policyId, int maxSteps) {
        super(policyId, "Step limit of " + maxSteps + " exceeded in policy '" + policyId + "'");
        this.maxSteps = maxSteps;
    }

    public int getMaxSteps() {
        return maxSteps;
    }
}
