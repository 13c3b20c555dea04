package com.plang.exception;

/**
 * Exception thrown when a single policy cannot be interpreted.
 * The DAG executor treats it as fail-open: the policy counts as ALLOW
 * and the rest of the plan keeps running.
 */
public class PolicyExecutionException extends PlangException {

    private final String policyId;

    public PolicyExecutionException(String policyId, String message) {
        super(message);
        this.policyId = policyId;
    }

    public PolicyExecutionException(String policyId, String message, Throwable cause) {
        super(message, cause);
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
