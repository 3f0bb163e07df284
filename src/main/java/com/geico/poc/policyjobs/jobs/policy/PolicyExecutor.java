package com.geico.poc.policyjobs.jobs.policy;

import com.geico.poc.policyjobs.transaction.TransactionContext;

/**
 * A built-in maintenance policy.
 *
 * Policies run inside the transaction the job executor set up and never open
 * one of their own.
 */
public interface PolicyExecutor {

    PolicyKind getKind();

    /**
     * Resolve everything the config names and check it, without side effects.
     * Called when a job is added or altered, and again on every run.
     */
    void validate(PolicyConfig config);

    /**
     * Run one pass of the policy. Finding no work is a success.
     */
    boolean execute(int jobId, PolicyConfig config, TransactionContext tx);
}
