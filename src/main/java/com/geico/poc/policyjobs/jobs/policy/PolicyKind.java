package com.geico.poc.policyjobs.jobs.policy;

import com.geico.poc.policyjobs.routine.RoutineName;

/**
 * The kinds of work a job can do: one of the built-in maintenance policies,
 * or a user-defined action.
 */
public enum PolicyKind {
    RETENTION("policy_retention", "Retention Policy"),
    REORDER("policy_reorder", "Reorder Policy"),
    COMPRESSION("policy_compression", "Compression Policy"),
    CONTINUOUS_AGG_REFRESH("policy_refresh_continuous_aggregate", "Refresh Continuous Aggregate Policy"),
    CUSTOM(null, "User-Defined Action");

    private final String routineName;
    private final String applicationName;

    PolicyKind(String routineName, String applicationName) {
        this.routineName = routineName;
        this.applicationName = applicationName;
    }

    /**
     * Name of the procedure implementing a built-in policy, null for CUSTOM.
     */
    public String getRoutineName() {
        return routineName;
    }

    public String getApplicationName() {
        return applicationName;
    }

    public boolean isBuiltIn() {
        return this != CUSTOM;
    }

    /**
     * Kind of the job running {@code routine}. Only routines in the internal
     * schema are built-in policies.
     */
    public static PolicyKind forRoutine(String internalSchema, RoutineName routine) {
        if (routine.getSchemaName().equals(internalSchema)) {
            for (PolicyKind kind : values()) {
                if (kind.isBuiltIn() && kind.routineName.equals(routine.getName())) {
                    return kind;
                }
            }
        }
        return CUSTOM;
    }
}
