package com.geico.poc.policyjobs.jobs.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.geico.poc.policyjobs.config.PolicyJobsConfig;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.jobs.JobExecutor;
import com.geico.poc.policyjobs.routine.Routine;
import com.geico.poc.policyjobs.routine.RoutineCall;
import com.geico.poc.policyjobs.routine.RoutineCatalog;
import com.geico.poc.policyjobs.routine.RoutineKind;
import com.geico.poc.policyjobs.routine.RoutineName;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the built-in policies into the routine catalog.
 *
 * Each policy is registered as a procedure {@code <internal schema>.<name>(integer, jsonb)}
 * owned by the superuser, so jobs run them through the same path as any
 * user-defined action.
 */
@Component
public class PolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(PolicyRegistry.class);

    @Autowired
    private PolicyJobsConfig config;

    @Autowired
    private RoutineCatalog routineCatalog;

    @Autowired
    private PolicyConfigParser parser;

    @Autowired
    private List<PolicyExecutor> executors;

    private final Map<PolicyKind, PolicyExecutor> byKind = new EnumMap<>(PolicyKind.class);

    @PostConstruct
    public void registerPolicies() {
        for (PolicyExecutor executor : executors) {
            if (byKind.put(executor.getKind(), executor) != null) {
                throw new IllegalStateException("duplicate executor for policy " + executor.getKind());
            }
        }
        for (PolicyKind kind : PolicyKind.values()) {
            if (!kind.isBuiltIn()) {
                continue;
            }
            PolicyExecutor executor = byKind.get(kind);
            if (executor == null) {
                throw new IllegalStateException("no executor for policy " + kind);
            }
            RoutineName name = new RoutineName(config.getInternalSchema(), kind.getRoutineName());
            routineCatalog.register(new Routine(name, JobExecutor.JOB_SIGNATURE, RoutineKind.PROCEDURE, config.getSuperuser(),
                call -> runPolicy(kind, executor, call)));
        }
        log.info("📋 Registered {} built-in policies in schema {}", byKind.size(), config.getInternalSchema());
    }

    /**
     * Check a built-in config against the live catalog. Custom configs pass.
     */
    public void validate(PolicyConfig policyConfig) {
        if (policyConfig.getKind().isBuiltIn()) {
            executorFor(policyConfig.getKind()).validate(policyConfig);
        }
    }

    public PolicyExecutor executorFor(PolicyKind kind) {
        PolicyExecutor executor = byKind.get(kind);
        if (executor == null) {
            throw new IllegalArgumentException("no executor for policy " + kind);
        }
        return executor;
    }

    private Object runPolicy(PolicyKind kind, PolicyExecutor executor, RoutineCall call) {
        int jobId = call.getArgument(0).asInt();
        JsonNode document = call.getArgument(1).asJson();
        if (document == null) {
            throw JobException.invalidParameter("config must not be NULL");
        }
        executor.execute(jobId, parser.parse(kind, document), call.getTransaction());
        return null;
    }
}
