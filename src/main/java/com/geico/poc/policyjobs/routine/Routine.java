package com.geico.poc.policyjobs.routine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * A function or procedure registered in the routine catalog.
 */
public class Routine {

    /**
     * Pseudo-role that every role is a member of.
     */
    public static final String PUBLIC = "PUBLIC";

    private final RoutineName name;
    private final List<ArgumentType> argumentTypes;
    private final RoutineKind kind;
    private final String owner;
    private final RoutineBody body;
    private final Set<String> executeGrantees = ConcurrentHashMap.newKeySet();

    public Routine(RoutineName name, List<ArgumentType> argumentTypes, RoutineKind kind,
                   String owner, RoutineBody body) {
        this.name = name;
        this.argumentTypes = Collections.unmodifiableList(new ArrayList<>(argumentTypes));
        this.kind = kind;
        this.owner = owner;
        this.body = body;
        // new routines are executable by everyone until revoked
        this.executeGrantees.add(PUBLIC);
    }

    public RoutineName getName() {
        return name;
    }

    public String getSchemaName() {
        return name.getSchemaName();
    }

    public String getRoutineName() {
        return name.getName();
    }

    public List<ArgumentType> getArgumentTypes() {
        return argumentTypes;
    }

    public RoutineKind getKind() {
        return kind;
    }

    public String getOwner() {
        return owner;
    }

    public RoutineBody getBody() {
        return body;
    }

    public Set<String> getExecuteGrantees() {
        return Collections.unmodifiableSet(executeGrantees);
    }

    public void grantExecute(String role) {
        executeGrantees.add(role);
    }

    public void revokeExecute(String role) {
        executeGrantees.remove(role);
    }

    /**
     * Signature as printed in error messages, e.g. {@code public.my_job(integer, jsonb)}.
     */
    public String getSignature() {
        return name + argumentTypes.stream()
            .map(ArgumentType::getSqlName)
            .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + getSignature();
    }
}
