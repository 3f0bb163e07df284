package com.geico.poc.policyjobs.routine;

import com.geico.poc.policyjobs.transaction.TransactionContext;

import java.util.Collections;
import java.util.List;

/**
 * One invocation of a routine: the bound literal arguments and the
 * transaction context the body runs in.
 */
public class RoutineCall {

    private final Routine routine;
    private final List<Literal> arguments;
    private final TransactionContext transaction;

    public RoutineCall(Routine routine, List<Literal> arguments, TransactionContext transaction) {
        this.routine = routine;
        this.arguments = Collections.unmodifiableList(arguments);
        this.transaction = transaction;
    }

    public Routine getRoutine() {
        return routine;
    }

    public List<Literal> getArguments() {
        return arguments;
    }

    public Literal getArgument(int index) {
        return arguments.get(index);
    }

    public TransactionContext getTransaction() {
        return transaction;
    }

    /**
     * Commit the work done so far and continue in a new transaction. Only
     * procedures called outside an atomic context may do this.
     */
    public void commit() {
        transaction.commitAndChain();
    }
}
