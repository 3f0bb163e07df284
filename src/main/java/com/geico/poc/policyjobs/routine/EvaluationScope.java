package com.geico.poc.policyjobs.routine;

import com.geico.poc.policyjobs.transaction.TransactionContext;

import java.util.List;

/**
 * Short-lived scope for evaluating a function call as an expression.
 *
 * The transaction context is atomic while the scope is open, so the function
 * cannot commit. Closing the scope releases it and restores the previous
 * atomicity.
 */
public final class EvaluationScope implements AutoCloseable {

    private final TransactionContext tx;
    private final boolean previousAtomic;
    private boolean closed;

    private EvaluationScope(TransactionContext tx) {
        this.tx = tx;
        this.previousAtomic = tx.setAtomic(true);
    }

    public static EvaluationScope open(TransactionContext tx) {
        return new EvaluationScope(tx);
    }

    public Object evaluate(Routine routine, List<Literal> arguments) {
        if (closed) {
            throw new IllegalStateException("evaluation scope is closed");
        }
        if (routine.getKind() != RoutineKind.FUNCTION) {
            throw new IllegalArgumentException(routine + " is not a function");
        }
        return routine.getBody().invoke(new RoutineCall(routine, arguments, tx));
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            tx.setAtomic(previousAtomic);
        }
    }
}
