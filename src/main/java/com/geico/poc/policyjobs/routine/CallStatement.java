package com.geico.poc.policyjobs.routine;

import com.geico.poc.policyjobs.transaction.TransactionContext;

import java.util.List;

/**
 * A prepared CALL of a procedure with literal arguments.
 */
public class CallStatement {

    private final Routine procedure;
    private final List<Literal> arguments;

    public CallStatement(Routine procedure, List<Literal> arguments) {
        if (procedure.getKind() != RoutineKind.PROCEDURE) {
            throw new IllegalArgumentException(procedure + " is not a procedure");
        }
        this.procedure = procedure;
        this.arguments = arguments;
    }

    /**
     * Run the procedure. A non-atomic call may commit through
     * {@link RoutineCall#commit()}; output goes to the sink.
     */
    public void execute(TransactionContext tx, boolean atomic, ResultSink sink) {
        boolean previous = tx.setAtomic(atomic);
        try {
            Object result = procedure.getBody().invoke(new RoutineCall(procedure, arguments, tx));
            if (result != null) {
                sink.accept(result);
            }
        } finally {
            tx.setAtomic(previous);
        }
    }

    public Routine getProcedure() {
        return procedure;
    }

    @Override
    public String toString() {
        return "CALL " + procedure.getName() + arguments;
    }
}
