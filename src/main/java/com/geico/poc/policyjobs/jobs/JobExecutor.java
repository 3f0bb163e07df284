package com.geico.poc.policyjobs.jobs;

import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.routine.ArgumentType;
import com.geico.poc.policyjobs.routine.CallStatement;
import com.geico.poc.policyjobs.routine.EvaluationScope;
import com.geico.poc.policyjobs.routine.Literal;
import com.geico.poc.policyjobs.routine.ResultSink;
import com.geico.poc.policyjobs.routine.Routine;
import com.geico.poc.policyjobs.routine.RoutineCatalog;
import com.geico.poc.policyjobs.routine.RoutineName;
import com.geico.poc.policyjobs.transaction.ExecutionFrame;
import com.geico.poc.policyjobs.transaction.LocalTransactionContext;
import com.geico.poc.policyjobs.transaction.TransactionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the routine a job points at, exactly once.
 *
 * The routine is called as {@code proc(job_id integer, config jsonb)}.
 * Functions are evaluated in an atomic scope. Procedures are called with
 * their output discarded and may commit unless the caller is inside an
 * explicit transaction block. Whatever the routine does to the transaction,
 * the surrounding {@link ExecutionFrame} only releases what it acquired.
 *
 * There is no retry here: a failure in the routine propagates to the caller.
 */
@Component
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    public static final List<ArgumentType> JOB_SIGNATURE =
        Arrays.asList(ArgumentType.INTEGER, ArgumentType.JSONB);

    @Autowired
    private RoutineCatalog routineCatalog;

    @Autowired
    private Clock clock;

    public JobExecutor() {
    }

    public JobExecutor(RoutineCatalog routineCatalog, Clock clock) {
        this.routineCatalog = routineCatalog;
        this.clock = clock;
    }

    /**
     * Entry point for the scheduler: run the job in a fresh transaction context.
     */
    public boolean execute(Job job) {
        return execute(job, new LocalTransactionContext(clock));
    }

    /**
     * Run the job in the caller's transaction context.
     *
     * @return true; failures are thrown
     */
    public boolean execute(Job job, TransactionContext tx) {
        try (ExecutionFrame frame = ExecutionFrame.enter(tx)) {
            Routine routine = resolve(job);
            List<Literal> args = Arrays.asList(
                Literal.of(ArgumentType.INTEGER, job.getId()),
                job.getConfig() != null ? Literal.of(ArgumentType.JSONB, job.getConfig()) : Literal.nullOf(ArgumentType.JSONB));

            log.debug("Executing job {} via {}", job.getId(), routine);
            switch (routine.getKind()) {
                case FUNCTION:
                    try (EvaluationScope scope = EvaluationScope.open(tx)) {
                        scope.evaluate(routine, args);
                    }
                    break;
                case PROCEDURE:
                    boolean atomic = tx.isAtomic() || tx.isInTransactionBlock();
                    new CallStatement(routine, args).execute(tx, atomic, ResultSink.discard());
                    break;
                default:
                    throw JobException.featureNotSupported("unsupported function type");
            }
            frame.complete();
        }
        return true;
    }

    private Routine resolve(Job job) {
        RoutineName name = new RoutineName(job.getProcSchema(), job.getProcName());
        Routine routine = routineCatalog.lookup(name, JOB_SIGNATURE);
        if (routine == null) {
            throw JobException.undefinedObject(String.format("function %s(integer, jsonb) does not exist", name));
        }
        return routine;
    }
}
