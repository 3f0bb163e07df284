package com.geico.poc.policyjobs.routine;

/**
 * Executable body of a routine.
 */
@FunctionalInterface
public interface RoutineBody {

    /**
     * @return the routine's result, null for procedures and void functions
     */
    Object invoke(RoutineCall call);
}
