package com.geico.poc.policyjobs.routine;

/**
 * Kind of a catalog routine. Only functions and procedures can be job targets.
 */
public enum RoutineKind {
    FUNCTION,
    PROCEDURE,
    AGGREGATE,
    WINDOW
}
