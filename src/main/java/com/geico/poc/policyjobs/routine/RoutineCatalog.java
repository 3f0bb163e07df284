package com.geico.poc.policyjobs.routine;

import java.util.List;

/**
 * Lookup and registration of callable routines.
 */
public interface RoutineCatalog {

    /**
     * Resolve a routine by name and exact argument types, or null.
     */
    Routine lookup(RoutineName name, List<ArgumentType> argumentTypes);

    /**
     * All overloads with the given name.
     */
    List<Routine> findByName(RoutineName name);

    /**
     * Register a routine, replacing any routine with the same signature.
     */
    void register(Routine routine);
}
