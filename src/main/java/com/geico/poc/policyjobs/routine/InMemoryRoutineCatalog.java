package com.geico.poc.policyjobs.routine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Routine catalog held in memory, keyed by qualified name.
 */
@Component
public class InMemoryRoutineCatalog implements RoutineCatalog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRoutineCatalog.class);

    private final Map<RoutineName, List<Routine>> routines = new ConcurrentHashMap<>();

    @Override
    public Routine lookup(RoutineName name, List<ArgumentType> argumentTypes) {
        for (Routine routine : routines.getOrDefault(name, List.of())) {
            if (routine.getArgumentTypes().equals(argumentTypes)) {
                return routine;
            }
        }
        return null;
    }

    @Override
    public List<Routine> findByName(RoutineName name) {
        return new ArrayList<>(routines.getOrDefault(name, List.of()));
    }

    @Override
    public void register(Routine routine) {
        List<Routine> overloads = routines.computeIfAbsent(routine.getName(), k -> new CopyOnWriteArrayList<>());
        synchronized (overloads) {
            Iterator<Routine> it = overloads.iterator();
            while (it.hasNext()) {
                Routine existing = it.next();
                if (existing.getArgumentTypes().equals(routine.getArgumentTypes())) {
                    overloads.remove(existing);
                    log.debug("Replacing {}", existing);
                }
            }
            overloads.add(routine);
        }
        log.debug("Registered {}", routine);
    }

    /**
     * Drop every overload of a routine.
     *
     * @return true if anything was removed
     */
    public boolean drop(RoutineName name) {
        return routines.remove(name) != null;
    }
}
