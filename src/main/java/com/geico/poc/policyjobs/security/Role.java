package com.geico.poc.policyjobs.security;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A database role.
 */
public class Role {

    private final String name;
    private final boolean login;
    private final boolean superuser;
    private final Set<String> memberOf = ConcurrentHashMap.newKeySet();

    public Role(String name, boolean login, boolean superuser) {
        this.name = name;
        this.login = login;
        this.superuser = superuser;
    }

    public String getName() {
        return name;
    }

    /**
     * Roles without LOGIN cannot own background workers.
     */
    public boolean canLogin() {
        return login;
    }

    public boolean isSuperuser() {
        return superuser;
    }

    /**
     * Roles this role is a direct member of.
     */
    public Set<String> getMemberOf() {
        return Collections.unmodifiableSet(memberOf);
    }

    void addMembership(String role) {
        memberOf.add(role);
    }

    @Override
    public String toString() {
        return name;
    }
}
