package com.geico.poc.policyjobs.security;

import com.geico.poc.policyjobs.routine.Routine;

/**
 * Role lookup and privilege checks.
 */
public interface RoleCatalog {

    /**
     * @return the role, or null if it does not exist
     */
    Role findRole(String name);

    /**
     * Whether {@code member} has the privileges of {@code role}: it is the
     * role, a superuser, or a direct or indirect member of it.
     */
    boolean hasPrivilegesOfRole(String member, String role);

    boolean hasExecutePrivilege(String role, Routine routine);
}
