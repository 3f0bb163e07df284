package com.geico.poc.policyjobs.security;

import com.geico.poc.policyjobs.config.PolicyJobsConfig;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.routine.Routine;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Role catalog held in memory. The configured superuser is created at startup.
 */
@Component
public class InMemoryRoleCatalog implements RoleCatalog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRoleCatalog.class);

    @Autowired
    private PolicyJobsConfig config;

    private final Map<String, Role> roles = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        String superuser = config.getSuperuser();
        roles.putIfAbsent(superuser, new Role(superuser, true, true));
        log.info("👤 Role catalog initialized (superuser: {})", superuser);
    }

    public Role createRole(String name, boolean login, boolean superuser) {
        Role role = new Role(name, login, superuser);
        if (roles.putIfAbsent(name, role) != null) {
            throw JobException.invalidParameter("role \"" + name + "\" already exists");
        }
        return role;
    }

    /**
     * Make {@code member} a member of {@code role}.
     */
    public void grantRole(String role, String member) {
        requireRole(role);
        requireRole(member).addMembership(role);
    }

    @Override
    public Role findRole(String name) {
        return name == null ? null : roles.get(name);
    }

    @Override
    public boolean hasPrivilegesOfRole(String member, String role) {
        if (member == null || role == null) {
            return false;
        }
        if (member.equals(role)) {
            return true;
        }
        Role start = roles.get(member);
        if (start == null) {
            return false;
        }
        if (start.isSuperuser()) {
            return true;
        }

        Set<String> seen = new HashSet<>();
        Deque<Role> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            Role current = pending.pop();
            if (!seen.add(current.getName())) {
                continue;
            }
            for (String parent : current.getMemberOf()) {
                if (parent.equals(role)) {
                    return true;
                }
                Role next = roles.get(parent);
                if (next != null) {
                    pending.push(next);
                }
            }
        }
        return false;
    }

    @Override
    public boolean hasExecutePrivilege(String role, Routine routine) {
        if (hasPrivilegesOfRole(role, routine.getOwner())) {
            return true;
        }
        for (String grantee : routine.getExecuteGrantees()) {
            if (Routine.PUBLIC.equals(grantee) || hasPrivilegesOfRole(role, grantee)) {
                return true;
            }
        }
        return false;
    }

    private Role requireRole(String name) {
        Role role = roles.get(name);
        if (role == null) {
            throw JobException.undefinedObject("role \"" + name + "\" does not exist");
        }
        return role;
    }
}
