package pl.marcinmilkowski.interlingua.discourse;

import java.util.Set;

/**
 * Presentation groups for predicates, in the order responses list them.
 */
public enum PredicateCategory {
    IDENTITY,
    POWER,
    ROLE,
    CAPABILITY,
    OTHER,
    STATE;

    private static final Set<String> IDENTITY_PREDICATES = Set.of("is-a", "has-name", "named", "instance-of");
    private static final Set<String> POWER_PREDICATES = Set.of("powered-by", "runs-on", "built-with", "built-on");
    private static final Set<String> ROLE_PREDICATES = Set.of("has-role", "serves-as", "acts-as", "role");
    private static final Set<String> CAPABILITY_PREDICATES = Set.of("has-capability", "can", "capable-of", "can-do");
    private static final Set<String> STATE_PREDICATES = Set.of("has-state", "has-status", "has-mood");

    public static PredicateCategory of(String predicate) {
        if (IDENTITY_PREDICATES.contains(predicate)) {
            return IDENTITY;
        }
        if (POWER_PREDICATES.contains(predicate)) {
            return POWER;
        }
        if (ROLE_PREDICATES.contains(predicate)) {
            return ROLE;
        }
        if (CAPABILITY_PREDICATES.contains(predicate) || predicate.startsWith("can-")) {
            return CAPABILITY;
        }
        if (STATE_PREDICATES.contains(predicate)) {
            return STATE;
        }
        return OTHER;
    }
}
