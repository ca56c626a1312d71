package org.carball.pgadvisor.model.qual;

import org.carball.pgadvisor.model.index.AccessMethod;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Normalized family of a predicate operator. Predicates on the same column are grouped together
 * only when their operators fall in the same class.
 */
public enum OperatorClass {
    EQUALITY,
    RANGE,
    PATTERN,
    CONTAINMENT,
    OTHER;

    public static OperatorClass fromOperator(String operator) {
        if (operator == null) {
            return OTHER;
        }
        switch (operator.trim().toUpperCase(Locale.ROOT)) {
            case "=":
                return EQUALITY;
            case "<":
            case "<=":
            case ">":
            case ">=":
            case "BETWEEN":
                return RANGE;
            case "~~":
            case "~~*":
            case "LIKE":
            case "ILIKE":
                return PATTERN;
            case "@>":
            case "<@":
            case "&&":
            case "?":
                return CONTAINMENT;
            default:
                return OTHER;
        }
    }

    /**
     * Access methods assumed when a qual row does not say which methods carry its operator. Hash is
     * left out; it is only proposed when the catalog declares it for the operator.
     */
    public Set<AccessMethod> defaultAccessMethods() {
        switch (this) {
            case EQUALITY:
                return EnumSet.of(AccessMethod.BTREE, AccessMethod.BRIN);
            case RANGE:
                return EnumSet.of(AccessMethod.BTREE, AccessMethod.BRIN);
            case PATTERN:
                return EnumSet.of(AccessMethod.GIN);
            case CONTAINMENT:
                return EnumSet.of(AccessMethod.GIN, AccessMethod.GIST);
            default:
                return EnumSet.noneOf(AccessMethod.class);
        }
    }
}
