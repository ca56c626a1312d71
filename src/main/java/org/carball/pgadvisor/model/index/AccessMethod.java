package org.carball.pgadvisor.model.index;

import org.carball.pgadvisor.model.qual.OperatorClass;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Index access methods and the operator classes each one can serve.
 */
public enum AccessMethod {
    BTREE("btree", true, EnumSet.of(OperatorClass.EQUALITY, OperatorClass.RANGE)),
    HASH("hash", false, EnumSet.of(OperatorClass.EQUALITY)),
    GIST("gist", true, EnumSet.of(OperatorClass.RANGE, OperatorClass.CONTAINMENT, OperatorClass.PATTERN)),
    SPGIST("spgist", false, EnumSet.of(OperatorClass.RANGE, OperatorClass.CONTAINMENT, OperatorClass.PATTERN)),
    GIN("gin", true, EnumSet.of(OperatorClass.CONTAINMENT, OperatorClass.PATTERN)),
    BRIN("brin", true, EnumSet.of(OperatorClass.EQUALITY, OperatorClass.RANGE));

    private final String amName;
    private final boolean multiColumn;
    private final Set<OperatorClass> operatorClasses;

    AccessMethod(String amName, boolean multiColumn, Set<OperatorClass> operatorClasses) {
        this.amName = amName;
        this.multiColumn = multiColumn;
        this.operatorClasses = operatorClasses;
    }

    public String getAmName() {
        return amName;
    }

    public boolean isMultiColumn() {
        return multiColumn;
    }

    /**
     * Operators of class OTHER are only known to be indexable through the catalog, so they are
     * never rejected here.
     */
    public boolean supports(OperatorClass operatorClass) {
        return operatorClass == OperatorClass.OTHER || operatorClasses.contains(operatorClass);
    }

    public static Optional<AccessMethod> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase().replace("-", "");
        for (AccessMethod method : values()) {
            if (method.amName.equals(normalized)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
