package com.example.sop_generator.model;

public enum GatewayType {
    XOR,
    AND,
    OR;

    public boolean isParallelOrInclusive() {
        return this == AND || this == OR;
    }

    /** Connector used when listing several target steps, e.g. "Step 3 and/or Step 4". */
    public String stepConnector() {
        return this == OR ? " and/or Step " : " and Step ";
    }
}
