// file: src/main/java/io/objledger/core/error/CommandArgumentErrorKind.java
package io.objledger.core.error;

public enum CommandArgumentErrorKind {
    TYPE_MISMATCH("TypeMismatch"),
    INVALID_BCS_BYTES("InvalidBCSBytes"),
    INVALID_USAGE_OF_TAKEN_VALUE("InvalidUsageOfTakenValue"),
    INVALID_OBJECT_BY_VALUE("InvalidObjectByValue"),
    INVALID_OBJECT_BY_MUT_REF("InvalidObjectByMutRef"),
    INVALID_GAS_COIN_USAGE("InvalidGasCoinUsage"),
    SHARED_OBJECT_NOT_ALLOWED_IN_VECTOR("SharedObjectNotAllowedInVector");

    private final String wireName;

    CommandArgumentErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
