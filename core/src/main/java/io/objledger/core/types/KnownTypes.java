// file: src/main/java/io/objledger/core/types/KnownTypes.java
package io.objledger.core.types;

import io.objledger.core.AccountAddress;

import java.util.List;

/** Framework types the validator itself needs to recognise. */
public final class KnownTypes {
    public static final StructTag UID = new StructTag(AccountAddress.FRAMEWORK, "object", "UID");
    public static final StructTag ID = new StructTag(AccountAddress.FRAMEWORK, "object", "ID");
    public static final StructTag UTF8_STRING = new StructTag(AccountAddress.STD, "string", "String");
    public static final StructTag ASCII_STRING = new StructTag(AccountAddress.STD, "ascii", "String");
    public static final StructTag GAS = new StructTag(AccountAddress.FRAMEWORK, "gas", "GAS");
    public static final StructTag GAS_COIN =
            new StructTag(AccountAddress.FRAMEWORK, "coin", "Coin", List.of(GAS));
    public static final StructTag UPGRADE_CAP = new StructTag(AccountAddress.FRAMEWORK, "package", "UpgradeCap");

    private KnownTypes() {}

    public static boolean isOption(StructTag s) {
        return s.isSameStruct(AccountAddress.STD, "option", "Option") && s.typeParams().size() == 1;
    }

    public static StructTag option(TypeTag inner) {
        return new StructTag(AccountAddress.STD, "option", "Option", List.of(inner));
    }
}
