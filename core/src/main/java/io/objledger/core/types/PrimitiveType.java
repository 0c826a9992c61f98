// file: src/main/java/io/objledger/core/types/PrimitiveType.java
package io.objledger.core.types;

/** Primitive types with their wire tag and fixed encoded width (0 for none). */
public enum PrimitiveType implements TypeTag {
    BOOL("bool", 0, 1),
    U8("u8", 1, 1),
    U64("u64", 2, 8),
    U128("u128", 3, 16),
    ADDRESS("address", 4, 32),
    SIGNER("signer", 5, 0),
    U16("u16", 8, 2),
    U32("u32", 9, 4),
    U256("u256", 10, 32);

    private final String name;
    private final int tag;
    private final int width;

    PrimitiveType(String name, int tag, int width) {
        this.name = name;
        this.tag = tag;
        this.width = width;
    }

    public int tag() {
        return tag;
    }

    /** Encoded size in bytes; 0 when values of the type cannot be passed as pure bytes. */
    public int width() {
        return width;
    }

    public static PrimitiveType fromTag(int tag) {
        for (PrimitiveType p : values()) {
            if (p.tag == tag) return p;
        }
        return null;
    }

    public static PrimitiveType fromName(String name) {
        for (PrimitiveType p : values()) {
            if (p.name.equals(name)) return p;
        }
        return null;
    }

    @Override
    public String toCanonicalString() {
        return name;
    }
}
