// file: src/main/java/io/objledger/core/publish/Ability.java
package io.objledger.core.publish;

import java.util.EnumSet;
import java.util.Set;

public enum Ability {
    COPY(0x1), DROP(0x2), STORE(0x4), KEY(0x8);

    private final int bit;

    Ability(int bit) {
        this.bit = bit;
    }

    public static int toMask(Set<Ability> abilities) {
        int mask = 0;
        for (Ability a : abilities) mask |= a.bit;
        return mask;
    }

    public static Set<Ability> fromMask(int mask) {
        EnumSet<Ability> out = EnumSet.noneOf(Ability.class);
        for (Ability a : values()) {
            if ((mask & a.bit) != 0) out.add(a);
        }
        return out;
    }

    static int allBits() {
        return toMask(EnumSet.allOf(Ability.class));
    }
}
