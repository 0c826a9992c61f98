// file: src/main/java/io/objledger/core/args/ResolvedInput.java
package io.objledger.core.args;

import io.objledger.core.object.LedgerObject;
import io.objledger.core.tx.CallArg;

import java.util.Objects;

/**
 * A transaction input after loading: the call arg and, for object inputs,
 * the object version it names.
 */
public record ResolvedInput(CallArg arg, LedgerObject object) {
    public ResolvedInput {
        Objects.requireNonNull(arg, "arg");
        if ((arg instanceof CallArg.Pure) != (object == null)) {
            throw new IllegalArgumentException("pure inputs carry no object, object inputs need one");
        }
    }

    public static ResolvedInput pure(CallArg.Pure arg) {
        return new ResolvedInput(arg, null);
    }

    public boolean isPure() {
        return object == null;
    }

    /** True when the input may not be mutated: immutable objects and read-only shared inputs. */
    public boolean isReadOnly() {
        if (object == null) return false;
        if (object.isImmutable()) return true;
        return arg instanceof CallArg.SharedObject s && !s.mutable();
    }

    public boolean isShared() {
        return arg instanceof CallArg.SharedObject;
    }
}
