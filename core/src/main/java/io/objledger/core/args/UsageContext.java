// file: src/main/java/io/objledger/core/args/UsageContext.java
package io.objledger.core.args;

import io.objledger.core.tx.Argument;
import io.objledger.core.types.TypeTag;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-transaction state of the argument walk: which values have been moved
 * and the types each command produced. Created fresh for every transaction.
 */
public final class UsageContext {
    private final List<ResolvedInput> inputs;
    private final Set<Argument> taken = new HashSet<>();
    private final List<List<TypeTag>> resultTypes = new ArrayList<>();

    public UsageContext(List<ResolvedInput> inputs) {
        this.inputs = List.copyOf(inputs);
    }

    public ResolvedInput input(int index) {
        return inputs.get(index);
    }

    public boolean isTaken(Argument arg) {
        return taken.contains(normalize(arg));
    }

    public void take(Argument arg) {
        taken.add(normalize(arg));
    }

    public void recordResults(List<TypeTag> types) {
        resultTypes.add(List.copyOf(types));
    }

    public List<TypeTag> results(int command) {
        return resultTypes.get(command);
    }

    /** {@code Result(k)} and {@code NestedResult(k, 0)} name the same value. */
    static Argument normalize(Argument arg) {
        if (arg instanceof Argument.Result r) {
            return new Argument.NestedResult(r.command(), 0);
        }
        return arg;
    }
}
