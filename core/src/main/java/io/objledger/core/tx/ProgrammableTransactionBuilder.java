// file: src/main/java/io/objledger/core/tx/ProgrammableTransactionBuilder.java
package io.objledger.core.tx;

import io.objledger.core.AccountAddress;
import io.objledger.core.ObjectID;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.types.TypeTag;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Incremental builder for {@link ProgrammableTransaction}.
 * Passing the same object twice yields the same input index.
 */
public final class ProgrammableTransactionBuilder {
    private final List<CallArg> inputs = new ArrayList<>();
    private final Map<ObjectID, Integer> objectInputs = new HashMap<>();
    private final List<Command> commands = new ArrayList<>();

    public Argument pure(byte[] bcsBytes) {
        inputs.add(new CallArg.Pure(bcsBytes));
        return new Argument.Input(inputs.size() - 1);
    }

    public Argument pureAddress(AccountAddress address) {
        return pure(address.bytes());
    }

    public Argument pureU64(long v) {
        return pure(new BcsWriter().writeU64(v).toByteArray());
    }

    public Argument object(CallArg objectArg) {
        ObjectID id = objectArg.objectId()
                .orElseThrow(() -> new IllegalArgumentException("not an object input: " + objectArg));
        Integer existing = objectInputs.get(id);
        if (existing != null) {
            return new Argument.Input(existing);
        }
        inputs.add(objectArg);
        int idx = inputs.size() - 1;
        objectInputs.put(id, idx);
        return new Argument.Input(idx);
    }

    /** Appends a raw command and returns its result argument. */
    public Argument command(Command command) {
        commands.add(command);
        return new Argument.Result(commands.size() - 1);
    }

    public Argument moveCall(ObjectID pkg, String module, String function,
                             List<TypeTag> typeArguments, List<Argument> arguments) {
        return command(new Command.MoveCall(pkg, module, function, typeArguments, arguments));
    }

    public Argument makeMoveVec(TypeTag elementType, List<Argument> elements) {
        return command(new Command.MakeMoveVec(Optional.ofNullable(elementType), elements));
    }

    public void transferObjects(List<Argument> objects, AccountAddress recipient) {
        Argument to = pureAddress(recipient);
        command(new Command.TransferObjects(objects, to));
    }

    public void publish(List<byte[]> modules, List<ObjectID> dependencies) {
        command(new Command.Publish(modules, dependencies));
    }

    public ProgrammableTransaction finish() {
        return new ProgrammableTransaction(inputs, commands);
    }
}
