// file: src/main/java/io/objledger/core/tx/ProgrammableTransaction.java
package io.objledger.core.tx;

import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.List;

/** Inputs plus the ordered commands that consume them. */
public record ProgrammableTransaction(List<CallArg> inputs, List<Command> commands) {
    public ProgrammableTransaction {
        inputs = List.copyOf(inputs);
        commands = List.copyOf(commands);
    }

    public void encode(BcsWriter w) {
        w.writeVector(inputs, CallArg::encode);
        w.writeVector(commands, Command::encode);
    }

    public static ProgrammableTransaction decode(BcsReader r) {
        return new ProgrammableTransaction(r.readVector(CallArg::decode), r.readVector(Command::decode));
    }
}
