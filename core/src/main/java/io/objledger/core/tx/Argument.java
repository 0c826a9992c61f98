// file: src/main/java/io/objledger/core/tx/Argument.java
package io.objledger.core.tx;

import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

/** Reference to a value inside a programmable transaction. */
public sealed interface Argument permits Argument.GasCoin, Argument.Input, Argument.Result, Argument.NestedResult {

    Argument GAS_COIN = new GasCoin();

    record GasCoin() implements Argument {
        @Override
        public String toString() {
            return "GasCoin";
        }
    }

    /** Index into the transaction inputs. */
    record Input(int index) implements Argument {
        public Input {
            if (index < 0) throw new IllegalArgumentException("negative input index");
        }
    }

    /** The single result of an earlier command. */
    record Result(int command) implements Argument {
        public Result {
            if (command < 0) throw new IllegalArgumentException("negative command index");
        }
    }

    /** One of several results of an earlier command. */
    record NestedResult(int command, int result) implements Argument {
        public NestedResult {
            if (command < 0 || result < 0) throw new IllegalArgumentException("negative result index");
        }
    }

    static void encode(BcsWriter w, Argument a) {
        if (a instanceof GasCoin) {
            w.writeUleb128(0);
        } else if (a instanceof Input in) {
            w.writeUleb128(1);
            w.writeU16(in.index());
        } else if (a instanceof Result res) {
            w.writeUleb128(2);
            w.writeU16(res.command());
        } else {
            NestedResult n = (NestedResult) a;
            w.writeUleb128(3);
            w.writeU16(n.command());
            w.writeU16(n.result());
        }
    }

    static Argument decode(BcsReader r) {
        long tag = r.readUleb128();
        if (tag == 0) return GAS_COIN;
        if (tag == 1) return new Input(r.readU16());
        if (tag == 2) return new Result(r.readU16());
        if (tag == 3) return new NestedResult(r.readU16(), r.readU16());
        throw new BcsException("unknown argument tag: " + tag);
    }
}
