// file: src/main/java/io/objledger/core/effects/ExecutionStatus.java
package io.objledger.core.effects;

import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.error.ExecutionError;
import io.objledger.core.error.ExecutionFailureStatus;

import java.util.Objects;

public sealed interface ExecutionStatus permits ExecutionStatus.Success, ExecutionStatus.Failure {

    ExecutionStatus SUCCESS = new Success();

    record Success() implements ExecutionStatus {
        @Override
        public String toString() {
            return "Success";
        }
    }

    /** {@code command} is null when the failure is not tied to a command (for example gas). */
    record Failure(ExecutionFailureStatus error, Integer command) implements ExecutionStatus {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        public static Failure of(ExecutionError e) {
            return new Failure(e.status(), e.command());
        }

        @Override
        public String toString() {
            return "Failure { error: " + error + ", command: " + (command == null ? "None" : "Some(" + command + ")") + " }";
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    static void encode(BcsWriter w, ExecutionStatus s) {
        if (s instanceof Failure f) {
            w.writeUleb128(1);
            ExecutionFailureStatus.encode(w, f.error());
            w.writeOption(f.command() == null ? null : Long.valueOf(f.command()), BcsWriter::writeU64);
        } else {
            w.writeUleb128(0);
        }
    }

    static ExecutionStatus decode(BcsReader r) {
        long tag = r.readUleb128();
        if (tag == 0) return SUCCESS;
        if (tag != 1) throw new BcsException("unknown status tag: " + tag);
        ExecutionFailureStatus err = ExecutionFailureStatus.decode(r);
        Long cmd = r.readOption(BcsReader::readU64);
        return new Failure(err, cmd == null ? null : Math.toIntExact(cmd));
    }
}
