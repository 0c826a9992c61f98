// file: src/main/java/io/objledger/core/tx/Command.java
package io.objledger.core.tx;

import io.objledger.core.ObjectID;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.types.TypeTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** One step of a programmable transaction. */
public sealed interface Command
        permits Command.MoveCall, Command.MakeMoveVec, Command.Publish, Command.TransferObjects {

    /** Arguments in the order their {@code argIdx} is reported. */
    List<Argument> arguments();

    record MoveCall(ObjectID packageId, String module, String function,
                    List<TypeTag> typeArguments, List<Argument> arguments) implements Command {
        public MoveCall {
            Objects.requireNonNull(packageId, "packageId");
            Objects.requireNonNull(module, "module");
            Objects.requireNonNull(function, "function");
            typeArguments = List.copyOf(typeArguments);
            arguments = List.copyOf(arguments);
        }

        @Override
        public String toString() {
            return "MoveCall(" + packageId + "::" + module + "::" + function + ")";
        }
    }

    /** Builds {@code vector<T>}; the element type is inferred from the first element when absent. */
    record MakeMoveVec(Optional<TypeTag> elementType, List<Argument> elements) implements Command {
        public MakeMoveVec {
            Objects.requireNonNull(elementType, "elementType");
            elements = List.copyOf(elements);
        }

        @Override
        public List<Argument> arguments() {
            return elements;
        }
    }

    record Publish(List<byte[]> modules, List<ObjectID> dependencies) implements Command {
        public Publish {
            List<byte[]> copy = new ArrayList<>(modules.size());
            for (byte[] m : modules) copy.add(m.clone());
            modules = List.copyOf(copy);
            dependencies = List.copyOf(dependencies);
        }

        @Override
        public List<Argument> arguments() {
            return List.of();
        }

        @Override
        public String toString() {
            return "Publish(" + modules.size() + " modules, deps=" + dependencies + ")";
        }
    }

    /** Moves each object to {@code recipient}; the recipient argument index is {@code objects.size()}. */
    record TransferObjects(List<Argument> objects, Argument recipient) implements Command {
        public TransferObjects {
            objects = List.copyOf(objects);
            Objects.requireNonNull(recipient, "recipient");
        }

        @Override
        public List<Argument> arguments() {
            List<Argument> all = new ArrayList<>(objects);
            all.add(recipient);
            return all;
        }
    }

    static void encode(BcsWriter w, Command c) {
        if (c instanceof MoveCall m) {
            w.writeUleb128(0);
            m.packageId().encode(w);
            w.writeString(m.module());
            w.writeString(m.function());
            w.writeVector(m.typeArguments(), TypeTag::encode);
            w.writeVector(m.arguments(), Argument::encode);
        } else if (c instanceof TransferObjects t) {
            w.writeUleb128(1);
            w.writeVector(t.objects(), Argument::encode);
            Argument.encode(w, t.recipient());
        } else if (c instanceof Publish p) {
            w.writeUleb128(2);
            w.writeVector(p.modules(), BcsWriter::writeBytes);
            w.writeVector(p.dependencies(), (ww, id) -> id.encode(ww));
        } else {
            MakeMoveVec v = (MakeMoveVec) c;
            w.writeUleb128(3);
            w.writeOption(v.elementType().orElse(null), TypeTag::encode);
            w.writeVector(v.elements(), Argument::encode);
        }
    }

    static Command decode(BcsReader r) {
        long tag = r.readUleb128();
        if (tag == 0) {
            return new MoveCall(ObjectID.decode(r), r.readString(), r.readString(),
                    r.readVector(TypeTag::decode), r.readVector(Argument::decode));
        }
        if (tag == 1) {
            List<Argument> objs = r.readVector(Argument::decode);
            return new TransferObjects(objs, Argument.decode(r));
        }
        if (tag == 2) {
            List<byte[]> mods = r.readVector(BcsReader::readBytes);
            return new Publish(mods, r.readVector(ObjectID::decode));
        }
        if (tag == 3) {
            TypeTag t = r.readOption(TypeTag::decode);
            return new MakeMoveVec(Optional.ofNullable(t), r.readVector(Argument::decode));
        }
        throw new BcsException("unknown command tag: " + tag);
    }
}
