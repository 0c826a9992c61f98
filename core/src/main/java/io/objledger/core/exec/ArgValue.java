// file: src/main/java/io/objledger/core/exec/ArgValue.java
package io.objledger.core.exec;

import io.objledger.core.ObjectID;
import io.objledger.core.types.StructTag;
import io.objledger.core.types.TypeTag;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/** Value passed to or returned from a command. */
public sealed interface ArgValue permits ArgValue.ObjectValue, ArgValue.PureValue, ArgValue.VectorValue {

    /** An object by id; its content lives in the {@link TemporaryStore}. */
    record ObjectValue(ObjectID id, StructTag type) implements ArgValue {
        public ObjectValue {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(type, "type");
        }
    }

    record PureValue(byte[] bytes) implements ArgValue {
        public PureValue {
            bytes = Objects.requireNonNull(bytes, "bytes").clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof PureValue other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "PureValue(" + HexFormat.of().formatHex(bytes) + ")";
        }
    }

    record VectorValue(TypeTag elementType, List<ArgValue> elements) implements ArgValue {
        public VectorValue {
            Objects.requireNonNull(elementType, "elementType");
            elements = List.copyOf(elements);
        }
    }
}
