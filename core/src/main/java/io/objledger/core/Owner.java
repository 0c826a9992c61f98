// file: src/main/java/io/objledger/core/Owner.java
package io.objledger.core;

import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Objects;

/**
 * Who may use an object.
 * <p>
 * Closed set of variants. Code that authorizes or transitions objects
 * switches over {@link #kind()} so that a new variant breaks compilation
 * at every such site instead of silently falling through.
 */
public sealed interface Owner permits Owner.AddressOwner, Owner.ObjectOwner, Owner.Shared, Owner.Immutable {

    enum Kind { ADDRESS, OBJECT, SHARED, IMMUTABLE }

    Owner IMMUTABLE = new Immutable();

    Kind kind();

    /** Owned exclusively by an account; only that account may use it as input. */
    record AddressOwner(AccountAddress address) implements Owner {
        public AddressOwner {
            Objects.requireNonNull(address, "address");
        }

        @Override
        public Kind kind() {
            return Kind.ADDRESS;
        }
    }

    /** Owned by another object (a child); authorized through its parent chain. */
    record ObjectOwner(ObjectID parent) implements Owner {
        public ObjectOwner {
            Objects.requireNonNull(parent, "parent");
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }
    }

    /** Usable by anyone through consensus; remembers the version at which it became shared. */
    record Shared(SequenceNumber initialSharedVersion) implements Owner {
        public Shared {
            Objects.requireNonNull(initialSharedVersion, "initialSharedVersion");
        }

        @Override
        public Kind kind() {
            return Kind.SHARED;
        }
    }

    /** Frozen: readable by anyone, never written again. */
    record Immutable() implements Owner {
        @Override
        public Kind kind() {
            return Kind.IMMUTABLE;
        }

        @Override
        public String toString() {
            return "Immutable";
        }
    }

    static Owner address(AccountAddress a) {
        return new AddressOwner(a);
    }

    static Owner object(ObjectID parent) {
        return new ObjectOwner(parent);
    }

    static Owner shared(SequenceNumber initialSharedVersion) {
        return new Shared(initialSharedVersion);
    }

    default void encode(BcsWriter w) {
        w.writeUleb128(kind().ordinal());
        switch (kind()) {
            case ADDRESS -> ((AddressOwner) this).address().encode(w);
            case OBJECT -> ((ObjectOwner) this).parent().encode(w);
            case SHARED -> ((Shared) this).initialSharedVersion().encode(w);
            case IMMUTABLE -> { }
        }
    }

    static Owner decode(BcsReader r) {
        long tag = r.readUleb128();
        Kind[] kinds = Kind.values();
        if (tag >= kinds.length) throw new BcsException("unknown owner tag: " + tag);
        return switch (kinds[(int) tag]) {
            case ADDRESS -> new AddressOwner(AccountAddress.decode(r));
            case OBJECT -> new ObjectOwner(ObjectID.decode(r));
            case SHARED -> new Shared(SequenceNumber.decode(r));
            case IMMUTABLE -> IMMUTABLE;
        };
    }
}
