package io.objledger.storage;

import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.SequenceNumber;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.ObjectEntry;
import org.junit.jupiter.api.Test;

import static io.objledger.storage.StoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Commits replace the latest entry of every touched id, keep
 * prior live versions readable, and keep the parent index in step.
 */
class InMemoryObjectStoreTest {

    private final InMemoryObjectStore store = new InMemoryObjectStore();
    private final LedgerObject gas = gas(id(0), ALICE, 1_000);
    private final LedgerObject obj = object(id(1), 3, Owner.address(ALICE));

    InMemoryObjectStoreTest() {
        store.insertGenesisObject(gas);
        store.insertGenesisObject(obj);
    }

    // ---- genesis ----

    @Test
    void genesis_objects_are_live_at_their_version() {
        assertEquals(obj, store.getObject(obj.id()).orElseThrow());
        assertEquals(obj, store.getObject(obj.id(), SequenceNumber.of(3)).orElseThrow());
        assertEquals(2, store.size());
    }

    @Test
    void duplicate_genesis_object_is_rejected() {
        assertThrows(IllegalStateException.class, () -> store.insertGenesisObject(obj));
    }

    // ---- commits ----

    @Test
    void commit_installs_new_versions_and_keeps_old_ones() {
        var c = new TxBuilder(gas).input(obj).write(obj.id(), Owner.address(BOB)).build();
        store.commit(c.tx(), c.outputs());

        LedgerObject latest = store.getObject(obj.id()).orElseThrow();
        assertEquals(SequenceNumber.of(4), latest.version());
        assertEquals(Owner.address(BOB), latest.owner());
        assertEquals(obj, store.getObject(obj.id(), SequenceNumber.of(3)).orElseThrow());
        assertEquals(c.outputs().effects(), store.getEffects(c.tx().digest()).orElseThrow());
        assertEquals(c.tx(), store.getTransaction(c.tx().digest()).orElseThrow());
    }

    @Test
    void committing_the_same_transaction_twice_changes_nothing() {
        var c = new TxBuilder(gas).input(obj).delete(obj.id()).build();
        store.commit(c.tx(), c.outputs());
        ObjectEntry afterFirst = store.getLatestEntry(obj.id()).orElseThrow();

        store.commit(c.tx(), c.outputs());

        assertEquals(afterFirst, store.getLatestEntry(obj.id()).orElseThrow());
        assertTrue(afterFirst instanceof ObjectEntry.Deleted);
        assertTrue(store.getObject(obj.id()).isEmpty());
    }

    // ---- parent index ----

    @Test
    void children_and_wrapped_objects_are_found_under_their_parent() {
        LedgerObject parent = object(id(2), 3, Owner.address(ALICE));
        store.insertGenesisObject(parent);
        ObjectID child = id(3);
        var c = new TxBuilder(gas).input(obj).input(parent)
                .write(parent.id(), Owner.address(ALICE))
                .write(child, Owner.object(parent.id()))
                .wrap(obj.id(), parent.id())
                .build();
        store.commit(c.tx(), c.outputs());

        var owned = store.scanOwnedBy(parent.id());
        assertEquals(2, owned.size());
        assertTrue(owned.stream().anyMatch(e -> e.id().equals(child) && e instanceof ObjectEntry.Live));
        assertTrue(owned.stream().anyMatch(e -> e.id().equals(obj.id()) && e instanceof ObjectEntry.Wrapped));
    }

    @Test
    void transferring_a_child_out_removes_it_from_the_parent() {
        LedgerObject parent = object(id(2), 3, Owner.address(ALICE));
        LedgerObject child = object(id(3), 3, Owner.object(parent.id()));
        store.insertGenesisObject(parent);
        store.insertGenesisObject(child);
        assertEquals(1, store.scanOwnedBy(parent.id()).size());

        var c = new TxBuilder(gas).input(child).write(child.id(), Owner.address(BOB)).build();
        store.commit(c.tx(), c.outputs());

        assertTrue(store.scanOwnedBy(parent.id()).isEmpty());
    }
}
