package io.objledger.server;

import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.error.ExecutionError;
import io.objledger.core.error.ExecutionFailureStatus;
import io.objledger.core.exec.ArgValue;
import io.objledger.core.exec.ContractRuntime;
import io.objledger.core.exec.ObjectView;
import io.objledger.core.exec.TemporaryStore;
import io.objledger.core.object.MoveObjectData;

import java.util.Arrays;
import java.util.List;

/**
 * Runs the functions of {@link TestLedger#MODULE} directly against the store.
 * A wrapper's contents end with the ids of the objects wrapped in it.
 */
final class ScriptedRuntime implements ContractRuntime {
    private static final int ID_BYTES = 32;

    @Override
    public List<ArgValue> call(Call call, TemporaryStore store) {
        List<ArgValue> args = call.arguments();
        switch (call.function()) {
            case "make": {
                ObjectID id = store.create(new MoveObjectData(TestLedger.OBJ, new byte[]{1}), Owner.address(store.sender()));
                return List.of(new ArgValue.ObjectValue(id, TestLedger.OBJ));
            }
            case "take":
                store.delete(id(args.get(0)));
                return List.of();
            case "take_vec":
                for (ArgValue v : ((ArgValue.VectorValue) args.get(0)).elements()) store.delete(id(v));
                return List.of();
            case "borrow_mut":
                store.mutate(id(args.get(0)), new byte[]{42});
                return List.of();
            case "make_child":
                store.create(new MoveObjectData(TestLedger.OBJ, new byte[]{2}), Owner.object(id(args.get(0))));
                return List.of();
            case "delete_child": {
                ObjectID child = new ObjectID(((ArgValue.PureValue) args.get(1)).bytes());
                if (store.loadChild(child).isEmpty()) {
                    throw new ExecutionError(new ExecutionFailureStatus.ContractAbort(2), "no child " + child);
                }
                store.delete(child);
                return List.of();
            }
            case "wrap": {
                ObjectID parent = id(args.get(0));
                ObjectID child = id(args.get(1));
                byte[] contents = contents(store, parent);
                byte[] grown = Arrays.copyOf(contents, contents.length + ID_BYTES);
                System.arraycopy(child.bytes(), 0, grown, contents.length, ID_BYTES);
                store.wrap(child, parent);
                store.mutate(parent, grown);
                return List.of();
            }
            case "unwrap": {
                ObjectID parent = id(args.get(0));
                byte[] contents = contents(store, parent);
                if (contents.length < ID_BYTES) {
                    throw new ExecutionError(new ExecutionFailureStatus.ContractAbort(3), "nothing wrapped in " + parent);
                }
                ObjectID child = new ObjectID(Arrays.copyOfRange(contents, contents.length - ID_BYTES, contents.length));
                store.mutate(parent, Arrays.copyOf(contents, contents.length - ID_BYTES));
                store.write(child, new MoveObjectData(TestLedger.OBJ, child.bytes()), Owner.address(store.sender()));
                return List.of();
            }
            case "abort":
                throw new ExecutionError(new ExecutionFailureStatus.ContractAbort(7), "abort 7");
            default:
                return List.of();
        }
    }

    private static ObjectID id(ArgValue v) {
        return ((ArgValue.ObjectValue) v).id();
    }

    private static byte[] contents(TemporaryStore store, ObjectID id) {
        ObjectView v = store.read(id).orElseThrow();
        return v.moveData().contents();
    }
}
