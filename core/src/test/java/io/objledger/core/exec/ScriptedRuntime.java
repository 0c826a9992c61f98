package io.objledger.core.exec;

import io.objledger.core.Owner;
import io.objledger.core.TestObjects;
import io.objledger.core.error.ExecutionError;
import io.objledger.core.error.ExecutionFailureStatus;
import io.objledger.core.object.MoveObjectData;

import java.util.List;

/** Runs the functions of the test module "m" directly against the store. */
final class ScriptedRuntime implements ContractRuntime {

    @Override
    public List<ArgValue> call(Call call, TemporaryStore store) {
        switch (call.function()) {
            case "make": {
                var id = store.create(new MoveObjectData(TestObjects.OBJ, new byte[]{1}), Owner.address(store.sender()));
                return List.of(new ArgValue.ObjectValue(id, TestObjects.OBJ));
            }
            case "take":
                store.delete(((ArgValue.ObjectValue) call.arguments().get(0)).id());
                return List.of();
            case "borrow_mut": {
                var id = ((ArgValue.ObjectValue) call.arguments().get(0)).id();
                store.mutate(id, new byte[]{42});
                return List.of();
            }
            case "abort":
                throw new ExecutionError(new ExecutionFailureStatus.ContractAbort(7), "abort 7");
            default:
                return List.of();
        }
    }
}
