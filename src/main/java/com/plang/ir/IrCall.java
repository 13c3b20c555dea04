package com.plang.ir;

import java.util.List;

/**
 * Builtin function call. The result is written to a temporary slot of the running function.
 *
 * @param function   Builtin name
 * @param args       Argument expressions
 * @param resultSlot Temporary slot receiving the result
 */
public record IrCall(String function, List<IrExpression> args, int resultSlot) implements Instruction {

    public IrCall {
        args = List.copyOf(args);
    }

    @Override
    public InstructionKind kind() {
        return InstructionKind.CALL;
    }

    @Override
    public String toString() {
        return "%t" + resultSlot + " = call " + function + args;
    }
}
