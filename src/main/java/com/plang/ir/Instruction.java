package com.plang.ir;

/**
 * A single IR instruction. Interpreters dispatch on {@link #kind()}.
 */
public sealed interface Instruction permits IrAction, IrBranch, IrCall, IrJump {

    InstructionKind kind();

    /**
     * Whether this instruction ends its basic block.
     */
    default boolean isTerminator() {
        return kind() != InstructionKind.CALL;
    }
}
