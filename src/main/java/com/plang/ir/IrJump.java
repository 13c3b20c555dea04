package com.plang.ir;

/**
 * Unconditional jump.
 *
 * @param target Block id to continue with
 */
public record IrJump(int target) implements Instruction {

    @Override
    public InstructionKind kind() {
        return InstructionKind.JUMP;
    }

    @Override
    public String toString() {
        return "jmp b" + target;
    }
}
