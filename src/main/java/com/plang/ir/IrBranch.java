package com.plang.ir;

/**
 * Conditional branch over two blocks.
 *
 * @param condition Condition; builtin calls have already been hoisted into temporaries
 * @param thenBlock Block id taken when the condition is truthy
 * @param elseBlock Block id taken otherwise
 */
public record IrBranch(IrExpression condition, int thenBlock, int elseBlock) implements Instruction {

    @Override
    public InstructionKind kind() {
        return InstructionKind.BRANCH;
    }

    @Override
    public String toString() {
        return "br " + condition + " ? b" + thenBlock + " : b" + elseBlock;
    }
}
