package com.plang.ir;

/**
 * Tags of the closed instruction set.
 */
public enum InstructionKind {
    /** Emit an action and leave the function. */
    ACTION,
    /** Two-way conditional branch. */
    BRANCH,
    /** Builtin function call writing a temporary slot. */
    CALL,
    /** Unconditional jump to a continuation block. */
    JUMP
}
