package com.plang.ir;

import java.util.List;
import java.util.Optional;

/**
 * Ordered run of instructions with at most one terminator, which must come last.
 * A block without a terminator falls off the end of the function (implicit default ALLOW).
 *
 * @param id           Block id, equal to its index in the function
 * @param label        Human-readable label
 * @param instructions Instructions in execution order
 */
public record BasicBlock(int id, String label, List<Instruction> instructions) {

    public BasicBlock {
        instructions = List.copyOf(instructions);
    }

    public Optional<Instruction> terminator() {
        if (instructions.isEmpty()) {
            return Optional.empty();
        }
        Instruction last = instructions.get(instructions.size() - 1);
        return last.isTerminator() ? Optional.of(last) : Optional.empty();
    }
}
