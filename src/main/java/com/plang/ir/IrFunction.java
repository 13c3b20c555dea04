package com.plang.ir;

import com.plang.governance.ActionType;
import com.plang.governance.GovernanceCategory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiled policy: one function per policy declaration.
 * Governance metadata belongs to the function, not to individual blocks.
 *
 * @param id         Policy identifier, unique within its module
 * @param metadata   Category and priority
 * @param blocks     Basic blocks; a block's id is its index
 * @param entryBlock Id of the block where execution starts
 * @param tempSlots  Number of temporaries used by hoisted calls
 */
public record IrFunction(
        String id,
        GovernanceMetadata metadata,
        List<BasicBlock> blocks,
        int entryBlock,
        int tempSlots
) {
    public IrFunction {
        blocks = List.copyOf(blocks);
    }

    public BasicBlock block(int blockId) {
        return blocks.get(blockId);
    }

    public BasicBlock entry() {
        return blocks.get(entryBlock);
    }

    public GovernanceCategory category() {
        return metadata.category();
    }

    public int priority() {
        return metadata.priority();
    }

    public IrFunction withMetadata(GovernanceMetadata newMetadata) {
        return new IrFunction(id, newMetadata, blocks, entryBlock, tempSlots);
    }

    /**
     * All action instructions in block order.
     */
    public List<IrAction> actions() {
        List<IrAction> actions = new ArrayList<>();
        for (BasicBlock block : blocks) {
            for (Instruction instruction : block.instructions()) {
                if (instruction instanceof IrAction action) {
                    actions.add(action);
                }
            }
        }
        return actions;
    }

    /**
     * Distinct explicit actions this function can emit.
     */
    public Set<ActionType> actionTypes() {
        Set<ActionType> types = EnumSet.noneOf(ActionType.class);
        for (IrAction action : actions()) {
            types.add(action.action());
        }
        return types;
    }

    public boolean canEmit(ActionType type) {
        return actionTypes().contains(type);
    }

    /**
     * Targets of {@code route to} actions, in order of first appearance.
     */
    public Set<String> routeTargets() {
        Set<String> targets = new LinkedHashSet<>();
        for (IrAction action : actions()) {
            if (action.action() == ActionType.ROUTE && action.target() != null) {
                targets.add(action.target());
            }
        }
        return targets;
    }

    /**
     * Render the function as text, one instruction per line.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("func ").append(id)
                .append(" [").append(metadata.category()).append(", priority=").append(metadata.priority())
                .append("]\n");
        for (BasicBlock block : blocks) {
            sb.append("  b").append(block.id()).append(" (").append(block.label()).append("):\n");
            for (Instruction instruction : block.instructions()) {
                sb.append("    ").append(instruction).append('\n');
            }
            if (block.terminator().isEmpty()) {
                sb.append("    <default allow>\n");
            }
        }
        return sb.toString();
    }
}
