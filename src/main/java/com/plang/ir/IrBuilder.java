package com.plang.ir;

import com.plang.ast.ActionStatement;
import com.plang.ast.Expression;
import com.plang.ast.PolicyDeclaration;
import com.plang.ast.PolicySet;
import com.plang.ast.Statement;
import com.plang.ast.WhenStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a parsed policy set into an {@link IrModule}, one function per policy.
 * <p>
 * Each {@code when} becomes a branch over a then block and an else (or continuation) block.
 * Builtin calls inside a condition are hoisted, innermost first, into CALL instructions ahead
 * of the branch. The first action on a path ends that path; statements after it are unreachable
 * and are dropped. A path that reaches the end of the body without an action falls off the end,
 * which the engine treats as the default ALLOW.
 * <p>
 * Policies without an explicit priority get their declaration index.
 */
public class IrBuilder {

    private static final Logger log = LoggerFactory.getLogger(IrBuilder.class);

    private static final int TERMINATED = -1;

    /**
     * Build the IR module for a parsed policy set.
     *
     * @param policySet Parsed source
     * @return Module with functions in declaration order
     */
    public IrModule build(PolicySet policySet) {
        List<IrFunction> functions = new ArrayList<>();
        List<PolicyDeclaration> policies = policySet.policies();

        for (int i = 0; i < policies.size(); i++) {
            PolicyDeclaration declaration = policies.get(i);
            int priority = declaration.hasExplicitPriority() ? declaration.priority() : i;
            IrFunction function = new FunctionBuilder(declaration, priority).build();
            functions.add(function);
            log.debug("Lowered policy '{}' into {} blocks", function.id(), function.blocks().size());
        }

        return new IrModule(functions);
    }

    /**
     * Builds one function. Blocks are addressed by index until the function is sealed.
     */
    private static final class FunctionBuilder {

        private final PolicyDeclaration declaration;
        private final int priority;
        private final List<String> labels = new ArrayList<>();
        private final List<List<Instruction>> blocks = new ArrayList<>();
        private int nextTemp;
        private int nextLabel;

        FunctionBuilder(PolicyDeclaration declaration, int priority) {
            this.declaration = declaration;
            this.priority = priority;
        }

        IrFunction build() {
            int entry = newBlock("entry");
            lowerStatements(declaration.body(), entry);

            List<BasicBlock> sealed = new ArrayList<>(blocks.size());
            for (int i = 0; i < blocks.size(); i++) {
                sealed.add(new BasicBlock(i, labels.get(i), blocks.get(i)));
            }

            IrFunction function = new IrFunction(
                    declaration.name(),
                    new GovernanceMetadata(declaration.category(), priority),
                    sealed,
                    entry,
                    nextTemp);
            verify(function);
            return function;
        }

        /**
         * Lower statements into the given block.
         *
         * @return Id of the block left open at the end, or TERMINATED when every path ended in an action
         */
        private int lowerStatements(List<Statement> statements, int block) {
            int current = block;
            for (int i = 0; i < statements.size(); i++) {
                if (current == TERMINATED) {
                    log.debug("Policy '{}': dropping {} unreachable statement(s) from line {}",
                            declaration.name(), statements.size() - i, statements.get(i).line());
                    break;
                }
                Statement statement = statements.get(i);
                if (statement instanceof ActionStatement action) {
                    blocks.get(current).add(new IrAction(action.action(), action.target(), action.reason()));
                    current = TERMINATED;
                } else if (statement instanceof WhenStatement when) {
                    current = lowerWhen(when, current);
                }
            }
            return current;
        }

        private int lowerWhen(WhenStatement when, int block) {
            int label = nextLabel++;
            IrExpression condition = lowerExpression(when.condition(), block);

            int thenBlock = newBlock("then_" + label);
            int thenOpen = lowerStatements(when.thenBody(), thenBlock);

            int elseBlock = TERMINATED;
            int elseOpen = TERMINATED;
            boolean hasElse = !when.elseBody().isEmpty();
            if (hasElse) {
                elseBlock = newBlock("else_" + label);
                elseOpen = lowerStatements(when.elseBody(), elseBlock);
            }

            boolean needsJoin = !hasElse || thenOpen != TERMINATED || elseOpen != TERMINATED;
            int join = needsJoin ? newBlock("join_" + label) : TERMINATED;

            blocks.get(block).add(new IrBranch(condition, thenBlock, hasElse ? elseBlock : join));
            if (thenOpen != TERMINATED) {
                blocks.get(thenOpen).add(new IrJump(join));
            }
            if (elseOpen != TERMINATED) {
                blocks.get(elseOpen).add(new IrJump(join));
            }
            return join;
        }

        private IrExpression lowerExpression(Expression expression, int block) {
            if (expression instanceof Expression.Literal literal) {
                return new IrExpression.Const(literal.value());
            }
            if (expression instanceof Expression.Path path) {
                return new IrExpression.Var(path.segments());
            }
            if (expression instanceof Expression.ListLiteral list) {
                List<IrExpression> items = new ArrayList<>();
                for (Expression item : list.items()) {
                    items.add(lowerExpression(item, block));
                }
                return new IrExpression.ListOf(items);
            }
            if (expression instanceof Expression.Not not) {
                return new IrExpression.Not(lowerExpression(not.operand(), block));
            }
            if (expression instanceof Expression.Binary binary) {
                IrExpression left = lowerExpression(binary.left(), block);
                IrExpression right = lowerExpression(binary.right(), block);
                return new IrExpression.Binary(binary.operator(), left, right);
            }
            if (expression instanceof Expression.Call call) {
                List<IrExpression> args = new ArrayList<>();
                for (Expression arg : call.args()) {
                    args.add(lowerExpression(arg, block));
                }
                int slot = nextTemp++;
                blocks.get(block).add(new IrCall(call.function(), args, slot));
                return new IrExpression.Temp(slot);
            }
            throw new IllegalStateException("Unhandled expression: " + expression);
        }

        private int newBlock(String label) {
            blocks.add(new ArrayList<>());
            labels.add(label);
            return blocks.size() - 1;
        }

        /**
         * Structural well-formedness: terminators come last and every target exists.
         */
        private void verify(IrFunction function) {
            int count = function.blocks().size();
            for (BasicBlock block : function.blocks()) {
                List<Instruction> instructions = block.instructions();
                for (int i = 0; i < instructions.size(); i++) {
                    Instruction instruction = instructions.get(i);
                    if (instruction.isTerminator() && i != instructions.size() - 1) {
                        throw new IllegalStateException("Policy '" + function.id()
                                + "': terminator before end of block b" + block.id());
                    }
                    if (instruction instanceof IrBranch branch) {
                        checkTarget(function, branch.thenBlock(), count);
                        checkTarget(function, branch.elseBlock(), count);
                    } else if (instruction instanceof IrJump jump) {
                        checkTarget(function, jump.target(), count);
                    }
                }
            }
        }

        private void checkTarget(IrFunction function, int target, int count) {
            if (target < 0 || target >= count) {
                throw new IllegalStateException("Policy '" + function.id() + "': invalid block target b" + target);
            }
        }
    }
}
