package org.introspect.recorder;

import org.introspect.ir.BinaryOp;
import org.introspect.ir.Call;
import org.introspect.ir.Cast;
import org.introspect.ir.Constant;
import org.introspect.ir.ExpressionNode;
import org.introspect.ir.LogicalAnd;
import org.introspect.ir.LogicalOr;
import org.introspect.ir.NodeVisitor;
import org.introspect.ir.NullPointer;
import org.introspect.ir.StringLiteral;
import org.introspect.ir.UnaryOp;
import org.introspect.ir.Unsupported;
import org.introspect.ir.Variable;
import org.introspect.runtime.Pointer;
import org.introspect.runtime.Values;
import org.introspect.types.CType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The short-circuit-preserving rewrite. Walks a classified tree once, in
 * evaluation order, allocating a slot per leaf and emitting a {@link Step} per
 * node that evaluates it the way the original condition would:
 * <ul>
 *     <li>leaves are read once and recorded when reached;</li>
 *     <li>casts record the converted value;</li>
 *     <li>calls evaluate and record their arguments left to right, then record
 *     their own result;</li>
 *     <li>{@code &&} and {@code ||} skip their right operand when the left one
 *     decides the result, leaving that subtree unreached;</li>
 *     <li>address-of records the address without reading the variable;</li>
 *     <li>unsupported nodes are evaluated opaquely, never expanded.</li>
 * </ul>
 */
public class EvaluationRecorder {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluationRecorder.class);

    public InstrumentedAssertion rewrite(String primitive, String sourceText, ExpressionNode root) {
        SlotTable slots = new SlotTable(maxId(root) + 1);
        Step rootStep = root.accept(new Emitter(slots));
        LOG.debug("Rewrote '{}' with {} slots over {} nodes", sourceText, slots.size(), slots.nodeCount());
        return new InstrumentedAssertion(primitive, sourceText, root, slots, rootStep);
    }

    private static int maxId(ExpressionNode node) {
        int max = node.getId();
        for (ExpressionNode child : node.getChildren()) {
            max = Math.max(max, maxId(child));
        }
        return max;
    }

    /**
     * Slots are allocated in visiting order, which mirrors evaluation order.
     */
    private static final class Emitter implements NodeVisitor<Step> {

        private final SlotTable slots;

        private Emitter(SlotTable slots) {
            this.slots = slots;
        }

        @Override
        public Step visit(Variable n) {
            int id = n.getId();
            int slot = slots.allocate(n);
            String name = n.getName();
            CType type = n.getType();
            return frame -> frame.record(id, slot, Values.coerce(frame.environment().read(name), type));
        }

        @Override
        public Step visit(Constant n) {
            int id = n.getId();
            int slot = slots.allocate(n);
            Object value = Values.convert(n.getValue(), n.getType());
            return frame -> frame.record(id, slot, value);
        }

        @Override
        public Step visit(StringLiteral n) {
            int id = n.getId();
            int slot = slots.allocate(n);
            String value = n.getValue();
            return frame -> frame.record(id, slot, frame.environment().stringLiteral(value));
        }

        @Override
        public Step visit(NullPointer n) {
            int id = n.getId();
            int slot = slots.allocate(n);
            return frame -> frame.record(id, slot, Pointer.NULL);
        }

        @Override
        public Step visit(Cast n) {
            int id = n.getId();
            Step inner = n.getInner().accept(this);
            int slot = slots.allocate(n);
            CType target = n.getType();
            return frame -> {
                frame.enter(id);
                Object value = inner.run(frame);
                return frame.record(id, slot, Values.convert(value, target));
            };
        }

        @Override
        public Step visit(UnaryOp n) {
            int id = n.getId();
            if (n.isAddressOf()) {
                int slot = slots.allocate(n);
                String variable = ((Variable) n.getOperand()).getName();
                return frame -> frame.record(id, slot, frame.environment().addressOf(variable));
            }
            Step operand = n.getOperand().accept(this);
            CType type = n.getType();
            return frame -> {
                frame.enter(id);
                Object value = operand.run(frame);
                return frame.complete(id, Operations.unary(n.getOperator(), value, type));
            };
        }

        @Override
        public Step visit(BinaryOp n) {
            int id = n.getId();
            Step left = n.getLeft().accept(this);
            Step right = n.getRight().accept(this);
            return frame -> {
                frame.enter(id);
                Object l = left.run(frame);
                Object r = right.run(frame);
                return frame.complete(id,
                        Operations.binary(n.getOperator(), l, r, n.getOperationType(), n.getType()));
            };
        }

        @Override
        public Step visit(LogicalAnd n) {
            int id = n.getId();
            Step left = n.getLeft().accept(this);
            Step right = n.getRight().accept(this);
            return frame -> {
                frame.enter(id);
                if (!Values.isTrue(left.run(frame))) {
                    return frame.complete(id, 0L);
                }
                return frame.complete(id, Values.isTrue(right.run(frame)) ? 1L : 0L);
            };
        }

        @Override
        public Step visit(LogicalOr n) {
            int id = n.getId();
            Step left = n.getLeft().accept(this);
            Step right = n.getRight().accept(this);
            return frame -> {
                frame.enter(id);
                if (Values.isTrue(left.run(frame))) {
                    return frame.complete(id, 1L);
                }
                return frame.complete(id, Values.isTrue(right.run(frame)) ? 1L : 0L);
            };
        }

        @Override
        public Step visit(Call n) {
            int id = n.getId();
            List<Step> arguments = new ArrayList<>();
            for (ExpressionNode argument : n.getArguments()) {
                arguments.add(argument.accept(this));
            }
            int slot = slots.allocate(n);
            String callee = n.getCallee();
            List<CType> parameterTypes = n.getParameterTypes();
            CType returnType = n.getType();
            return frame -> {
                frame.enter(id);
                List<Object> values = new ArrayList<>(arguments.size());
                for (int i = 0; i < arguments.size(); i++) {
                    values.add(Values.convert(arguments.get(i).run(frame), parameterTypes.get(i)));
                }
                Object result = frame.environment().call(callee, values);
                return frame.record(id, slot, Values.coerce(result, returnType));
            };
        }

        @Override
        public Step visit(Unsupported n) {
            int id = n.getId();
            int slot = slots.allocate(n);
            String text = n.getOriginalText();
            CType type = n.getType();
            return frame -> frame.record(id, slot, Values.coerce(frame.environment().evaluateOpaque(text), type));
        }
    }
}
