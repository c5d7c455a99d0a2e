package emit;

import ir.IRModule;
import ir.type.Type;
import ir.type.UnknownType;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.StorageClass;
import ir.value.Value;
import ir.value.Variable;
import ir.value.instructions.Instruction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders IR values of one function as C expressions.
 * <p>
 * A result used exactly once, later in its own block, is folded into its user
 * unless something in between could change what it computes: an assignment to
 * a variable it reads, or a store, call or intrinsic when it reads memory or
 * has effects of its own. Every other used result gets a temporary.
 */
public class ExpressionPrinter {
    // C precedence levels, lower binds tighter
    private static final int PRIMARY = 0;
    private static final int POSTFIX = 1;
    private static final int UNARY = 2;

    private final IRModule module;
    private final Function function;
    private final Map<Integer, Instruction> defs;
    private final Map<Integer, Integer> uses = new HashMap<>();
    private final Set<Integer> inlined = new HashSet<>();
    private final Map<Integer, Facts> facts = new HashMap<>();

    private record Expr(String text, int precedence) {
    }

    // what an expression tree reads and whether it has effects
    private record Facts(Set<Integer> variables, boolean memory, boolean effects) {
    }

    public ExpressionPrinter(IRModule module, Function function) {
        this.module = module;
        this.function = function;
        this.defs = function.definitions();
        for (BasicBlock bb : function.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                for (Value v : inst.getOperands()) {
                    if (v.isResult()) {
                        uses.merge(v.getInstructionId(), 1, Integer::sum);
                    }
                }
            }
        }
        for (BasicBlock bb : function.getBlocks()) {
            decideInlining(bb);
        }
    }

    private void decideInlining(BasicBlock bb) {
        List<Instruction> insts = bb.getInstructions();
        Map<Integer, Integer> position = new HashMap<>();
        for (int i = 0; i < insts.size(); i++) {
            position.put(insts.get(i).getId(), i);
        }
        for (int j = 0; j < insts.size(); j++) {
            Instruction user = insts.get(j);
            if (user.opCode() == Opcode.PHI) {
                continue;
            }
            for (Value v : user.getOperands()) {
                if (!v.isResult() || uses.getOrDefault(v.getInstructionId(), 0) != 1) {
                    continue;
                }
                Integer i = position.get(v.getInstructionId());
                Instruction def = defs.get(v.getInstructionId());
                if (i == null || i >= j || def.opCode() == Opcode.PHI) {
                    continue;
                }
                if (!clobbered(facts(def), insts.subList(i + 1, j))) {
                    inlined.add(def.getId());
                }
            }
        }
    }

    private boolean clobbered(Facts f, List<Instruction> between) {
        for (Instruction inst : between) {
            switch (inst.opCode()) {
                case ASSIGN -> {
                    Variable dest = function.getVariable(inst.getDestination());
                    if (f.variables().contains(inst.getDestination())
                            || f.effects() && dest != null && dest.getStorage() != StorageClass.REGISTER) {
                        return true;
                    }
                }
                case STORE, CALL, INTRINSIC -> {
                    if (f.memory() || f.effects()) {
                        return true;
                    }
                }
                default -> {
                }
            }
        }
        return false;
    }

    private Facts facts(Instruction def) {
        Facts known = facts.get(def.getId());
        if (known != null) {
            return known;
        }
        Set<Integer> vars = new HashSet<>();
        boolean memory = def.opCode() == Opcode.LOAD;
        boolean effects = def.opCode() == Opcode.CALL || def.opCode() == Opcode.INTRINSIC;
        for (Value v : def.getOperands()) {
            if (v.isVariable()) {
                vars.add(v.getVariableId());
                Variable var = function.getVariable(v.getVariableId());
                memory |= var != null && var.getStorage() != StorageClass.REGISTER;
            } else if (v.isResult() && inlined.contains(v.getInstructionId())) {
                Facts sub = facts(defs.get(v.getInstructionId()));
                vars.addAll(sub.variables());
                memory |= sub.memory();
                effects |= sub.effects();
            }
        }
        Facts f = new Facts(vars, memory, effects);
        facts.put(def.getId(), f);
        return f;
    }

    /**
     * @return ids of the variables the printed form of {@code v} mentions
     */
    public Set<Integer> variablesRead(Value v) {
        Set<Integer> out = new LinkedHashSet<>();
        collectVariables(v, out);
        return out;
    }

    private void collectVariables(Value v, Set<Integer> out) {
        if (v.isVariable()) {
            out.add(v.getVariableId());
        } else if (v.isResult()) {
            Instruction def = defs.get(v.getInstructionId());
            if (def != null && isInlined(def)) {
                for (Value op : def.getOperands()) {
                    collectVariables(op, out);
                }
            }
        }
    }

    /**
     * @return the results without an inlined form that {@code v} mentions, as instructions
     */
    public List<Instruction> temporariesRead(Value v) {
        List<Instruction> out = new ArrayList<>();
        collectTemporaries(v, out);
        return out;
    }

    private void collectTemporaries(Value v, List<Instruction> out) {
        if (!v.isResult()) {
            return;
        }
        Instruction def = defs.get(v.getInstructionId());
        if (def == null) {
            return;
        }
        if (isInlined(def)) {
            for (Value op : def.getOperands()) {
                collectTemporaries(op, out);
            }
        } else {
            out.add(def);
        }
    }

    public boolean isInlined(Instruction inst) {
        return inlined.contains(inst.getId());
    }

    /**
     * @return true if the instruction's value is stored in a temporary
     */
    public boolean needsTemporary(Instruction inst) {
        if (!inst.producesValue() || isInlined(inst)) {
            return false;
        }
        return inst.opCode() == Opcode.PHI || uses.getOrDefault(inst.getId(), 0) > 0;
    }

    public int useCount(Instruction inst) {
        return uses.getOrDefault(inst.getId(), 0);
    }

    public String temporaryName(Instruction inst) {
        return "t" + inst.getId();
    }

    public String temporaryType(Instruction inst) {
        if (inst.opCode().isCompare()) {
            return "bool";
        }
        return TypeNames.of(inst.getType(), inst.getWidth());
    }

    public String print(Value v) {
        return expr(v).text();
    }

    /**
     * @return the right-hand side of the instruction, ignoring any temporary it may have
     */
    public String printDefinition(Instruction inst) {
        return define(inst).text();
    }

    /**
     * Renders a branch condition, negated if asked. A negated compare is
     * printed as the inverse compare.
     */
    public String condition(Value v, boolean negated) {
        if (!negated) {
            return print(v);
        }
        if (v.isResult() && isInlined(defs.get(v.getInstructionId()))) {
            Instruction def = defs.get(v.getInstructionId());
            if (def.opCode().isCompare()) {
                return compare(def, def.opCode().inverse()).text();
            }
        }
        return "!" + parenthesize(expr(v), UNARY);
    }

    public String call(Instruction call) {
        List<Value> ops = call.getOperands();
        String target;
        int first;
        if (call.getMnemonic() != null) {
            target = call.getMnemonic();
            first = 0;
        } else if (!ops.isEmpty()) {
            Value t = ops.get(0);
            first = 1;
            if (t.isConstant()) {
                Function callee = module == null ? null : module.getFunctionAt(t.getConstant());
                target = callee != null ? callee.getName() : Function.defaultName(t.getConstant());
            } else {
                target = "(*" + print(t) + ")";
            }
        } else {
            target = "(*unknown)";
            first = 0;
        }
        return target + arguments(ops.subList(first, ops.size()));
    }

    public String constant(long value, int bits) {
        if (value >= 0 && value < 10) {
            return Long.toString(value);
        }
        if (bits > 0 && bits < 64) {
            long masked = value & ((1L << bits) - 1);
            return masked < 10 ? Long.toString(masked) : "0x" + Long.toHexString(masked);
        }
        return value < 0 ? "-0x" + Long.toHexString(-value) : "0x" + Long.toHexString(value);
    }

    private String arguments(List<Value> args) {
        List<String> parts = new ArrayList<>();
        for (Value a : args) {
            parts.add(print(a));
        }
        return "(" + String.join(", ", parts) + ")";
    }

    private Expr expr(Value v) {
        switch (v.getKind()) {
            case CONSTANT -> {
                return new Expr(constant(v.getConstant(), v.getBits()), PRIMARY);
            }
            case VARIABLE -> {
                Variable var = function.getVariable(v.getVariableId());
                return new Expr(var == null ? "var" + v.getVariableId() : var.getName(), PRIMARY);
            }
            default -> {
                Instruction def = defs.get(v.getInstructionId());
                if (def == null) {
                    return new Expr("t" + v.getInstructionId(), PRIMARY);
                }
                if (!isInlined(def)) {
                    return new Expr(temporaryName(def), PRIMARY);
                }
                return define(def);
            }
        }
    }

    private Expr define(Instruction inst) {
        Opcode op = inst.opCode();
        if (op.isBinary()) {
            return binary(inst.getOperand(0), op, inst.getOperand(1));
        }
        if (op.isCompare()) {
            return compare(inst, op);
        }
        switch (op) {
            case NEG, NOT -> {
                return new Expr(op.getSymbol() + parenthesize(expr(inst.getOperand(0)), UNARY), UNARY);
            }
            case ZEXT, SEXT -> {
                String cast = op == Opcode.ZEXT ? TypeNames.unsigned(inst.getWidth()) : TypeNames.signed(inst.getWidth());
                return new Expr("(" + cast + ")" + parenthesize(expr(inst.getOperand(0)), UNARY), UNARY);
            }
            case LOAD -> {
                return new Expr(dereference(inst.getOperand(0), inst.getWidth(), inst.getType()), UNARY);
            }
            case COPY -> {
                return expr(inst.getOperand(0));
            }
            case CALL -> {
                return new Expr(call(inst), POSTFIX);
            }
            case INTRINSIC -> {
                return new Expr(inst.getMnemonic() + arguments(inst.getOperands()), POSTFIX);
            }
            default -> {
                // PHI and anything without a value of its own
                return new Expr(temporaryName(inst), PRIMARY);
            }
        }
    }

    /**
     * @return the lvalue or rvalue {@code *(T *)addr} for a {@code width}-byte access
     */
    public String dereference(Value address, int width, Type accessType) {
        Expr a = expr(address);
        Type at = typeOf(address);
        if (at.isPointer()) {
            return "*" + parenthesize(a, UNARY);
        }
        String t = TypeNames.of(accessType, width);
        String cast = t.endsWith("*") ? t + "*" : t + " *";
        return "*(" + cast + ")" + parenthesize(a, UNARY);
    }

    private Type typeOf(Value v) {
        if (v.isResult()) {
            Instruction def = defs.get(v.getInstructionId());
            return def == null ? UnknownType.get() : def.getType();
        }
        return function.typeOf(v);
    }

    private Expr binary(Value lhs, Opcode op, Value rhs) {
        int p = op.getPrecedence();
        Expr l = expr(lhs);
        Expr r = expr(rhs);
        String left = l.precedence() > p ? "(" + l.text() + ")" : l.text();
        String right = r.precedence() >= p ? "(" + r.text() + ")" : r.text();
        return new Expr(left + " " + op.getSymbol() + " " + right, p);
    }

    private Expr compare(Instruction inst, Opcode op) {
        int p = op.getPrecedence();
        Value lhs = inst.getOperand(0);
        Value rhs = inst.getOperand(1);
        Expr l = expr(lhs);
        Expr r = expr(rhs);
        if (op.isUnsignedCompare()) {
            l = unsignedView(lhs, l);
            r = unsignedView(rhs, r);
        }
        String left = l.precedence() > p ? "(" + l.text() + ")" : l.text();
        String right = r.precedence() >= p ? "(" + r.text() + ")" : r.text();
        return new Expr(left + " " + op.getSymbol() + " " + right, p);
    }

    private Expr unsignedView(Value v, Expr e) {
        if (v.isConstant()) {
            return e;
        }
        return new Expr("(" + TypeNames.unsigned(widthOf(v)) + ")" + parenthesize(e, UNARY), UNARY);
    }

    private int widthOf(Value v) {
        if (v.isVariable()) {
            Variable var = function.getVariable(v.getVariableId());
            return var == null ? 4 : var.getWidth();
        }
        if (v.isResult()) {
            Instruction def = defs.get(v.getInstructionId());
            return def == null ? 4 : def.getWidth();
        }
        return Math.max(1, v.getBits() / 8);
    }

    private static String parenthesize(Expr e, int context) {
        return e.precedence() > context ? "(" + e.text() + ")" : e.text();
    }
}
