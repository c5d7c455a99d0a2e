package pass.IRPass;

import frontend.Registers;
import ir.Diagnostic;
import ir.TypeTable;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.Type;
import ir.type.TypeLattice;
import ir.type.UnknownType;
import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.Variable;
import ir.value.instructions.Instruction;
import pass.IRPassType;
import pass.Pass;
import pass.PassContext;
import pass.PassResult;
import util.LoggingManager;
import util.logging.Logger;

import java.util.Map;

/**
 * Propagates types over the lattice until nothing moves. Every instruction
 * contributes constraints between the types of its operands and its result;
 * each constraint is applied as a meet, so types only ever go down and the
 * iteration terminates. A value that falls to Conflict is reported once.
 */
public class TypeInferencePass implements Pass.FunctionPass {
    public static final String WIDEN_SMALL_INTS = "widen-small-ints";

    // PointerTo(PointerTo(PointerTo(T))) is as deep as inference goes
    private static final int MAX_POINTER_DEPTH = 3;
    private static final int MAX_ROUNDS = 64;

    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public String getName() {
        return IRPassType.TYPE_INFERENCE.getName();
    }

    @Override
    public PassResult runOnFunction(Function function, PassContext context) {
        TypeLattice lattice = new TypeLattice(context.getOptions().getBoolean(WIDEN_SMALL_INTS, false));
        Solver solver = new Solver(function, lattice);
        solver.seed();
        int rounds = 0;
        while (solver.round()) {
            if (++rounds >= MAX_ROUNDS) {
                log.warn("{}: type inference stopped after {} rounds", function.getName(), rounds);
                break;
            }
        }
        if (!function.returnsValue() && !function.getReturnType().isVoid()) {
            function.setReturnType(VoidType.getVoid());
            solver.changed = true;
        }
        register(function, context.getModule().getTypeTable());
        return PassResult.of(solver.changed);
    }

    private static void register(Function f, TypeTable table) {
        for (Variable v : f.getVariables()) {
            table.register(v.getType());
        }
        table.register(f.getReturnType());
    }

    private static final class Solver {
        private final Function f;
        private final TypeLattice lattice;
        private final Map<Integer, Instruction> defs;
        private final Map<Integer, Integer> blockOf;
        boolean changed;
        private boolean roundChanged;

        Solver(Function f, TypeLattice lattice) {
            this.f = f;
            this.lattice = lattice;
            this.defs = f.definitions();
            this.blockOf = f.instructionBlocks();
        }

        void seed() {
            for (String reg : new String[]{Registers.ESP, Registers.EBP}) {
                Variable v = f.findRegister(reg);
                if (v != null) {
                    constrain(Value.variable(v), PointerType.opaque(), f.getEntryBlockId(), -1);
                }
            }
        }

        boolean round() {
            roundChanged = false;
            for (BasicBlock bb : f.getBlocks()) {
                for (Instruction inst : bb.getInstructions()) {
                    visit(inst, bb.getId());
                }
            }
            return roundChanged;
        }

        private void visit(Instruction inst, int block) {
            long addr = inst.getAddress();
            Value result = inst.producesValue() ? inst.asValue() : null;
            IntegerType sized = IntegerType.ofBytes(Math.max(1, inst.getWidth()));
            switch (inst.opCode()) {
                case ADD, SUB -> {
                    Type a = typeOf(inst.getOperand(0));
                    Type b = typeOf(inst.getOperand(1));
                    if (a.isPointer() && b.isPointer() && inst.opCode() == Opcode.SUB) {
                        constrain(result, sized, block, addr);
                    } else if (a.isPointer() && !b.isPointer()) {
                        constrain(result, a, block, addr);
                    } else if (b.isPointer() && !a.isPointer() && inst.opCode() == Opcode.ADD) {
                        constrain(result, b, block, addr);
                    } else if (a.isInteger() && !b.isPointer() || b.isInteger() && !a.isPointer()) {
                        constrain(result, sized, block, addr);
                    }
                }
                case MUL, SHL, SHR, SAR, NEG, NOT -> {
                    constrain(result, sized, block, addr);
                    // a shift count says nothing about the shifted value's width
                    int constrained = isShift(inst.opCode()) ? 1 : inst.getNumOperands();
                    for (int i = 0; i < constrained; i++) {
                        constrain(inst.getOperand(i), sized, block, addr);
                    }
                }
                case AND, OR, XOR, ZEXT, SEXT -> constrain(result, sized, block, addr);
                case CMP_EQ, CMP_NE, CMP_SLT, CMP_SLE, CMP_SGT, CMP_SGE,
                        CMP_ULT, CMP_ULE, CMP_UGT, CMP_UGE -> {
                    constrain(result, IntegerType.getI1(), block, addr);
                    unify(inst.getOperand(0), inst.getOperand(1), block, addr);
                }
                case LOAD -> {
                    Value ptr = inst.getOperand(0);
                    constrain(ptr, pointerTo(typeOf(result)), block, addr);
                    Type pt = typeOf(ptr);
                    if (pt.isPointer()) {
                        constrain(result, ((PointerType) pt).getPointeeType(), block, addr);
                    }
                }
                case STORE -> {
                    Value ptr = inst.getOperand(0);
                    Value stored = inst.getOperand(1);
                    constrain(ptr, pointerTo(typeOf(stored)), block, addr);
                    Type pt = typeOf(ptr);
                    if (pt.isPointer()) {
                        constrain(stored, ((PointerType) pt).getPointeeType(), block, addr);
                    }
                }
                case ASSIGN -> unify(Value.variable(inst.getDestination()), inst.getOperand(0), block, addr);
                case COPY -> unify(result, inst.getOperand(0), block, addr);
                case PHI -> {
                    for (Value v : inst.getOperands()) {
                        unify(result, v, block, addr);
                    }
                }
                case COND_BRANCH -> constrain(inst.getOperand(0), IntegerType.getI1(), block, addr);
                case SWITCH -> constrain(inst.getOperand(0), IntegerType.getI32(), block, addr);
                case RETURN -> {
                    if (inst.getNumOperands() > 0 && !inst.getOperand(0).isConstant()) {
                        Value v = inst.getOperand(0);
                        Type met = meet(f.getReturnType(), typeOf(v), v, block, addr);
                        if (!met.equals(f.getReturnType())) {
                            f.setReturnType(met);
                            mark();
                        }
                        constrain(v, met, block, addr);
                    }
                }
                default -> {
                }
            }
        }

        private void unify(Value a, Value b, int block, long addr) {
            if (a.isConstant() || b.isConstant()) {
                return;
            }
            Type met = meet(typeOf(a), typeOf(b), a, block, addr);
            constrain(a, met, block, addr);
            constrain(b, met, block, addr);
        }

        private void constrain(Value v, Type t, int block, long addr) {
            if (v == null || v.isConstant()) {
                return;
            }
            Type old = typeOf(v);
            Type met = meet(old, t, v, block, addr);
            if (met.equals(old)) {
                return;
            }
            if (v.isVariable()) {
                f.getVariable(v.getVariableId()).setType(met);
            } else {
                Instruction def = defs.get(v.getInstructionId());
                if (def == null) {
                    return;
                }
                def.setType(met);
            }
            mark();
        }

        private Type meet(Type a, Type b, Value subject, int block, long addr) {
            Type met = lattice.meet(a, b);
            if (met.isConflict() && !a.isConflict() && !b.isConflict()) {
                int where = subject.isResult() ? blockOf.getOrDefault(subject.getInstructionId(), block) : block;
                f.addDiagnostic(Diagnostic.Kind.TYPE_CONFLICT, where, addr,
                        describe(subject) + " used as both " + a + " and " + b);
            }
            return met;
        }

        private String describe(Value v) {
            if (v.isVariable()) {
                Variable var = f.getVariable(v.getVariableId());
                return var == null ? v.toString() : var.getName();
            }
            return v.toString();
        }

        private Type typeOf(Value v) {
            if (v == null || v.isConstant()) {
                return UnknownType.get();
            }
            if (v.isVariable()) {
                Variable var = f.getVariable(v.getVariableId());
                return var == null ? UnknownType.get() : var.getType();
            }
            Instruction def = defs.get(v.getInstructionId());
            return def == null ? UnknownType.get() : def.getType();
        }

        private void mark() {
            roundChanged = true;
            changed = true;
        }

        private static boolean isShift(Opcode op) {
            return op == Opcode.SHL || op == Opcode.SHR || op == Opcode.SAR;
        }

        private static Type pointerTo(Type t) {
            return depth(t) >= MAX_POINTER_DEPTH ? PointerType.opaque() : PointerType.get(t);
        }

        private static int depth(Type t) {
            int d = 0;
            while (t instanceof PointerType p) {
                t = p.getPointeeType();
                d++;
            }
            return d;
        }
    }
}
