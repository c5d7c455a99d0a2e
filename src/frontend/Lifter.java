package frontend;

import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.StorageClass;
import ir.value.Value;
import ir.value.Variable;
import ir.value.instructions.Instruction;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers decoded x86-32 instructions into IR, one block at a time.
 * Control transfers are left to {@link CFGBuilder}; the lifter only supplies
 * their condition or dispatch values.
 */
public class Lifter {
    private static final Logger logger = LoggingManager.getLogger(Lifter.class);

    private final Function function;
    private BasicBlock block;
    private FlagState flags;

    /**
     * The operation that last set the status flags in the current block.
     * For cmp/sub, {@code lhs - rhs}; for everything else the flags describe {@code result}.
     */
    private record FlagState(boolean compare, Value lhs, Value rhs, Value result, int width) {
    }

    public Lifter(Function function) {
        this.function = function;
    }

    public void startBlock(BasicBlock bb) {
        this.block = bb;
        this.flags = null;
    }

    public void lift(DecodedInstruction inst) {
        String m = inst.getMnemonic();
        long addr = inst.getAddress();
        switch (m) {
            case "nop", "ret", "retn", "retf", "iret", "jmp", "hlt" -> {
            }
            case "mov" -> {
                int w = widthOf(inst, 0, 1);
                write(inst.getOperand(0), read(inst.getOperand(1), w, addr), addr);
            }
            case "movzx", "movsx" -> {
                int dw = widthOf(inst, 0, -1);
                Value src = read(inst.getOperand(1), widthOf(inst, 1, -1, 1), addr);
                Value ext = emit(m.equals("movzx") ? Opcode.ZEXT : Opcode.SEXT, addr, dw, src);
                write(inst.getOperand(0), ext, addr);
            }
            case "lea" -> write(inst.getOperand(0), address(inst.getOperand(1), addr), addr);
            case "push" -> push(read(inst.getOperand(0), 4, addr), addr);
            case "pop" -> write(inst.getOperand(0), pop(addr), addr);
            case "leave" -> {
                assign(Registers.ESP, reg(Registers.EBP), addr);
                assign(Registers.EBP, pop(addr), addr);
            }
            case "add", "sub", "and", "or", "xor", "imul", "shl", "sal", "shr", "sar" -> arithmetic(inst);
            case "inc", "dec" -> {
                int w = widthOf(inst, 0, -1);
                Value a = read(inst.getOperand(0), w, addr);
                Value r = emit(m.equals("inc") ? Opcode.ADD : Opcode.SUB, addr, w, a, Value.constant(1, w * 8));
                write(inst.getOperand(0), r, addr);
                flags = new FlagState(false, null, null, r, w);
            }
            case "neg", "not" -> {
                int w = widthOf(inst, 0, -1);
                Value a = read(inst.getOperand(0), w, addr);
                Value r = emit(m.equals("neg") ? Opcode.NEG : Opcode.NOT, addr, w, a);
                write(inst.getOperand(0), r, addr);
                if (m.equals("neg")) {
                    flags = new FlagState(false, null, null, r, w);
                }
            }
            case "cmp" -> {
                int w = widthOf(inst, 0, 1);
                Value a = read(inst.getOperand(0), w, addr);
                Value b = read(inst.getOperand(1), w, addr);
                flags = new FlagState(true, a, b, null, w);
            }
            case "test" -> {
                int w = widthOf(inst, 0, 1);
                Value a = read(inst.getOperand(0), w, addr);
                if (inst.getOperand(0).equals(inst.getOperand(1))) {
                    flags = new FlagState(false, null, null, a, w);
                } else {
                    Value b = read(inst.getOperand(1), w, addr);
                    flags = new FlagState(false, null, null, emit(Opcode.AND, addr, w, a, b), w);
                }
            }
            case "call" -> call(inst);
            default -> {
                if (m.startsWith("set") && inst.getNumOperands() == 1) {
                    Value c = compare(m.substring(3), addr);
                    write(inst.getOperand(0), emit(Opcode.ZEXT, addr, 1, c), addr);
                } else if (!inst.isConditionalJump()) {
                    intrinsic(inst);
                }
            }
        }
    }

    /**
     * Emits the compare a conditional jump tests.
     *
     * @return an i1 value that is true when the jump is taken
     */
    public Value condition(DecodedInstruction jcc) {
        return compare(jcc.getMnemonic().substring(1), jcc.getAddress());
    }

    /**
     * @return the value an indirect jump dispatches on: the index register of a
     *         jump table operand, or the jump target itself
     */
    public Value switchIndex(DecodedInstruction jmp) {
        if (jmp.getNumOperands() == 0) {
            return reg(Registers.EFLAGS);
        }
        Operand op = jmp.getOperand(0);
        if (op.isMemory() && op.getIndex() != null) {
            return readRegister(op.getIndex(), jmp.getAddress());
        }
        return read(op, 4, jmp.getAddress());
    }

    private void arithmetic(DecodedInstruction inst) {
        String m = inst.getMnemonic();
        long addr = inst.getAddress();
        int w = widthOf(inst, 0, 1);
        if (m.equals("xor") && inst.getOperand(0).equals(inst.getOperand(1))) {
            Value zero = Value.constant(0, w * 8);
            write(inst.getOperand(0), zero, addr);
            flags = new FlagState(false, null, null, zero, w);
            return;
        }
        Value a;
        Value b;
        if (m.equals("imul") && inst.getNumOperands() == 3) {
            a = read(inst.getOperand(1), w, addr);
            b = read(inst.getOperand(2), w, addr);
        } else {
            a = read(inst.getOperand(0), w, addr);
            b = inst.getNumOperands() > 1 ? read(inst.getOperand(1), w, addr) : Value.constant(1, 8);
        }
        Opcode op = switch (m) {
            case "add" -> Opcode.ADD;
            case "sub" -> Opcode.SUB;
            case "and" -> Opcode.AND;
            case "or" -> Opcode.OR;
            case "xor" -> Opcode.XOR;
            case "imul" -> Opcode.MUL;
            case "shl", "sal" -> Opcode.SHL;
            case "shr" -> Opcode.SHR;
            default -> Opcode.SAR;
        };
        Value r = emit(op, addr, w, a, b);
        write(inst.getOperand(0), r, addr);
        flags = new FlagState(op == Opcode.SUB, a, b, r, w);
    }

    private void call(DecodedInstruction inst) {
        long addr = inst.getAddress();
        Instruction call = function.newInstruction(Opcode.CALL, addr, 4);
        if (inst.getNumOperands() > 0) {
            Operand target = inst.getOperand(0);
            switch (target.getKind()) {
                case IMMEDIATE -> call.addOperand(Value.constant(target.getImmediate()));
                case SYMBOL -> call.setMnemonic(target.getSymbol());
                default -> call.addOperand(read(target, 4, addr));
            }
        }
        block.addInstruction(call);
        assign(Registers.EAX, call.asValue(), addr);
        flags = null;
    }

    private void intrinsic(DecodedInstruction inst) {
        List<Value> operands = new ArrayList<>();
        for (Operand op : inst.getOperands()) {
            operands.add(op.isMemory() ? address(op, inst.getAddress()) : read(op, 4, inst.getAddress()));
        }
        Instruction in = function.newInstruction(Opcode.INTRINSIC, inst.getAddress(), 4, operands);
        in.setMnemonic(inst.getMnemonic());
        block.addInstruction(in);
        flags = null;
        logger.debug("no semantics for '{}' at 0x{}, kept as intrinsic", inst.getMnemonic(),
                Long.toHexString(inst.getAddress()));
    }

    private Value compare(String cc, long addr) {
        Opcode op = switch (cc) {
            case "e", "z" -> Opcode.CMP_EQ;
            case "ne", "nz" -> Opcode.CMP_NE;
            case "l", "nge" -> Opcode.CMP_SLT;
            case "le", "ng" -> Opcode.CMP_SLE;
            case "g", "nle" -> Opcode.CMP_SGT;
            case "ge", "nl" -> Opcode.CMP_SGE;
            case "b", "nae", "c" -> Opcode.CMP_ULT;
            case "be", "na" -> Opcode.CMP_ULE;
            case "a", "nbe" -> Opcode.CMP_UGT;
            case "ae", "nb", "nc" -> Opcode.CMP_UGE;
            case "s" -> Opcode.CMP_SLT;
            case "ns" -> Opcode.CMP_SGE;
            default -> null;
        };
        if (op == null) {
            Instruction in = function.newInstruction(Opcode.INTRINSIC, addr, 1, reg(Registers.EFLAGS));
            in.setMnemonic("cond_" + cc);
            block.addInstruction(in);
            return in.asValue();
        }
        if (flags == null) {
            return emit(op, addr, 1, reg(Registers.EFLAGS), Value.constant(0));
        }
        boolean signTest = cc.equals("s") || cc.equals("ns");
        if (flags.compare() && !signTest) {
            return emit(op, addr, 1, flags.lhs(), flags.rhs());
        }
        Value result = flags.result();
        if (result == null) {
            result = emit(Opcode.SUB, addr, flags.width(), flags.lhs(), flags.rhs());
            flags = new FlagState(true, flags.lhs(), flags.rhs(), result, flags.width());
        }
        return emit(op, addr, 1, result, Value.constant(0, flags.width() * 8));
    }

    private void push(Value v, long addr) {
        Value sp = emit(Opcode.SUB, addr, 4, reg(Registers.ESP), Value.constant(4));
        assign(Registers.ESP, sp, addr);
        block.addInstruction(function.newInstruction(Opcode.STORE, addr, 4, sp, v));
    }

    private Value pop(long addr) {
        Value v = emit(Opcode.LOAD, addr, 4, reg(Registers.ESP));
        Value sp = emit(Opcode.ADD, addr, 4, reg(Registers.ESP), Value.constant(4));
        assign(Registers.ESP, sp, addr);
        return v;
    }

    /* operands */

    private Value read(Operand op, int width, long addr) {
        return switch (op.getKind()) {
            case IMMEDIATE -> Value.constant(op.getImmediate(), width * 8);
            case REGISTER -> readRegister(op.getRegister(), addr);
            case SYMBOL -> Value.variable(symbol(op.getSymbol()));
            case MEMORY -> {
                int w = op.getWidth() > 0 ? op.getWidth() : width;
                if (op.isAbsolute()) {
                    yield Value.variable(function.getOrCreateGlobal(op.getDisplacement(), w));
                }
                yield emit(Opcode.LOAD, addr, w, address(op, addr));
            }
        };
    }

    private void write(Operand op, Value v, long addr) {
        switch (op.getKind()) {
            case REGISTER -> writeRegister(op.getRegister(), v, addr);
            case SYMBOL -> block.addInstruction(function.newAssign(symbol(op.getSymbol()), v, addr));
            case MEMORY -> {
                int w = op.getWidth() > 0 ? op.getWidth() : 4;
                if (op.isAbsolute()) {
                    Variable g = function.getOrCreateGlobal(op.getDisplacement(), w);
                    block.addInstruction(function.newAssign(g, v, addr));
                } else {
                    block.addInstruction(function.newInstruction(Opcode.STORE, addr, w, address(op, addr), v));
                }
            }
            case IMMEDIATE -> throw new IllegalArgumentException(
                    "immediate used as destination at 0x" + Long.toHexString(addr));
        }
    }

    private Value readRegister(String name, long addr) {
        Registers.Alias alias = Registers.alias(name);
        Value full = reg(alias.full());
        if (alias.isFull()) {
            return full;
        }
        Value v = full;
        if (alias.shift() > 0) {
            v = emit(Opcode.SHR, addr, 4, v, Value.constant(alias.shift()));
        }
        return emit(Opcode.AND, addr, alias.width(), v, Value.constant(alias.mask()));
    }

    private void writeRegister(String name, Value v, long addr) {
        Registers.Alias alias = Registers.alias(name);
        if (alias.isFull()) {
            assign(alias.full(), v, addr);
            return;
        }
        long keep = ~(alias.mask() << alias.shift()) & 0xffffffffL;
        Value cleared = emit(Opcode.AND, addr, 4, reg(alias.full()), Value.constant(keep));
        Value wide = emit(Opcode.ZEXT, addr, 4, v);
        if (alias.shift() > 0) {
            wide = emit(Opcode.SHL, addr, 4, wide, Value.constant(alias.shift()));
        }
        assign(alias.full(), emit(Opcode.OR, addr, 4, cleared, wide), addr);
    }

    private Value address(Operand op, long addr) {
        if (op.isAbsolute()) {
            return Value.constant(op.getDisplacement());
        }
        Value v = null;
        if (op.getBase() != null) {
            v = readRegister(op.getBase(), addr);
        }
        if (op.getIndex() != null) {
            Value idx = readRegister(op.getIndex(), addr);
            if (op.getScale() > 1) {
                idx = emit(Opcode.MUL, addr, 4, idx, Value.constant(op.getScale()));
            }
            v = v == null ? idx : emit(Opcode.ADD, addr, 4, v, idx);
        }
        long disp = op.getDisplacement();
        if (v == null) {
            return Value.constant(disp);
        }
        if (disp > 0) {
            v = emit(Opcode.ADD, addr, 4, v, Value.constant(disp));
        } else if (disp < 0) {
            v = emit(Opcode.SUB, addr, 4, v, Value.constant(-disp));
        }
        return v;
    }

    private Variable symbol(String name) {
        for (Variable v : function.getVariables()) {
            if (v.getStorage() == StorageClass.GLOBAL && v.getName().equals(name)) {
                return v;
            }
        }
        return function.newVariable(name, StorageClass.GLOBAL, null, -1, 4);
    }

    /**
     * Width of operand {@code i}; a register or sized memory operand decides,
     * otherwise operand {@code other}, otherwise 4 bytes.
     */
    private int widthOf(DecodedInstruction inst, int i, int other) {
        return widthOf(inst, i, other, 4);
    }

    private int widthOf(DecodedInstruction inst, int i, int other, int fallback) {
        int w = widthOf(inst.getOperand(i));
        if (w == 0 && other >= 0 && other < inst.getNumOperands()) {
            w = widthOf(inst.getOperand(other));
        }
        return w == 0 ? fallback : w;
    }

    private static int widthOf(Operand op) {
        if (op.isRegister()) {
            return Registers.alias(op.getRegister()).width();
        }
        return op.isMemory() ? op.getWidth() : 0;
    }

    /* emission helpers */

    private Value reg(String name) {
        return Value.variable(function.getOrCreateRegister(name));
    }

    private void assign(String register, Value v, long addr) {
        block.addInstruction(function.newAssign(function.getOrCreateRegister(register), v, addr));
    }

    private Value emit(Opcode op, long addr, int width, Value... operands) {
        Instruction inst = function.newInstruction(op, addr, width, operands);
        block.addInstruction(inst);
        return inst.asValue();
    }
}
