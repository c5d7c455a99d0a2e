package ir;

import ir.value.BasicBlock;
import ir.value.Edge;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.Variable;
import ir.value.instructions.Instruction;

/**
 * Textual dump of the IR, used by the disassemble-only path and in test failure messages.
 */
public class IRPrinter {

    public String print(IRModule module) {
        StringBuilder sb = new StringBuilder();
        sb.append("; module '").append(module.getName()).append("'\n");
        for (Function f : module.getFunctions()) {
            sb.append('\n').append(print(f));
        }
        return sb.toString();
    }

    public String print(Function f) {
        StringBuilder sb = new StringBuilder();
        sb.append("function ").append(f.getName())
                .append(" @0x").append(Long.toHexString(f.getEntryAddress()))
                .append(" -> ").append(f.returnsValue() ? f.getReturnType().toIR() : "void")
                .append('\n');
        for (Variable v : f.getVariables()) {
            sb.append("  var ").append(v.getName())
                    .append(" : ").append(v.getStorage().name().toLowerCase())
                    .append(", ").append(v.getWidth()).append(" bytes, ")
                    .append(v.getType().toIR()).append('\n');
        }
        for (BasicBlock bb : f.getBlocks()) {
            sb.append(bb.getName()).append(':');
            if (bb.getId() == f.getEntryBlockId()) {
                sb.append(" ; entry");
            }
            if (bb.isUnreachable()) {
                sb.append(" ; unreachable");
            }
            sb.append('\n');
            for (Instruction inst : bb.getInstructions()) {
                sb.append("  ").append(print(f, inst)).append('\n');
            }
            if (!bb.getSuccessors().isEmpty()) {
                sb.append("  ; succ");
                for (Edge e : bb.getSuccessors()) {
                    sb.append(' ').append(print(f, e));
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    public String print(Function f, Instruction inst) {
        StringBuilder sb = new StringBuilder();
        if (inst.producesValue()) {
            sb.append('%').append(inst.getId()).append(" = ");
        }
        sb.append(inst.opCode().getName());
        if (inst.getMnemonic() != null) {
            sb.append(' ').append(inst.getMnemonic());
        }
        if (inst.opCode() == Opcode.ASSIGN) {
            Variable dest = f.getVariable(inst.getDestination());
            sb.append(' ').append(dest == null ? "$" + inst.getDestination() : dest.getName()).append(',');
        }
        for (int i = 0; i < inst.getNumOperands(); i++) {
            sb.append(i == 0 ? " " : ", ").append(print(f, inst.getOperand(i)));
            if (inst.opCode() == Opcode.PHI) {
                BasicBlock from = f.getBlock(inst.getIncomingBlocks().get(i));
                sb.append(" [").append(from == null ? "?" : from.getName()).append(']');
            }
        }
        if (inst.getAddress() >= 0) {
            sb.append("  ; 0x").append(Long.toHexString(inst.getAddress()));
        }
        return sb.toString();
    }

    private String print(Function f, Value value) {
        if (value.isVariable()) {
            Variable v = f.getVariable(value.getVariableId());
            return v == null ? value.toString() : v.getName();
        }
        return value.toString();
    }

    private String print(Function f, Edge e) {
        if (e.isUnknown()) {
            return e.toString();
        }
        BasicBlock target = f.getBlock(e.getTarget());
        String name = target == null ? "bb#" + e.getTarget() : target.getName();
        return switch (e.getKind()) {
            case SWITCH_CASE -> "case " + e.getCaseValue() + ":" + name;
            default -> e.getKind().getName() + ":" + name;
        };
    }
}
