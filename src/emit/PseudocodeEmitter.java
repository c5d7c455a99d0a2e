package emit;

import ir.Diagnostic;
import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.StorageClass;
import ir.value.Value;
import ir.value.Variable;
import ir.value.instructions.Instruction;
import structure.Region;
import structure.RegionKind;
import structure.RegionTree;
import structure.Structurer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Prints C-like pseudocode from region trees. Emission reads the IR and the
 * trees but never changes them, and the same input always gives the same text.
 */
public class PseudocodeEmitter {
    private final EmitOptions options;

    public PseudocodeEmitter() {
        this(EmitOptions.defaults());
    }

    public PseudocodeEmitter(EmitOptions options) {
        this.options = options;
    }

    public String emit(IRModule module) {
        StringBuilder sb = new StringBuilder();
        Map<String, Variable> globals = new LinkedHashMap<>();
        for (Function f : module.getFunctions()) {
            for (Variable v : f.getVariables()) {
                if (v.getStorage() == StorageClass.GLOBAL) {
                    globals.putIfAbsent(v.getName(), v);
                }
            }
        }
        for (Variable g : globals.values()) {
            sb.append(TypeNames.declare(TypeNames.of(g.getType(), g.getWidth()), g.getName())).append(";\n");
        }
        boolean first = globals.isEmpty();
        for (Function f : module.getFunctions()) {
            if (!first) {
                sb.append('\n');
            }
            first = false;
            sb.append(emit(module, f));
        }
        return sb.toString();
    }

    public String emit(IRModule module, Function function) {
        return new FunctionWriter(module, function, treeFor(function)).write();
    }

    /**
     * @return the function's attached tree if it still covers exactly its blocks, else a fresh one
     */
    public static RegionTree treeFor(Function function) {
        RegionTree tree = function.getRegionTree();
        if (tree != null) {
            Set<Integer> blocks = new TreeSet<>();
            for (BasicBlock bb : function.getBlocks()) {
                blocks.add(bb.getId());
            }
            List<Integer> leaves = tree.leaves();
            if (leaves.size() == blocks.size() && blocks.equals(new TreeSet<>(leaves))) {
                return tree;
            }
        }
        return new Structurer().structure(function);
    }

    private final class FunctionWriter {
        private final Function function;
        private final RegionTree tree;
        private final ExpressionPrinter ex;
        private final Set<Integer> declaredVariables = new HashSet<>();
        private final Set<Integer> declaredTemporaries = new HashSet<>();
        // predecessor block -> phis that take a value from it
        private final Map<Integer, List<Instruction>> phiCopies = new LinkedHashMap<>();
        private StringBuilder out = new StringBuilder();

        FunctionWriter(IRModule module, Function function, RegionTree tree) {
            this.function = function;
            this.tree = tree;
            this.ex = new ExpressionPrinter(module, function);
            for (BasicBlock bb : function.getBlocks()) {
                for (Instruction inst : bb.getInstructions()) {
                    if (inst.opCode() == Opcode.PHI) {
                        for (int pred : inst.getIncomingBlocks()) {
                            phiCopies.computeIfAbsent(pred, k -> new ArrayList<>()).add(inst);
                        }
                    }
                }
            }
        }

        String write() {
            for (Diagnostic d : function.getDiagnostics()) {
                out.append("// ").append(d).append('\n');
            }
            out.append(signature()).append("\n{\n");
            if (options.getDeclarations() == EmitOptions.Declarations.TOP && declareAll()) {
                out.append('\n');
            }
            for (Region r : tree.getRoot().getChildren()) {
                region(r, 1);
            }
            out.append("}\n");
            return out.toString();
        }

        private String signature() {
            String ret = function.returnsValue() ? TypeNames.of(function.getReturnType(), 4) : "void";
            List<String> params = new ArrayList<>();
            for (Variable p : function.getParameters()) {
                params.add(TypeNames.declare(TypeNames.of(p.getType(), p.getWidth()), p.getName()));
            }
            String list = params.isEmpty() ? "void" : String.join(", ", params);
            return TypeNames.declare(ret, function.getName()) + "(" + list + ")";
        }

        private boolean declareAll() {
            Set<Integer> referenced = new TreeSet<>();
            List<Instruction> temps = new ArrayList<>();
            for (BasicBlock bb : function.getBlocks()) {
                for (Instruction inst : bb.getInstructions()) {
                    if (inst.isAssign()) {
                        referenced.add(inst.getDestination());
                    }
                    for (Value v : inst.getOperands()) {
                        if (v.isVariable()) {
                            referenced.add(v.getVariableId());
                        }
                    }
                    if (ex.needsTemporary(inst)) {
                        temps.add(inst);
                    }
                }
            }
            boolean any = false;
            for (int id : referenced) {
                Variable v = function.getVariable(id);
                if (v != null && isLocal(v)) {
                    line(1, TypeNames.declare(TypeNames.of(v.getType(), v.getWidth()), v.getName()) + ";");
                    declaredVariables.add(id);
                    any = true;
                }
            }
            temps.sort((a, b) -> Integer.compare(a.getId(), b.getId()));
            for (Instruction t : temps) {
                line(1, TypeNames.declare(ex.temporaryType(t), ex.temporaryName(t)) + ";");
                declaredTemporaries.add(t.getId());
                any = true;
            }
            return any;
        }

        private boolean isLocal(Variable v) {
            return v.getStorage() != StorageClass.GLOBAL && v.getStorage() != StorageClass.PARAMETER;
        }

        /* regions */

        private void region(Region r, int depth) {
            switch (r.getKind()) {
                case LEAF -> leaf(function.getBlock(r.getBlock()), depth);
                case SEQUENCE -> {
                    for (Region child : r.getChildren()) {
                        region(child, depth);
                    }
                }
                case IF_THEN_ELSE -> {
                    region(r.getChild(0), depth);
                    String cond = condition(r.getTestBlock(), r.isNegated(), depth);
                    line(depth, "if (" + cond + ") {");
                    region(r.getChild(1), depth + 1);
                    if (r.getChildren().size() > 2) {
                        line(depth, "} else {");
                        region(r.getChild(2), depth + 1);
                    }
                    line(depth, "}");
                }
                case WHILE -> whileLoop(r, depth);
                case DO_WHILE -> {
                    line(depth, "do {");
                    region(r.getChild(0), depth + 1);
                    String cond = condition(r.getTestBlock(), r.isNegated(), depth + 1);
                    line(depth, "} while (" + cond + ");");
                }
                case LOOP -> {
                    line(depth, "while (true) {");
                    region(r.getChild(0), depth + 1);
                    line(depth, "}");
                }
                case SWITCH -> switchRegion(r, depth);
                case GOTO_BLOCK -> line(depth, "goto " + label(r.getBlock()) + ";");
                case GOTO_UNKNOWN -> line(depth, r.getTargetAddress() < 0 ? "goto unknown;"
                        : "goto unknown_" + Long.toHexString(r.getTargetAddress()) + ";");
                case BREAK -> line(depth, "break;");
                case CONTINUE -> line(depth, "continue;");
            }
        }

        private void whileLoop(Region r, int depth) {
            StringBuilder saved = out;
            out = new StringBuilder();
            region(r.getChild(0), depth + 1);
            String head = out.toString();
            out = saved;
            if (head.isEmpty()) {
                String cond = condition(r.getTestBlock(), r.isNegated(), depth);
                line(depth, "while (" + cond + ") {");
            } else {
                line(depth, "while (true) {");
                out.append(head);
                String cond = condition(r.getTestBlock(), !r.isNegated(), depth + 1);
                line(depth + 1, "if (" + cond + ") {");
                line(depth + 2, "break;");
                line(depth + 1, "}");
            }
            region(r.getChild(1), depth + 1);
            line(depth, "}");
        }

        private void switchRegion(Region r, int depth) {
            region(r.getChild(0), depth);
            BasicBlock dispatch = function.getBlock(r.getTestBlock());
            Instruction term = dispatch == null ? null : dispatch.getTerminator();
            String index = "0";
            if (term != null && term.getNumOperands() > 0) {
                declareFor(term.getOperand(0), depth);
                index = ex.print(term.getOperand(0));
            }
            line(depth, "switch (" + index + ") {");
            for (int i = 0; i < r.getCaseValues().size(); i++) {
                for (long value : r.getCaseValues().get(i)) {
                    line(depth, "case " + ex.constant(value, 32) + ":");
                }
                Region body = r.getChild(i + 1);
                region(body, depth + 1);
                if (!body.getKind().isJump()) {
                    line(depth + 1, "break;");
                }
            }
            line(depth, "}");
        }

        private String condition(int testBlock, boolean negated, int depth) {
            BasicBlock bb = function.getBlock(testBlock);
            Instruction term = bb == null ? null : bb.getTerminator();
            if (term == null || term.opCode() != Opcode.COND_BRANCH || term.getNumOperands() == 0) {
                return negated ? "false" : "true";
            }
            declareFor(term.getOperand(0), depth);
            return ex.condition(term.getOperand(0), negated);
        }

        private String label(int block) {
            String l = tree.labelOf(block);
            if (l != null) {
                return l;
            }
            BasicBlock bb = function.getBlock(block);
            return bb == null ? "label_b" + block : bb.getLabel();
        }

        /* statements */

        private void leaf(BasicBlock bb, int depth) {
            if (bb == null) {
                return;
            }
            if (tree.isLabeled(bb.getId())) {
                line(Math.max(0, depth - 1), tree.labelOf(bb.getId()) + ":");
            }
            for (Instruction inst : bb.getInstructions()) {
                if (inst.isTerminator()) {
                    phiCopies(bb, depth);
                    if (inst.opCode() == Opcode.RETURN) {
                        if (inst.getNumOperands() > 0) {
                            declareFor(inst.getOperand(0), depth);
                            line(depth, "return " + ex.print(inst.getOperand(0)) + ";");
                        } else {
                            line(depth, "return;");
                        }
                    }
                    return;
                }
                statement(inst, depth);
            }
            phiCopies(bb, depth);
        }

        private void phiCopies(BasicBlock bb, int depth) {
            for (Instruction phi : phiCopies.getOrDefault(bb.getId(), List.of())) {
                List<Integer> incoming = phi.getIncomingBlocks();
                for (int i = 0; i < incoming.size(); i++) {
                    if (incoming.get(i) == bb.getId()) {
                        Value v = phi.getOperand(i);
                        declareFor(v, depth);
                        line(depth, defineTemporary(phi, depth) + " = " + ex.print(v) + ";");
                    }
                }
            }
        }

        private void statement(Instruction inst, int depth) {
            if (inst.opCode() == Opcode.PHI || ex.isInlined(inst)) {
                return;
            }
            for (Value v : inst.getOperands()) {
                declareFor(v, depth);
            }
            switch (inst.opCode()) {
                case ASSIGN -> {
                    Variable dest = function.getVariable(inst.getDestination());
                    String name = dest == null ? "var" + inst.getDestination() : dest.getName();
                    if (dest != null && isLocal(dest) && declaredVariables.add(dest.getId())) {
                        name = TypeNames.declare(TypeNames.of(dest.getType(), dest.getWidth()), name);
                    }
                    line(depth, name + " = " + ex.print(inst.getOperand(0)) + ";");
                }
                case STORE -> line(depth, ex.dereference(inst.getOperand(0), inst.getWidth(),
                        function.typeOf(inst.getOperand(1))) + " = " + ex.print(inst.getOperand(1)) + ";");
                default -> {
                    if (ex.needsTemporary(inst)) {
                        line(depth, defineTemporary(inst, depth) + " = " + ex.printDefinition(inst) + ";");
                    } else if (!inst.opCode().isPure()) {
                        line(depth, ex.printDefinition(inst) + ";");
                    }
                }
            }
        }

        private String defineTemporary(Instruction inst, int depth) {
            String name = ex.temporaryName(inst);
            if (declaredTemporaries.add(inst.getId())) {
                return TypeNames.declare(ex.temporaryType(inst), name);
            }
            return name;
        }

        /**
         * Declares, at first use, the locals and temporaries {@code v} reads.
         */
        private void declareFor(Value v, int depth) {
            for (int id : ex.variablesRead(v)) {
                Variable var = function.getVariable(id);
                if (var != null && isLocal(var) && declaredVariables.add(id)) {
                    line(depth, TypeNames.declare(TypeNames.of(var.getType(), var.getWidth()), var.getName()) + ";");
                }
            }
            for (Instruction t : ex.temporariesRead(v)) {
                if (declaredTemporaries.add(t.getId())) {
                    line(depth, TypeNames.declare(ex.temporaryType(t), ex.temporaryName(t)) + ";");
                }
            }
        }

        private void line(int depth, String text) {
            out.append(" ".repeat(depth * options.getIndentWidth())).append(text).append('\n');
        }
    }
}
