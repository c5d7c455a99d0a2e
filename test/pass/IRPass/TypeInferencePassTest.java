package pass.IRPass;

import ir.Diagnostic;
import ir.IRModule;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.StorageClass;
import ir.value.Value;
import ir.value.Variable;
import ir.value.instructions.Instruction;
import org.junit.jupiter.api.Test;
import pass.PassOptions;
import pass.PipelineConfig;
import util.TestListings;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TypeInferencePassTest {

    private static long conflicts(Function f) {
        return f.getDiagnostics().stream().filter(d -> d.kind() == Diagnostic.Kind.TYPE_CONFLICT).count();
    }

    @Test
    public void testLoadThroughParameterMakesPointer() {
        // return *arg1 * 3;
        Function f = new Function("deref", 0x10);
        BasicBlock bb = f.newBlock(0x10);
        Variable p = f.getOrCreateStackSlot(4, 4);
        Instruction load = f.newInstruction(Opcode.LOAD, 0x10, 4, Value.variable(p));
        Instruction mul = f.newInstruction(Opcode.MUL, 0x13, 4, load.asValue(), Value.constant(3));
        bb.addInstruction(load);
        bb.addInstruction(mul);
        bb.addInstruction(f.newInstruction(Opcode.RETURN, 0x16, 0, mul.asValue()));
        f.setReturnsValue(true);
        IRModule module = PassTestSupport.moduleOf(f);

        assertTrue(PassTestSupport.run(module, "type-inference").anyChanged());
        assertEquals(IntegerType.i32, mul.getType());
        assertEquals(IntegerType.i32, load.getType());
        assertEquals(PointerType.get(IntegerType.i32), p.getType());
        assertEquals(IntegerType.i32, f.getReturnType());
        assertTrue(module.getTypeTable().contains(PointerType.get(IntegerType.i32)));
        assertEquals(0, conflicts(f));
        assertFalse(PassTestSupport.run(module, "type-inference").anyChanged());
    }

    @Test
    public void testPointerAndIntegerUseConflicts() {
        Function f = new Function("mixed", 0x10);
        BasicBlock bb = f.newBlock(0x10);
        Variable x = f.newVariable("x", StorageClass.REGISTER, "ecx", 0, 4);
        Instruction load = f.newInstruction(Opcode.LOAD, 0x10, 4, Value.variable(x));
        Instruction shl = f.newInstruction(Opcode.SHL, 0x12, 4, Value.variable(x), Value.constant(2));
        bb.addInstruction(load);
        bb.addInstruction(shl);
        bb.addInstruction(f.newInstruction(Opcode.RETURN, 0x15, 0));
        IRModule module = PassTestSupport.moduleOf(f);

        PassTestSupport.run(module, "type-inference");
        assertTrue(x.getType().isConflict());
        assertEquals(1, conflicts(f));
        assertEquals(bb.getId(), f.getDiagnostics().get(0).blockId());
        assertTrue(f.getReturnType().isVoid());

        assertFalse(PassTestSupport.run(module, "type-inference").anyChanged());
        assertEquals(1, conflicts(f));
    }

    private static Function mixedWidths() {
        Function f = new Function("widths", 0x10);
        BasicBlock bb = f.newBlock(0x10);
        Variable x = f.newVariable("x", StorageClass.REGISTER, "eax", 0, 4);
        Instruction narrow = f.newInstruction(Opcode.AND, 0x10, 1, Value.constant(1), Value.constant(3));
        Instruction wide = f.newInstruction(Opcode.AND, 0x12, 4, Value.constant(1), Value.constant(3));
        bb.addInstruction(narrow);
        bb.addInstruction(f.newAssign(x, narrow.asValue(), 0x10));
        bb.addInstruction(wide);
        bb.addInstruction(f.newAssign(x, wide.asValue(), 0x12));
        bb.addInstruction(f.newInstruction(Opcode.RETURN, 0x14, 0));
        return f;
    }

    @Test
    public void testMixedWidthsConflictByDefault() {
        Function f = mixedWidths();
        PassTestSupport.run(PassTestSupport.moduleOf(f), "type-inference");
        assertTrue(f.getVariables().iterator().next().getType().isConflict());
    }

    @Test
    public void testWidenSmallIntsOption() {
        Function f = mixedWidths();
        PipelineConfig config = PipelineConfig.of(List.of())
                .then("type-inference", PassOptions.of(Map.of(TypeInferencePass.WIDEN_SMALL_INTS, "true")));
        PassTestSupport.run(PassTestSupport.moduleOf(f), config);
        assertEquals(IntegerType.i32, f.getVariables().iterator().next().getType());
        assertEquals(0, conflicts(f));
    }

    @Test
    public void testConditionsAreBoolean() {
        IRModule module = TestListings.module("count.lst");
        PassTestSupport.run(module, PipelineConfig.defaults());
        Function f = module.getFunctions().get(0);
        for (BasicBlock bb : f.getBlocks()) {
            Instruction t = bb.getTerminator();
            if (t.opCode() == Opcode.COND_BRANCH && t.getOperand(0).isResult()) {
                assertEquals(IntegerType.i1, f.typeOf(t.getOperand(0)));
            }
        }
    }

    @Test
    public void testStoreThroughArgument() {
        IRModule module = TestListings.module("program.lst");
        PassTestSupport.run(module, PipelineConfig.defaults());
        Function store = module.getFunction("store");
        assertTrue(store.getParameters().get(0).getType().isPointer(), store.getParameters().get(0).getType().toIR());
    }
}
