package pass.IRPass;

import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Edge;
import ir.value.EdgeKind;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.StorageClass;
import ir.value.Value;
import ir.value.Variable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CoalesceVariablesPassTest {

    private Function f;
    private Variable eax;
    private Variable ecx;
    private Variable edx;
    private BasicBlock first;
    private BasicBlock second;

    // first: ecx = 5; eax = ecx      second: edx = 7; eax = edx; return eax
    private IRModule build(int edxWidth) {
        f = new Function("f", 0x10);
        first = f.newBlock(0x10);
        second = f.newBlock(0x20);
        eax = f.newVariable("eax", StorageClass.REGISTER, "eax", 0, 4);
        ecx = f.newVariable("ecx", StorageClass.REGISTER, "ecx", 0, 4);
        edx = f.newVariable("edx", StorageClass.REGISTER, "edx", 0, edxWidth);
        first.addInstruction(f.newAssign(ecx, Value.constant(5), 0x10));
        first.addInstruction(f.newAssign(eax, Value.variable(ecx), 0x15));
        first.addInstruction(f.newInstruction(Opcode.BRANCH, 0x17, 0));
        first.addSuccessor(Edge.of(EdgeKind.UNCONDITIONAL, second.getId()));
        second.addInstruction(f.newAssign(edx, Value.constant(7), 0x20));
        second.addInstruction(f.newAssign(eax, Value.variable(edx), 0x25));
        second.addInstruction(f.newInstruction(Opcode.RETURN, 0x27, 0, Value.variable(eax)));
        f.setReturnsValue(true);
        return PassTestSupport.moduleOf(f);
    }

    @Test
    public void testDisjointVariablesShareOneName() {
        IRModule module = build(4);
        assertTrue(PassTestSupport.run(module, "coalesce-variables").anyChanged());
        assertNull(f.getVariable(edx.getId()));
        assertNotNull(f.getVariable(ecx.getId()));
        assertNotNull(f.getVariable(eax.getId()));
        assertEquals(ecx.getId(), second.getInstructions().get(0).getDestination());
        assertEquals(Value.variable(ecx), second.getInstructions().get(1).getOperand(0));
        assertTrue(ecx.getLiveBlocks().contains(first.getId()));
        assertTrue(ecx.getLiveBlocks().contains(second.getId()));
        assertFalse(PassTestSupport.run(module, "coalesce-variables").anyChanged());
    }

    @Test
    public void testWidthMismatchKeepsVariables() {
        IRModule module = build(2);
        PassTestSupport.run(module, "coalesce-variables");
        assertNotNull(f.getVariable(edx.getId()));
        assertEquals(3, f.getVariables().size());
    }

    @Test
    public void testLiveBlocksRecorded() {
        IRModule module = build(2);
        PassTestSupport.run(module, "coalesce-variables");
        assertEquals(java.util.Set.of(first.getId()), ecx.getLiveBlocks());
        assertEquals(java.util.Set.of(second.getId()), edx.getLiveBlocks());
    }
}
