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
import ir.value.instructions.Instruction;
import org.junit.jupiter.api.Test;
import util.TestListings;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowPassesTest {

    private static IRModule parse(String text) {
        return new frontend.CFGBuilder().build(TestListings.parse(text, "t"));
    }

    private static long returnBlocks(Function f) {
        return f.getBlocks().stream().filter(BasicBlock::isReturnBlock).count();
    }

    @Test
    public void testReturnsMergedIntoOneExit() {
        IRModule module = parse(String.join("\n",
                "0x10: mov eax, dword [esp+4]",
                "0x14: test eax, eax",
                "0x16: je 0x20",
                "0x18: mov eax, 1",
                "0x1d: ret",
                "0x20: mov eax, 2",
                "0x25: ret",
                ""));
        Function f = module.getFunctions().get(0);
        assertEquals(2, returnBlocks(f));
        assertTrue(PassTestSupport.run(module, "merge-returns").anyChanged());
        assertEquals(1, returnBlocks(f));

        BasicBlock exit = f.getBlocks().stream().filter(BasicBlock::isReturnBlock).findFirst().orElseThrow();
        Instruction ret = exit.getTerminator();
        // both returns read eax, so no phi is needed
        assertEquals(Value.variable(f.findRegister("eax")), ret.getOperand(0));
        assertEquals(2, f.predecessors().get(exit.getId()).size());
        assertFalse(PassTestSupport.run(module, "merge-returns").anyChanged());
    }

    @Test
    public void testDifferentReturnValuesMeetInPhi() {
        Function f = new Function("f", 0x10);
        BasicBlock head = f.newBlock(0x10);
        BasicBlock a = f.newBlock(0x20);
        BasicBlock b = f.newBlock(0x30);
        Variable arg = f.getOrCreateStackSlot(4, 4);
        Instruction test = f.newInstruction(Opcode.CMP_EQ, 0x10, 1, Value.variable(arg), Value.constant(0));
        head.addInstruction(test);
        head.addInstruction(f.newInstruction(Opcode.COND_BRANCH, 0x12, 0, test.asValue()));
        head.addSuccessor(Edge.of(EdgeKind.TRUE, a.getId()));
        head.addSuccessor(Edge.of(EdgeKind.FALSE, b.getId()));
        a.addInstruction(f.newInstruction(Opcode.RETURN, 0x20, 0, Value.constant(1)));
        b.addInstruction(f.newInstruction(Opcode.RETURN, 0x30, 0, Value.variable(arg)));
        f.setReturnsValue(true);
        IRModule module = PassTestSupport.moduleOf(f);

        PassTestSupport.run(module, "merge-returns");
        BasicBlock exit = f.getBlocks().stream().filter(BasicBlock::isReturnBlock).findFirst().orElseThrow();
        Instruction phi = exit.getInstructions().get(0);
        assertEquals(Opcode.PHI, phi.opCode());
        assertEquals(List.of(a.getId(), b.getId()), phi.getIncomingBlocks());
        assertEquals(phi.asValue(), exit.getTerminator().getOperand(0));
    }

    @Test
    public void testCopiesPropagatedAndDeadAssignmentsRemoved() {
        IRModule module = TestListings.module("identity.lst");
        PassTestSupport.run(module, "stack-recovery", "copy-propagation", "dead-code");
        Function f = module.getFunction("identity");
        assertEquals(1, f.getBlockCount());
        Instruction ret = f.getEntryBlock().getTerminator();
        Variable returned = f.getVariable(ret.getOperand(0).getVariableId());
        assertEquals(StorageClass.PARAMETER, returned.getStorage());
        assertEquals(List.of(ret), f.getEntryBlock().getInstructions());
    }

    @Test
    public void testDeadCodeKeepsEffectsAndBlocks() {
        IRModule module = TestListings.module("program.lst");
        Function store = module.getFunction("store");
        Function main = module.getFunction("main");
        int mainBlocks = main.getBlockCount();
        PassTestSupport.run(module, "stack-recovery", "copy-propagation", "dead-code");
        assertEquals(mainBlocks, main.getBlockCount());
        List<Opcode> ops = store.getEntryBlock().getInstructions().stream().map(Instruction::opCode).toList();
        assertTrue(ops.contains(Opcode.STORE), ops.toString());
        assertTrue(main.getBlocks().stream().flatMap(bb -> bb.getInstructions().stream())
                .anyMatch(i -> i.opCode() == Opcode.CALL));
    }

    @Test
    public void testStraightLineBlocksMerged() {
        IRModule module = parse("0x10: mov eax, 1\n0x15: jmp 0x20\n0x20: ret\n");
        Function f = module.getFunctions().get(0);
        assertEquals(2, f.getBlockCount());
        assertTrue(PassTestSupport.run(module, "merge-blocks").anyChanged());
        assertEquals(1, f.getBlockCount());
        assertTrue(f.getEntryBlock().isReturnBlock());
        assertFalse(PassTestSupport.run(module, "merge-blocks").anyChanged());
    }

    @Test
    public void testJoinPointsNotMerged() {
        IRModule module = TestListings.module("pick.lst");
        Function f = module.getFunctions().get(0);
        PassTestSupport.run(module, "merge-blocks");
        assertEquals(4, f.getBlockCount());
    }
}
