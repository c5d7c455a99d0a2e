package frontend;

import exception.MalformedInputException;
import ir.Diagnostic;
import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Edge;
import ir.value.EdgeKind;
import ir.value.Function;
import ir.value.Opcode;
import org.junit.jupiter.api.Test;
import util.TestListings;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CFGBuilderTest {

    private static IRModule build(String text) {
        return new CFGBuilder().build(TestListings.parse(text, "t"));
    }

    @Test
    public void testBranchesSplitBlocks() {
        Function f = TestListings.function("pick.lst");
        assertEquals("pick", f.getName());
        assertEquals(4, f.getBlockCount());
        BasicBlock head = f.getEntryBlock();
        assertEquals(0x401000L, head.getStartAddress());
        assertEquals(Opcode.COND_BRANCH, head.getTerminator().opCode());

        List<Edge> succs = head.getSuccessors();
        assertEquals(EdgeKind.TRUE, succs.get(0).getKind());
        assertEquals(TestListings.blockAt(f, 0x401010).getId(), succs.get(0).getTarget());
        assertEquals(EdgeKind.FALSE, succs.get(1).getKind());
        assertEquals(TestListings.blockAt(f, 0x401009).getId(), succs.get(1).getTarget());

        BasicBlock fall = TestListings.blockAt(f, 0x401010);
        assertEquals(List.of(TestListings.blockAt(f, 0x401015).getId()), fall.getSuccessorIds());
        assertEquals(EdgeKind.FALLTHROUGH, fall.getSuccessors().get(0).getKind());
    }

    @Test
    public void testStraightLineCodeIsOneBlock() {
        Function f = TestListings.function("identity.lst");
        assertEquals(1, f.getBlockCount());
        assertTrue(f.getEntryBlock().isReturnBlock());

        Function call = TestListings.module("program.lst").getFunction("main");
        assertEquals(1, call.getBlockCount());
    }

    @Test
    public void testJumpToNextInstructionStillEndsBlock() {
        Function f = build("0x10: mov eax, 1\n0x15: jmp 0x17\n0x17: ret\n").getFunctions().get(0);
        assertEquals(2, f.getBlockCount());
        assertEquals(Opcode.BRANCH, f.getEntryBlock().getTerminator().opCode());
        assertEquals(List.of(TestListings.blockAt(f, 0x17).getId()), f.getEntryBlock().getSuccessorIds());
    }

    @Test
    public void testReturnCarriesEaxWhenWritten() {
        Function f = TestListings.function("pick.lst");
        assertTrue(f.returnsValue());
        BasicBlock ret = TestListings.blockAt(f, 0x401015);
        assertTrue(ret.isReturnBlock());
        assertEquals(1, ret.getTerminator().getNumOperands());
        assertTrue(ret.getTerminator().getOperand(0).isVariable());
    }

    @Test
    public void testNoReturnValueWithoutEax() {
        Function f = build("0x10: mov ecx, 1\n0x15: ret\n").getFunctions().get(0);
        assertFalse(f.returnsValue());
        assertEquals(0, f.getEntryBlock().getTerminator().getNumOperands());
    }

    @Test
    public void testJumpTableBecomesSwitch() {
        Function f = TestListings.function("classify.lst");
        BasicBlock dispatch = TestListings.blockAt(f, 0x401009);
        assertEquals(Opcode.SWITCH, dispatch.getTerminator().opCode());
        List<Edge> cases = dispatch.getSuccessors();
        assertEquals(3, cases.size());
        for (int i = 0; i < cases.size(); i++) {
            assertEquals(EdgeKind.SWITCH_CASE, cases.get(i).getKind());
            assertEquals(i, cases.get(i).getCaseValue());
        }
    }

    @Test
    public void testUnresolvedJumpIsFlagged() {
        IRModule module = TestListings.module("dispatch.lst");
        Function f = module.getFunctions().get(0);
        BasicBlock bb = f.getEntryBlock();
        assertTrue(bb.hasUnknownSuccessor());
        assertEquals(1, f.getDiagnostics().size());
        assertEquals(Diagnostic.Kind.UNRESOLVED_CONTROL_TRANSFER, f.getDiagnostics().get(0).kind());
        assertEquals(1, module.getDiagnostics().size());
    }

    @Test
    public void testSuccessorOutsideListingIsUnknown() {
        Function f = build("0x10: cmp eax, 0\n0x13: je 0x99\n0x15: ret\n").getFunctions().get(0);
        Edge taken = f.getEntryBlock().getSuccessors().get(0);
        assertTrue(taken.isUnknown());
        assertEquals(0x99L, taken.getTargetAddress());
        assertFalse(f.getDiagnostics().isEmpty());
    }

    @Test
    public void testFallingOffTheEnd() {
        Function f = build("0x10: mov eax, 1\n").getFunctions().get(0);
        assertTrue(f.getEntryBlock().hasUnknownSuccessor());
        assertEquals(1, f.getDiagnostics().size());
    }

    @Test
    public void testUnreachableBlocksKept() {
        Function f = build("0x10: ret\n0x11: mov eax, 2\n0x16: ret\n").getFunctions().get(0);
        assertEquals(2, f.getBlockCount());
        assertFalse(f.getEntryBlock().isUnreachable());
        assertTrue(TestListings.blockAt(f, 0x11).isUnreachable());
    }

    @Test
    public void testFunctionsKeepListingOrder() {
        IRModule module = TestListings.module("program.lst");
        assertEquals(List.of("main", "helper", "loop", "tangle", "store"),
                module.getFunctions().stream().map(Function::getName).toList());
        assertSame(module.getFunction("helper"), module.getFunctionAt(0x401020));
    }

    @Test
    public void testDuplicateAddressRejected() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> build("0x10: nop\n0x10: ret\n"));
        assertTrue(e.getMessage().contains("0x10"), e.getMessage());
    }

    @Test
    public void testCrossFunctionEdgeRejected() {
        String text = String.join("\n",
                "function 0x10 a",
                "0x10: jmp 0x20",
                "function 0x20 b",
                "0x20: ret",
                "");
        assertThrows(MalformedInputException.class, () -> build(text));
    }

    @Test
    public void testCallsDoNotCrossFunctions() {
        IRModule module = TestListings.module("program.lst");
        Function main = module.getFunction("main");
        assertTrue(main.getBlocks().stream().allMatch(bb -> !bb.hasUnknownSuccessor()));
    }

    @Test
    public void testMissingEntryRejected() {
        assertThrows(MalformedInputException.class, () -> build("function 0x10 f\n0x14: ret\n"));
    }
}
