package pass.IRPass;

import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.StorageClass;
import ir.value.Variable;
import ir.value.instructions.Instruction;
import org.junit.jupiter.api.Test;
import util.TestListings;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StackRecoveryPassTest {

    private static List<Instruction> all(Function f) {
        return f.getBlocks().stream().flatMap(bb -> bb.getInstructions().stream()).toList();
    }

    @Test
    public void testFrameAccessesBecomeParameters() {
        IRModule module = TestListings.module("identity.lst");
        assertTrue(PassTestSupport.run(module, "stack-recovery").anyChanged());
        Function f = module.getFunction("identity");

        List<Variable> params = f.getParameters();
        assertEquals(1, params.size());
        assertEquals("arg1", params.get(0).getName());
        assertEquals(StorageClass.PARAMETER, params.get(0).getStorage());
        assertEquals(4, params.get(0).getLocation());
        assertTrue(all(f).stream().noneMatch(i -> i.opCode() == Opcode.LOAD || i.opCode() == Opcode.STORE));
    }

    @Test
    public void testFramePointerBookkeepingRemoved() {
        IRModule module = TestListings.module("identity.lst");
        PassTestSupport.run(module, "stack-recovery");
        Function f = module.getFunction("identity");
        Variable ebp = f.findRegister("ebp");
        Variable esp = f.findRegister("esp");
        for (Instruction inst : all(f)) {
            if (inst.isAssign()) {
                assertNotEquals(ebp == null ? -1 : ebp.getId(), inst.getDestination(), inst.toString());
                assertNotEquals(esp == null ? -1 : esp.getId(), inst.getDestination(), inst.toString());
            }
        }
    }

    @Test
    public void testPushedArgumentsFoldIntoCall() {
        IRModule module = TestListings.module("program.lst");
        PassTestSupport.run(module, "stack-recovery");
        Function main = module.getFunction("main");
        Instruction call = all(main).stream().filter(i -> i.opCode() == Opcode.CALL).findFirst().orElseThrow();
        assertEquals(2, call.getNumOperands());
        assertTrue(call.getOperand(0).isConstant());
        assertEquals(0x401020L, call.getOperand(0).getConstant());
        Variable arg = main.getVariable(call.getOperand(1).getVariableId());
        assertEquals("arg1", arg.getName());
    }

    @Test
    public void testParametersWithoutFramePointer() {
        IRModule module = TestListings.module("program.lst");
        PassTestSupport.run(module, "stack-recovery");
        Function store = module.getFunction("store");
        assertEquals(List.of("arg1", "arg2"), store.getParameters().stream().map(Variable::getName).toList());
        assertTrue(store.getVariables().stream().anyMatch(v -> v.getStorage() == StorageClass.GLOBAL));
    }

    @Test
    public void testBlocksUntouched() {
        IRModule module = TestListings.module("count.lst");
        int blocks = module.getFunctions().get(0).getBlockCount();
        PassTestSupport.run(module, "stack-recovery");
        assertEquals(blocks, module.getFunctions().get(0).getBlockCount());
        for (BasicBlock bb : module.getFunctions().get(0).getBlocks()) {
            assertTrue(bb.getTerminator().isTerminator());
        }
    }
}
