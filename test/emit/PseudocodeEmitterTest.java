package emit;

import driver.Decompiler;
import ir.IRModule;
import ir.value.Function;
import org.junit.jupiter.api.Test;
import pass.PassRegistry;
import pass.PipelineConfig;
import structure.RegionTree;
import util.TestListings;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class PseudocodeEmitterTest {

    private static Decompiler.Result decompile(String listing, EmitOptions options) {
        return new Decompiler(PassRegistry.withBuiltins(), options)
                .decompile(TestListings.listing(listing), PipelineConfig.defaults());
    }

    private static String pseudocode(String listing) {
        return decompile(listing, EmitOptions.defaults()).pseudocode();
    }

    private static int occurrences(String text, String needle) {
        int n = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
            n++;
        }
        return n;
    }

    @Test
    public void testIdentityReturnsItsArgument() {
        String c = pseudocode("identity.lst");
        assertTrue(c.contains("return arg1;"), c);
        assertTrue(Pattern.compile("identity\\([^,)]*arg1\\)").matcher(c).find(), c);
        assertFalse(c.contains("ebp"), c);
        assertFalse(c.contains("esp"), c);
    }

    @Test
    public void testIfElse() {
        String c = pseudocode("pick.lst");
        assertTrue(c.contains("if ("), c);
        assertTrue(c.contains("} else {"), c);
        assertFalse(c.contains("goto"), c);
    }

    @Test
    public void testWhileLoopWithoutGoto() {
        String c = pseudocode("count.lst");
        assertTrue(c.contains("while ("), c);
        assertFalse(c.contains("goto"), c);
    }

    @Test
    public void testDoWhile() {
        String c = pseudocode("spin.lst");
        assertTrue(c.contains("do {"), c);
        assertTrue(c.contains("} while ("), c);
    }

    @Test
    public void testIrreducibleFlowUsesLabels() {
        Decompiler.Result result = decompile("tangle.lst", EmitOptions.defaults());
        String c = result.pseudocode();
        RegionTree tree = result.module().getFunctions().get(0).getRegionTree();
        assertFalse(tree.getLabels().isEmpty());
        for (String label : tree.getLabels().values()) {
            assertTrue(c.contains("goto " + label + ";"), c);
            assertTrue(c.contains(label + ":\n"), c);
        }
    }

    @Test
    public void testSwitch() {
        String c = pseudocode("classify.lst");
        assertTrue(c.contains("switch ("), c);
        assertTrue(c.contains("case 0:"), c);
        assertTrue(c.contains("case 1:"), c);
        assertTrue(c.contains("case 2:"), c);
    }

    @Test
    public void testUnresolvedJump() {
        String c = pseudocode("dispatch.lst");
        assertTrue(c.contains("goto unknown"), c);
        assertTrue(c.startsWith("// "), c);
    }

    @Test
    public void testEveryFunctionEmittedInOrder() {
        String c = pseudocode("program.lst");
        int last = -1;
        for (String name : new String[]{"main(", "helper(", "loop(", "tangle(", "store("}) {
            int at = c.indexOf(name);
            assertTrue(at > last, name + " in\n" + c);
            last = at;
        }
        assertTrue(c.contains("g_404000"), c);
    }

    @Test
    public void testBracesBalance() {
        for (String listing : new String[]{"pick.lst", "count.lst", "tangle.lst", "classify.lst", "program.lst"}) {
            String c = pseudocode(listing);
            assertEquals(occurrences(c, "{"), occurrences(c, "}"), c);
        }
    }

    @Test
    public void testDeclarationsAtTop() {
        String c = pseudocode("count.lst");
        assertTrue(Pattern.compile("(?m)^    \\w+\\s+\\*?ecx;$").matcher(c).find(), c);
        assertTrue(Pattern.compile("(?m)^    ecx = 0;$").matcher(c).find(), c);
    }

    @Test
    public void testDeclarationsAtFirstUse() {
        String c = decompile("count.lst",
                EmitOptions.defaults().withDeclarations(EmitOptions.Declarations.FIRST_USE)).pseudocode();
        assertTrue(Pattern.compile("(?m)^    \\S.*[ *]ecx = 0;$").matcher(c).find(), c);
        assertFalse(Pattern.compile("(?m)^\\s+\\w+\\s+\\*?ecx;$").matcher(c).find(), c);
    }

    @Test
    public void testIndentWidth() {
        String c = decompile("identity.lst", EmitOptions.defaults().withIndentWidth(2)).pseudocode();
        assertTrue(c.contains("\n  return arg1;\n"), c);
        assertThrows(IllegalArgumentException.class, () -> EmitOptions.defaults().withIndentWidth(-1));
    }

    @Test
    public void testEmissionLeavesTheModuleAlone() {
        IRModule module = TestListings.module("tangle.lst");
        Function f = module.getFunctions().get(0);
        PseudocodeEmitter emitter = new PseudocodeEmitter();
        String first = emitter.emit(module);
        assertNull(f.getRegionTree());
        assertEquals(first, emitter.emit(module));
    }

    @Test
    public void testStaleTreeIsRebuilt() {
        Function f = TestListings.function("pick.lst");
        f.setRegionTree(new structure.Structurer().structure(TestListings.function("identity.lst")));
        RegionTree tree = PseudocodeEmitter.treeFor(f);
        assertEquals(new structure.Structurer().structure(f), tree);
    }
}
