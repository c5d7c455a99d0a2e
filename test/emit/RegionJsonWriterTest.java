package emit;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import driver.Decompiler;
import ir.IRModule;
import org.junit.jupiter.api.Test;
import pass.PipelineConfig;
import util.TestListings;

import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class RegionJsonWriterTest {

    private static JsonObject json(IRModule module) throws Exception {
        StringWriter out = new StringWriter();
        new RegionJsonWriter(out).serialize(module);
        return JsonParser.parseString(out.toString()).getAsJsonObject();
    }

    private static JsonObject function(JsonObject root, String name) {
        for (var e : root.getAsJsonArray("functions")) {
            JsonObject f = e.getAsJsonObject();
            if (f.get("name").getAsString().equals(name)) {
                return f;
            }
        }
        return fail("no function " + name);
    }

    @Test
    public void testModuleShape() throws Exception {
        Decompiler decompiler = new Decompiler();
        IRModule module = decompiler.decompile(TestListings.listing("program.lst"), PipelineConfig.defaults()).module();
        JsonObject root = json(module);
        assertEquals(5, root.getAsJsonArray("functions").size());
        assertTrue(root.has("types"));

        JsonObject helper = function(root, "helper");
        assertEquals("0x401020", helper.get("entry").getAsString());
        assertEquals("sequence", helper.getAsJsonObject("region").get("kind").getAsString());
        assertTrue(helper.has("labels"));
        JsonArray vars = helper.getAsJsonArray("variables");
        boolean param = false;
        for (var v : vars) {
            JsonObject o = v.getAsJsonObject();
            if (o.get("storage").getAsString().equals("parameter")) {
                param = true;
                assertEquals("arg1", o.get("name").getAsString());
            }
        }
        assertTrue(param);
        assertEquals(decompiler.toJson(module), decompiler.toJson(module));
    }

    @Test
    public void testLoopAndGotoFields() throws Exception {
        JsonObject root = json(new Decompiler()
                .decompile(TestListings.listing("count.lst"), PipelineConfig.defaults()).module());
        JsonObject region = function(root, "count").getAsJsonObject("region");
        JsonObject loop = null;
        for (var c : region.getAsJsonArray("children")) {
            if (c.getAsJsonObject().get("kind").getAsString().equals("while")) {
                loop = c.getAsJsonObject();
            }
        }
        assertNotNull(loop, region.toString());
        assertTrue(loop.has("header"));
        assertTrue(loop.has("follow"));
        assertTrue(loop.has("test_block"));

        JsonObject tangle = function(json(TestListings.module("tangle.lst")), "tangle");
        assertFalse(tangle.getAsJsonObject("labels").entrySet().isEmpty());
    }

    @Test
    public void testDiagnostics() throws Exception {
        JsonObject f = function(json(TestListings.module("dispatch.lst")), "dispatch");
        JsonArray diags = f.getAsJsonArray("diagnostics");
        assertEquals(1, diags.size());
        assertEquals("unresolved_control_transfer", diags.get(0).getAsJsonObject().get("kind").getAsString());
    }
}
