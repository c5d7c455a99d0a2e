package emit;

import com.google.gson.stream.JsonWriter;
import ir.Diagnostic;
import ir.IRModule;
import ir.type.Type;
import ir.value.Function;
import ir.value.Variable;
import structure.Region;
import structure.RegionTree;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * Writes the machine-readable side of the output: per function its variables
 * with their recovered types, its diagnostics and its region tree, plus the
 * module's type table.
 */
public class RegionJsonWriter extends JsonWriter {

    public RegionJsonWriter(Writer writer) {
        super(writer);
        setIndent("  ");
    }

    public JsonWriter serialize(IRModule module) throws IOException {
        beginObject();
        name("module").value(module.getName());
        name("types").beginArray();
        for (Type t : module.getTypeTable().getTypes()) {
            value(t.toIR());
        }
        endArray();
        name("functions").beginArray();
        for (Function f : module.getFunctions()) {
            serialize(f);
        }
        endArray();
        endObject();
        flush();
        return this;
    }

    private void serialize(Function f) throws IOException {
        beginObject();
        name("name").value(f.getName());
        name("entry").value("0x" + Long.toHexString(f.getEntryAddress()));
        name("return_type").value(f.returnsValue() ? TypeNames.of(f.getReturnType(), 4) : "void");
        name("variables").beginArray();
        for (Variable v : f.getVariables()) {
            beginObject();
            name("id").value(v.getId());
            name("name").value(v.getName());
            name("storage").value(v.getStorage().name().toLowerCase());
            name("width").value(v.getWidth());
            name("type").value(TypeNames.of(v.getType(), v.getWidth()));
            name("live_blocks").beginArray();
            for (int b : v.getLiveBlocks()) {
                value(b);
            }
            endArray();
            endObject();
        }
        endArray();
        name("diagnostics").beginArray();
        for (Diagnostic d : f.getDiagnostics()) {
            beginObject();
            name("kind").value(d.kind().name().toLowerCase());
            name("block").value(d.blockId());
            name("address").value(d.address());
            name("message").value(d.message());
            endObject();
        }
        endArray();
        RegionTree tree = PseudocodeEmitter.treeFor(f);
        name("labels").beginObject();
        for (Map.Entry<Integer, String> e : tree.getLabels().entrySet()) {
            name(Integer.toString(e.getKey())).value(e.getValue());
        }
        endObject();
        name("region");
        region(tree.getRoot());
        endObject();
    }

    private void region(Region r) throws IOException {
        beginObject();
        name("kind").value(r.getKind().getName());
        switch (r.getKind()) {
            case LEAF, GOTO_BLOCK, BREAK, CONTINUE -> name("block").value(r.getBlock());
            case GOTO_UNKNOWN -> name("address").value(r.getTargetAddress());
            case IF_THEN_ELSE, WHILE, DO_WHILE, SWITCH -> {
                name("test_block").value(r.getTestBlock());
                name("negated").value(r.isNegated());
            }
            default -> {
            }
        }
        if (r.getKind().isLoop()) {
            name("header").value(r.getBlock());
        }
        if (r.getKind().isBreakable()) {
            name("follow").value(r.getFollow());
        }
        if (!r.getCaseValues().isEmpty()) {
            name("cases").beginArray();
            for (List<Long> values : r.getCaseValues()) {
                beginArray();
                for (long v : values) {
                    value(v);
                }
                endArray();
            }
            endArray();
        }
        if (!r.getChildren().isEmpty()) {
            name("children").beginArray();
            for (Region child : r.getChildren()) {
                region(child);
            }
            endArray();
        }
        endObject();
    }
}
