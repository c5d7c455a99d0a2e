package frontend;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A fully materialized decoder stream plus the function names the listing declared.
 */
public final class Listing {
    private final String name;
    private final List<DecodedInstruction> instructions;
    private final Map<Long, String> functionNames;

    public Listing(String name, List<DecodedInstruction> instructions, Map<Long, String> functionNames) {
        this.name = name;
        this.instructions = List.copyOf(instructions);
        this.functionNames = Collections.unmodifiableMap(functionNames);
    }

    public String getName() {
        return name;
    }

    public List<DecodedInstruction> getInstructions() {
        return instructions;
    }

    /**
     * @return entry address to declared name; entries without a name are absent
     */
    public Map<Long, String> getFunctionNames() {
        return functionNames;
    }
}
