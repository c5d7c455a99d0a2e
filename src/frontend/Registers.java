package frontend;

import java.util.List;
import java.util.Map;

/**
 * x86-32 general purpose registers and the sub-registers aliasing them.
 */
public final class Registers {
    public static final String ESP = "esp";
    public static final String EBP = "ebp";
    public static final String EAX = "eax";
    public static final String ECX = "ecx";
    public static final String EDX = "edx";
    // status flags as one opaque register, read when a condition has no recorded compare
    public static final String EFLAGS = "eflags";

    public static final List<String> CALLEE_SAVED = List.of("ebx", "esi", "edi", "ebp");
    public static final List<String> CALL_CLOBBERED = List.of("eax", "ecx", "edx");

    /**
     * A view of a full register: {@code (full >> shift) & mask}.
     */
    public record Alias(String full, int shift, int width) {
        public long mask() {
            return width == 4 ? 0xffffffffL : (1L << (width * 8)) - 1;
        }

        public boolean isFull() {
            return width == 4 && shift == 0;
        }
    }

    private static final Map<String, Alias> ALIASES = Map.ofEntries(
            Map.entry("eax", new Alias("eax", 0, 4)),
            Map.entry("ebx", new Alias("ebx", 0, 4)),
            Map.entry("ecx", new Alias("ecx", 0, 4)),
            Map.entry("edx", new Alias("edx", 0, 4)),
            Map.entry("esi", new Alias("esi", 0, 4)),
            Map.entry("edi", new Alias("edi", 0, 4)),
            Map.entry("ebp", new Alias("ebp", 0, 4)),
            Map.entry("esp", new Alias("esp", 0, 4)),
            Map.entry("ax", new Alias("eax", 0, 2)),
            Map.entry("bx", new Alias("ebx", 0, 2)),
            Map.entry("cx", new Alias("ecx", 0, 2)),
            Map.entry("dx", new Alias("edx", 0, 2)),
            Map.entry("si", new Alias("esi", 0, 2)),
            Map.entry("di", new Alias("edi", 0, 2)),
            Map.entry("bp", new Alias("ebp", 0, 2)),
            Map.entry("sp", new Alias("esp", 0, 2)),
            Map.entry("al", new Alias("eax", 0, 1)),
            Map.entry("bl", new Alias("ebx", 0, 1)),
            Map.entry("cl", new Alias("ecx", 0, 1)),
            Map.entry("dl", new Alias("edx", 0, 1)),
            Map.entry("ah", new Alias("eax", 8, 1)),
            Map.entry("bh", new Alias("ebx", 8, 1)),
            Map.entry("ch", new Alias("ecx", 8, 1)),
            Map.entry("dh", new Alias("edx", 8, 1)));

    private Registers() {
    }

    public static boolean isRegister(String name) {
        return ALIASES.containsKey(name);
    }

    public static Alias alias(String name) {
        return ALIASES.get(name);
    }

    public static boolean isStackRegister(String name) {
        return ESP.equals(name) || EBP.equals(name);
    }
}
