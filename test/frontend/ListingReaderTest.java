package frontend;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ListingReaderTest {
    private final ListingReader reader = new ListingReader();

    @Test
    public void testHeaderNamesFunction() throws Exception {
        Listing listing = reader.read("function 0x401000 main\n0x401000: ret\n", "t");
        assertEquals("main", listing.getFunctionNames().get(0x401000L));
        assertEquals(1, listing.getInstructions().size());
        assertTrue(listing.getInstructions().get(0).isReturn());
    }

    @Test
    public void testNumberForms() {
        assertEquals(31, ListingReader.parseNumber("0x1f"));
        assertEquals(31, ListingReader.parseNumber("1fh"));
        assertEquals(31, ListingReader.parseNumber("31"));
        assertThrows(IllegalArgumentException.class, () -> ListingReader.parseNumber("0xzz"));
    }

    @Test
    public void testMemoryOperand() throws Exception {
        Listing listing = reader.read("0x10: mov eax, dword [ebx+esi*4-8]\n0x14: ret\n", "t");
        Operand mem = listing.getInstructions().get(0).getOperand(1);
        assertTrue(mem.isMemory());
        assertEquals("ebx", mem.getBase());
        assertEquals("esi", mem.getIndex());
        assertEquals(4, mem.getScale());
        assertEquals(-8, mem.getDisplacement());
        assertEquals(4, mem.getWidth());
    }

    @Test
    public void testDerivedSuccessors() throws Exception {
        String text = String.join("\n",
                "0x10: cmp eax, 1",
                "0x13: je 0x20",
                "0x15: call 0x100",
                "0x1a: jmp 0x10",
                "0x20: ret",
                "");
        List<DecodedInstruction> insts = reader.read(text, "t").getInstructions();
        assertEquals(List.of(0x13L), insts.get(0).getSuccessors());
        assertEquals(List.of(0x20L, 0x15L), insts.get(1).getSuccessors());
        assertTrue(insts.get(2).isCall());
        assertEquals(List.of(0x1aL), insts.get(2).getSuccessors());
        assertEquals(List.of(0x10L), insts.get(3).getSuccessors());
        assertTrue(insts.get(4).getSuccessors().isEmpty());
    }

    @Test
    public void testExplicitSuccessorsWin() throws Exception {
        Listing listing = reader.read("0x10: jmp eax -> 0x20, 0x30\n0x20: ret\n0x30: ret\n", "t");
        assertEquals(List.of(0x20L, 0x30L), listing.getInstructions().get(0).getSuccessors());
    }

    @Test
    public void testSyntaxErrorReportsLine() {
        ListingParseException e = assertThrows(ListingParseException.class,
                () -> reader.read(util.TestListings.text("broken.lst"), "broken.lst"));
        assertFalse(e.getErrors().isEmpty());
        assertEquals(2, e.getErrors().get(0).getLineNumber());
    }

    @Test
    public void testUnknownRegisterInMemoryOperand() {
        ListingParseException e = assertThrows(ListingParseException.class,
                () -> reader.read("0x10: mov eax, dword [foo+4]\n", "t"));
        assertTrue(e.getMessage().contains("foo"));
    }

    @Test
    public void testReadFromFile() throws Exception {
        Path file = Files.createTempFile("listing", ".lst");
        try {
            Files.writeString(file, util.TestListings.text("identity.lst"));
            Listing listing = reader.read(file);
            assertEquals(file.getFileName().toString(), listing.getName());
            assertEquals(5, listing.getInstructions().size());
        } finally {
            Files.deleteIfExists(file);
        }
    }
}
