package emit;

import ir.type.ConflictType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.UnknownType;
import ir.type.VoidType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TypeNamesTest {

    @Test
    public void testUnknownShowsWidth() {
        assertEquals("undefined4", TypeNames.of(UnknownType.get(), 4));
        assertEquals("undefined1", TypeNames.of(null, 1));
        assertEquals("undefined1", TypeNames.of(UnknownType.get(), 0));
    }

    @Test
    public void testConflictFallsBackToWidthInteger() {
        assertEquals("int32_t", TypeNames.of(ConflictType.get(), 4));
        assertEquals("int16_t", TypeNames.of(ConflictType.get(), 2));
    }

    @Test
    public void testIntegers() {
        assertEquals("char", TypeNames.of(IntegerType.i8, 1));
        assertEquals("short", TypeNames.of(IntegerType.i16, 2));
        assertEquals("int", TypeNames.of(IntegerType.i32, 4));
        assertEquals("bool", TypeNames.of(IntegerType.i1, 1));
        assertEquals("void", TypeNames.of(VoidType.getVoid(), 4));
    }

    @Test
    public void testPointers() {
        assertEquals("void *", TypeNames.of(PointerType.opaque(), 4));
        assertEquals("int *", TypeNames.of(PointerType.get(IntegerType.i32), 4));
        assertEquals("char **", TypeNames.of(PointerType.get(PointerType.get(IntegerType.i8)), 4));
    }

    @Test
    public void testDeclare() {
        assertEquals("int x", TypeNames.declare("int", "x"));
        assertEquals("void *p", TypeNames.declare("void *", "p"));
    }
}
