package ir.type;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeLatticeTest {
    private static final List<Type> SAMPLE = List.of(
            UnknownType.get(),
            IntegerType.i1, IntegerType.i8, IntegerType.i16, IntegerType.i32, IntegerType.getInteger(64),
            PointerType.opaque(), PointerType.get(IntegerType.i8), PointerType.get(IntegerType.i32),
            PointerType.get(PointerType.opaque()),
            VoidType.getVoid(),
            ConflictType.get());

    private final TypeLattice strict = TypeLattice.strict();

    @Test
    public void testUnknownIsIdentity() {
        for (Type t : SAMPLE) {
            assertEquals(t, strict.meet(UnknownType.get(), t));
            assertEquals(t, strict.meet(t, UnknownType.get()));
        }
    }

    @Test
    public void testConflictAbsorbs() {
        for (Type t : SAMPLE) {
            assertTrue(strict.meet(ConflictType.get(), t).isConflict(), t.toIR());
        }
    }

    @Test
    public void testMeetIsCommutativeAndIdempotent() {
        for (Type a : SAMPLE) {
            assertEquals(a, strict.meet(a, a));
            for (Type b : SAMPLE) {
                assertEquals(strict.meet(a, b), strict.meet(b, a), a + " /\\ " + b);
            }
        }
    }

    @Test
    public void testMeetIsAssociative() {
        for (Type a : SAMPLE) {
            for (Type b : SAMPLE) {
                for (Type c : SAMPLE) {
                    assertEquals(strict.meet(strict.meet(a, b), c), strict.meet(a, strict.meet(b, c)));
                }
            }
        }
    }

    @Test
    public void testMeetNeverMovesUp() {
        for (Type a : SAMPLE) {
            for (Type b : SAMPLE) {
                Type m = strict.meet(a, b);
                assertTrue(strict.isBelowOrEqual(m, a), m + " above " + a);
                assertTrue(strict.isBelowOrEqual(m, b), m + " above " + b);
            }
        }
    }

    @Test
    public void testDisagreeingConcreteTypesConflict() {
        assertTrue(strict.meet(IntegerType.i32, PointerType.opaque()).isConflict());
        assertTrue(strict.meet(IntegerType.i8, IntegerType.i32).isConflict());
        assertTrue(strict.meet(VoidType.getVoid(), IntegerType.i32).isConflict());
    }

    @Test
    public void testPointersMeetPointeeWise() {
        assertEquals(PointerType.get(IntegerType.i32),
                strict.meet(PointerType.opaque(), PointerType.get(IntegerType.i32)));
        assertTrue(strict.meet(PointerType.get(IntegerType.i8), PointerType.get(IntegerType.i32)).isConflict());
    }

    @Test
    public void testWideningKeepsWiderInteger() {
        TypeLattice widening = new TypeLattice(true);
        assertTrue(widening.widensSmallInts());
        assertEquals(IntegerType.i32, widening.meet(IntegerType.i8, IntegerType.i32));
        assertEquals(IntegerType.i32, widening.meet(IntegerType.i32, IntegerType.i16));
        assertTrue(widening.meet(IntegerType.i1, IntegerType.i32).isConflict());
        assertTrue(widening.meet(IntegerType.i32, PointerType.opaque()).isConflict());
    }

    @Test
    public void testUnsupportedWidth() {
        assertThrows(RuntimeException.class, () -> IntegerType.getInteger(24));
        assertEquals(IntegerType.i16, IntegerType.ofBytes(2));
        assertEquals(2, IntegerType.i16.getByteWidth());
    }

    @Test
    public void testTypesAreInterned() {
        assertSame(IntegerType.i32, IntegerType.ofBytes(4));
        assertSame(PointerType.get(IntegerType.i8), PointerType.get(IntegerType.getInteger(8)));
        assertSame(PointerType.opaque(), PointerType.get(UnknownType.get()));
        assertEquals("i8**", PointerType.get(PointerType.get(IntegerType.i8)).toIR());
        assertEquals(TypeKind.POINTER, PointerType.opaque().getKind());
        assertTrue(VoidType.getVoid().isVoid());
        assertFalse(VoidType.getVoid().isInteger());
    }

    @Test
    public void testTypeTableKeysOnTextualForm() {
        ir.TypeTable table = new ir.TypeTable();
        Type p = table.register(PointerType.get(IntegerType.i32));
        assertSame(p, table.register(PointerType.get(IntegerType.getInteger(32))));
        table.register(IntegerType.i8);
        assertEquals(2, table.size());
        assertTrue(table.contains(IntegerType.i8));
        assertEquals(List.of("i32*", "i8"), table.getTypes().stream().map(Type::toIR).toList());
    }
}
