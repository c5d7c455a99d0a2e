package ir.type;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pointer to an interned pointee; the pointee may itself still be unknown.
 */
public final class PointerType extends Type {
    // pointees are interned, so identity keys are enough
    private static final Map<Type, PointerType> byPointee = new ConcurrentHashMap<>();

    private final Type pointee;

    private PointerType(Type pointee) {
        super(TypeKind.POINTER);
        this.pointee = pointee;
    }

    public static PointerType get(Type pointee) {
        return byPointee.computeIfAbsent(pointee, PointerType::new);
    }

    public static PointerType opaque() {
        return get(UnknownType.get());
    }

    public Type getPointeeType() {
        return pointee;
    }

    @Override
    public String toIR() {
        return pointee.toIR() + "*";
    }
}
