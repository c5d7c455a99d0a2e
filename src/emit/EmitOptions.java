package emit;

/**
 * Layout knobs for {@link PseudocodeEmitter}.
 */
public final class EmitOptions {
    public enum Declarations {
        // all locals right after the opening brace of the function
        TOP,
        // each local where it is first assigned or read
        FIRST_USE
    }

    private final Declarations declarations;
    private final int indentWidth;

    private EmitOptions(Declarations declarations, int indentWidth) {
        this.declarations = declarations;
        this.indentWidth = indentWidth;
    }

    public static EmitOptions defaults() {
        return new EmitOptions(Declarations.TOP, 4);
    }

    public EmitOptions withDeclarations(Declarations placement) {
        return new EmitOptions(placement, indentWidth);
    }

    public EmitOptions withIndentWidth(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("negative indent width: " + width);
        }
        return new EmitOptions(declarations, width);
    }

    public Declarations getDeclarations() {
        return declarations;
    }

    public int getIndentWidth() {
        return indentWidth;
    }
}
