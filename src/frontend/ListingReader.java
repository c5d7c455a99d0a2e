package frontend;

import frontend.grammar.ListingBaseVisitor;
import frontend.grammar.ListingLexer;
import frontend.grammar.ListingParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import util.LoggingManager;
import util.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a textual disassembly listing into decoder records.
 *
 * <p>When a line gives no explicit {@code -> succ, ...} list the successors are
 * derived from the mnemonic: returns and halts have none, {@code jmp} goes to
 * its direct target, conditional jumps go to the target then the next
 * instruction, everything else (calls included) falls through to the next
 * instruction of the same function.
 */
public class ListingReader {
    private static final Logger logger = LoggingManager.getLogger(ListingReader.class);

    public Listing read(Path path) throws IOException, ListingParseException {
        String text = Files.readString(path);
        return read(text, path.getFileName().toString());
    }

    public Listing read(String text, String sourceName) throws ListingParseException {
        String[] sourceLines = text.split("\r?\n", -1);
        ErrorCollector errors = new ErrorCollector(sourceLines);

        ListingLexer lexer = new ListingLexer(CharStreams.fromString(text, sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        ListingParser parser = new ListingParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        ListingParser.ListingContext tree = parser.listing();

        if (!errors.errors.isEmpty()) {
            throw new ListingParseException("Failed to parse listing " + sourceName, errors.errors);
        }

        List<RawLine> raw = new ArrayList<>();
        Map<Long, String> names = new LinkedHashMap<>();
        Map<Long, Integer> headerLines = new LinkedHashMap<>();
        OperandVisitor operandVisitor = new OperandVisitor();
        long currentEntry = -1;
        for (ListingParser.LineContext line : tree.line()) {
            int lineNumber = line.getStart().getLine();
            try {
                if (line.functionHeader() != null) {
                    ListingParser.FunctionHeaderContext header = line.functionHeader();
                    currentEntry = parseNumber(header.address().getText());
                    if (header.name != null) {
                        names.put(currentEntry, header.name.getText());
                    }
                    headerLines.put(currentEntry, lineNumber);
                    continue;
                }
                ListingParser.InstructionLineContext inst = line.instructionLine();
                long address = parseNumber(inst.address().getText());
                if (currentEntry < 0) {
                    // records before any header start an anonymous function
                    currentEntry = address;
                }
                List<Operand> operands = new ArrayList<>();
                if (inst.operandList() != null) {
                    for (ListingParser.OperandContext op : inst.operandList().operand()) {
                        operands.add(operandVisitor.visit(op));
                    }
                }
                List<Long> explicit = null;
                if (inst.successorList() != null) {
                    explicit = new ArrayList<>();
                    for (ListingParser.AddressContext a : inst.successorList().address()) {
                        explicit.add(parseNumber(a.getText()));
                    }
                }
                raw.add(new RawLine(currentEntry, address, inst.mnemonic.getText(), operands, explicit));
            } catch (IllegalArgumentException e) {
                throw ListingParseException.syntaxError(sourceName, lineNumber,
                        sourceLines[Math.min(lineNumber, sourceLines.length) - 1], e.getMessage());
            }
        }

        List<DecodedInstruction> records = deriveSuccessors(raw);
        logger.debug("read {} instructions in {} functions from {}", records.size(), countFunctions(raw),
                sourceName);
        if (headerLines.size() > countFunctions(raw)) {
            logger.warn("{} function headers without instructions in {}",
                    headerLines.size() - countFunctions(raw), sourceName);
        }
        return new Listing(sourceName, records, names);
    }

    private List<DecodedInstruction> deriveSuccessors(List<RawLine> raw) {
        List<DecodedInstruction> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            RawLine line = raw.get(i);
            Long next = null;
            for (int j = i + 1; j < raw.size(); j++) {
                if (raw.get(j).entry == line.entry) {
                    next = raw.get(j).address;
                    break;
                }
            }
            String m = line.mnemonic.toLowerCase();
            boolean isReturn = m.equals("ret") || m.equals("retn") || m.equals("retf") || m.equals("iret");
            boolean isCall = m.equals("call");
            List<Long> succs = new ArrayList<>();
            if (line.explicit != null) {
                succs.addAll(line.explicit);
            } else if (isReturn || m.equals("hlt") || m.equals("ud2")) {
                // no successors
            } else if (m.equals("jmp")) {
                if (!line.operands.isEmpty() && line.operands.get(0).isImmediate()) {
                    succs.add(line.operands.get(0).getImmediate());
                }
            } else if (m.startsWith("j")) {
                if (!line.operands.isEmpty() && line.operands.get(0).isImmediate()) {
                    succs.add(line.operands.get(0).getImmediate());
                }
                if (next != null) {
                    succs.add(next);
                }
            } else if (next != null) {
                succs.add(next);
            }
            out.add(new DecodedInstruction(line.entry, line.address, m, line.operands, succs, isCall, isReturn));
        }
        return out;
    }

    private static int countFunctions(List<RawLine> raw) {
        return (int) raw.stream().mapToLong(RawLine::entry).distinct().count();
    }

    /**
     * Parses {@code 0x1f}, {@code 1fh} or decimal {@code 31}.
     */
    public static long parseNumber(String text) {
        String t = text.trim();
        try {
            if (t.startsWith("0x") || t.startsWith("0X")) {
                return Long.parseLong(t.substring(2), 16);
            }
            if (t.endsWith("h") || t.endsWith("H")) {
                return Long.parseLong(t.substring(0, t.length() - 1), 16);
            }
            return Long.parseLong(t);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad number '" + text + "'", e);
        }
    }

    private record RawLine(long entry, long address, String mnemonic, List<Operand> operands,
            List<Long> explicit) {
    }

    private static class OperandVisitor extends ListingBaseVisitor<Operand> {
        @Override
        public Operand visitRegisterOperand(ListingParser.RegisterOperandContext ctx) {
            return Operand.register(ctx.name.getText());
        }

        @Override
        public Operand visitImmediateOperand(ListingParser.ImmediateOperandContext ctx) {
            long v = parseNumber(ctx.value.getText());
            return Operand.immediate(ctx.neg != null ? -v : v);
        }

        @Override
        public Operand visitMemoryOperand(ListingParser.MemoryOperandContext ctx) {
            int width = 0;
            if (ctx.sizeSpec() != null) {
                ListingParser.SizeSpecContext size = ctx.sizeSpec();
                if (size.BYTE() != null) {
                    width = 1;
                } else if (size.WORD() != null) {
                    width = 2;
                } else if (size.DWORD() != null) {
                    width = 4;
                } else {
                    width = 8;
                }
            }
            MemoryBuilder mem = new MemoryBuilder();
            mem.add(ctx.memExpr().first, false);
            for (ListingParser.SignedTermContext term : ctx.memExpr().signedTerm()) {
                mem.add(term.memTerm(), term.op.getType() == ListingParser.MINUS);
            }
            return Operand.memory(mem.base, mem.index, mem.scale, mem.displacement, width);
        }
    }

    private static class MemoryBuilder {
        String base;
        String index;
        int scale = 1;
        long displacement;

        void add(ListingParser.MemTermContext term, boolean negative) {
            if (term instanceof ListingParser.DisplacementTermContext disp) {
                long v = parseNumber(disp.value.getText());
                displacement += negative ? -v : v;
                return;
            }
            ListingParser.RegisterTermContext reg = (ListingParser.RegisterTermContext) term;
            String name = reg.reg.getText().toLowerCase();
            if (!Registers.isRegister(name)) {
                throw new IllegalArgumentException("unknown register '" + name + "' in memory operand");
            }
            if (negative) {
                throw new IllegalArgumentException("register '" + name + "' cannot be subtracted");
            }
            if (reg.scale != null || base != null) {
                if (index != null) {
                    throw new IllegalArgumentException("more than one index register");
                }
                index = name;
                scale = reg.scale != null ? (int) parseNumber(reg.scale.getText()) : 1;
            } else {
                base = name;
            }
        }
    }

    private static class ErrorCollector extends BaseErrorListener {
        private final String[] sourceLines;
        private final List<ListingParseException.ParseError> errors = new ArrayList<>();

        ErrorCollector(String[] sourceLines) {
            this.sourceLines = sourceLines;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                int charPositionInLine, String msg, RecognitionException e) {
            String text = line >= 1 && line <= sourceLines.length ? sourceLines[line - 1] : "";
            String near = offendingSymbol instanceof Token token ? " near '" + token.getText() + "'" : "";
            errors.add(new ListingParseException.ParseError(line, text,
                    "col " + charPositionInLine + near + ": " + msg));
        }
    }
}
