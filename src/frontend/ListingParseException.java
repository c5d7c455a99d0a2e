package frontend;

import java.util.ArrayList;
import java.util.List;

/**
 * Syntax errors in a disassembly listing, one {@link ParseError} per offending line.
 */
public class ListingParseException extends Exception {
    private final List<ParseError> errors;

    public static class ParseError {
        private final int lineNumber;
        private final String line;
        private final String errorMessage;

        public ParseError(int lineNumber, String line, String errorMessage) {
            this.lineNumber = lineNumber;
            this.line = line;
            this.errorMessage = errorMessage;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getLine() {
            return line;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("Line ").append(lineNumber).append(": ").append(errorMessage);
            if (line != null && !line.isEmpty()) {
                sb.append("\n  -> ").append(line.trim());
            }
            return sb.toString();
        }
    }

    public ListingParseException(String message, List<ParseError> errors) {
        super(formatMultipleErrors(message, errors));
        this.errors = new ArrayList<>(errors);
    }

    public List<ParseError> getErrors() {
        return new ArrayList<>(errors);
    }

    private static String formatMultipleErrors(String message, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder(message);
        sb.append("\nFound ").append(errors.size()).append(" error(s):");
        for (int i = 0; i < errors.size() && i < 5; i++) {
            sb.append("\n").append(i + 1).append(". ").append(errors.get(i));
        }
        if (errors.size() > 5) {
            sb.append("\n... and ").append(errors.size() - 5).append(" more error(s)");
        }
        return sb.toString();
    }

    public static ListingParseException syntaxError(String source, int lineNumber, String line, String message) {
        return new ListingParseException("Syntax error in " + source,
                List.of(new ParseError(lineNumber, line, message)));
    }
}
