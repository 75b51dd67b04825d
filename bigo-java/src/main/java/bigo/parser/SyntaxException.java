package bigo.parser;

/**
 * Raised when pseudocode text does not conform to the grammar.
 * Carries the 1-based position of the offending input and what was expected there.
 */
public class SyntaxException extends RuntimeException {

    private final int line;
    private final int column;
    private final String expected;
    private final String found;

    public SyntaxException(int line, int column, String expected, String found) {
        super("[" + line + ":" + column + "] " + expected + " (got " + found + ")");
        this.line = line;
        this.column = column;
        this.expected = expected;
        this.found = found;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }
}
