package bigo.resolve;

/**
 * @param input      the text that was rejected, possibly null
 * @param error      what could not be recognized
 * @param suggestion another resolver or input shape to try, may be null
 */
public record ResolutionFailure(String input, String error, String suggestion) implements Resolution {
    @Override
    public boolean success() {
        return false;
    }
}
