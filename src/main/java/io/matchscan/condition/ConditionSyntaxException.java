package io.matchscan.condition;

/**
 * Thrown when branch text in an interchange file cannot be parsed.
 */
public class ConditionSyntaxException extends IllegalArgumentException {

    private final String text;
    private final int position;

    public ConditionSyntaxException(String message, String text, int position) {
        super(message + (text != null ? " at position " + position + " in '" + text + "'" : ""));
        this.text = text;
        this.position = position;
    }

    public String text() {
        return text;
    }

    public int position() {
        return position;
    }
}
