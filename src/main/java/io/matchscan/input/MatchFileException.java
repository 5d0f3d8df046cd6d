package io.matchscan.input;

import java.io.IOException;

/**
 * Thrown when a match file is malformed: bad YAML shape, unknown type, or unparsable branch.
 */
public class MatchFileException extends IOException {

    public MatchFileException(String message) {
        super(message);
    }

    public MatchFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
