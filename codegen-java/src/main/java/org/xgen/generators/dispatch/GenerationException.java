package org.xgen.generators.dispatch;

/**
 * A generation hook failed for one node.
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
