package com.rowguard.exception;

/**
 * Thrown when a plan node, expression or type cannot be offloaded to the native engine.
 *
 * <p>This is the canonical "expected unsupported" signal of the transform layer. The
 * fallback rules catch it during dispatch and turn it into a fallback tag on the node
 * being validated; it never reaches the caller of the pipeline.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Functions the backend does not implement</li>
 *   <li>Data types the backend cannot represent</li>
 *   <li>Operator variants the native transformer does not handle</li>
 * </ul>
 *
 * @see com.rowguard.fallback.AddFallbackTagRule
 */
public class NotSupportedException extends RuntimeException {

    private final String nodeName;

    /**
     * Creates an exception without node context.
     *
     * @param message the error message
     */
    public NotSupportedException(String message) {
        super(message);
        this.nodeName = null;
    }

    /**
     * Creates an exception naming the node that could not be handled.
     *
     * @param message the error message
     * @param nodeName the name of the offending node
     */
    public NotSupportedException(String message, String nodeName) {
        super(message + " (node: " + nodeName + ")");
        this.nodeName = nodeName;
    }

    /**
     * Creates an exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public NotSupportedException(String message, Throwable cause) {
        super(message, cause);
        this.nodeName = null;
    }

    /**
     * Returns the name of the node that could not be handled.
     *
     * @return the node name, or null if not available
     */
    public String getNodeName() {
        return nodeName;
    }
}
