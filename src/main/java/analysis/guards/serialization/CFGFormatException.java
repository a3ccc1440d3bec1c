package analysis.guards.serialization;

/**
 * Thrown when a JSON description of a control flow graph is malformed
 */
public class CFGFormatException extends RuntimeException {

    private static final long serialVersionUID = -3715288349114425417L;

    /**
     * Problem with the description of a function
     *
     * @param function
     *            name of the function being read, null if not known yet
     * @param message
     *            description of the problem
     */
    public CFGFormatException(String function, String message) {
        super(function == null ? message : "in " + function + ": " + message);
    }

    /**
     * Problem with the description of a function, caused by another exception
     *
     * @param function
     *            name of the function being read, null if not known yet
     * @param message
     *            description of the problem
     * @param cause
     *            underlying exception
     */
    public CFGFormatException(String function, String message, Throwable cause) {
        super(function == null ? message : "in " + function + ": " + message, cause);
    }
}
