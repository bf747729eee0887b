package express.mvp.scrpc.server;

/**
 * Raised when a function is registered under a name that is already taken.
 */
public class DuplicateFunctionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String functionName;

    /**
     * Creates an exception for {@code functionName}.
     *
     * @param functionName the name that is already registered
     */
    public DuplicateFunctionException(String functionName) {
        super("The function name " + functionName + " is already taken.");
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
