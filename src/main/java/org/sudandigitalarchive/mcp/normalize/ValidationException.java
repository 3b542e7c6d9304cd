package org.sudandigitalarchive.mcp.normalize;

/**
 * Caller input that cannot be turned into a well-formed archive request.
 * Raised before any HTTP call is made.
 */
public class ValidationException extends RuntimeException {

    private final String parameter;

    public ValidationException(String parameter, String message) {
        super(parameter == null ? message : parameter + ": " + message);
        this.parameter = parameter;
    }

    /**
     * @return the offending parameter name, or null when the failure is not tied to one parameter
     */
    public String getParameter() {
        return parameter;
    }
}
