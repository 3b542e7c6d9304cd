package org.sudandigitalarchive.mcp.client;

import java.util.OptionalInt;

/**
 * A failed call to the archive API. The origin says where the call broke down;
 * HTTP status failures also carry the remote status code.
 */
public class ApiException extends Exception {

    public enum Origin {
        /** The archive could not be reached: connection, DNS, timeout or interruption. */
        TRANSPORT,
        /** The archive answered with a non-2xx status. */
        HTTP_STATUS,
        /** A 2xx answer whose body did not match the expected shape. */
        DECODE
    }

    private final Origin origin;
    private final Integer statusCode;

    private ApiException(Origin origin, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.origin = origin;
        this.statusCode = statusCode;
    }

    public static ApiException transport(String message, Throwable cause) {
        return new ApiException(Origin.TRANSPORT, message, null, cause);
    }

    public static ApiException httpStatus(int statusCode, String message) {
        return new ApiException(Origin.HTTP_STATUS, message, statusCode, null);
    }

    public static ApiException decode(String message, Throwable cause) {
        return new ApiException(Origin.DECODE, message, null, cause);
    }

    public Origin getOrigin() {
        return origin;
    }

    /**
     * @return the remote status code, present only for {@link Origin#HTTP_STATUS}
     */
    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
