package org.introspect;

public class IntrospectException extends RuntimeException {

    public IntrospectException(String message) {
        super(message);
    }

    public IntrospectException(String message, Throwable cause) {
        super(message, cause);
    }

    public IntrospectException(Throwable cause) {
        super(cause);
    }
}
