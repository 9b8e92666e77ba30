package org.tesis.loteo;

public class InvalidBoundaryException extends IllegalArgumentException {

    public InvalidBoundaryException(String message) {
        super(message);
    }

    public InvalidBoundaryException(String message, Throwable cause) {
        super(message, cause);
    }
}
