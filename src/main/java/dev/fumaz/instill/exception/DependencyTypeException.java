package dev.fumaz.instill.exception;

/**
 * Signals that a stored value does not match the type declared by the key it is read through.
 * <p>
 * This is never recoverable: it means two keys share an identity while declaring different value types.
 */
public class DependencyTypeException extends InstillException {

    public DependencyTypeException(String message) {
        super(message);
    }

}
