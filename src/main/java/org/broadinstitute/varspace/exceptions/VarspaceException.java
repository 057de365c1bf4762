package org.broadinstitute.varspace.exceptions;

/**
 * <p/>
 * Class VarspaceException.
 * <p/>
 * This exception is for errors that are beyond the caller's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class VarspaceException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public VarspaceException( String msg ) {
        super(msg);
    }

    public VarspaceException( String message, Throwable throwable ) {
        super(message, throwable);
    }

}
