// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.fxp;

/**
 * The base of all exceptions raised by fixed-point operations. These
 * are unchecked: they signal that a particular calculation could not
 * produce a value, and a caller that is able to substitute a value or
 * abandon the calculation may catch them.
 */
public class FxException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public FxException(String msg, Object... args) {
        super(String.format(msg, args));
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind this one
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public FxException(Throwable cause, String msg, Object... args) {
        super(String.format(msg, args), cause);
    }

    @Override
    public String toString() {
        return String.format("%s: %s", getClass().getSimpleName(),
                getMessage());
    }
}
