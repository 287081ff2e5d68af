// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.fxp;

/** Raised when text cannot be interpreted as a fixed-point value. */
public class ValueError extends FxException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public ValueError(String msg, Object... args) {
        super(msg, args);
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind this one
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public ValueError(Throwable cause, String msg, Object... args) {
        super(cause, msg, args);
    }
}
