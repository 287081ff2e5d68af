// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.fxp;

/** Raised when a value will not fit the range of its target format. */
public class OverflowError extends FxException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public OverflowError(String msg, Object... args) {
        super(msg, args);
    }
}
