package com.elara.kconfig;

/** An implementation defect, as opposed to bad input. */
public class KconfigInternalError extends RuntimeException {

    public KconfigInternalError(String message) {
        super("Internal error: " + message);
    }
}
