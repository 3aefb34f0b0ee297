package com.governance.engine.fix;

/**
 * One remediation attempt failed. Callers log it and carry on with the remaining fixes.
 */
public class AutoFixException extends Exception {

    public AutoFixException(String message) {
        super(message);
    }

    public AutoFixException(String message, Throwable cause) {
        super(message, cause);
    }
}
