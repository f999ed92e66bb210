package org.perlcheck.diagnostics;

import java.io.Serial;

/**
 * Raised for source that cannot be parsed and for unusable configuration.
 * The message is complete and ends with a newline, ready to be printed.
 */
public class PerlCheckException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String errorMessage;

    /**
     * A syntax error located at a raw token.
     */
    public PerlCheckException(int tokenIndex, String message, ErrorMessageUtil errorMessageUtil) {
        super(message);
        this.errorMessage = errorMessageUtil.errorMessage(tokenIndex, message);
    }

    /**
     * A syntax error located at a known line.
     */
    public PerlCheckException(int line, String near, String message, ErrorMessageUtil errorMessageUtil) {
        super(message);
        this.errorMessage = errorMessageUtil.errorMessage(line, near, message);
    }

    public PerlCheckException(String message) {
        this(message, (Throwable) null);
    }

    public PerlCheckException(String message, Throwable cause) {
        super(message, cause);
        this.errorMessage = message.endsWith("\n") ? message : message + "\n";
    }

    @Override
    public String getMessage() {
        return errorMessage;
    }
}
