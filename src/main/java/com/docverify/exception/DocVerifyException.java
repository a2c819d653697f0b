package com.docverify.exception;

/**
 * Runtime exception for application-level failures: unreadable manifests, an unreachable extraction
 * service, fixture seeding that cannot complete, an executor that cannot talk to its target.
 * <p>
 * Inside the assertion runner these are turned into {@code error} results; anywhere else they reach the CLI
 * and end the process with a nonzero exit code.
 */
public class DocVerifyException extends RuntimeException {

    /**
     * @param message The detail message.
     */
    public DocVerifyException(String message) {
        super(message);
    }

    /**
     * @param message The detail message.
     * @param cause   The underlying failure. May be {@code null}.
     */
    public DocVerifyException(String message, Throwable cause) {
        super(message, cause);
    }
}
