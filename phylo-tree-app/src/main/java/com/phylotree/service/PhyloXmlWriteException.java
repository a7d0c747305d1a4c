package com.phylotree.service;

/**
 * A write could not be completed. Output already written is left as is.
 */
public class PhyloXmlWriteException extends RuntimeException {

    public enum ErrorCode {
        CANNOT_OPEN_FILE,
        WRITE_FAILED,
        DOCUMENT_SETUP_FAILED
    }

    private final ErrorCode errorCode;

    public PhyloXmlWriteException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
