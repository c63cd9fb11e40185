package com.infrastructure.api.service;

/**
 * Raised when an upload is rejected as a whole before any record is stored:
 * missing file, unsupported format, unreadable content or an empty batch.
 */
public class ImportRejectedException extends RuntimeException {
    public ImportRejectedException(String m) { super(m); }
    public ImportRejectedException(String m, Throwable c) { super(m, c); }
}
