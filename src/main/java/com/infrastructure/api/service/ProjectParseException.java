package com.infrastructure.api.service;

/**
 * Raised when uploaded content is not well-formed JSON or XML. The message carries the parser's own message.
 */
public class ProjectParseException extends ImportRejectedException {
    public ProjectParseException(String m, Throwable c) { super(m, c); }
}
