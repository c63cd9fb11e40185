package com.infrastructure.api.service;

import com.infrastructure.api.model.CandidateProject;

import java.util.List;
import java.util.Set;

/**
 * Reads candidate project records out of an uploaded file of one format.
 */
public interface ProjectFileParser {

    /**
     * Lower-case file extensions, without the dot, this parser handles.
     */
    Set<String> supportedExtensions();

    /**
     * Parses the whole file. Raw bytes are handed over so the parser can detect the encoding
     * and skip a byte order mark.
     *
     * @return records in document order; empty when the document has no recognizable project list
     * @throws ProjectParseException when the content is not well-formed
     */
    List<CandidateProject> parse(byte[] content);
}
