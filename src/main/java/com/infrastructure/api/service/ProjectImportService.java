package com.infrastructure.api.service;

import com.google.common.io.Files;
import com.infrastructure.api.dto.ImportSummary;
import com.infrastructure.api.dto.ImportSummary.FailedRecord;
import com.infrastructure.api.dto.ImportSummary.ImportedProject;
import com.infrastructure.api.model.CandidateProject;
import com.infrastructure.api.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bulk import of projects from uploaded JSON or XML files.
 *
 * <p>Not transactional: each record is inserted in its own transaction, so one invalid or
 * failing record never prevents the others from being stored.</p>
 */
@Service
public class ProjectImportService {

    private static final Logger logger = LoggerFactory.getLogger(ProjectImportService.class);

    private final Map<String, ProjectFileParser> parsersByExtension = new HashMap<>();
    private final ProjectRecordValidator validator;
    private final ProjectService projectService;

    public ProjectImportService(List<ProjectFileParser> parsers,
                                ProjectRecordValidator validator,
                                ProjectService projectService) {
        for (ProjectFileParser parser : parsers) {
            for (String extension : parser.supportedExtensions()) {
                parsersByExtension.put(extension, parser);
            }
        }
        this.validator = validator;
        this.projectService = projectService;
    }

    public boolean supportsFile(String filename) {
        return parsersByExtension.containsKey(extensionOf(filename));
    }

    /**
     * Parses the file, then validates and stores each record independently.
     *
     * @throws ImportRejectedException for an unsupported extension, unreadable content or an empty batch
     */
    public ImportSummary importProjects(String filename, byte[] content) {
        String extension = extensionOf(filename);
        ProjectFileParser parser = parsersByExtension.get(extension);
        if (parser == null) {
            throw new ImportRejectedException("Unsupported file format. Please upload a JSON or XML file");
        }

        List<CandidateProject> candidates = parser.parse(content);
        if (candidates.isEmpty()) {
            throw new ImportRejectedException("No valid projects found in file");
        }
        logger.info("Parsed {} project records from '{}'", candidates.size(), filename);

        List<ImportedProject> successful = new ArrayList<>();
        List<FailedRecord> failed = new ArrayList<>();
        for (CandidateProject candidate : candidates) {
            List<String> errors = validator.validate(candidate);
            if (!errors.isEmpty()) {
                logger.warn("Skipping invalid project '{}': {}", candidate.displayName(), errors);
                failed.add(new FailedRecord(candidate.displayName(), errors));
                continue;
            }
            try {
                Project saved = projectService.insert(candidate);
                successful.add(new ImportedProject(saved.getId(), saved.getName()));
            } catch (DataAccessException e) {
                String reason = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
                logger.warn("Failed to store project '{}': {}", candidate.displayName(), reason);
                failed.add(new FailedRecord(candidate.displayName(), List.of(reason)));
            }
        }

        ImportSummary summary = ImportSummary.of(successful, failed);
        logger.info("Import of '{}' finished: total={}, successful={}, failed={}",
                filename, summary.total(), summary.successful(), summary.failed());
        return summary;
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        return Files.getFileExtension(filename.trim()).toLowerCase(Locale.ROOT);
    }
}
