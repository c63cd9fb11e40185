package com.infrastructure.api.service;

import com.infrastructure.api.dto.AssignmentDetail;
import com.infrastructure.api.dto.AssignmentResponse;
import com.infrastructure.api.model.Assignment;
import com.infrastructure.api.repository.AssignmentRepository;
import com.infrastructure.api.repository.CompanyRepository;
import com.infrastructure.api.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * Maintains the many-to-many link between projects and companies.
 *
 * <p>The existence checks give callers a precise 404, but the unique constraint on
 * (project_id, company_id) is what actually prevents duplicates when requests race.</p>
 */
@Service
public class AssignmentService {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentService.class);

    static final String ALREADY_ASSIGNED = "This company is already assigned to this project";

    // 23505 is the standard unique_violation state (PostgreSQL, H2); MySQL reports 1062 under 23000.
    private static final String UNIQUE_VIOLATION_STATE = "23505";
    private static final int MYSQL_DUPLICATE_ENTRY = 1062;

    private final AssignmentRepository assignmentRepository;
    private final ProjectRepository projectRepository;
    private final CompanyRepository companyRepository;

    public AssignmentService(AssignmentRepository assignmentRepository,
                             ProjectRepository projectRepository,
                             CompanyRepository companyRepository) {
        this.assignmentRepository = assignmentRepository;
        this.projectRepository = projectRepository;
        this.companyRepository = companyRepository;
    }

    public List<AssignmentDetail> findAll() {
        return assignmentRepository.findAllDetails();
    }

    /**
     * Assigns a company to a project.
     *
     * @throws ResourceNotFoundException when the project, or else the company, does not exist
     * @throws AssignmentConflictException when the pair is already assigned
     */
    @Transactional
    public AssignmentResponse assign(Long projectId, Long companyId) {
        if (projectId == null || !projectRepository.existsById(projectId)) {
            throw ResourceNotFoundException.project();
        }
        if (companyId == null || !companyRepository.existsById(companyId)) {
            throw ResourceNotFoundException.company();
        }

        Assignment assignment = new Assignment(
                projectRepository.getReferenceById(projectId),
                companyRepository.getReferenceById(companyId));
        try {
            Assignment saved = assignmentRepository.saveAndFlush(assignment);
            logger.info("Assigned company {} to project {} as assignment {}", companyId, projectId, saved.getId());
            return AssignmentResponse.created(saved.getId(), projectId, companyId);
        } catch (DataIntegrityViolationException e) {
            if (isUniqueViolation(e)) {
                logger.warn("Company {} is already assigned to project {}", companyId, projectId);
                throw new AssignmentConflictException(ALREADY_ASSIGNED, e);
            }
            throw e;
        }
    }

    public void delete(Long id) {
        if (assignmentRepository.deleteAssignmentById(id) == 0) {
            throw ResourceNotFoundException.assignment();
        }
        logger.info("Deleted assignment {}", id);
    }

    static boolean isUniqueViolation(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql) {
                if (UNIQUE_VIOLATION_STATE.equals(sql.getSQLState())
                        || sql.getErrorCode() == MYSQL_DUPLICATE_ENTRY) {
                    return true;
                }
            }
            if (cause instanceof org.hibernate.exception.ConstraintViolationException cve
                    && cve.getConstraintName() != null
                    && cve.getConstraintName().toLowerCase(Locale.ROOT).contains(Assignment.UNIQUE_PAIR_CONSTRAINT)) {
                return true;
            }
        }
        return false;
    }
}
