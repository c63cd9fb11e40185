package com.infrastructure.api.service;

import com.infrastructure.api.dto.ProjectRequest;
import com.infrastructure.api.dto.ProjectStats;
import com.infrastructure.api.dto.ProjectUpdateRequest;
import com.infrastructure.api.model.CandidateProject;
import com.infrastructure.api.model.Project;
import com.infrastructure.api.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Service
public class ProjectService {

    private static final Logger logger = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;
    private final ProjectRecordValidator validator;
    private final ProfanityFilter profanityFilter;

    public ProjectService(ProjectRepository projectRepository,
                          ProjectRecordValidator validator,
                          ProfanityFilter profanityFilter) {
        this.projectRepository = projectRepository;
        this.validator = validator;
        this.profanityFilter = profanityFilter;
    }

    public List<Project> findAll() {
        return projectRepository.findAll();
    }

    public Project findById(Long id) {
        return projectRepository.findById(id).orElseThrow(ResourceNotFoundException::project);
    }

    /**
     * Validates and stores a project submitted through the API.
     *
     * @throws InvalidProjectException listing every failed check
     */
    public Project create(ProjectRequest request) {
        CandidateProject candidate = request.toCandidate();
        List<String> errors = validator.validate(candidate);
        if (!errors.isEmpty()) {
            throw new InvalidProjectException(errors);
        }
        return insert(candidate);
    }

    /**
     * Stores an already validated record. The name is masked by the profanity filter first.
     */
    public Project insert(CandidateProject candidate) {
        Project project = new Project();
        project.setName(profanityFilter.clean(candidate.name()));
        project.setBudget(Project.toStoredBudget(BigDecimal.valueOf(candidate.budget())));
        project.setStatus(candidate.status());
        project.setProvince(candidate.province());
        project.setCity(candidate.city());
        project.setLatitude(candidate.latitude());
        project.setLongitude(candidate.longitude());
        Project saved = projectRepository.saveAndFlush(project);
        logger.debug("Stored project {} '{}'", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * Replaces name, budget, status and province. City and coordinates are not updatable.
     */
    @Transactional
    public Project update(Long id, ProjectUpdateRequest request) {
        Double budget = request.getBudget() != null ? request.getBudget().doubleValue() : null;
        List<String> errors = validator.validateMutableFields(request.getName(), budget,
                request.getStatus(), request.getProvince());
        if (!errors.isEmpty()) {
            throw new InvalidProjectException(errors);
        }
        Project project = findById(id);
        project.setName(profanityFilter.clean(request.getName()));
        project.setBudget(Project.toStoredBudget(request.getBudget()));
        project.setStatus(request.getStatus());
        project.setProvince(request.getProvince());
        return projectRepository.saveAndFlush(project);
    }

    /**
     * Deletes the project; its assignments are removed by the foreign key cascade.
     */
    public void delete(Long id) {
        if (projectRepository.deleteProjectById(id) == 0) {
            throw ResourceNotFoundException.project();
        }
        logger.info("Deleted project {}", id);
    }

    public List<ProjectStats> statistics() {
        return projectRepository.aggregateByProvinceAndStatus();
    }
}
