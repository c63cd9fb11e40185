package com.infrastructure.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.OffsetDateTime;

/**
 * Links one project to one company. The pair is unique, and both foreign keys are declared
 * {@code ON DELETE CASCADE} so removing either parent row removes its assignments in the database.
 */
@Setter
@Getter
@Entity
@Table(name = "assignments",
        uniqueConstraints = @UniqueConstraint(name = Assignment.UNIQUE_PAIR_CONSTRAINT,
                columnNames = {"project_id", "company_id"}))
public class Assignment {

    public static final String UNIQUE_PAIR_CONSTRAINT = "unique_project_company";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false, foreignKey = @ForeignKey(name = "fk_assignments_project"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Project project;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "company_id", nullable = false, foreignKey = @ForeignKey(name = "fk_assignments_company"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Company company;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public Assignment() {
    }

    public Assignment(Project project, Company company) {
        this.project = project;
        this.company = company;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = OffsetDateTime.now();
    }
}
