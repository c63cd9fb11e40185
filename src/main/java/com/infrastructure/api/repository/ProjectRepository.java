package com.infrastructure.api.repository;

import com.infrastructure.api.dto.ProjectStats;
import com.infrastructure.api.model.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ProjectRepository extends JpaRepository<Project, Long> {

    /**
     * Deletes by id with a single statement so dependent assignments go through the foreign key cascade.
     *
     * @return number of rows removed, 0 when no project had that id
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Project p where p.id = :id")
    int deleteProjectById(@Param("id") Long id);

    @Query("select new com.infrastructure.api.dto.ProjectStats(p.province, p.status, count(p), sum(p.budget), avg(p.budget)) " +
            "from Project p group by p.province, p.status")
    List<ProjectStats> aggregateByProvinceAndStatus();
}
