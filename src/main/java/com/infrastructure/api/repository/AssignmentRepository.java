package com.infrastructure.api.repository;

import com.infrastructure.api.dto.AssignmentDetail;
import com.infrastructure.api.model.Assignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface AssignmentRepository extends JpaRepository<Assignment, Long> {

    /**
     * Lists every assignment with its project and company summary, most recent first.
     */
    @Query("select new com.infrastructure.api.dto.AssignmentDetail(" +
            "a.id, p.id, c.id, a.createdAt, p.name, p.status, p.province, p.city, c.name) " +
            "from Assignment a join a.project p join a.company c " +
            "order by a.createdAt desc, a.id desc")
    List<AssignmentDetail> findAllDetails();

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Assignment a where a.id = :id")
    int deleteAssignmentById(@Param("id") Long id);
}
