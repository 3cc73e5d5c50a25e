package dev.resumeranker.repository;

import dev.resumeranker.entity.DuplicateClusterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for duplicate clusters.
 */
@Repository
public interface DuplicateClusterRepository extends JpaRepository<DuplicateClusterEntity, Long> {

    List<DuplicateClusterEntity> findByJobIdOrderByIdAsc(String jobId);

    void deleteByJobId(String jobId);
}
