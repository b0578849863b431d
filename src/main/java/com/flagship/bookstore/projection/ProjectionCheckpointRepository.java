package com.flagship.bookstore.projection;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProjectionCheckpointRepository extends JpaRepository<ProjectionCheckpointEntity, String> {
}
