package com.flagship.bookstore.projection;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectionDocumentRepository extends JpaRepository<ProjectionDocumentEntity, ProjectionDocumentKey> {

    List<ProjectionDocumentEntity> findByKeyDocumentType(String documentType);
}
