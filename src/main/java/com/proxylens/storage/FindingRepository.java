package com.proxylens.storage;

import com.proxylens.domain.Finding;

import java.util.List;

/**
 * Append-only store of findings.
 */
public interface FindingRepository {

    void appendAll(List<Finding> findings);

    /**
     * Findings of an upload in creation order
     */
    List<Finding> findByUpload(String uploadId);

    long countByUpload(String uploadId);
}
