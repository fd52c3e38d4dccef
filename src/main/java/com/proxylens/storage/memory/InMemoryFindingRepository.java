package com.proxylens.storage.memory;

import com.proxylens.domain.Finding;
import com.proxylens.storage.FindingRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Finding store kept in process memory, in creation order per upload.
 */
@Repository
@ConditionalOnProperty(name = "proxylens.storage.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryFindingRepository implements FindingRepository {

    private final ConcurrentMap<String, List<Finding>> findingsByUpload = new ConcurrentHashMap<>();

    @Override
    public void appendAll(List<Finding> findings) {
        for (Finding finding : findings) {
            List<Finding> list = findingsByUpload.computeIfAbsent(finding.getUploadId(), k -> new ArrayList<>());
            synchronized (list) {
                list.add(finding);
            }
        }
    }

    @Override
    public List<Finding> findByUpload(String uploadId) {
        List<Finding> list = findingsByUpload.get(uploadId);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    @Override
    public long countByUpload(String uploadId) {
        return findByUpload(uploadId).size();
    }
}
