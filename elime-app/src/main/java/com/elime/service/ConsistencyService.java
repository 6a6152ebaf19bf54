package com.elime.service;

import com.elime.model.PhotoRecord;
import com.elime.repository.EyePositionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Guards the store's one-row-per-photo rule and compares the store against
 * the photo folder.
 */
@Service
public class ConsistencyService {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyService.class);

    private final EyePositionRepository repository;

    public ConsistencyService(EyePositionRepository repository) {
        this.repository = repository;
    }

    /**
     * The record for {@code fileName}, if any.
     *
     * @throws StoreCorruptionException if the store holds more than one
     */
    public Optional<PhotoRecord> findSingle(String fileName) {
        List<PhotoRecord> records = repository.findByFileName(fileName);
        if (records.size() > 1) {
            log.error("Database in bad shape. Found {} occurrences of photo named {}", records.size(), fileName);
            throw new StoreCorruptionException(fileName, records.size());
        }
        return records.stream().findFirst();
    }

    /**
     * False, with a warning, when the folder holds fewer photos than the store
     * has records. That usually means the wrong folder is configured.
     */
    public boolean folderCoversStore(int photoCount) {
        int stored = repository.count();
        if (photoCount < stored) {
            log.warn("Only {} photos in folder but {} in database. Check the photo folder, nothing was changed.",
                photoCount, stored);
            return false;
        }
        return true;
    }

    /**
     * Stored file names that are not among {@code photoNames}, in capture order.
     */
    public Set<String> orphans(Collection<String> photoNames) {
        Set<String> present = new HashSet<>(photoNames);
        Set<String> orphans = new LinkedHashSet<>();
        for (PhotoRecord record : repository.findAllOrderByCaptureDate()) {
            if (!present.contains(record.fileName())) {
                orphans.add(record.fileName());
            }
        }
        return orphans;
    }
}
