package com.elime.service;

import com.elime.config.ElimeProperties;
import com.elime.repository.EyePositionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.util.Set;

/**
 * Removes records whose photo is no longer in the photo folder, after the
 * operator confirms.
 */
@Service
public class TidyService {

    private static final Logger log = LoggerFactory.getLogger(TidyService.class);

    static final String QUESTION = "Do you want to remove these photos from database? [delete/no]:";
    static final String CONFIRMATION = "delete";

    private final EyePositionRepository repository;
    private final ConsistencyService consistency;
    private final TransactionTemplate transactionTemplate;
    private final ElimeProperties properties;

    public TidyService(EyePositionRepository repository, ConsistencyService consistency,
                       TransactionTemplate transactionTemplate, ElimeProperties properties) {
        this.repository = repository;
        this.consistency = consistency;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    public CommandOutcome tidy(OperatorPrompt prompt) {
        Path photoFolder = PhotoFolders.requireDirectory(properties.getPhotoFolder(), "elime.photo-folder");
        repository.createTableIfMissing();

        if (repository.count() == 0) {
            log.error("Database is empty, nothing to tidy");
            return CommandOutcome.done(0);
        }

        Set<String> orphans = consistency.orphans(PhotoFolders.listPhotos(photoFolder));
        if (orphans.isEmpty()) {
            log.info("Database and {} agree", photoFolder);
            return CommandOutcome.done(0);
        }

        log.info("{} photos in database are missing from {}:", orphans.size(), photoFolder);
        orphans.forEach(name -> log.info("  {}", name));

        String answer = prompt.ask(QUESTION);
        if (!CONFIRMATION.equals(answer)) {
            log.info("Database left untouched");
            return CommandOutcome.done(0);
        }

        int removed = 0;
        for (String name : orphans) {
            transactionTemplate.executeWithoutResult(status -> repository.deleteByFileName(name));
            removed++;
            log.info("Removed {}", name);
        }
        return CommandOutcome.done(removed);
    }
}
