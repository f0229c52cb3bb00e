package org.endlesssource.mediafeed.sampler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RecursiveTask;

/**
 * Reduces one directory subtree to a {@link ScanResult}. Subdirectories are forked so wide or
 * deep trees spread across the scan pool. Links are never followed and count as leaves.
 */
final class DirectoryScanTask extends RecursiveTask<ScanResult> {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanTask.class);

    private final Path directory;
    private final ScanBudget budget;

    DirectoryScanTask(Path directory, ScanBudget budget) {
        this.directory = directory;
        this.budget = budget;
    }

    @Override
    protected ScanResult compute() {
        if (!budget.admit()) {
            return ScanResult.empty();
        }

        ScanResult result = ScanResult.empty();
        List<DirectoryScanTask> subtasks = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                if (!budget.admit()) {
                    break;
                }
                BasicFileAttributes attributes;
                try {
                    attributes = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException e) {
                    logger.debug("Skipping unreadable entry {}: {}", entry, e.getMessage());
                    continue;
                }
                if (attributes.isDirectory()) {
                    DirectoryScanTask subtask = new DirectoryScanTask(entry, budget);
                    subtask.fork();
                    subtasks.add(subtask);
                } else {
                    result = result.combine(ScanResult.of(entry));
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            logger.debug("Skipping unreadable directory {}: {}", directory, e.getMessage());
        }

        // Forked subtasks see the same budget, so after the deadline they return at once.
        for (DirectoryScanTask subtask : subtasks) {
            result = result.combine(subtask.join());
        }
        return result;
    }
}
