package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.InvalidArgumentException;
import com.csd.pkginspect.exception.NotFoundException;
import com.csd.pkginspect.model.ReleaseRecord;
import com.csd.pkginspect.model.UpdateCheckResult;
import com.csd.pkginspect.model.VersionHistory;
import lombok.extern.slf4j.Slf4j;
import org.apache.maven.artifact.versioning.ComparableVersion;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Answers "what is newer than X" over a package's release history.
 */
@Slf4j
@Service
public class UpdateService {

    private final RemoteCatalogClient catalog;

    public UpdateService(RemoteCatalogClient catalog) {
        this.catalog = catalog;
    }

    public ReleaseRecord latest(VersionHistory history) {
        return releases(history).stream()
                .max(ReleaseComparator.INSTANCE)
                .orElseThrow(() -> new NotFoundException("No releases were found for " + history.getPackageName()));
    }

    public ReleaseRecord initial(VersionHistory history) {
        return releases(history).stream()
                .min(ReleaseComparator.INSTANCE)
                .orElseThrow(() -> new NotFoundException("No releases were found for " + history.getPackageName()));
    }

    public boolean isLatest(VersionHistory history, String version) {
        return VersionUtil.parse(version).equals(latest(history).getParsedVersion());
    }

    /**
     * Distinct versions strictly after {@code current}, ascending. Empty when {@code current} is the latest release.
     */
    public List<String> updatesAfter(VersionHistory history, String current) {
        if (current == null || current.isBlank()) {
            throw new InvalidArgumentException("A current version must be specified.");
        }
        Map<ComparableVersion, String> sorted = new TreeMap<>();
        for (ReleaseRecord record : releases(history)) {
            sorted.putIfAbsent(record.getParsedVersion(), record.getVersion());
        }
        ComparableVersion target = VersionUtil.parse(current);
        boolean found = false;
        List<String> after = new ArrayList<>();
        for (Map.Entry<ComparableVersion, String> entry : sorted.entrySet()) {
            if (found) {
                after.add(entry.getValue());
            } else if (entry.getKey().equals(target)) {
                found = true;
            }
        }
        if (!found) {
            throw new NotFoundException("Appears '" + current + "' was not found in '"
                    + history.getPackageName() + "' versions history.");
        }
        // the latest release by date can be a backport below the highest version
        if (isLatest(history, current)) {
            return List.of();
        }
        return after;
    }

    public UpdateCheckResult checkUpdates(String packageName, String currentVersion) {
        VersionHistory history = catalog.fetchHistory(packageName);
        List<String> updates = updatesAfter(history, currentVersion);
        String latest = latest(history).getVersion();
        String message = updates.isEmpty()
                ? "No updates were found. The specified version (" + currentVersion + ") appears to be the latest."
                : updates.size() + " update(s) available after " + currentVersion + ", latest is " + latest + ".";
        log.info("Update check for {} {}: {} update(s)", packageName, currentVersion, updates.size());
        return UpdateCheckResult.builder()
                .packageName(packageName)
                .currentVersion(currentVersion)
                .latestVersion(latest)
                .updates(updates)
                .message(message)
                .build();
    }

    private static List<ReleaseRecord> releases(VersionHistory history) {
        List<ReleaseRecord> kept = new ArrayList<>();
        for (ReleaseRecord record : history.getRecords()) {
            if (record.hasVersion() && !VersionUtil.isPreRelease(record.getVersion())) {
                kept.add(record);
            }
        }
        return kept;
    }
}
