package com.csd.pkginspect.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class UpdateCheckResult {
    private String packageName;
    private String currentVersion;
    private String latestVersion;
    private List<String> updates;   // ascending, empty when already up to date
    private String message;

    public boolean hasUpdates() {
        return updates != null && !updates.isEmpty();
    }
}
