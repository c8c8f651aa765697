package com.csd.pkginspect.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PackageRecord {
    RuntimeVersion runtime;
    PackageDirectory directory;
    String installedVersion;

    public String getPackageName() {
        return directory.getPackageName();
    }
}
