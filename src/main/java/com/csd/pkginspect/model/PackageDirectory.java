package com.csd.pkginspect.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * One installed package entry for one runtime: a descriptor directory or a single-file module.
 */
@Value
@Builder
public class PackageDirectory {
    RuntimeVersion runtime;
    String packageName;      // as written on disk, e.g. "requests"
    String normalizedName;   // lower-case, '-' and '.' folded to '_'
    Path path;
    PackageKind kind;

    public boolean isDescriptorDirectory() {
        return kind == PackageKind.DESCRIPTOR_DIRECTORY;
    }

    public Path getSitePackages() {
        return path.getParent();
    }
}
