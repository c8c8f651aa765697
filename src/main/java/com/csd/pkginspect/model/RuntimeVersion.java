package com.csd.pkginspect.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.maven.artifact.versioning.ComparableVersion;

import java.util.Objects;

/**
 * An installed runtime, identified by the version label of its directory (e.g. {@code 3.12}).
 * Equality and ordering use the parsed numeric components, so {@code 3.12} equals {@code 3.12.0}.
 */
public final class RuntimeVersion implements Comparable<RuntimeVersion> {

    private final String label;
    private final ComparableVersion parsed;

    private RuntimeVersion(String label) {
        this.label = label;
        this.parsed = new ComparableVersion(label);
    }

    public static RuntimeVersion of(String label) {
        Objects.requireNonNull(label, "label");
        return new RuntimeVersion(label.trim());
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public int compareTo(RuntimeVersion other) {
        return parsed.compareTo(other.parsed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuntimeVersion)) return false;
        return parsed.equals(((RuntimeVersion) o).parsed);
    }

    @Override
    public int hashCode() {
        return parsed.hashCode();
    }

    @Override
    public String toString() {
        return label;
    }
}
