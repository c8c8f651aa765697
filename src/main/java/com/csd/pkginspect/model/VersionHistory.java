package com.csd.pkginspect.model;

import lombok.Value;

import java.util.List;
import java.util.stream.Stream;

/**
 * Release records of one package in document order. Immutable once fetched.
 */
@Value
public class VersionHistory {
    String packageName;
    List<ReleaseRecord> records;

    public VersionHistory(String packageName, List<ReleaseRecord> records) {
        this.packageName = packageName;
        this.records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Stream<ReleaseRecord> stream() {
        return records.stream();
    }
}
