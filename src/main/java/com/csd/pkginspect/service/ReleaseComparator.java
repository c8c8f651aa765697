package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.InvalidArgumentException;
import com.csd.pkginspect.model.ComparisonOperator;
import com.csd.pkginspect.model.ReleaseRecord;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * Total order over release records: by date, then by version. A side missing its date is ordered by
 * version alone, a side missing its version by date alone.
 */
public final class ReleaseComparator implements Comparator<ReleaseRecord> {

    public static final ReleaseComparator INSTANCE = new ReleaseComparator();

    private ReleaseComparator() {}

    @Override
    public int compare(ReleaseRecord a, ReleaseRecord b) {
        if (!a.hasDate() || !b.hasDate()) {
            return compareVersionsOf(a, b);
        }
        if (!a.hasVersion() || !b.hasVersion()) {
            return a.getDate().compareTo(b.getDate());
        }
        int byDate = a.getDate().compareTo(b.getDate());
        return byDate != 0 ? byDate : compareVersionsOf(a, b);
    }

    public static boolean compare(ReleaseRecord a, ReleaseRecord b, ComparisonOperator op) {
        return op.test(INSTANCE.compare(a, b));
    }

    public static boolean compareVersions(String a, String b, ComparisonOperator op) {
        return op.test(VersionUtil.parse(a).compareTo(VersionUtil.parse(b)));
    }

    public static boolean compareDates(LocalDate a, LocalDate b, ComparisonOperator op) {
        if (a == null || b == null) {
            throw new InvalidArgumentException("Both release dates must be present to compare them.");
        }
        return op.test(a.compareTo(b));
    }

    private static int compareVersionsOf(ReleaseRecord a, ReleaseRecord b) {
        if (!a.hasVersion() || !b.hasVersion()) {
            // neither side carries anything comparable
            return Boolean.compare(a.hasVersion(), b.hasVersion());
        }
        return a.getParsedVersion().compareTo(b.getParsedVersion());
    }
}
