package com.csd.pkginspect.model;

import lombok.Value;

import java.util.Locale;

@Value
public class ByteSize {
    double bytes;
    double calculatedSize;
    String unit;        // KB, MB, GB, TB
    String unitName;    // e.g. "MB (Megabytes)"

    public String getSymbolic() {
        return String.format(Locale.ROOT, "%.3f %s", calculatedSize, unitName);
    }

    @Override
    public String toString() {
        return getSymbolic();
    }
}
