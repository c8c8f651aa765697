package com.csd.pkginspect.model;

public enum PackageKind {
    DESCRIPTOR_DIRECTORY(".dist-info"), // <name>-<version>.dist-info directory
    MODULE_FILE(".py");                 // bare top-level module

    private final String suffix;

    PackageKind(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public static PackageKind fromFileName(String fileName) {
        for (PackageKind kind : values()) {
            if (fileName.endsWith(kind.suffix)) {
                return kind;
            }
        }
        return null;
    }
}
