package com.csd.pkginspect.exception;

/**
 * The remote index rejected the request or the document does not exist.
 * Both computed URLs are carried so the caller can spot a wrong package or ecosystem name.
 */
public class RemoteNotFoundException extends PkgInspectException {

    private final String packageUrl;
    private final String statsUrl;

    public RemoteNotFoundException(String message, String packageUrl, String statsUrl, Throwable cause) {
        super(message + " Please ensure the package name and manager are correct and available on:"
                + "\n- packageUrl = " + packageUrl
                + "\n- statsUrl = " + statsUrl, cause);
        this.packageUrl = packageUrl;
        this.statsUrl = statsUrl;
    }

    public String getPackageUrl() {
        return packageUrl;
    }

    public String getStatsUrl() {
        return statsUrl;
    }
}
