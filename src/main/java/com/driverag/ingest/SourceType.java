package com.driverag.ingest;

public enum SourceType {
    UPLOAD("upload"),
    DRIVE("drive");

    private final String prefix;

    SourceType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String documentId(String locator) {
        return prefix + "-" + ContentFingerprint.sha256(locator).substring(0, 24);
    }
}
