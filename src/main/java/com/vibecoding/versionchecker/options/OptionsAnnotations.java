package com.vibecoding.versionchecker.options;

/**
 * 버전 검사 어노테이션 키 (실제 키는 "{prefix}/{containerName}")
 */
public final class OptionsAnnotations {

    public static final String ENABLE = "enable.version-checker.io";
    public static final String OVERRIDE_URL = "override-url.version-checker.io";
    public static final String USE_SHA = "use-sha.version-checker.io";
    public static final String RESOLVE_SHA_TO_TAGS = "resolve-sha-to-tags.version-checker.io";
    public static final String USE_METADATA = "use-metadata.version-checker.io";
    public static final String MATCH_REGEX = "match-regex.version-checker.io";
    public static final String PIN_MAJOR = "pin-major.version-checker.io";
    public static final String PIN_MINOR = "pin-minor.version-checker.io";
    public static final String PIN_PATCH = "pin-patch.version-checker.io";

    private OptionsAnnotations() {
    }

    public static String key(String prefix, String containerName) {
        return prefix + "/" + containerName;
    }
}
