package com.governance.engine.config;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SemanticVersions {

    private static final Pattern STRICT = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");
    private static final Pattern EMBEDDED = Pattern.compile("(\\d+\\.\\d+\\.\\d+)");

    private SemanticVersions() {
    }

    public static boolean isValid(String version) {
        return version != null && STRICT.matcher(version).matches();
    }

    /** First x.y.z token inside {@code text}, or null when there is none. */
    public static String extract(String text) {
        Matcher m = EMBEDDED.matcher(text);
        return m.find() ? m.group(1) : null;
    }
}
