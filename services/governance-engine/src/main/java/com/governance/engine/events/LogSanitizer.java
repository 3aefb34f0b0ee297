package com.governance.engine.events;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts credentials and secret-looking tokens from text before it is logged.
 */
public final class LogSanitizer {

    static final String REDACTED = "***REDACTED***";

    private static final List<Pattern> SENSITIVE = List.of(
            Pattern.compile("(?:password|passwd|pwd)\\s*[:=]\\s*[\"']?([^\"'\\s]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:secret|api[_-]?key|token|auth)\\s*[:=]\\s*[\"']?([^\"'\\s]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:bearer|authorization)\\s+(\\S+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:connection|conn)[_-]?string\\s*[:=]\\s*[\"']?([^\"']+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:postgres(?:ql)?|mongodb|redis)://[^:/\\s]+:([^@\\s]+)@", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:client[_-]?secret|secret[_-]?key)\\s*[:=]\\s*[\"']?([^\"'\\s]+)", Pattern.CASE_INSENSITIVE));

    private static final Pattern LONG_TOKEN = Pattern.compile("\\b([A-Za-z0-9]{32,})\\b");

    private LogSanitizer() {
    }

    public static String sanitize(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        String out = message;
        for (Pattern p : SENSITIVE) {
            out = redactGroup(out, p);
        }
        return LONG_TOKEN.matcher(out).replaceAll(REDACTED);
    }

    /** Redacts capture group 1 of every match whose secret is longer than four characters. */
    private static String redactGroup(String text, Pattern pattern) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (m.find()) {
            String secret = m.group(1);
            if (secret == null || secret.length() <= 4) {
                continue;
            }
            sb.append(text, last, m.start(1)).append(REDACTED);
            last = m.end(1);
        }
        sb.append(text, last, text.length());
        return sb.toString();
    }

    public static String sanitize(Throwable error) {
        String message = error.getMessage();
        return sanitize(message == null ? error.getClass().getSimpleName() : message);
    }
}
