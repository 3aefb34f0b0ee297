package com.governance.engine.events;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void redactsCredentialValues() {
        assertThat(LogSanitizer.sanitize("password=hunter22 user=bob"))
                .isEqualTo("password=***REDACTED*** user=bob");
        assertThat(LogSanitizer.sanitize("Authorization: Bearer abc.def.ghi"))
                .contains("Bearer ***REDACTED***");
        assertThat(LogSanitizer.sanitize("postgres://app:s3cr3tpw@db:5432/app"))
                .doesNotContain("s3cr3tpw");
    }

    @Test
    void keepsShortValues() {
        assertThat(LogSanitizer.sanitize("token=abc")).isEqualTo("token=abc");
    }

    @Test
    void redactsLongOpaqueTokens() {
        String token = "a".repeat(20) + "B".repeat(20);
        assertThat(LogSanitizer.sanitize("key " + token + " used")).isEqualTo("key ***REDACTED*** used");
    }

    @Test
    void leavesOrdinaryTextAlone() {
        String text = "README.md too short: 12 words (minimum: 50)";
        assertThat(LogSanitizer.sanitize(text)).isEqualTo(text);
        assertThat(LogSanitizer.sanitize((String) null)).isNull();
    }

    @Test
    void fallsBackToExceptionTypeWithoutMessage() {
        assertThat(LogSanitizer.sanitize(new IOException())).isEqualTo("IOException");
        assertThat(LogSanitizer.sanitize(new IOException("secret: topsecretvalue"))).isEqualTo("secret: ***REDACTED***");
    }
}
