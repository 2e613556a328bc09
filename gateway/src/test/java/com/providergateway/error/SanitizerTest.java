package com.providergateway.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SanitizerTest {

    @Test
    void masksCommandLineSecrets() {
        String redacted = Sanitizer.redact("worker --api-key=sk-123 --token abc --password=hunter2 --secret=s3");

        assertThat(redacted).doesNotContain("sk-123", "abc", "hunter2", "s3");
        assertThat(redacted).contains("--api-key=***", "--password=***");
    }

    @Test
    void masksBearerTokensAndJsonFields() {
        String redacted = Sanitizer.redact("Authorization: Bearer eyJhbGciOi.x.y {\"api_key\":\"k-1\",\"model\":\"m\"}");

        assertThat(redacted).contains("Bearer ***", "\"api_key\":\"***\"", "\"model\":\"m\"");
        assertThat(redacted).doesNotContain("eyJhbGciOi", "k-1");
    }

    @Test
    void leavesOrdinaryTextAlone() {
        assertThat(Sanitizer.redact("exit code 1: model not loaded")).isEqualTo("exit code 1: model not loaded");
        assertThat(Sanitizer.redact(null)).isNull();
    }

    @Test
    void truncatesLongSnapshots() {
        String snapshot = Sanitizer.snapshot("x".repeat(5000));

        assertThat(snapshot).startsWith("x".repeat(2048)).endsWith("(2952 more chars)");
    }
}
