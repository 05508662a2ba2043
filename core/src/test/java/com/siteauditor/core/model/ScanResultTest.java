package com.siteauditor.core.model;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanResultTest {

    private static final URI U = URI.create("https://example.test/");

    @Test
    void non_ok_result_cannot_carry_findings() {
        assertThatThrownBy(() -> ScanResult.builder("x", U)
                .status(ScanStatus.error("boom"))
                .finding("k", Severity.LOW, "detail")
                .build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void empty_ok_requires_clean_outcome_opt_in() {
        assertThatThrownBy(() -> ScanResult.builder("x", U).build())
                .isInstanceOf(IllegalStateException.class);

        ScanResult clean = ScanResult.builder("x", U).cleanOutcomeAllowed(true).build();
        assertThat(clean.getStatus().isOk()).isTrue();
        assertThat(clean.getFindings()).isEmpty();
    }

    @Test
    void same_finding_key_keeps_last_value() {
        ScanResult r = ScanResult.builder("x", U)
                .finding("k", Severity.LOW, "first")
                .finding("k", Severity.HIGH, "second")
                .build();
        assertThat(r.getFindings()).hasSize(1);
        assertThat(r.getFindings().get("k").getDetail()).isEqualTo("second");
    }

    @Test
    void withDuration_copies_everything_else() {
        ScanResult r = ScanResult.builder("x", U)
                .finding("k", Severity.MEDIUM, "d")
                .measurement("score.performance", 0.8)
                .rawOutput("raw")
                .build();
        ScanResult timed = r.withDuration(42);
        assertThat(timed.getDurationMs()).isEqualTo(42);
        assertThat(timed.getFindings()).isEqualTo(r.getFindings());
        assertThat(timed.getMeasurements()).containsEntry("score.performance", 0.8);
        assertThat(timed.getRawOutput()).isEqualTo("raw");

        assertThat(ScanResult.skipped("x", U, "tool-not-installed").withDuration(1).getStatus())
                .isEqualTo(ScanStatus.skipped("tool-not-installed"));
    }

    @Test
    void status_text_round_trips() {
        assertThat(ScanStatus.ok().toString()).isEqualTo("ok");
        assertThat(ScanStatus.skipped(ScanStatus.TOOL_NOT_INSTALLED).toString()).isEqualTo("skipped:tool-not-installed");
        assertThat(ScanStatus.parse("error:timeout after 3s")).isEqualTo(ScanStatus.error("timeout after 3s"));
        assertThatThrownBy(() -> ScanStatus.error(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ScanStatus.parse("weird")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void severity_parse_is_lenient() {
        assertThat(Severity.parse("critical")).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.parse("Moderate")).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.parse("unknown")).isEqualTo(Severity.INFO);
        assertThat(Severity.parse(null)).isEqualTo(Severity.INFO);
    }
}
