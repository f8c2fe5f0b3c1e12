package com.authprobe.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class ProbeConfigTest {

    private static ProbeConfig minimal() {
        return ProbeConfig.defaults().setTarget("http://localhost:8080/login");
    }

    @Test
    void defaults_match_documented_values() {
        ProbeConfig cfg = ProbeConfig.defaults();
        assertEquals(5, cfg.getCalibrationCount());
        assertEquals(5, cfg.getWorkerCount());
        assertEquals(Duration.ofSeconds(2), cfg.getRequestPacing());
        assertEquals(3, cfg.getScoreThreshold());
        assertEquals(0.01, cfg.getToleranceRatio(), 1e-9);
        assertEquals(3, cfg.getWeightStatus());
        assertEquals(2, cfg.getWeightLength());
        assertEquals(3, cfg.getWeightUrl());
    }

    @Test
    void validate_withMinimalValidConfig_shouldPass() {
        assertDoesNotThrow(minimal()::validate);
    }

    @Test
    void validate_fail_whenTargetMissing() {
        assertThrows(NullPointerException.class, ProbeConfig.defaults()::validate);
        assertThrows(IllegalArgumentException.class, ProbeConfig.defaults().setTarget("  ")::validate);
    }

    @Test
    void validate_fail_whenWorkersOutOfRange() {
        IllegalArgumentException low = assertThrows(IllegalArgumentException.class, minimal().setWorkerCount(0)::validate);
        assertTrue(low.getMessage().contains("workerCount"));
        assertThrows(IllegalArgumentException.class, minimal().setWorkerCount(21)::validate);
        assertDoesNotThrow(minimal().setWorkerCount(20)::validate);
        assertDoesNotThrow(minimal().setWorkerCount(1)::validate);
    }

    @Test
    void validate_fail_whenToleranceOrWeightsInvalid() {
        assertThrows(IllegalArgumentException.class, minimal().setToleranceRatio(-0.01)::validate);
        assertThrows(IllegalArgumentException.class, minimal().setToleranceRatio(1.0)::validate);
        IllegalArgumentException nan = assertThrows(IllegalArgumentException.class,
                minimal().setToleranceRatio(Double.NaN)::validate);
        assertTrue(nan.getMessage().contains("toleranceRatio"));
        assertThrows(IllegalArgumentException.class, minimal().setToleranceRatio(Double.POSITIVE_INFINITY)::validate);
        IllegalArgumentException w = assertThrows(IllegalArgumentException.class,
                minimal().setWeightStatus(0).setWeightLength(0).setWeightUrl(0)::validate);
        assertTrue(w.getMessage().contains("weight"));
        assertThrows(IllegalArgumentException.class, minimal().setScoreThreshold(0)::validate);
    }

    @Test
    void validate_fail_whenPacingNegative() {
        assertThrows(IllegalArgumentException.class, minimal().setRequestPacing(Duration.ofMillis(-1))::validate);
        assertDoesNotThrow(minimal().setRequestPacing(Duration.ZERO)::validate);
    }

    @Test
    void empty_delimiter_means_auto_detect() {
        assertNull(minimal().setDelimiter("").getDelimiter());
        assertEquals(";", minimal().setDelimiter(";").getDelimiter());
    }

    @Test
    void hits_path_is_resolved_under_output_dir() {
        ProbeConfig cfg = minimal();
        assertEquals(cfg.getOutputDir().resolve("hits.txt"), cfg.getHitsPath());
    }
}
