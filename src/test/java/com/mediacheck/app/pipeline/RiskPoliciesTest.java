package com.mediacheck.app.pipeline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RiskPoliciesTest {

    private final RiskPolicy image = RiskPolicies.imageRiskPolicy();
    private final RiskPolicy video = RiskPolicies.videoRiskPolicy();

    @Test
    void imagePolicyUsesAiFraction() {
        assertEquals(RiskScore.HIGH, image.assess(2, 2, 4), "exactly half is high");
        assertEquals(RiskScore.HIGH, image.assess(2, 1, 3));
        assertEquals(RiskScore.MEDIUM, image.assess(1, 3, 4));
        assertEquals(RiskScore.LOW, image.assess(0, 4, 4));
        assertEquals(RiskScore.LOW, image.assess(0, 0, 0));
    }

    @Test
    void videoPolicyComparesCounts() {
        assertEquals(RiskScore.MEDIUM, video.assess(2, 2, 4), "tie is not high for videos");
        assertEquals(RiskScore.HIGH, video.assess(3, 2, 5));
        assertEquals(RiskScore.MEDIUM, video.assess(1, 9, 10));
        assertEquals(RiskScore.LOW, video.assess(0, 3, 3));
    }

    @Test
    void pipelinesUseTheirOwnPolicy() {
        assertEquals(RiskScore.HIGH, Pipeline.IMAGE.riskPolicy().assess(2, 2, 4));
        assertEquals(RiskScore.MEDIUM, Pipeline.VIDEO.riskPolicy().assess(2, 2, 4));
    }

    @Test
    void confidenceIsRoundedGenuinePercentage() {
        assertEquals(75, RiskPolicies.confidence(3, 4));
        assertEquals(67, RiskPolicies.confidence(2, 3));
        assertEquals(33, RiskPolicies.confidence(1, 3));
        assertEquals(100, RiskPolicies.confidence(5, 5));
        assertEquals(0, RiskPolicies.confidence(0, 0));
    }
}
