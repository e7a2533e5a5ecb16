package org.estateranker.engine.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProximityCurveTest {

    @Test
    void linearFallsOffProportionally() {
        assertThat(ProximityCurve.LINEAR.factor(0, 1000)).isEqualTo(1.0);
        assertThat(ProximityCurve.LINEAR.factor(250, 1000)).isCloseTo(0.75, within(1e-9));
        assertThat(ProximityCurve.LINEAR.factor(1000, 1000)).isZero();
    }

    @Test
    void exponentialRewardsVeryCloseMore() {
        assertThat(ProximityCurve.EXPONENTIAL.factor(500, 1000)).isCloseTo(0.25, within(1e-9));
        assertThat(ProximityCurve.EXPONENTIAL.factor(500, 1000))
                .isLessThan(ProximityCurve.LINEAR.factor(500, 1000));
    }

    @Test
    void outsideRadiusAndDegenerateRadiusYieldZero() {
        assertThat(ProximityCurve.LINEAR.factor(1500, 1000)).isZero();
        assertThat(ProximityCurve.EXPONENTIAL.factor(10, 0)).isZero();
    }

    @Test
    void factorNeverIncreasesWithDistance() {
        double previous = Double.MAX_VALUE;
        for (int d = 0; d <= 3000; d += 100) {
            double factor = ProximityCurve.EXPONENTIAL.factor(d, 3000);
            assertThat(factor).isBetween(0.0, 1.0).isLessThanOrEqualTo(previous);
            previous = factor;
        }
    }

    @Test
    void namesParseLeniently() {
        assertThat(ProximityCurve.fromName(" Exponential ")).isEqualTo(ProximityCurve.EXPONENTIAL);
        assertThat(ProximityCurve.fromName("cubic")).isEqualTo(ProximityCurve.LINEAR);
        assertThat(ProximityCurve.fromName(null)).isEqualTo(ProximityCurve.LINEAR);
    }
}
