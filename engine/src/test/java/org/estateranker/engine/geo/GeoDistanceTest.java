package org.estateranker.engine.geo;

import org.estateranker.engine.domain.model.GeoPoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GeoDistanceTest {

    @Test
    void samePointIsZero() {
        assertThat(GeoDistance.meters(13.7563, 100.5018, 13.7563, 100.5018)).isZero();
    }

    @Test
    void oneDegreeOfLatitudeIsAbout111Km() {
        assertThat(GeoDistance.meters(0, 100, 1, 100)).isCloseTo(111_195, within(10.0));
    }

    @Test
    void bangkokToChiangMai() {
        GeoPoint bangkok = GeoPoint.of(13.7563, 100.5018);
        GeoPoint chiangMai = GeoPoint.of(18.7883, 98.9853);

        assertThat(GeoDistance.meters(bangkok, chiangMai) / 1000).isCloseTo(583, within(5.0));
        assertThat(GeoDistance.meters(bangkok, chiangMai)).isEqualTo(GeoDistance.meters(chiangMai, bangkok));
    }

    @Test
    void rejectsNullPoints() {
        assertThatThrownBy(() -> GeoDistance.meters(null, GeoPoint.of(1, 1)))
                .isInstanceOf(NullPointerException.class);
    }
}
