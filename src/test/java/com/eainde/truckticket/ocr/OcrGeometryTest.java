package com.eainde.truckticket.ocr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OcrGeometryTest {

    private static void assertBox(BoundingBox actual, double x0, double y0, double x1, double y1) {
        assertThat(actual.x0()).isCloseTo(x0, within(1e-9));
        assertThat(actual.y0()).isCloseTo(y0, within(1e-9));
        assertThat(actual.x1()).isCloseTo(x1, within(1e-9));
        assertThat(actual.y1()).isCloseTo(y1, within(1e-9));
    }

    @Nested
    @DisplayName("BoundingBox")
    class Boxes {

        private final BoundingBox box = BoundingBox.of(0.1, 0.2, 0.3, 0.4);

        @Test
        @DisplayName("rotates back to upright a quarter turn at a time")
        void upright() {
            assertBox(box.toUpright(0), 0.1, 0.2, 0.3, 0.4);
            assertBox(box.toUpright(90), 0.2, 0.7, 0.4, 0.9);
            assertBox(box.toUpright(180), 0.7, 0.6, 0.9, 0.8);
            assertBox(box.toUpright(360), 0.1, 0.2, 0.3, 0.4);
            assertBox(box.toUpright(-90), box.toUpright(270).x0(), box.toUpright(270).y0(),
                    box.toUpright(270).x1(), box.toUpright(270).y1());
        }

        @Test
        @DisplayName("rejects coordinates outside the page or inverted corners")
        void validation() {
            assertThatThrownBy(() -> BoundingBox.of(0, 0, 1.2, 0.5)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BoundingBox.of(0.5, 0, 0.4, 0.5)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("containment, overlap and union")
        void relations() {
            BoundingBox page = BoundingBox.of(0, 0, 1, 1);
            BoundingBox right = BoundingBox.of(0.25, 0.5, 0.6, 0.6);

            assertThat(page.contains(box)).isTrue();
            assertThat(box.contains(page)).isFalse();
            assertThat(box.overlapsHorizontally(right)).isTrue();
            assertThat(box.overlapsHorizontally(BoundingBox.of(0.3, 0, 0.5, 0.1))).isFalse();
            assertBox(box.union(right), 0.1, 0.2, 0.6, 0.6);
        }
    }

    @Test
    @DisplayName("an upright page keeps its text and rotates its lines")
    void pageUpright() {
        OcrLine line = new OcrLine("TICKET 123456",
                List.of(new OcrWord("TICKET", BoundingBox.of(0.1, 0.2, 0.2, 0.3), 0.9)),
                BoundingBox.of(0.1, 0.2, 0.3, 0.3));
        OcrPage rotated = new OcrPage(1, null, List.of(line), 90, null);

        OcrPage upright = rotated.upright();

        assertThat(upright.orientationDegrees()).isZero();
        assertThat(upright.text()).isEqualTo("TICKET 123456");
        assertBox(upright.lines().get(0).box(), 0.2, 0.7, 0.3, 0.9);
        assertBox(upright.lines().get(0).words().get(0).box(), 0.2, 0.8, 0.3, 0.9);
        assertThat(upright.lines().get(0).confidence()).isEqualTo(0.9);
        assertThat(OcrPage.textOnly(2, "x").upright().text()).isEqualTo("x");
        assertThatThrownBy(() -> new OcrPage(1, "", List.of(), 45, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("page text defaults to lines in reading order")
    void readingOrder() {
        OcrPage page = OcrPage.of(1, List.of(
                OcrLine.of("second", BoundingBox.of(0.1, 0.5, 0.4, 0.6)),
                OcrLine.of("right", BoundingBox.of(0.5, 0.1, 0.9, 0.2)),
                OcrLine.of("left", BoundingBox.of(0.1, 0.1, 0.4, 0.2))));

        assertThat(page.text()).isEqualTo("left\nright\nsecond");
    }

    @Test
    @DisplayName("crops a normalized region to at least one pixel")
    void crop() {
        float[] px = new float[64];
        for (int i = 0; i < px.length; i++) {
            px[i] = i;
        }
        PageImage image = new PageImage(8, 8, px);

        PageImage region = image.crop(BoundingBox.of(0.25, 0.5, 0.75, 1.0));
        PageImage point = image.crop(BoundingBox.of(0.5, 0.5, 0.5, 0.5));

        assertThat(region.width()).isEqualTo(4);
        assertThat(region.height()).isEqualTo(4);
        assertThat(region.at(0, 0)).isEqualTo(34f);
        assertThat(region.at(3, 3)).isEqualTo(61f);
        assertThat(point.width()).isEqualTo(1);
        assertThat(point.height()).isEqualTo(1);
        assertThatThrownBy(() -> new PageImage(2, 2, new float[3])).isInstanceOf(IllegalArgumentException.class);
    }
}
