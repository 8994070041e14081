package org.exquisite.util;

import org.exquisite.TestImages;
import org.exquisite.model.enums.GrowthMode;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RasterUtilsTest {

    @Test
    void crop_ShouldReturnADetachedCopy() {
        BufferedImage source = TestImages.coordinates(10, 10);

        BufferedImage crop = RasterUtils.crop(source, 2, 3, 4, 5);
        crop.setRGB(0, 0, 0xFFFFFF);

        assertThat(crop.getWidth()).isEqualTo(4);
        assertThat(crop.getHeight()).isEqualTo(5);
        assertThat(source.getRGB(2, 3)).isEqualTo(TestImages.coordinates(10, 10).getRGB(2, 3));
    }

    @Test
    void crop_ShouldRejectRectanglesOutsideTheImage() {
        assertThatThrownBy(() -> RasterUtils.crop(TestImages.solid(10, 10, 0), 8, 0, 4, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sliceAlong_ShouldCutAlongTheGrowthAxis() {
        BufferedImage source = TestImages.coordinates(12, 8);

        BufferedImage columns = RasterUtils.sliceAlong(source, GrowthMode.GROW_LEFT, 4, 3);
        BufferedImage rows = RasterUtils.sliceAlong(source, GrowthMode.GROW_DOWN, 2, 5);

        assertThat(columns.getWidth()).isEqualTo(3);
        assertThat(columns.getHeight()).isEqualTo(8);
        assertThat(columns.getRGB(0, 0)).isEqualTo(source.getRGB(4, 0));
        assertThat(rows.getWidth()).isEqualTo(12);
        assertThat(rows.getRGB(0, 0)).isEqualTo(source.getRGB(0, 2));
    }

    @Test
    void pixelsEqual_ShouldIgnoreAlphaButNotColour() {
        BufferedImage rgb = TestImages.solid(3, 3, 40);
        BufferedImage argb = new BufferedImage(3, 3, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 3; x++) {
                argb.setRGB(x, y, 0xFF282828);
            }
        }

        assertThat(RasterUtils.pixelsEqual(rgb, argb)).isTrue();
        argb.setRGB(1, 1, 0xFF292828);
        assertThat(RasterUtils.pixelsEqual(rgb, argb)).isFalse();
    }

    @Test
    void luminance_ShouldWeightChannelsPerItuR601() {
        assertThat(RasterUtils.luminance(0xFFFFFF)).isCloseTo(1.0f, within(1e-6f));
        assertThat(RasterUtils.luminance(0x00FF00)).isCloseTo(0.587f, within(1e-6f));
    }
}
