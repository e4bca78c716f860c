package org.janelia.tiling.filter;

import org.janelia.tiling.image.PixelBuffer;
import org.janelia.tiling.image.TestImages;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link InvertFilter} class.
 */
public class InvertFilterTest {

    @Test
    public void testInvert() {
        final FilterAdapter adapter = new FilterAdapter(new InvertFilter());
        for (final int channels : new int[] { 1, 3 }) {
            final PixelBuffer source = TestImages.random(7, 5, channels, 17);
            final PixelBuffer inverted = adapter.apply(source, FilterParameters.EMPTY);
            for (int y = 0; y < source.getHeight(); y++) {
                for (int x = 0; x < source.getWidth(); x++) {
                    for (int c = 0; c < channels; c++) {
                        Assert.assertEquals("invalid sample at (" + x + ", " + y + ", " + c + ")",
                                            255 - source.get(x, y, c), inverted.get(x, y, c));
                    }
                }
            }
        }
    }

}
