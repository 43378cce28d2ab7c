package com.project.image.anvil;

import com.project.image.anvil.DTOs.AnvilPolygon;
import com.project.image.anvil.DTOs.AnvilSpec;
import com.project.image.anvil.DTOs.AspectRatio;
import com.project.image.anvil.DTOs.RgbColor;
import com.project.image.anvil.DTOs.ShapeGeometry;
import com.project.image.anvil.DTOs.ShapeMask;
import com.project.image.anvil.service.ShapeEngine;
import org.junit.jupiter.api.Test;

import java.awt.Rectangle;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ShapeEngineTest {
    private static final RgbColor BLUE = RgbColor.fromHex("#0070F2");

    private final ShapeEngine engine = new ShapeEngine(AnvilPolygon.DEFAULT);

    private static AnvilSpec spec(double scale, double offsetX, double offsetY) {
        return new AnvilSpec(scale, offsetX, offsetY, BLUE, 0.5, AspectRatio.LANDSCAPE_16_9);
    }

    @Test
    void place_defaultSpec_centersTwoToOneBox() {
        ShapeGeometry g = engine.place(160, 90, spec(0.7, 0, 0));

        assertThat(g.width()).isCloseTo(112.0, within(1e-9));
        assertThat(g.height()).isCloseTo(56.0, within(1e-9));
        assertThat(g.left()).isCloseTo(24.0, within(1e-9));
        assertThat(g.top()).isCloseTo(17.0, within(1e-9));
    }

    @Test
    void place_portraitCanvas_sizesAgainstWidth() {
        ShapeGeometry g = engine.place(90, 160, spec(0.7, 0, 0));

        assertThat(g.width()).isCloseTo(63.0, within(1e-9));
        assertThat(g.height()).isCloseTo(31.5, within(1e-9));
    }

    @Test
    void place_fullOffsets_touchCanvasEdges() {
        ShapeGeometry bottomRight = engine.place(160, 90, spec(0.7, 1, 1));
        ShapeGeometry topLeft = engine.place(160, 90, spec(0.7, -1, -1));

        assertThat(bottomRight.right()).isCloseTo(160.0, within(1e-9));
        assertThat(bottomRight.bottom()).isCloseTo(90.0, within(1e-9));
        assertThat(topLeft.left()).isCloseTo(0.0, within(1e-9));
        assertThat(topLeft.top()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void computeShapeMask_boundingBoxStaysInsideCanvas() {
        int[][] canvases = {{160, 90}, {90, 160}, {100, 100}, {17, 16}};
        double[] scales = {0.5, 0.75, 1.0};
        double[] offsets = {-1, -0.3, 0, 0.6, 1};
        for (int[] canvas : canvases) {
            for (double scale : scales) {
                for (double ox : offsets) {
                    for (double oy : offsets) {
                        ShapeMask mask = engine.computeShapeMask(canvas[0], canvas[1], spec(scale, ox, oy));
                        Rectangle bounds = mask.pixelBounds();
                        assertThat(bounds).isNotNull();
                        assertThat(bounds.x).isGreaterThanOrEqualTo(0);
                        assertThat(bounds.y).isGreaterThanOrEqualTo(0);
                        assertThat(bounds.x + bounds.width).isLessThanOrEqualTo(canvas[0]);
                        assertThat(bounds.y + bounds.height).isLessThanOrEqualTo(canvas[1]);
                    }
                }
            }
        }
    }

    @Test
    void computeShapeMask_isDeterministic() {
        AnvilSpec spec = spec(0.85, 0.4, -0.2);

        ShapeMask first = engine.computeShapeMask(320, 180, spec);
        ShapeMask second = engine.computeShapeMask(320, 180, spec);

        assertThat(second.data()).isEqualTo(first.data());
    }

    @Test
    void computeShapeMask_followsAnvilOutline() {
        ShapeMask mask = engine.computeShapeMask(160, 90, spec(0.7, 0, 0));

        // box spans x 24..136, y 17..73; the diagonal runs from the top-right to the bottom middle
        assertThat(mask.isInside(25, 18)).isTrue();
        assertThat(mask.isInside(30, 70)).isTrue();
        assertThat(mask.isInside(130, 18)).isTrue();
        assertThat(mask.isInside(124, 67)).isFalse();
        assertThat(mask.isInside(5, 5)).isFalse();
        assertThat(mask.isInside(80, 80)).isFalse();
    }

    @Test
    void computeShapeMask_customPolygon() {
        ShapeEngine rectangle = new ShapeEngine(AnvilPolygon.parse(List.of("0,0", "1,0", "1,1", "0,1")));

        ShapeMask mask = rectangle.computeShapeMask(200, 100, spec(1.0, 0, 0));

        assertThat(mask.pixelBounds()).isEqualTo(new Rectangle(0, 0, 200, 100));
    }

    @Test
    void polygonParse_rejectsMalformedVertices() {
        assertThatThrownBy(() -> AnvilPolygon.parse(List.of("0,0", "1")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
