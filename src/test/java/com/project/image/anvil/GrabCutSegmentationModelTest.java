package com.project.image.anvil;

import com.project.image.anvil.service.segmentation.GrabCutSegmentationModel;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GrabCutSegmentationModelTest {

    @Test
    void predict_brightObjectOnDarkBackground_isForeground() {
        GrabCutSegmentationModel model = new GrabCutSegmentationModel(5, 512);
        boolean nativeAvailable;
        try {
            model.load();
            nativeAvailable = true;
        } catch (RuntimeException | LinkageError e) {
            nativeAvailable = false;
        }
        assumeTrue(nativeAvailable, "OpenCV native library not available on this platform");

        BufferedImage img = new BufferedImage(120, 80, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(new Color(20, 30, 40));
        g.fillRect(0, 0, 120, 80);
        g.setColor(new Color(240, 200, 60));
        g.fillRect(40, 25, 40, 30);
        g.dispose();

        byte[] alpha = model.predict(img);

        assertThat(alpha).hasSize(120 * 80);
        assertThat(alpha[40 * 120 + 60] & 0xFF).isEqualTo(255);
        assertThat(alpha[2 * 120 + 2] & 0xFF).isZero();
    }
}
