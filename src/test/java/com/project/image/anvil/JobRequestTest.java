package com.project.image.anvil;

import com.project.image.anvil.DTOs.AnvilSpec;
import com.project.image.anvil.DTOs.AspectRatio;
import com.project.image.anvil.DTOs.ExportFormat;
import com.project.image.anvil.DTOs.JobKind;
import com.project.image.anvil.DTOs.JobRequest;
import com.project.image.anvil.DTOs.RgbColor;
import com.project.image.anvil.DTOs.Style;
import com.project.image.anvil.exceptions.SpecValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobRequestTest {
    private static final AnvilSpec SPEC = AnvilSpec.defaults(RgbColor.fromHex("#0070F2"), AspectRatio.LANDSCAPE_16_9);

    @Test
    void preview_coversAllSixStyles() {
        JobRequest request = JobRequest.preview(TestImages.noise(64, 36, 1), SPEC, "beach");

        assertThat(request.styles()).containsExactly(Style.values());
        assertThat(request.exportFormat()).isEqualTo(ExportFormat.IMAGE);
    }

    @Test
    void preview_withDuplicateStyles_isRejected() {
        List<Style> sixButRepeated = List.of(Style.FLAT, Style.FLAT, Style.STROKE, Style.GRADIENT,
                Style.WINDOW, Style.SILHOUETTE);

        assertThatThrownBy(() -> new JobRequest(JobKind.PREVIEW, TestImages.noise(64, 36, 1), SPEC,
                sixButRepeated, ExportFormat.IMAGE, "beach"))
                .isInstanceOf(SpecValidationException.class);
    }

    @Test
    void advanced_withTwoStyles_isRejected() {
        assertThatThrownBy(() -> new JobRequest(JobKind.ADVANCED, TestImages.noise(64, 36, 1), SPEC,
                List.of(Style.FLAT, Style.WINDOW), ExportFormat.IMAGE, "beach"))
                .isInstanceOf(SpecValidationException.class);
    }

    @Test
    void blankBaseName_defaultsToImage() {
        JobRequest request = JobRequest.advanced(TestImages.noise(64, 36, 1), SPEC, Style.WINDOW, null, " ");

        assertThat(request.baseName()).isEqualTo("image");
        assertThat(request.exportFormat()).isEqualTo(ExportFormat.IMAGE);
    }
}
