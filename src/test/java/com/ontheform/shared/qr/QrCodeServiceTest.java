package com.ontheform.shared.qr;

import com.google.zxing.BinaryBitmap;
import com.google.zxing.LuminanceSource;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.qrcode.QRCodeReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.Base64;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QrCodeService")
class QrCodeServiceTest {

    private final QrCodeService qrCodeService = new QrCodeService();

    @Test
    @DisplayName("PNG decodes back to the submission id")
    void png_decodesToContent() throws Exception {
        String submissionId = UUID.randomUUID().toString();

        byte[] png = qrCodeService.toPng(submissionId);

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        assertThat(image.getWidth()).isEqualTo(QrCodeService.DEFAULT_SIZE);
        LuminanceSource source = new BufferedImageLuminanceSource(image);
        Result decoded = new QRCodeReader().decode(new BinaryBitmap(new HybridBinarizer(source)));
        assertThat(decoded.getText()).isEqualTo(submissionId);
    }

    @Test
    @DisplayName("data URL wraps the PNG in base64")
    void dataUrl_base64Png() {
        byte[] png = qrCodeService.toPng("abc");

        String dataUrl = qrCodeService.toDataUrl(png);

        assertThat(dataUrl).startsWith("data:image/png;base64,");
        assertThat(Base64.getDecoder().decode(dataUrl.substring("data:image/png;base64,".length()))).isEqualTo(png);
    }

    @Test
    @DisplayName("empty content is rejected")
    void emptyContent_rejected() {
        assertThatThrownBy(() -> qrCodeService.toPng("")).isInstanceOf(IllegalArgumentException.class);
    }
}
