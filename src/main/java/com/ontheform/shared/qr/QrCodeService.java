package com.ontheform.shared.qr;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.EnumMap;
import java.util.Map;

/**
 * Renders QR codes as PNG images.
 */
@Component
public class QrCodeService {

    public static final int DEFAULT_SIZE = 200;
    public static final int DEFAULT_MARGIN = 2;

    private static final String PNG_DATA_URL_PREFIX = "data:image/png;base64,";

    public byte[] toPng(String content) {
        return toPng(content, DEFAULT_SIZE, DEFAULT_MARGIN);
    }

    public byte[] toPng(String content, int size, int margin) {
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("QR code content must not be empty");
        }

        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.MARGIN, margin);
        hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());

        try {
            BitMatrix matrix = new QRCodeWriter().encode(content, BarcodeFormat.QR_CODE, size, size, hints);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", out);
            return out.toByteArray();
        } catch (WriterException | IOException e) {
            throw new QrCodeGenerationException("Failed to render QR code", e);
        }
    }

    public String toDataUrl(byte[] png) {
        return PNG_DATA_URL_PREFIX + Base64.getEncoder().encodeToString(png);
    }

    public String toDataUrl(String content) {
        return toDataUrl(toPng(content));
    }
}
