package com.ontheform.features.submission.application.sideeffect;

import com.ontheform.shared.qr.QrCodeService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Renders a QR code of the submission id for forms with {@code showQrCode}.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class QrCodeSideEffect implements SubmissionSideEffect {

    private final QrCodeService qrCodeService;

    @Override
    public String name() {
        return "qr-code";
    }

    @Override
    public boolean appliesTo(SideEffectContext context) {
        return context.getForm().isShowQrCode();
    }

    @Override
    public void apply(SideEffectContext context) {
        byte[] png = qrCodeService.toPng(context.getSubmission().getId().toString());
        context.qrRendered(png, qrCodeService.toDataUrl(png));
    }
}
