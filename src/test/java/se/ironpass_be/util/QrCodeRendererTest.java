package se.ironpass_be.util;

import com.google.zxing.BinaryBitmap;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class QrCodeRendererTest {

    private final QrCodeRenderer renderer = new QrCodeRenderer(300);

    @Test
    void rendersScannablePngOfRequestedSize() throws Exception {
        String token = "0123456789abcdef".repeat(4);

        String dataUrl = renderer.toDataUrl(token);

        assertThat(dataUrl).startsWith(QrCodeRenderer.DATA_URL_PREFIX);
        byte[] png = Base64.getDecoder().decode(dataUrl.substring(QrCodeRenderer.DATA_URL_PREFIX.length()));
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        assertThat(image.getWidth()).isEqualTo(300);
        assertThat(image.getHeight()).isEqualTo(300);

        Result decoded = new MultiFormatReader().decode(
                new BinaryBitmap(new HybridBinarizer(new BufferedImageLuminanceSource(image))));
        assertThat(decoded.getText()).isEqualTo(token);
    }
}
