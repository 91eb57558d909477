package com.tableadvisor.advisor.decoder;

import com.tableadvisor.common.exception.AdvisorException;
import com.tableadvisor.common.model.Frame;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Decodes captured PNG/JPEG bytes into a {@link Frame}.
 */
@Component
public class FrameDecoder {

    public Frame decode(String sessionId, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new AdvisorException(sessionId, "empty frame body");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new AdvisorException(sessionId, "frame could not be read", e);
        }
        if (image == null) {
            throw new AdvisorException(sessionId, "unsupported image format, " + bytes.length + " bytes");
        }
        return Frame.fromImage(image);
    }
}
