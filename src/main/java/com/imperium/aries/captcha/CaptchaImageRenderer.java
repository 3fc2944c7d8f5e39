package com.imperium.aries.captcha;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Random;

/**
 * 把验证码文本绘制成带干扰线与噪点的 PNG，输出 data URL。
 */
@Component
public class CaptchaImageRenderer {

    public static final String DATA_URL_PREFIX = "data:image/png;base64,";

    private static final String[] FONT_FAMILIES = {Font.SANS_SERIF, Font.SERIF, Font.MONOSPACED};
    private static final int NOISE_LINES = 5;
    private static final int NOISE_DOTS = 60;

    private final int width;
    private final int height;
    private final Random random = new SecureRandom();

    public CaptchaImageRenderer(
            @Value("${app.captcha.width:120}") int width,
            @Value("${app.captcha.height:40}") int height) {
        this.width = width;
        this.height = height;
    }

    public String renderDataUrl(String text) {
        BufferedImage image = render(text);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode captcha image", e);
        }
        return DATA_URL_PREFIX + Base64.getEncoder().encodeToString(out.toByteArray());
    }

    BufferedImage render(String text) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(new Color(245, 245, 245));
            g.fillRect(0, 0, width, height);

            g.setStroke(new BasicStroke(1.2f));
            for (int i = 0; i < NOISE_LINES; i++) {
                g.setColor(randomColor(120, 200));
                g.drawLine(random.nextInt(width), random.nextInt(height),
                        random.nextInt(width), random.nextInt(height));
            }

            int fontSize = (int) (height * 0.7);
            int slot = width / (text.length() + 1);
            for (int i = 0; i < text.length(); i++) {
                g.setFont(new Font(FONT_FAMILIES[random.nextInt(FONT_FAMILIES.length)], Font.BOLD, fontSize));
                g.setColor(randomColor(20, 110));
                AffineTransform saved = g.getTransform();
                int x = slot / 2 + i * slot + random.nextInt(Math.max(1, slot / 3));
                int y = (height + fontSize) / 2 - random.nextInt(Math.max(1, height / 8));
                g.rotate(Math.toRadians(random.nextInt(41) - 20), x, y);
                g.drawString(String.valueOf(text.charAt(i)), x, y);
                g.setTransform(saved);
            }

            for (int i = 0; i < NOISE_DOTS; i++) {
                image.setRGB(random.nextInt(width), random.nextInt(height), randomColor(0, 255).getRGB());
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private Color randomColor(int min, int max) {
        int bound = max - min + 1;
        return new Color(min + random.nextInt(bound), min + random.nextInt(bound), min + random.nextInt(bound));
    }
}
