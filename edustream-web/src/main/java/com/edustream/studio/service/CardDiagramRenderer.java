package com.edustream.studio.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Draws a square quiz card: the title, the problem description and, when present, the four
 * answer options in a 2x2 grid. Every option box is drawn the same way so the card never
 * gives the answer away.
 */
@Service
@Slf4j
public class CardDiagramRenderer implements DiagramRenderer {

    static final int SIZE = 1080;
    private static final int MARGIN = 70;

    private static final Color BACKGROUND = new Color(0x1a, 0x1a, 0x2e);
    private static final Color ACCENT = new Color(0x4e, 0xcc, 0xa3);
    private static final Color OPTION_FILL = new Color(0x2d, 0x34, 0x36);
    private static final Color BODY_TEXT = new Color(0xdd, 0xdd, 0xdd);

    private final FileStorageService storageService;

    public CardDiagramRenderer(FileStorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public String renderFromDescription(String title, String description, List<String> options, String correctAnswer) {
        byte[] png = drawCard(title, description, options);
        String filename = "diagram-" + UUID.randomUUID() + ".png";
        String key = storageService.storeFile(new ByteArrayInputStream(png), filename, png.length);
        log.info("Rendered diagram '{}' ({} bytes)", key, png.length);
        return key;
    }

    byte[] drawCard(String title, String description, List<String> options) {
        BufferedImage image = new BufferedImage(SIZE, SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(BACKGROUND);
            g.fillRect(0, 0, SIZE, SIZE);

            int y = drawLines(g, title != null ? title : "", new Font(Font.SANS_SERIF, Font.BOLD, 48),
                    Color.WHITE, MARGIN + 40, true);

            g.setColor(ACCENT);
            g.setStroke(new BasicStroke(4));
            g.drawLine(MARGIN, y + 10, SIZE - MARGIN, y + 10);

            boolean hasOptions = options != null && !options.isEmpty();
            int bodyLimit = hasOptions ? 620 : 900;
            drawLines(g, description != null ? description : "", new Font(Font.SANS_SERIF, Font.PLAIN, 30),
                    BODY_TEXT, Math.min(y + 70, bodyLimit), false);

            if (hasOptions) {
                drawOptions(g, options);
            } else {
                g.setColor(ACCENT);
                g.setFont(new Font(Font.SANS_SERIF, Font.BOLD | Font.ITALIC, 36));
                drawCentered(g, "Save this for your exam!", SIZE - 110);
            }
        } finally {
            g.dispose();
        }

        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode diagram", e);
        }
    }

    private void drawOptions(Graphics2D g, List<String> options) {
        int gap = 40;
        int width = (SIZE - 2 * MARGIN - gap) / 2;
        int height = 130;
        int top = SIZE - MARGIN - 2 * height - gap;
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 28));
        FontMetrics fm = g.getFontMetrics();

        for (int i = 0; i < Math.min(4, options.size()); i++) {
            int x = MARGIN + (i % 2) * (width + gap);
            int y = top + (i / 2) * (height + gap);
            g.setColor(OPTION_FILL);
            g.fillRoundRect(x, y, width, height, 24, 24);
            g.setColor(ACCENT);
            g.setStroke(new BasicStroke(4));
            g.drawRoundRect(x, y, width, height, 24, 24);

            List<String> lines = wrap(splitOption(options.get(i)), fm, width - 30);
            int lineHeight = fm.getHeight();
            int textY = y + (height - lines.size() * lineHeight) / 2 + fm.getAscent();
            g.setColor(Color.WHITE);
            for (String line : lines) {
                g.drawString(line, x + (width - fm.stringWidth(line)) / 2, textY);
                textY += lineHeight;
            }
        }
    }

    // "A: Ra = 6 kN, Rb = 6 kN" reads better with each value on its own line
    private static String splitOption(String option) {
        int colon = option.indexOf(": ");
        if (colon < 0) {
            return option;
        }
        String rest = option.substring(colon + 2);
        return option.substring(0, colon + 1) + "\n" + String.join("\n", rest.split(",\\s*"));
    }

    private int drawLines(Graphics2D g, String text, Font font, Color color, int y, boolean centered) {
        g.setFont(font);
        g.setColor(color);
        FontMetrics fm = g.getFontMetrics();
        for (String line : wrap(text, fm, SIZE - 2 * MARGIN)) {
            if (centered) {
                drawCentered(g, line, y);
            } else {
                g.drawString(line, MARGIN, y);
            }
            y += fm.getHeight();
        }
        return y;
    }

    private static void drawCentered(Graphics2D g, String line, int y) {
        g.drawString(line, (SIZE - g.getFontMetrics().stringWidth(line)) / 2, y);
    }

    static List<String> wrap(String text, FontMetrics fm, int maxWidth) {
        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\n")) {
            StringBuilder line = new StringBuilder();
            for (String word : paragraph.split(" ")) {
                String candidate = line.length() == 0 ? word : line + " " + word;
                if (fm.stringWidth(candidate) > maxWidth && line.length() > 0) {
                    lines.add(line.toString());
                    line = new StringBuilder(word);
                } else {
                    line = new StringBuilder(candidate);
                }
            }
            lines.add(line.toString());
        }
        return lines;
    }
}
