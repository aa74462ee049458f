package com.edustream.studio.service;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CardDiagramRendererTest {

    @Mock
    private FileStorageService storageService;

    @InjectMocks
    private CardDiagramRenderer renderer;

    @BeforeAll
    static void headless() {
        System.setProperty("java.awt.headless", "true");
    }

    @Test
    void renderFromDescription_shouldStoreSquarePng() throws IOException {
        when(storageService.storeFile(any(InputStream.class), startsWith("diagram-"), anyLong()))
                .thenAnswer(invocation -> invocation.getArgument(1));

        String key = renderer.renderFromDescription("Can you find the reactions?",
                "Simply supported beam, span 6 m, point load 20 kN at midspan.",
                List.of("A: Ra = 10 kN, Rb = 10 kN", "B: Ra = 20 kN, Rb = 0 kN", "C: Ra = 5 kN, Rb = 15 kN",
                        "D: Ra = 15 kN, Rb = 5 kN"),
                "A");

        assertTrue(key.startsWith("diagram-") && key.endsWith(".png"), key);
        ArgumentCaptor<InputStream> stream = ArgumentCaptor.forClass(InputStream.class);
        ArgumentCaptor<Long> length = ArgumentCaptor.forClass(Long.class);
        verify(storageService).storeFile(stream.capture(), eq(key), length.capture());
        byte[] png = stream.getValue().readAllBytes();
        assertEquals(png.length, length.getValue());
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        assertEquals(CardDiagramRenderer.SIZE, image.getWidth());
        assertEquals(CardDiagramRenderer.SIZE, image.getHeight());
    }

    @Test
    void drawCard_shouldRenderInfographicWithoutOptions() throws IOException {
        byte[] png = renderer.drawCard("Gear Ratios", "Driver gear 20 teeth, driven gear 60 teeth.", null);

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        assertEquals(CardDiagramRenderer.SIZE, image.getWidth());
    }

    @Test
    void drawCard_shouldFillAllOptionBoxesAlike() throws IOException {
        byte[] png = renderer.drawCard("Quiz", "desc", List.of("A: 1 kN", "B: 2 kN", "C: 3 kN", "D: 4 kN"));

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        int[][] boxCorners = {{70, 710}, {560, 710}, {70, 880}, {560, 880}};
        for (int[] corner : boxCorners) {
            assertEquals(0x2d3436, image.getRGB(corner[0] + 15, corner[1] + 65) & 0xffffff);
        }
    }
}
