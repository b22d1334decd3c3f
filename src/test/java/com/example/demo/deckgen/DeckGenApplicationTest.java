package com.example.demo.deckgen;

import com.example.demo.deckgen.client.FileIoImageUploader;
import com.example.demo.deckgen.client.ImageUploader;
import com.example.demo.deckgen.client.RestSlidesClient;
import com.example.demo.deckgen.client.SlidesClient;
import com.example.demo.deckgen.config.AutofitProperties;
import com.example.demo.deckgen.config.DispatchProperties;
import com.example.demo.deckgen.config.UploadProperties;
import com.example.demo.deckgen.dispatch.Sleeper;
import com.example.demo.deckgen.dispatch.ThreadSleeper;
import com.example.demo.deckgen.service.DeckRenderer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
public class DeckGenApplicationTest {

    @Autowired
    private DeckRenderer deckRenderer;

    @Autowired
    private SlidesClient slidesClient;

    @Autowired
    private ImageUploader imageUploader;

    @Autowired
    private Sleeper sleeper;

    @Autowired
    private AutofitProperties autofitProperties;

    @Autowired
    private DispatchProperties dispatchProperties;

    @Autowired
    private UploadProperties uploadProperties;

    @Test
    public void testContextWiring() {
        assertNotNull(deckRenderer);
        assertInstanceOf(RestSlidesClient.class, slidesClient);
        assertInstanceOf(FileIoImageUploader.class, imageUploader);
        assertInstanceOf(ThreadSleeper.class, sleeper);
    }

    @Test
    public void testDefaultsFromApplicationYaml() {
        assertEquals(14.0, autofitProperties.getMinFontSize());
        assertEquals(0.25, autofitProperties.getStep());
        assertEquals(6, dispatchProperties.getMaxRateLimitedPerChunk());
        assertEquals(List.of("createImage"), dispatchProperties.getRateLimitedKinds());
        assertEquals(Duration.ofSeconds(2), dispatchProperties.getChunkDelay());
        assertEquals(Duration.ofMillis(150), uploadProperties.getRequestDelay());
        assertEquals(6, uploadProperties.getBurstSize());
    }
}
