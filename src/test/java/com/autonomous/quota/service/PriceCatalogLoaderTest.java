package com.autonomous.quota.service;

import com.autonomous.quota.exception.PriceCatalogLoadException;
import com.autonomous.quota.model.PriceEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.FileSystemResource;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PriceCatalogLoaderTest {

    private static final String HEADER = "model,version,input,cached_input,output\n";

    private PriceCatalogLoader loader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        loader = new PriceCatalogLoader();
    }

    @Test
    void shouldLoadGenericAndVersionedKeys() throws Exception {
        Path csv = tempDir.resolve("pricing.csv");
        Files.writeString(csv, HEADER
            + "gpt-4o,gpt-4o-2024-08-06,2.5,1.25,10.0\n"
            + "gpt-4o-mini,gpt-4o-mini-2024-07-18,0.15,0.075,0.6\n");

        Map<String, PriceEntry> entries = loader.load(new FileSystemResource(csv));

        assertEquals(4, entries.size());
        assertEquals(entries.get("gpt-4o"), entries.get("gpt-4o-2024-08-06"));
        assertEquals("gpt-4o", entries.get("gpt-4o-2024-08-06").getModel());
        assertEquals(2.5, entries.get("gpt-4o").getInputRate());
        assertEquals(1.25, entries.get("gpt-4o").getCachedInputRate());
        assertEquals(10.0, entries.get("gpt-4o").getOutputRate());
    }

    @Test
    void shouldDefaultEmptyCachedInputToZero() throws Exception {
        Map<String, PriceEntry> entries = loader.parse(new StringReader(HEADER
            + "gpt-4o,gpt-4o-2024-08-06,2.5,,10.0\n"));

        assertEquals(2, entries.size());
        assertEquals(0.0, entries.get("gpt-4o").getCachedInputRate());
    }

    @Test
    void shouldDefaultUnparsableCachedInputToZero() throws Exception {
        Map<String, PriceEntry> entries = loader.parse(new StringReader(HEADER
            + "gpt-4o,gpt-4o-2024-08-06,2.5,n/a,10.0\n"));

        assertEquals(2, entries.size());
        assertEquals(0.0, entries.get("gpt-4o").getCachedInputRate());
    }

    @Test
    void shouldNotDuplicateWhenVersionMatchesOrIsEmpty() throws Exception {
        Map<String, PriceEntry> entries = loader.parse(new StringReader(HEADER
            + "gpt-4-1106-preview,gpt-4-1106-preview,10.0,,30.0\n"
            + "o3,,2.0,0.5,8.0\n"));

        assertEquals(2, entries.size());
        assertTrue(entries.containsKey("gpt-4-1106-preview"));
        assertTrue(entries.containsKey("o3"));
    }

    @Test
    void shouldSkipRowWithInvalidInputPrice() throws Exception {
        Map<String, PriceEntry> entries = loader.parse(new StringReader(HEADER
            + "gpt-4o,gpt-4o-2024-08-06,invalid,1.25,10.0\n"));

        assertTrue(entries.isEmpty());
    }

    @Test
    void shouldSkipRowWithInvalidOutputPriceButKeepOthers() throws Exception {
        Map<String, PriceEntry> entries = loader.parse(new StringReader(HEADER
            + "gpt-4o,gpt-4o-2024-08-06,2.5,1.25,ten\n"
            + "gpt-4o-mini,gpt-4o-mini-2024-07-18,0.15,0.075,0.6\n"));

        assertEquals(2, entries.size());
        assertFalse(entries.containsKey("gpt-4o"));
        assertTrue(entries.containsKey("gpt-4o-mini"));
    }

    @Test
    void shouldSkipNegativePrices() throws Exception {
        Map<String, PriceEntry> entries = loader.parse(new StringReader(HEADER
            + "gpt-4o,gpt-4o-2024-08-06,-2.5,1.25,10.0\n"));

        assertTrue(entries.isEmpty());
    }

    @Test
    void shouldSkipIncompleteRow() throws Exception {
        Map<String, PriceEntry> entries = loader.parse(new StringReader(HEADER
            + "gpt-4o,gpt-4o-2024-08-06\n"));

        assertTrue(entries.isEmpty());
    }

    @Test
    void shouldFailWhenOnlyHeaderPresent() {
        assertThrows(PriceCatalogLoadException.class, () -> loader.parse(new StringReader(HEADER)));
    }

    @Test
    void shouldFailOnEmptySource() {
        assertThrows(PriceCatalogLoadException.class, () -> loader.parse(new StringReader("")));
    }

    @Test
    void shouldFailWhenFileDoesNotExist() {
        FileSystemResource missing = new FileSystemResource(tempDir.resolve("missing.csv"));

        PriceCatalogLoadException e = assertThrows(PriceCatalogLoadException.class, () -> loader.load(missing));
        assertTrue(e.getMessage().contains("cannot open pricing file"));
    }

    @Test
    void shouldRejectUnparsableRates() {
        assertEquals(2.5, PriceCatalogLoader.parseRate("2.5"));
        assertEquals(0.0, PriceCatalogLoader.parseRate("0"));
        assertEquals(10.123456, PriceCatalogLoader.parseRate("10.123456"));
        assertNull(PriceCatalogLoader.parseRate(""));
        assertNull(PriceCatalogLoader.parseRate("invalid"));
        assertNull(PriceCatalogLoader.parseRate("NaN"));
        assertNull(PriceCatalogLoader.parseRate("-1"));
    }
}
