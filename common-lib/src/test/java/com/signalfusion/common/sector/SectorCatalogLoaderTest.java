package com.signalfusion.common.sector;

import com.signalfusion.common.exception.FusionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SectorCatalogLoaderTest {

    private final SectorCatalogLoader loader = new SectorCatalogLoader();

    @Test
    @DisplayName("default catalog holds the eleven sectors and four boost patterns")
    void defaultCatalog() {
        SectorCatalog catalog = loader.loadDefault();

        assertEquals(11, catalog.size());
        assertEquals(4, catalog.patterns().size());
        assertEquals("technology", catalog.profiles().get(0).sectorId());
        assertEquals("XLK", catalog.etfTicker("technology"));
        assertEquals("XLRE", catalog.etfTicker("real_estate"));
        assertEquals("N/A", catalog.etfTicker("general_market"));
        assertTrue(catalog.profile("utilities").orElseThrow().hasTicker("nee"));
        assertNotNull(catalog.version());
    }

    @Test
    @DisplayName("file-system location overrides the bundled catalog")
    void fileLocation(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("catalog.json");
        Files.writeString(file, """
            {
              "version": "fixture-1",
              "sectors": [
                {"sectorId": "alpha", "etfTicker": "AAA", "tickers": ["ab"], "keywords": ["Widget"]}
              ],
              "patterns": {"alpha": "\\\\bwidgets?\\\\b"}
            }
            """);

        SectorCatalog catalog = loader.load(file.toString());

        assertEquals("fixture-1", catalog.version());
        SectorProfile alpha = catalog.profile("alpha").orElseThrow();
        assertEquals(List.of("AB"), alpha.tickers());
        assertEquals(List.of("widget"), alpha.keywords());
        assertTrue(catalog.patterns().get("alpha").matcher("WIDGETS").find());
    }

    @Test
    @DisplayName("missing resource, malformed JSON and bad patterns fail fast")
    void invalidCatalogs(@TempDir Path dir) throws IOException {
        assertThrows(FusionException.class, () -> loader.load("classpath:no-such-catalog.json"));

        Path malformed = dir.resolve("malformed.json");
        Files.writeString(malformed, "{ \"sectors\": [ {\"sectorId\": ");
        assertThrows(FusionException.class, () -> loader.load(malformed.toString()));

        Path badPattern = dir.resolve("bad-pattern.json");
        Files.writeString(badPattern,
            "{\"sectors\":[{\"sectorId\":\"a\",\"keywords\":[\"x\"]}],\"patterns\":{\"a\":\"(unclosed\"}}");
        assertThrows(FusionException.class, () -> loader.load(badPattern.toString()));

        Path duplicate = dir.resolve("duplicate.json");
        Files.writeString(duplicate, "{\"sectors\":[{\"sectorId\":\"a\"},{\"sectorId\":\"a\"}]}");
        assertThrows(FusionException.class, () -> loader.load(duplicate.toString()));
    }
}
