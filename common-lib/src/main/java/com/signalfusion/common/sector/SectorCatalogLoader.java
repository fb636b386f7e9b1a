package com.signalfusion.common.sector;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalfusion.common.exception.FusionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads a versioned {@link SectorCatalog} from JSON.
 *
 * <p>Locations prefixed with {@code classpath:} are resolved against the class loader;
 * anything else is treated as a file-system path. A missing or malformed catalog is a
 * startup error ({@link FusionException}).
 */
public final class SectorCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(SectorCatalogLoader.class);

    public static final String DEFAULT_LOCATION = "classpath:sector-catalog.json";
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final ObjectMapper objectMapper;

    public SectorCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public SectorCatalogLoader() {
        this(new ObjectMapper());
    }

    public SectorCatalog loadDefault() {
        return load(DEFAULT_LOCATION);
    }

    public SectorCatalog load(String location) {
        String target = (location == null || location.isBlank()) ? DEFAULT_LOCATION : location.trim();
        try (InputStream in = open(target)) {
            CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
            SectorCatalog catalog = new SectorCatalog(document.version(), document.sectors(), document.patterns());
            log.info("[SectorCatalog] Loaded location={} version={} sectors={} patterns={}",
                target, catalog.version(), catalog.size(), catalog.patterns().size());
            return catalog;
        } catch (IOException e) {
            throw FusionException.invalidConfiguration("SectorCatalogLoader", "cannot read sector catalog " + target, e);
        } catch (IllegalArgumentException e) {
            throw FusionException.invalidConfiguration("SectorCatalogLoader", "malformed sector catalog " + target, e);
        }
    }

    private InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) resource = resource.substring(1);
            InputStream in = SectorCatalogLoader.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("classpath resource not found: " + resource);
            }
            return in;
        }
        return Files.newInputStream(Path.of(location));
    }

    record CatalogDocument(
        @JsonProperty("version") String version,
        @JsonProperty("sectors") List<SectorProfile> sectors,
        @JsonProperty("patterns") Map<String, String> patterns
    ) {}
}
