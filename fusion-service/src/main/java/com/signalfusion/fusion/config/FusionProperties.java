package com.signalfusion.fusion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables of the fusion pipeline, bound from {@code fusion.*}.
 *
 * <p>Label thresholds are kept per fuser ({@code category.label-threshold},
 * {@code combined.label-threshold}, {@code channels.strong-threshold} /
 * {@code channels.weak-threshold}) and are never shared between them.
 */
@Configuration
@ConfigurationProperties(prefix = "fusion")
@Data
@Validated
public class FusionProperties {

    @Valid private Recency recency = new Recency();
    @Valid private Relevance relevance = new Relevance();
    @Valid private Blend blend = new Blend();
    @Valid private Category category = new Category();
    @Valid private Combined combined = new Combined();
    @Valid private Channels channels = new Channels();
    @Valid private Ranking ranking = new Ranking();
    @Valid private Allocation allocation = new Allocation();
    @Valid private Gateway gateway = new Gateway();
    @Valid private Inference inference = new Inference();
    @Valid private SectorCatalog sectorCatalog = new SectorCatalog();

    @Data
    public static class Recency {
        @Positive
        private double decayHours = 24.0;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double minWeight = 0.1;
    }

    @Data
    public static class Relevance {
        @Positive
        private double densityFactor = 0.1;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double threshold = 0.2;
    }

    @Data
    public static class Blend {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double financialFinanceShare = 0.8;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double nonFinancialFinanceShare = 0.4;
    }

    @Data
    public static class Category {
        @PositiveOrZero
        private double labelThreshold = 0.1;
    }

    @Data
    public static class Combined {
        @Positive
        private double generalWeight = 0.4;

        @Positive
        private double specificWeight = 0.6;

        @PositiveOrZero
        private double confidenceFactor = 0.2;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double financialRatio = 0.7;

        @Positive
        private double financialBoost = 1.1;

        @PositiveOrZero
        private double labelThreshold = 0.12;

        /** Free-text scope sent to the gateway when collecting general market news. */
        @NotBlank
        private String generalMarketQuery = "stock market";
    }

    @Data
    public static class Channels {
        @PositiveOrZero
        private double newsWeight = 0.4;

        @PositiveOrZero
        private double forumWeight = 0.3;

        @PositiveOrZero
        private double microblogWeight = 0.3;

        @PositiveOrZero
        private double strongThreshold = 0.2;

        @PositiveOrZero
        private double weakThreshold = 0.05;

        @Positive
        private double postWeight = 2.0;
    }

    @Data
    public static class Ranking {
        @Min(1)
        private int minItemCount = 2;

        @PositiveOrZero
        private double tierThreshold = 0.1;
    }

    @Data
    public static class Allocation {
        @PositiveOrZero
        private double commissionPerTrade = 10.0;

        @NotBlank
        private String defaultRiskTolerance = "moderate";

        @Positive
        private double defaultPortfolioSize = 10_000.0;

        @Min(1)
        private int defaultMaxSectors = 3;

        @Min(1)
        private int defaultStocksPerSector = 2;
    }

    @Data
    public static class Gateway {
        @NotBlank
        private String baseUrl = "http://localhost:8090";

        @Positive
        private int connectTimeoutMillis = 10_000;

        @Positive
        private int responseTimeoutSeconds = 15;

        @Min(1)
        private int itemLimit = 50;
    }

    @Data
    public static class Inference {
        @NotBlank
        private String baseUrl = "http://localhost:8091";

        @Positive
        private int connectTimeoutMillis = 5_000;

        @Positive
        private int responseTimeoutSeconds = 10;

        /** Upper bound on items scored concurrently per request. */
        @Min(1)
        private int concurrency = 8;
    }

    @Data
    public static class SectorCatalog {
        @NotBlank
        private String location = "classpath:sector-catalog.json";
    }
}
