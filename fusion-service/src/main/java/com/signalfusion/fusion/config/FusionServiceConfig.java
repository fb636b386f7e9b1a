package com.signalfusion.fusion.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalfusion.common.aggregation.CategoryAggregator;
import com.signalfusion.common.aggregation.ChannelAggregator;
import com.signalfusion.common.allocation.ExecutionPlanner;
import com.signalfusion.common.allocation.PortfolioAllocator;
import com.signalfusion.common.allocation.PortfolioPlanner;
import com.signalfusion.common.allocation.RiskAssessor;
import com.signalfusion.common.economic.EconomicContextAssessor;
import com.signalfusion.common.fusion.CombinedSentimentFuser;
import com.signalfusion.common.fusion.MultiChannelFuser;
import com.signalfusion.common.model.CategoryLabel;
import com.signalfusion.common.model.Channel;
import com.signalfusion.common.scoring.AdaptiveBlender;
import com.signalfusion.common.scoring.ItemAnalyzer;
import com.signalfusion.common.scoring.RecencyWeighter;
import com.signalfusion.common.scoring.RelevanceClassifier;
import com.signalfusion.common.scoring.SentimentCapability;
import com.signalfusion.common.sector.SectorCatalog;
import com.signalfusion.common.sector.SectorCatalogLoader;
import com.signalfusion.common.sector.SectorClassifier;
import com.signalfusion.common.sector.SectorRanker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the pure common-lib engines as beans. Every engine is immutable, so one
 * instance serves all requests.
 */
@Configuration
public class FusionServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        // derived read-only properties (financialRatio, overweight, ...) are echoed back by clients
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    public RecencyWeighter recencyWeighter(FusionProperties properties, Clock clock) {
        FusionProperties.Recency recency = properties.getRecency();
        return new RecencyWeighter(recency.getDecayHours(), recency.getMinWeight(), clock);
    }

    @Bean
    public RelevanceClassifier relevanceClassifier(FusionProperties properties) {
        FusionProperties.Relevance relevance = properties.getRelevance();
        return new RelevanceClassifier(relevance.getDensityFactor(), relevance.getThreshold());
    }

    @Bean
    public AdaptiveBlender adaptiveBlender(FusionProperties properties) {
        FusionProperties.Blend blend = properties.getBlend();
        return new AdaptiveBlender(blend.getFinancialFinanceShare(), blend.getNonFinancialFinanceShare());
    }

    @Bean
    public ItemAnalyzer itemAnalyzer(SentimentCapability sentimentCapability,
                                     RelevanceClassifier relevanceClassifier,
                                     RecencyWeighter recencyWeighter,
                                     AdaptiveBlender adaptiveBlender,
                                     Clock clock) {
        return new ItemAnalyzer(sentimentCapability, relevanceClassifier, recencyWeighter, adaptiveBlender, clock);
    }

    @Bean
    public CategoryAggregator categoryAggregator(FusionProperties properties) {
        return new CategoryAggregator(properties.getCategory().getLabelThreshold());
    }

    @Bean
    public ChannelAggregator channelAggregator(FusionProperties properties) {
        return new ChannelAggregator(properties.getChannels().getPostWeight());
    }

    @Bean
    public CombinedSentimentFuser combinedSentimentFuser(FusionProperties properties) {
        FusionProperties.Combined combined = properties.getCombined();
        Map<CategoryLabel, Double> baseWeights = new EnumMap<>(CategoryLabel.class);
        baseWeights.put(CategoryLabel.GENERAL_MARKET, combined.getGeneralWeight());
        baseWeights.put(CategoryLabel.STOCK_SPECIFIC, combined.getSpecificWeight());
        return new CombinedSentimentFuser(baseWeights,
            combined.getConfidenceFactor(),
            combined.getFinancialRatio(),
            combined.getFinancialBoost(),
            combined.getLabelThreshold());
    }

    @Bean
    public MultiChannelFuser multiChannelFuser(FusionProperties properties) {
        FusionProperties.Channels channels = properties.getChannels();
        Map<Channel, Double> baseWeights = new EnumMap<>(Channel.class);
        baseWeights.put(Channel.NEWS, channels.getNewsWeight());
        baseWeights.put(Channel.SOCIAL_FORUM, channels.getForumWeight());
        baseWeights.put(Channel.MICROBLOG, channels.getMicroblogWeight());
        return new MultiChannelFuser(baseWeights, channels.getStrongThreshold(), channels.getWeakThreshold());
    }

    @Bean
    public SectorCatalog sectorCatalog(FusionProperties properties, ObjectMapper objectMapper) {
        return new SectorCatalogLoader(objectMapper).load(properties.getSectorCatalog().getLocation());
    }

    @Bean
    public SectorClassifier sectorClassifier(SectorCatalog sectorCatalog) {
        return new SectorClassifier(sectorCatalog);
    }

    @Bean
    public SectorRanker sectorRanker(SectorCatalog sectorCatalog, FusionProperties properties) {
        FusionProperties.Ranking ranking = properties.getRanking();
        return new SectorRanker(sectorCatalog, ranking.getMinItemCount(), ranking.getTierThreshold());
    }

    @Bean
    public PortfolioPlanner portfolioPlanner(FusionProperties properties) {
        return new PortfolioPlanner(
            new PortfolioAllocator(),
            new RiskAssessor(),
            new ExecutionPlanner(properties.getAllocation().getCommissionPerTrade()));
    }

    @Bean
    public EconomicContextAssessor economicContextAssessor() {
        return new EconomicContextAssessor();
    }
}
