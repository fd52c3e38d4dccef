package com.proxylens.detection;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.proxylens.detection.rules.BurstFromSingleIpRule;
import com.proxylens.detection.rules.C2BeaconingRule;
import com.proxylens.detection.rules.EndpointCompromiseMultiCategoryRule;
import com.proxylens.detection.rules.OffHoursAccessRule;
import com.proxylens.detection.rules.PhishToPayloadChainRule;
import com.proxylens.detection.rules.RepeatedBlockedThreatCategoryRule;
import com.proxylens.detection.rules.SingleUserManyDestinationsRule;
import com.proxylens.detection.rules.ThreatCategories;
import com.proxylens.detection.rules.ThreatCategorySpikeRule;
import com.proxylens.detection.rules.TopBlockedDestHostRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Set;

/**
 * Builds the rule registry from {@code proxylens.detection.*} thresholds.
 */
@Configuration
public class DetectionConfig {

    private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

    @Value("${proxylens.detection.burst.threshold:200}")
    private long burstThreshold;

    @Value("${proxylens.detection.off-hours.start-hour:7}")
    private int offHoursStart;

    @Value("${proxylens.detection.off-hours.end-hour:20}")
    private int offHoursEnd;

    @Value("${proxylens.detection.off-hours.zone:UTC}")
    private String offHoursZone;

    @Value("${proxylens.detection.off-hours.min-sample:20}")
    private int offHoursMinSample;

    @Value("${proxylens.detection.off-hours.min-off-hours-events:5}")
    private int offHoursMinEvents;

    @Value("${proxylens.detection.off-hours.min-on-hours-ratio:0.6}")
    private double offHoursMinOnRatio;

    @Value("${proxylens.detection.many-destinations.window-minutes:10}")
    private long manyDestinationsWindow;

    @Value("${proxylens.detection.many-destinations.threshold:25}")
    private int manyDestinationsThreshold;

    @Value("${proxylens.detection.category-spike.high-risk-categories:}")
    private String highRiskCategories;

    @Value("${proxylens.detection.category-spike.high-risk-min:3}")
    private int highRiskMin;

    @Value("${proxylens.detection.category-spike.high-risk-ratio:0.005}")
    private double highRiskRatio;

    @Value("${proxylens.detection.category-spike.normal-min:50}")
    private int normalMin;

    @Value("${proxylens.detection.category-spike.normal-ratio:0.05}")
    private double normalRatio;

    @Value("${proxylens.detection.repeated-blocked.threshold:25}")
    private int repeatedBlockedThreshold;

    @Value("${proxylens.detection.top-blocked-host.threshold:15}")
    private int topBlockedHostThreshold;

    @Value("${proxylens.detection.multi-category.min-categories:3}")
    private int multiCategoryMinCategories;

    @Value("${proxylens.detection.multi-category.min-blocked:12}")
    private int multiCategoryMinBlocked;

    @Value("${proxylens.detection.multi-category.critical-blocked:40}")
    private int multiCategoryCriticalBlocked;

    @Value("${proxylens.detection.c2-beaconing.min-minutes:4}")
    private int c2MinMinutes;

    @Value("${proxylens.detection.c2-beaconing.min-hits:8}")
    private int c2MinHits;

    @Value("${proxylens.detection.phish-chain.min-phish:2}")
    private int phishChainMinPhish;

    @Value("${proxylens.detection.phish-chain.min-payload:2}")
    private int phishChainMinPayload;

    @Value("${proxylens.detection.phish-chain.window-minutes:30}")
    private long phishChainWindow;

    @Bean
    public RuleRegistry ruleRegistry() {
        RuleRegistry registry = new RuleRegistry(ImmutableList.of(
            new BurstFromSingleIpRule(burstThreshold),
            new OffHoursAccessRule(offHoursStart, offHoursEnd, ZoneId.of(offHoursZone),
                offHoursMinSample, offHoursMinEvents, offHoursMinOnRatio),
            new SingleUserManyDestinationsRule(Duration.ofMinutes(manyDestinationsWindow), manyDestinationsThreshold),
            new ThreatCategorySpikeRule(parseCategories(highRiskCategories),
                highRiskMin, highRiskRatio, normalMin, normalRatio),
            new RepeatedBlockedThreatCategoryRule(repeatedBlockedThreshold),
            new TopBlockedDestHostRule(topBlockedHostThreshold),
            new EndpointCompromiseMultiCategoryRule(multiCategoryMinCategories, multiCategoryMinBlocked,
                multiCategoryCriticalBlocked),
            new C2BeaconingRule(c2MinMinutes, c2MinHits),
            new PhishToPayloadChainRule(phishChainMinPhish, phishChainMinPayload,
                Duration.ofMinutes(phishChainWindow))));

        log.info("Registered {} detection rules", registry.size());
        return registry;
    }

    /**
     * Comma-separated categories; blank falls back to the built-in high-risk set
     */
    static Set<String> parseCategories(String csv) {
        if (csv == null || csv.isBlank()) {
            return ThreatCategories.DEFAULT_HIGH_RISK;
        }
        return ImmutableSet.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(csv));
    }
}
