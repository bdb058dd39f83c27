package com.intelplatform.orchestrator.provider;

import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.ProviderConfig;
import com.intelplatform.common.model.ProviderType;
import com.intelplatform.common.payload.IntelPayload;
import com.intelplatform.common.payload.KeywordRanking;
import com.intelplatform.common.payload.PlatformAudience;
import com.intelplatform.common.payload.PlatformRating;
import com.intelplatform.common.payload.PricingData;
import com.intelplatform.common.payload.ProductPrice;
import com.intelplatform.common.payload.ReviewData;
import com.intelplatform.common.payload.SeoData;
import com.intelplatform.common.payload.Sentiment;
import com.intelplatform.common.payload.SerpData;
import com.intelplatform.common.payload.SocialData;
import com.intelplatform.common.payload.TrafficData;
import com.intelplatform.common.payload.TrafficSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Synthetic provider: answers after 500-2000 ms with plausible random data for the
 * provider's primary category, probes answer after 100-300 ms.
 *
 * <p>Active only when Spring profile {@code simulated} is set.
 * {@code @Primary} ensures it wins over the live {@link HttpProviderClient} bean.
 */
@Service
@Primary
@Profile("simulated")
public class SimulatedProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedProviderClient.class);

    @Override
    public Mono<IntelPayload> fetch(ProviderConfig provider, IntelRequest request) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        Duration latency = Duration.ofMillis(random.nextLong(500, 2001));
        ProviderType primary = provider.types().isEmpty() ? ProviderType.SEO : provider.types().get(0);
        return Mono.delay(latency)
            .map(tick -> synthesize(primary, request))
            .doOnNext(payload -> log.debug("[Simulated] provider={} type={} latencyMs={}",
                provider.id(), primary.wireName(), latency.toMillis()));
    }

    @Override
    public Mono<Void> healthCheck(ProviderConfig provider) {
        return Mono.delay(Duration.ofMillis(ThreadLocalRandom.current().nextLong(100, 301))).then();
    }

    IntelPayload synthesize(ProviderType type, IntelRequest request) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return switch (type) {
            case SEO -> IntelPayload.ofSeo(new SeoData(
                random.nextInt(1, 101),
                random.nextLong(0, 1_000_000),
                random.nextLong(0, 10_000),
                random.nextLong(0, 100_000),
                keywords(request, random)));
            case TRAFFIC -> IntelPayload.ofTraffic(new TrafficData(
                random.nextLong(0, 10_000_000),
                random.nextDouble(),
                random.nextDouble(0, 600),
                random.nextDouble(1, 11),
                new TrafficSources(random.nextDouble(), random.nextDouble(), random.nextDouble(),
                    random.nextDouble(), random.nextDouble())));
            case PRICING -> IntelPayload.ofPricing(new PricingData(products(random), null));
            case SERP -> IntelPayload.ofSerp(new SerpData(
                random.nextInt(1, 101),
                "https://" + request.target(),
                request.target(),
                "Results for " + request.target(),
                random.nextBoolean(),
                random.nextBoolean(),
                random.nextInt(0, 5),
                random.nextInt(0, 4)));
            case SOCIAL -> IntelPayload.ofSocial(new SocialData(
                Map.of("twitter", new PlatformAudience(random.nextLong(0, 1_000_000), random.nextDouble(0, 10)),
                       "linkedin", new PlatformAudience(random.nextLong(0, 500_000), random.nextDouble(0, 10))),
                random.nextLong(0, 50_000),
                Sentiment.values()[random.nextInt(Sentiment.values().length)]));
            case REVIEWS -> IntelPayload.ofReviews(new ReviewData(
                Math.round(random.nextDouble(1, 5) * 10) / 10.0,
                random.nextLong(0, 20_000),
                Map.of("trustpilot", new PlatformRating(Math.round(random.nextDouble(1, 5) * 10) / 10.0,
                    random.nextLong(0, 10_000))),
                Sentiment.values()[random.nextInt(Sentiment.values().length)]));
        };
    }

    private static List<KeywordRanking> keywords(IntelRequest request, ThreadLocalRandom random) {
        List<String> source = request.keywords().isEmpty()
            ? List.of("keyword1", "keyword2", "keyword3", "keyword4", "keyword5")
            : request.keywords();
        List<KeywordRanking> rankings = new ArrayList<>();
        for (String keyword : source) {
            rankings.add(new KeywordRanking(keyword, random.nextInt(1, 101),
                random.nextLong(0, 100_000), random.nextInt(0, 101)));
        }
        return rankings;
    }

    private static List<ProductPrice> products(ThreadLocalRandom random) {
        List<ProductPrice> products = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            products.add(new ProductPrice("Product " + i,
                Math.round(random.nextDouble(10, 1010) * 100) / 100.0,
                "USD", random.nextBoolean(), System.currentTimeMillis()));
        }
        return products;
    }
}
