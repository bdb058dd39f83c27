package com.intelplatform.common.normalize;

import com.intelplatform.common.model.Freshness;
import com.intelplatform.common.model.IntelRequest;
import com.intelplatform.common.model.NormalizedResult;
import com.intelplatform.common.model.ProviderResponse;
import com.intelplatform.common.model.ResultMetadata;
import com.intelplatform.common.payload.IntelPayload;
import com.intelplatform.common.payload.KeywordRanking;
import com.intelplatform.common.payload.PlatformAudience;
import com.intelplatform.common.payload.PlatformRating;
import com.intelplatform.common.payload.PriceRange;
import com.intelplatform.common.payload.PricingData;
import com.intelplatform.common.payload.ProductPrice;
import com.intelplatform.common.payload.ReviewData;
import com.intelplatform.common.payload.SeoData;
import com.intelplatform.common.payload.SerpData;
import com.intelplatform.common.payload.Sentiment;
import com.intelplatform.common.payload.SocialData;
import com.intelplatform.common.payload.TrafficData;
import com.intelplatform.common.payload.TrafficSources;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Merges heterogeneous provider payloads into one {@link NormalizedResult}.
 *
 * <p>Only {@code success=true} responses contribute data. Each category has its own
 * conflict policy:
 * <pre>
 *   SEO      domainAuthority/backlinks/referringDomains/organicKeywords → max
 *            topKeywords → concat, dedup by keyword keeping lowest position, sort asc, top 10
 *   Traffic  monthlyVisits → max; bounceRate/avgSessionDuration/pagesPerSession/trafficSources → last seen
 *   Pricing  products → concat (cap 20); priceRange → recomputed from all merged product prices
 *   SERP     position → min; every other field → last non-empty
 *   Social   platforms → shallow merge (later wins); mentions → max; sentiment → last non-empty
 *   Reviews  averageRating → unweighted mean; totalReviews → max; platforms → shallow merge
 * </pre>
 * A category with no contributing response is omitted, never defaulted to zero.
 * {@code completeness = successful / total}, failed responses included in the denominator.
 */
public class ResultNormalizer {

    static final int MAX_TOP_KEYWORDS = 10;
    static final int MAX_PRODUCTS     = 20;
    static final String DEFAULT_CURRENCY = "USD";

    private final Clock clock;

    public ResultNormalizer(Clock clock) {
        this.clock = clock;
    }

    public NormalizedResult normalize(List<ProviderResponse> responses, IntelRequest request) {
        List<IntelPayload> payloads = responses.stream()
            .filter(ProviderResponse::success)
            .map(ProviderResponse::data)
            .filter(Objects::nonNull)
            .toList();
        long successful = responses.stream().filter(ProviderResponse::success).count();
        List<String> providerIds = responses.stream().map(ProviderResponse::providerId).toList();

        IntelPayload merged = new IntelPayload(
            mergeSeo(sections(payloads, IntelPayload::seo, SeoData::hasSignature)),
            mergeTraffic(sections(payloads, IntelPayload::traffic, TrafficData::hasSignature)),
            mergePricing(sections(payloads, IntelPayload::pricing, PricingData::hasSignature)),
            mergeSerp(sections(payloads, IntelPayload::serp, SerpData::hasSignature)),
            mergeSocial(sections(payloads, IntelPayload::social, SocialData::hasSignature)),
            mergeReviews(sections(payloads, IntelPayload::reviews, ReviewData::hasSignature)));

        double completeness = responses.isEmpty() ? 0.0 : (double) successful / responses.size();
        return new NormalizedResult(request.type(), request.target(), merged,
            new ResultMetadata(providerIds, clock.millis(), Freshness.FRESH, completeness));
    }

    // ── SEO ──────────────────────────────────────────────────────────────────

    SeoData mergeSeo(List<SeoData> sections) {
        if (sections.isEmpty()) return null;

        Integer domainAuthority = null;
        Long backlinks = null;
        Long referringDomains = null;
        Long organicKeywords = null;
        List<KeywordRanking> keywords = null;

        for (SeoData seo : sections) {
            if (seo.domainAuthority() != null) {
                domainAuthority = Math.max(domainAuthority == null ? 0 : domainAuthority, seo.domainAuthority());
            }
            backlinks        = maxOf(backlinks, seo.backlinks());
            referringDomains = maxOf(referringDomains, seo.referringDomains());
            organicKeywords  = maxOf(organicKeywords, seo.organicKeywords());
            if (seo.topKeywords() != null) {
                if (keywords == null) keywords = new ArrayList<>();
                keywords.addAll(seo.topKeywords());
            }
        }

        SeoData merged = new SeoData(domainAuthority, backlinks, referringDomains, organicKeywords,
            keywords == null ? null : bestRankings(keywords));
        return isBlank(merged.domainAuthority(), merged.backlinks(), merged.referringDomains(),
            merged.organicKeywords(), merged.topKeywords()) ? null : merged;
    }

    /** One entry per keyword text, the first lowest position wins; ascending by position, top 10. */
    static List<KeywordRanking> bestRankings(List<KeywordRanking> keywords) {
        Map<String, KeywordRanking> best = new LinkedHashMap<>();
        for (KeywordRanking ranking : keywords) {
            if (ranking == null || ranking.keyword() == null) continue;
            KeywordRanking current = best.get(ranking.keyword());
            if (current == null || current.position() > ranking.position()) {
                best.put(ranking.keyword(), ranking);
            }
        }
        return best.values().stream()
            .sorted(Comparator.comparingInt(KeywordRanking::position))
            .limit(MAX_TOP_KEYWORDS)
            .toList();
    }

    // ── Traffic ──────────────────────────────────────────────────────────────

    TrafficData mergeTraffic(List<TrafficData> sections) {
        if (sections.isEmpty()) return null;

        Long monthlyVisits = null;
        Double bounceRate = null;
        Double avgSessionDuration = null;
        Double pagesPerSession = null;
        TrafficSources sources = null;

        for (TrafficData traffic : sections) {
            monthlyVisits = maxOf(monthlyVisits, traffic.monthlyVisits());
            if (traffic.bounceRate() != null) bounceRate = traffic.bounceRate();
            if (traffic.avgSessionDuration() != null) avgSessionDuration = traffic.avgSessionDuration();
            if (traffic.pagesPerSession() != null) pagesPerSession = traffic.pagesPerSession();
            if (traffic.trafficSources() != null) sources = traffic.trafficSources();
        }

        if (isBlank(monthlyVisits, bounceRate, avgSessionDuration, pagesPerSession, sources)) return null;
        return new TrafficData(monthlyVisits, bounceRate, avgSessionDuration, pagesPerSession, sources);
    }

    // ── Pricing ──────────────────────────────────────────────────────────────

    PricingData mergePricing(List<PricingData> sections) {
        if (sections.isEmpty()) return null;

        List<ProductPrice> all = new ArrayList<>();
        for (PricingData pricing : sections) {
            if (pricing.products() != null) {
                pricing.products().stream().filter(Objects::nonNull).forEach(all::add);
            }
        }
        // A provider-reported priceRange alone never survives: the range is always derived.
        if (all.isEmpty()) return null;

        List<Double> prices = all.stream().map(ProductPrice::price).filter(Objects::nonNull).toList();
        PriceRange range = null;
        if (!prices.isEmpty()) {
            double min = prices.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            double max = prices.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            double avg = prices.stream().mapToDouble(Double::doubleValue).sum() / prices.size();
            String currency = all.get(0).currency() != null ? all.get(0).currency() : DEFAULT_CURRENCY;
            range = new PriceRange(min, max, avg, currency);
        }
        return new PricingData(List.copyOf(all.subList(0, Math.min(MAX_PRODUCTS, all.size()))), range);
    }

    // ── SERP ─────────────────────────────────────────────────────────────────

    SerpData mergeSerp(List<SerpData> sections) {
        if (sections.isEmpty()) return null;

        Integer position = null;
        String url = null;
        String title = null;
        String snippet = null;
        Boolean featuredSnippet = null;
        Boolean localPack = null;
        Integer adsAbove = null;
        Integer adsBelow = null;

        for (SerpData serp : sections) {
            if (serp.position() != null) {
                position = position == null ? serp.position() : Math.min(position, serp.position());
            }
            if (hasText(serp.url())) url = serp.url();
            if (hasText(serp.title())) title = serp.title();
            if (hasText(serp.snippet())) snippet = serp.snippet();
            if (serp.featuredSnippet() != null) featuredSnippet = serp.featuredSnippet();
            if (serp.localPack() != null) localPack = serp.localPack();
            if (serp.adsAbove() != null) adsAbove = serp.adsAbove();
            if (serp.adsBelow() != null) adsBelow = serp.adsBelow();
        }

        if (isBlank(position, url, title, snippet, featuredSnippet, localPack, adsAbove, adsBelow)) return null;
        return new SerpData(position, url, title, snippet, featuredSnippet, localPack, adsAbove, adsBelow);
    }

    // ── Social ───────────────────────────────────────────────────────────────

    SocialData mergeSocial(List<SocialData> sections) {
        if (sections.isEmpty()) return null;

        Map<String, PlatformAudience> platforms = null;
        Long mentions = null;
        Sentiment sentiment = null;

        for (SocialData social : sections) {
            if (social.platforms() != null) {
                if (platforms == null) platforms = new LinkedHashMap<>();
                platforms.putAll(social.platforms());
            }
            mentions = maxOf(mentions, social.mentions());
            if (social.sentiment() != null) sentiment = social.sentiment();
        }

        if (isBlank(platforms, mentions, sentiment)) return null;
        return new SocialData(platforms == null ? null : Collections.unmodifiableMap(platforms), mentions, sentiment);
    }

    // ── Reviews ──────────────────────────────────────────────────────────────

    ReviewData mergeReviews(List<ReviewData> sections) {
        if (sections.isEmpty()) return null;

        List<Double> ratings = new ArrayList<>();
        long totalReviews = 0;
        Map<String, PlatformRating> platforms = null;
        Sentiment sentiment = null;

        for (ReviewData review : sections) {
            if (review.averageRating() != null) ratings.add(review.averageRating());
            if (review.totalReviews() != null) totalReviews = Math.max(totalReviews, review.totalReviews());
            if (review.platforms() != null) {
                if (platforms == null) platforms = new LinkedHashMap<>();
                platforms.putAll(review.platforms());
            }
            if (review.sentiment() != null) sentiment = review.sentiment();
        }

        Double averageRating = ratings.isEmpty() ? null
            : ratings.stream().mapToDouble(Double::doubleValue).sum() / ratings.size();
        Long total = totalReviews > 0 ? totalReviews : null;

        if (isBlank(averageRating, total, platforms, sentiment)) return null;
        return new ReviewData(averageRating, total, platforms == null ? null : Collections.unmodifiableMap(platforms), sentiment);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static <T> List<T> sections(List<IntelPayload> payloads,
                                        Function<IntelPayload, T> accessor,
                                        Predicate<T> signature) {
        return payloads.stream()
            .map(accessor)
            .filter(Objects::nonNull)
            .filter(signature)
            .toList();
    }

    /** {@code max(existing || 0, candidate)}, or the existing value when there is no candidate. */
    private static Long maxOf(Long existing, Long candidate) {
        if (candidate == null) return existing;
        return Math.max(existing == null ? 0L : existing, candidate);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean isBlank(Object... values) {
        for (Object value : values) {
            if (value != null) return false;
        }
        return true;
    }
}
