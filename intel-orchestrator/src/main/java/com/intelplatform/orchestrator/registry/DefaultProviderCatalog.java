package com.intelplatform.orchestrator.registry;

import com.intelplatform.common.model.HealthCheckSpec;
import com.intelplatform.common.model.ProviderConfig;
import com.intelplatform.common.model.ProviderType;
import com.intelplatform.common.model.RateLimitBudget;
import com.intelplatform.common.model.RetryPolicy;

import java.util.List;

/**
 * Built-in provider descriptors registered at startup when
 * {@code intel.providers.register-defaults} is on.
 */
public final class DefaultProviderCatalog {

    private DefaultProviderCatalog() {}

    public static List<ProviderConfig> providers() {
        return List.of(
            provider("ahrefs", "Ahrefs", List.of(ProviderType.SEO),
                "https://apiv2.ahrefs.com",
                new RateLimitBudget(60, 3600, 50_000), new RetryPolicy(3, 1000, true),
                new HealthCheckSpec("/subscription", 300_000),
                List.of("domain_rating", "backlinks", "organic_keywords", "top_pages")),
            provider("semrush", "SEMrush", List.of(ProviderType.SEO, ProviderType.SERP),
                "https://api.semrush.com",
                new RateLimitBudget(120, 7200, 100_000), new RetryPolicy(3, 500, true),
                new HealthCheckSpec("/units", 300_000),
                List.of("domain_overview", "backlinks", "keywords", "serp_results")),
            provider("similarweb", "SimilarWeb", List.of(ProviderType.TRAFFIC),
                "https://api.similarweb.com/v1",
                new RateLimitBudget(600, 36_000, 500_000), new RetryPolicy(3, 2000, true),
                new HealthCheckSpec("/capabilities", 600_000),
                List.of("total_traffic", "traffic_sources", "engagement", "demographics")),
            provider("serpapi", "SerpApi", List.of(ProviderType.SERP),
                "https://serpapi.com",
                new RateLimitBudget(60, 3600, 50_000), new RetryPolicy(3, 1000, true),
                new HealthCheckSpec("/account", 300_000),
                List.of("google_search", "google_shopping", "bing_search")),
            provider("brandwatch", "Brandwatch", List.of(ProviderType.SOCIAL),
                "https://api.brandwatch.com",
                new RateLimitBudget(300, 18_000, 200_000), new RetryPolicy(3, 1500, true),
                new HealthCheckSpec("/projects", 600_000),
                List.of("mentions", "sentiment", "influencers", "demographics")),
            provider("trustpilot", "Trustpilot", List.of(ProviderType.REVIEWS),
                "https://api.trustpilot.com/v1",
                new RateLimitBudget(120, 7200, 100_000), new RetryPolicy(3, 1000, true),
                new HealthCheckSpec("/business-units", 300_000),
                List.of("business_units", "reviews", "product_reviews")),
            provider("price2spy", "Price2Spy", List.of(ProviderType.PRICING),
                "https://api.price2spy.com",
                new RateLimitBudget(60, 3600, 50_000), new RetryPolicy(3, 2000, true),
                new HealthCheckSpec("/account", 600_000),
                List.of("product_prices", "price_history", "competitor_products"))
        );
    }

    private static ProviderConfig provider(String id, String name, List<ProviderType> types, String baseUrl,
                                           RateLimitBudget budget, RetryPolicy retry,
                                           HealthCheckSpec healthCheck, List<String> operations) {
        return new ProviderConfig(id, name, types, baseUrl, budget, retry, healthCheck, operations);
    }
}
