package com.intelplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PricingData(
    @JsonProperty("products") List<ProductPrice> products,
    @JsonProperty("priceRange") PriceRange priceRange
) {
    @JsonIgnore
    public boolean hasSignature() {
        return products != null || priceRange != null;
    }
}
