package com.workforce.core.company;

import com.fasterxml.jackson.databind.JsonNode;
import com.workforce.core.registry.AgentRegistry;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A loaded company: identity, brand context, reference data and agent hierarchy.
 * Immutable once loaded; passed explicitly into every session of that company.
 *
 * @param id             company id (file name without extension)
 * @param name           display name
 * @param mission        mission statement
 * @param brandVoice     brand voice guidance
 * @param targetAudience who the company addresses
 * @param philosophy     company philosophy
 * @param products       product names
 * @param info           the raw {@code company} section, served as-is by the API
 * @param referenceData  reference sections keyed by name ({@code market_research}, {@code seo_data}, ...)
 * @param registry       agent hierarchy
 */
public record CompanyProfile(
    String id,
    String name,
    String mission,
    String brandVoice,
    String targetAudience,
    String philosophy,
    List<String> products,
    JsonNode info,
    Map<String, JsonNode> referenceData,
    AgentRegistry registry
) {

    public static final String MARKET_RESEARCH = "market_research";
    public static final String SEO_DATA = "seo_data";
    public static final String BRAND_ASSETS = "brand_assets";
    public static final String CONTENT_TEMPLATES = "content_templates";
    public static final String ANALYTICS = "analytics";

    public CompanyProfile {
        products = products != null ? List.copyOf(products) : List.of();
        referenceData = referenceData != null ? Map.copyOf(referenceData) : Map.of();
    }

    /**
     * A reference section, present only if the company file has a non-empty one.
     */
    public Optional<JsonNode> reference(String section) {
        JsonNode node = referenceData.get(section);
        if (node == null || node.isNull() || node.isMissingNode() || (node.isContainerNode() && node.isEmpty())) {
            return Optional.empty();
        }
        return Optional.of(node);
    }
}
