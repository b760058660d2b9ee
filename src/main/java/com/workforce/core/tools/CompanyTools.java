package com.workforce.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.workforce.core.agent.AgentExecutionException;
import com.workforce.core.company.CompanyProfile;
import org.springframework.ai.tool.annotation.Tool;

import java.util.List;
import java.util.Optional;

/**
 * Reference-data tools bound to one company. Each returns the relevant section as pretty
 * JSON, or a short notice when the company has no such data.
 */
public class CompanyTools {

    public static final String GET_MARKET_RESEARCH = "get_market_research";
    public static final String GET_SEO_DATA = "get_seo_data";
    public static final String GET_BRAND_ASSETS = "get_brand_assets";
    public static final String GET_CONTENT_TEMPLATES = "get_content_templates";
    public static final String GET_ANALYTICS = "get_analytics";

    public static final List<String> ALL = List.of(
            GET_MARKET_RESEARCH, GET_SEO_DATA, GET_BRAND_ASSETS, GET_CONTENT_TEMPLATES, GET_ANALYTICS);

    private final CompanyProfile company;
    private final ObjectMapper objectMapper;

    public CompanyTools(CompanyProfile company, ObjectMapper objectMapper) {
        this.company = company;
        this.objectMapper = objectMapper;
    }

    @Tool(name = GET_MARKET_RESEARCH,
            description = "Get all market research data including trends, competitive analysis and consumer insights. Returns JSON.")
    public String getMarketResearch() {
        return section(CompanyProfile.MARKET_RESEARCH, "No market research data available.");
    }

    @Tool(name = GET_SEO_DATA,
            description = "Get SEO and keyword data including rankings, volumes, difficulty scores and content gaps. Returns JSON.")
    public String getSeoData() {
        return section(CompanyProfile.SEO_DATA, "No SEO data available.");
    }

    @Tool(name = GET_BRAND_ASSETS,
            description = "Get company info, brand voice examples, tone guidelines and value propositions. Returns JSON.")
    public String getBrandAssets() {
        ObjectNode result = objectMapper.createObjectNode();
        ObjectNode info = result.putObject("company_info");
        info.put("name", company.name());
        info.put("brand_voice", company.brandVoice());
        info.put("mission", company.mission());
        info.put("target_audience", company.targetAudience());
        info.put("philosophy", company.philosophy());
        info.set("products", objectMapper.valueToTree(company.products()));
        result.set("brand_assets", company.reference(CompanyProfile.BRAND_ASSETS)
                .orElse(objectMapper.createObjectNode()));
        return pretty(result);
    }

    @Tool(name = GET_CONTENT_TEMPLATES,
            description = "Get content structure templates and social media best practices. Returns JSON.")
    public String getContentTemplates() {
        return section(CompanyProfile.CONTENT_TEMPLATES, "No content templates available.");
    }

    @Tool(name = GET_ANALYTICS,
            description = "Get internal analytics: sales, customers, marketing performance and website metrics. Returns JSON.")
    public String getAnalytics() {
        return section(CompanyProfile.ANALYTICS, "No analytics data available.");
    }

    private String section(String name, String fallback) {
        Optional<JsonNode> data = company.reference(name);
        return data.map(this::pretty).orElse(fallback);
    }

    private String pretty(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AgentExecutionException("Could not serialize reference data: " + e.getOriginalMessage(), e);
        }
    }
}
