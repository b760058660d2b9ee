package com.workforce.core.company;

import com.workforce.core.model.AgentNode;
import com.workforce.core.model.AgentRole;
import com.workforce.core.tools.CompanyTools;

import java.util.List;

/**
 * Agent hierarchy used for companies whose data file declares no {@code agents} section.
 */
public final class DefaultHierarchy {

    public static final String FOUNDER = "founder";
    public static final String MARKETING_HEAD = "marketing_head";
    public static final String MARKET_RESEARCHER = "market_researcher";
    public static final String DATA_ANALYST = "data_analyst";
    public static final String SEO_ANALYST = "seo_analyst";
    public static final String CONTENT_CREATOR = "content_creator";
    public static final String EVALUATOR = "evaluator";

    private DefaultHierarchy() {}

    public static List<AgentNode> nodes() {
        return List.of(
                new AgentNode(FOUNDER, "Founder", AgentRole.ORCHESTRATOR,
                        "Founder and CEO. Receives every request, delegates to the team and answers the user",
                        List.of(MARKETING_HEAD, MARKET_RESEARCHER, DATA_ANALYST, EVALUATOR), null, List.of()),
                new AgentNode(MARKETING_HEAD, "Marketing Head", AgentRole.LEAD,
                        "Leads marketing strategy, coordinates SEO and content creation",
                        List.of(SEO_ANALYST, CONTENT_CREATOR), FOUNDER, List.of()),
                new AgentNode(MARKET_RESEARCHER, "Market Researcher", AgentRole.WORKER,
                        "Conducts market research, analyzes competitors, identifies trends and opportunities",
                        List.of(), FOUNDER, List.of(CompanyTools.GET_MARKET_RESEARCH)),
                new AgentNode(DATA_ANALYST, "Data Analyst", AgentRole.WORKER,
                        "Analyzes internal metrics and performance data, provides data-driven insights",
                        List.of(), FOUNDER, List.of(CompanyTools.GET_ANALYTICS)),
                new AgentNode(SEO_ANALYST, "SEO Analyst", AgentRole.WORKER,
                        "Researches keywords, analyzes search trends, provides SEO recommendations",
                        List.of(), MARKETING_HEAD, List.of(CompanyTools.GET_SEO_DATA)),
                new AgentNode(CONTENT_CREATOR, "Content Creator", AgentRole.WORKER,
                        "Creates blog posts, social media content and marketing copy",
                        List.of(), MARKETING_HEAD,
                        List.of(CompanyTools.GET_CONTENT_TEMPLATES, CompanyTools.GET_BRAND_ASSETS)),
                new AgentNode(EVALUATOR, "Evaluator", AgentRole.REVIEWER,
                        "Reviews user-facing deliverables for brand voice, quality and completeness",
                        List.of(), FOUNDER, List.of(CompanyTools.GET_BRAND_ASSETS)));
    }
}
