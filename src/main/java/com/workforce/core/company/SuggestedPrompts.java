package com.workforce.core.company;

import com.workforce.core.model.TaskType;

import java.util.ArrayList;
import java.util.List;

/**
 * Suggested requests for a company: a standard set phrased with the company name, plus any
 * extra prompts its data file declares.
 */
public final class SuggestedPrompts {

    private SuggestedPrompts() {}

    public static List<SuggestedPrompt> forCompany(CompanyProfile company, List<SuggestedPrompt> extra) {
        String name = company.name() != null && !company.name().isBlank() ? company.name() : "the company";
        List<SuggestedPrompt> prompts = new ArrayList<>();
        prompts.add(new SuggestedPrompt("Simple Research",
                "Research current industry trends for " + name + ".",
                "simple", TaskType.RESEARCH,
                List.of("Founder", "Market Researcher", "Founder")));
        prompts.add(new SuggestedPrompt("SEO Analysis",
                "What keywords should we target for our new product launch?",
                "medium", TaskType.RESEARCH,
                List.of("Founder", "Marketing Head", "SEO Analyst", "Marketing Head", "Founder")));
        prompts.add(new SuggestedPrompt("Content Creation",
                "Write a seo-optimized blog post about sustainable practices in our industry.",
                "medium", TaskType.CONTENT_CREATION,
                List.of("Founder", "Marketing Head", "SEO Analyst", "Marketing Head", "Content Creator",
                        "Marketing Head", "Founder", "Evaluator", "Founder")));
        prompts.add(new SuggestedPrompt("Performance Review",
                "How did our marketing campaigns perform last quarter?",
                "simple", TaskType.ANALYSIS,
                List.of("Founder", "Data Analyst", "Founder")));
        prompts.add(new SuggestedPrompt("Competitive Analysis",
                "Analyze our competitors and identify opportunities for " + name + ".",
                "medium", TaskType.RESEARCH,
                List.of("Founder", "Market Researcher", "Founder")));
        if (extra != null) {
            prompts.addAll(extra);
        }
        return List.copyOf(prompts);
    }
}
