package com.workforce.core.company;

import com.workforce.core.model.TaskType;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Guesses a request's task type from keywords when the caller supplies none.
 * <p>
 * Content creation is checked first since it is the only type that is reviewed; a request
 * matching nothing is treated as strategy and handled by the orchestrator.
 */
public final class TaskClassifier {

    /** Short tokens that must match as whole words ("post" must not match "postgres"). */
    private static final Set<String> WORD_BOUNDARY_KEYWORDS = Set.of("post", "copy", "data", "kpi", "seo", "ad");

    private record TypePattern(TaskType type, List<String> keywords) {}

    private static final List<TypePattern> PATTERNS = List.of(
            new TypePattern(TaskType.CONTENT_CREATION,
                    List.of("blog", "post", "article", "write", "draft", "copy", "newsletter", "caption",
                            "social media", "tweet", "email", "landing page", "product description", "ad")),
            new TypePattern(TaskType.ANALYSIS,
                    List.of("metric", "kpi", "analytics", "conversion", "sales", "revenue", "perform",
                            "data", "churn", "retention", "funnel")),
            new TypePattern(TaskType.RESEARCH,
                    List.of("research", "trend", "competitor", "competitive", "market", "industry", "swot",
                            "landscape", "keyword", "seo", "consumer insight")),
            new TypePattern(TaskType.STRATEGY,
                    List.of("strategy", "plan", "campaign", "roadmap", "positioning", "launch"))
    );

    private TaskClassifier() {}

    public static TaskType classify(String request) {
        if (request == null || request.isBlank()) {
            return TaskType.STRATEGY;
        }
        String lower = request.toLowerCase(Locale.ROOT);
        for (TypePattern pattern : PATTERNS) {
            for (String keyword : pattern.keywords()) {
                if (matches(lower, keyword)) {
                    return pattern.type();
                }
            }
        }
        return TaskType.STRATEGY;
    }

    private static boolean matches(String lowerText, String keyword) {
        if (WORD_BOUNDARY_KEYWORDS.contains(keyword)) {
            return Pattern.compile("\\b" + Pattern.quote(keyword) + "s?\\b").matcher(lowerText).find();
        }
        return lowerText.contains(keyword);
    }
}
