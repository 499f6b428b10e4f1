package com.hirepanel.core.insight;

import java.util.Map;

/**
 * Groups criterion names into coarse themes so different personas can agree on them.
 */
public final class ThemeCatalog {

    static final String OTHER = "Other";

    private static final Map<String, String> THEMES = Map.ofEntries(
            Map.entry("experience_match", "Experience"),
            Map.entry("cultural_fit", "Culture"),
            Map.entry("qualification_alignment", "Qualifications"),
            Map.entry("communication_skills", "Communication"),
            Map.entry("technical_depth", "Technical"),
            Map.entry("architecture_thinking", "Technical"),
            Map.entry("problem_solving", "Problem Solving"),
            Map.entry("technical_leadership", "Leadership"),
            Map.entry("user_centered_thinking", "User Focus"),
            Map.entry("design_collaboration", "Collaboration"),
            Map.entry("product_craft", "Product Quality"),
            Map.entry("cross_functional_leadership", "Leadership"),
            Map.entry("business_impact_roi", "Business Impact"),
            Map.entry("financial_acumen", "Business Acumen"),
            Map.entry("resource_management", "Management"),
            Map.entry("growth_strategy", "Strategy"),
            Map.entry("strategic_vision_execution", "Strategy"),
            Map.entry("leadership_culture_fit", "Leadership"),
            Map.entry("market_customer_focus", "Market Understanding"),
            Map.entry("organizational_impact", "Organizational"),
            Map.entry("management_mentorship", "Management"),
            Map.entry("communication_collaboration", "Collaboration"),
            Map.entry("practical_leadership", "Leadership"),
            Map.entry("professional_development", "Development"));

    private ThemeCatalog() {}

    public static String themeFor(String criterionName) {
        return THEMES.getOrDefault(criterionName, OTHER);
    }
}
