package com.workforce.core.company;

/**
 * Listing entry for an available company.
 */
public record CompanySummary(String id, String name) {}
