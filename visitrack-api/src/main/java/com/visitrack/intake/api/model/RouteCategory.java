package com.visitrack.intake.api.model;

/**
 * Coarse section of a site a path belongs to, for grouping page views.
 */
public enum RouteCategory {
    ADMIN("Admin"),
    API("API"),
    AUTH("Auth"),
    DASHBOARD("Dashboard"),
    DOCS("Docs"),
    USER("User"),
    OTHER("Other");

    private final String label;

    RouteCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
