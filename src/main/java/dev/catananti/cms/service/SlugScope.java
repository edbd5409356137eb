package dev.catananti.cms.service;

/**
 * Independent slug namespaces. A slug only has to be unique within its own scope.
 */
public enum SlugScope {
    ARTICLE("Article"),
    CATEGORY("Category");

    private final String label;

    SlugScope(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
