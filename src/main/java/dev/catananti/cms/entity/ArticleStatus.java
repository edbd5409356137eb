package dev.catananti.cms.entity;

public enum ArticleStatus {
    DRAFT,
    PUBLISHED;

    public static ArticleStatus of(boolean published) {
        return published ? PUBLISHED : DRAFT;
    }
}
