package dev.catananti.cms.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("articles")
public class Article {

    @Id
    private Long id;

    private String title;

    private String slug;

    private String content;

    private String excerpt;

    @Column("is_published")
    @Builder.Default
    private Boolean published = false;

    /** Present iff {@link #published} is true. */
    @Column("published_at")
    private LocalDateTime publishedAt;

    @Column("author_id")
    private Long authorId;

    @Column("category_id")
    private Long categoryId;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Transient
    private String authorName;

    @Transient
    private String categoryName;

    public ArticleStatus status() {
        return ArticleStatus.of(Boolean.TRUE.equals(published));
    }

    /**
     * Draft to Published. No-op when already published.
     * @return whether the state changed
     */
    public boolean publish(LocalDateTime now) {
        if (Boolean.TRUE.equals(published)) {
            return false;
        }
        this.published = true;
        this.publishedAt = now;
        return true;
    }

    /**
     * Published to Draft. No-op on a draft.
     * @return whether the state changed
     */
    public boolean unpublish() {
        if (!Boolean.TRUE.equals(published)) {
            return false;
        }
        this.published = false;
        this.publishedAt = null;
        return true;
    }
}
