package dev.catananti.cms.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ArticleResponse {
    private Long id;
    private String title;
    private String slug;
    private String content;
    private String excerpt;
    private Boolean isPublished;
    private LocalDateTime publishedAt;
    private Long authorId;
    private String author;
    private Long categoryId;
    private String category;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
