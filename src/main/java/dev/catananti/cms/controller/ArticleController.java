package dev.catananti.cms.controller;

import dev.catananti.cms.dto.ApiResponse;
import dev.catananti.cms.dto.ArticleRequest;
import dev.catananti.cms.dto.ArticleResponse;
import dev.catananti.cms.dto.ArticleUpdateRequest;
import dev.catananti.cms.dto.MessageResponse;
import dev.catananti.cms.dto.PageResponse;
import dev.catananti.cms.service.ArticleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/articles")
@RequiredArgsConstructor
@Tag(name = "Articles", description = "Article authoring, publishing and reading")
@Slf4j
public class ArticleController {

    private final ArticleService articleService;

    @GetMapping
    @Operation(summary = "List articles", description = "Drafts are included only for staff with published_only=false")
    public Mono<ApiResponse<PageResponse<ArticleResponse>>> listArticles(
            @RequestParam(name = "published_only", defaultValue = "true") boolean publishedOnly,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "20") int limit) {
        return articleService.listArticles(publishedOnly, skip, limit)
                .map(page -> ApiResponse.ok(page, HttpStatus.OK.value()));
    }

    @GetMapping("/search")
    @Operation(summary = "Search published articles")
    public Mono<ApiResponse<PageResponse<ArticleResponse>>> searchArticles(
            @RequestParam("q") String query,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "20") int limit) {
        return articleService.searchArticles(query, skip, limit)
                .map(page -> ApiResponse.ok(page, HttpStatus.OK.value()));
    }

    @GetMapping("/mine")
    @Operation(summary = "The caller's own articles, drafts included")
    public Mono<ApiResponse<PageResponse<ArticleResponse>>> listMyArticles(
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "20") int limit) {
        return articleService.listMyArticles(skip, limit)
                .map(page -> ApiResponse.ok(page, HttpStatus.OK.value()));
    }

    @GetMapping("/{slug}")
    @Operation(summary = "Get a published article by slug")
    public Mono<ApiResponse<ArticleResponse>> getArticle(@PathVariable String slug) {
        return articleService.getPublishedArticle(slug)
                .map(article -> ApiResponse.ok(article, HttpStatus.OK.value()));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create an article")
    public Mono<ApiResponse<ArticleResponse>> createArticle(@Valid @RequestBody ArticleRequest request) {
        log.info("Creating article");
        return articleService.createArticle(request)
                .map(article -> ApiResponse.ok(article, "Article created successfully", HttpStatus.CREATED.value()));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update an article")
    public Mono<ApiResponse<ArticleResponse>> updateArticle(@PathVariable Long id,
                                                            @Valid @RequestBody ArticleUpdateRequest request) {
        log.info("Updating article: id={}", id);
        return articleService.updateArticle(id, request)
                .map(article -> ApiResponse.ok(article, "Article updated successfully", HttpStatus.OK.value()));
    }

    @PostMapping("/{id}/publish")
    @Operation(summary = "Publish an article")
    public Mono<ApiResponse<ArticleResponse>> publishArticle(@PathVariable Long id) {
        return articleService.publishArticle(id)
                .map(article -> ApiResponse.ok(article, HttpStatus.OK.value()));
    }

    @PostMapping("/{id}/unpublish")
    @Operation(summary = "Return an article to draft")
    public Mono<ApiResponse<ArticleResponse>> unpublishArticle(@PathVariable Long id) {
        return articleService.unpublishArticle(id)
                .map(article -> ApiResponse.ok(article, HttpStatus.OK.value()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an article")
    public Mono<ApiResponse<MessageResponse>> deleteArticle(@PathVariable Long id) {
        log.info("Deleting article: id={}", id);
        return articleService.deleteArticle(id)
                .thenReturn(ApiResponse.ok(new MessageResponse("Article deleted successfully"), HttpStatus.OK.value()));
    }
}
