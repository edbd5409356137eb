package dev.catananti.cms.service;

import dev.catananti.cms.entity.Article;
import dev.catananti.cms.entity.ArticleStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Draft/Published transitions for articles.
 * Draft to Published stamps {@code published_at} with the current UTC time, Published to Draft clears it,
 * and self-transitions leave the article untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PublishStateMachine {

    private final Clock clock;

    /**
     * @return whether the article changed state
     */
    public boolean transition(Article article, ArticleStatus target) {
        ArticleStatus current = article.status();
        if (current == target) {
            return false;
        }
        boolean changed = target == ArticleStatus.PUBLISHED
                ? article.publish(LocalDateTime.now(clock))
                : article.unpublish();
        if (changed) {
            log.info("Article '{}' moved {} -> {}", article.getTitle(), current, target);
        }
        return changed;
    }

    public boolean applyFlag(Article article, Boolean published) {
        if (published == null) {
            return false;
        }
        return transition(article, ArticleStatus.of(published));
    }

    public boolean publish(Article article) {
        return transition(article, ArticleStatus.PUBLISHED);
    }

    public boolean unpublish(Article article) {
        return transition(article, ArticleStatus.DRAFT);
    }
}
