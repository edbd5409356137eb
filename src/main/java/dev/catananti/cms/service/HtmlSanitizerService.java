package dev.catananti.cms.service;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Service;

/**
 * Sanitizes article HTML with a fixed allow-list. Scripts, styles, iframes and event handlers never survive.
 */
@Slf4j
@Service
public class HtmlSanitizerService {

    private static final Safelist ARTICLE_SAFELIST = new Safelist()
            .addTags("p", "br", "strong", "em", "ul", "ol", "li",
                    "h1", "h2", "h3", "h4", "h5", "h6", "blockquote", "a", "img")
            .addAttributes("a", "href", "title")
            .addAttributes("img", "src", "alt", "title", "width", "height")
            .addProtocols("a", "href", "http", "https", "mailto")
            .addProtocols("img", "src", "http", "https");

    /**
     * @param input raw user HTML
     * @return HTML containing only allow-listed tags and attributes
     */
    public String sanitize(String input) {
        if (input == null || input.isEmpty()) {
            return input;
        }
        log.debug("Sanitizing article HTML, length={}", input.length());
        return Jsoup.clean(input, ARTICLE_SAFELIST);
    }

    /** Plain text of the input, whitespace collapsed. */
    public String stripHtml(String input) {
        if (input == null || input.isEmpty()) {
            return input;
        }
        return Jsoup.parse(input).text();
    }
}
