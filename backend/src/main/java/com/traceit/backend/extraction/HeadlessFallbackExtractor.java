package com.traceit.backend.extraction;

import com.traceit.backend.exception.ContentExtractionException;
import com.traceit.backend.model.dto.ExtractedContent;
import com.traceit.backend.model.enums.SourcePlatform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Renders the page in a headless browser and parses the resulting markup.
 * A fresh browser is started for every call and always quit before returning.
 */
@Component
@Order(4)
@Slf4j
@RequiredArgsConstructor
public class HeadlessFallbackExtractor implements ContentExtractor {

    private final ObjectProvider<WebDriver> webDriverProvider;
    private final ArticleContentParser articleContentParser;

    @Override
    public boolean isEligible(String url) {
        return SourcePlatform.isHttpUrl(url);
    }

    @Override
    public ExtractedContent extract(String url) {
        WebDriver driver;
        try {
            driver = webDriverProvider.getObject();
        } catch (BeansException | WebDriverException e) {
            throw new ContentExtractionException("Failed to launch headless browser: " + e.getMessage(), e);
        }

        try {
            log.debug("Rendering {} in headless browser", url);
            driver.get(url);
            String html = driver.getPageSource();
            return articleContentParser.toContent(url, html);
        } catch (WebDriverException e) {
            throw new ContentExtractionException("Failed to extract article with headless browser: " + e.getMessage(), e);
        } finally {
            quit(driver);
        }
    }

    private void quit(WebDriver driver) {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Failed to close headless browser: {}", e.getMessage());
        }
    }
}
