package com.traceit.backend.extraction.config;

import com.traceit.backend.config.TraceitProperties;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.PageLoadStrategy;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

/**
 * Browser for the headless fallback extractor. It only renders a page and reads its DOM,
 * so it waits for DOMContentLoaded and never loads images.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class WebDriverConfig {

    private final TraceitProperties properties;

    /**
     * A new browser per lookup. Callers own the instance and must quit it.
     */
    @Bean
    @Scope("prototype")
    public WebDriver webDriver() {
        TraceitProperties.Webdriver settings = properties.getWebdriver();
        log.debug("Creating WebDriver instance: type={}, headless={}", settings.getType(), settings.isHeadless());

        WebDriver driver = "firefox".equalsIgnoreCase(settings.getType())
                ? new FirefoxDriver(firefoxOptions())
                : new ChromeDriver(chromeOptions());

        driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(settings.getTimeoutSeconds()));
        driver.manage().window().setSize(new Dimension(settings.getWindowWidth(), settings.getWindowHeight()));
        return driver;
    }

    ChromeOptions chromeOptions() {
        ChromeOptions options = new ChromeOptions();
        options.setPageLoadStrategy(PageLoadStrategy.EAGER);
        if (properties.getWebdriver().isHeadless()) {
            options.addArguments("--headless=new");
        }
        // Required when running as root inside a container
        options.addArguments("--no-sandbox", "--disable-dev-shm-usage");
        options.addArguments("--blink-settings=imagesEnabled=false");
        options.addArguments("--user-agent=" + properties.getExtraction().getUserAgent());
        return options;
    }

    FirefoxOptions firefoxOptions() {
        FirefoxOptions options = new FirefoxOptions();
        options.setPageLoadStrategy(PageLoadStrategy.EAGER);
        if (properties.getWebdriver().isHeadless()) {
            options.addArguments("--headless");
        }
        options.addPreference("permissions.default.image", 2);
        options.addPreference("general.useragent.override", properties.getExtraction().getUserAgent());
        return options;
    }
}
