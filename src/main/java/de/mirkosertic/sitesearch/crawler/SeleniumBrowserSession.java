package de.mirkosertic.sitesearch.crawler;

import de.mirkosertic.sitesearch.config.ApplicationConfig;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.PageLoadStrategy;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link BrowserSession} backed by a headless Chrome driven through Selenium.
 * <p>
 * Network quiescence is approximated from inside the page: the document has to be
 * completely loaded and the number of Resource Timing entries must not change for one
 * quiet period.
 */
public class SeleniumBrowserSession implements BrowserSession {

    private static final Logger logger = LoggerFactory.getLogger(SeleniumBrowserSession.class);

    private static final String RESOURCE_COUNT_SCRIPT =
            "return document.readyState === 'complete' ? performance.getEntriesByType('resource').length : -1;";

    private final WebDriver driver;
    private final Duration idleTimeout;
    private final Duration quietPeriod;

    SeleniumBrowserSession(final WebDriver driver, final Duration idleTimeout, final Duration quietPeriod) {
        this.driver = driver;
        this.idleTimeout = idleTimeout;
        this.quietPeriod = quietPeriod;
    }

    /**
     * Factory starting one headless Chrome per session with the configured header profile.
     */
    public static BrowserSessionFactory factory(final ApplicationConfig config) {
        return () -> {
            final ChromeOptions options = new ChromeOptions();
            options.addArguments(
                    "--headless=new",
                    "--no-sandbox",
                    "--disable-setuid-sandbox",
                    "--disable-dev-shm-usage",
                    "--user-agent=" + config.getUserAgent(),
                    "--lang=" + primaryLanguage(config.getAcceptLanguage()));
            options.setExperimentalOption("prefs", Map.of("intl.accept_languages", config.getAcceptLanguage()));
            options.setPageLoadStrategy(PageLoadStrategy.NORMAL);
            if (config.getBrowserBinary() != null) {
                options.setBinary(config.getBrowserBinary());
            }

            final WebDriver driver;
            try {
                driver = new ChromeDriver(options);
            } catch (final WebDriverException e) {
                throw new BrowserUnavailableException("Chrome could not be started: " + firstLine(e.getMessage()), e);
            }
            try {
                driver.manage().timeouts().pageLoadTimeout(config.getPageLoadTimeout());
            } catch (final WebDriverException e) {
                quitQuietly(driver);
                throw new BrowserUnavailableException("Chrome could not be configured: " + firstLine(e.getMessage()), e);
            }
            return new SeleniumBrowserSession(driver, config.getNetworkIdleTimeout(), config.getNetworkIdleQuietPeriod());
        };
    }

    @Override
    public void navigate(final String url) throws FetchException {
        try {
            driver.navigate().to(url);
        } catch (final TimeoutException e) {
            throw new FetchException("Page load timed out: " + url, e);
        } catch (final WebDriverException e) {
            throw new FetchException("Navigation failed: " + firstLine(e.getMessage()), e);
        }
    }

    @Override
    public void awaitNetworkIdle() throws FetchException {
        final AtomicLong previousCount = new AtomicLong(-1);
        try {
            new WebDriverWait(driver, idleTimeout, quietPeriod).until(webDriver -> {
                final Object result = ((JavascriptExecutor) webDriver).executeScript(RESOURCE_COUNT_SCRIPT);
                final long count = result instanceof Number number ? number.longValue() : -1;
                final long previous = previousCount.getAndSet(count);
                return count >= 0 && count == previous;
            });
        } catch (final TimeoutException e) {
            logger.debug("Network did not become idle within {}ms, reading page as is", idleTimeout.toMillis());
        } catch (final WebDriverException e) {
            throw new FetchException("Page failed while waiting for network idle: " + firstLine(e.getMessage()), e);
        }
    }

    @Override
    public String pageSource() throws FetchException {
        try {
            return driver.getPageSource();
        } catch (final WebDriverException e) {
            throw new FetchException("Could not read rendered page: " + firstLine(e.getMessage()), e);
        }
    }

    @Override
    public void close() {
        quitQuietly(driver);
    }

    private static void quitQuietly(final WebDriver driver) {
        try {
            driver.quit();
        } catch (final WebDriverException e) {
            logger.debug("Error while quitting browser: {}", firstLine(e.getMessage()));
        }
    }

    static String primaryLanguage(final String acceptLanguage) {
        final String first = acceptLanguage.split(",")[0];
        final int semicolon = first.indexOf(';');
        return (semicolon >= 0 ? first.substring(0, semicolon) : first).trim();
    }

    private static String firstLine(final String message) {
        if (message == null) {
            return "";
        }
        final int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
