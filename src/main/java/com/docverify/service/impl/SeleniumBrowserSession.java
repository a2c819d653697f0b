package com.docverify.service.impl;

import com.docverify.service.api.BrowserSession;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.WebDriverWait;

/**
 * A {@link BrowserSession} over a Selenium {@link WebDriver}.
 */
@Slf4j
class SeleniumBrowserSession implements BrowserSession {

    private final WebDriver driver;
    private final Duration settleTimeout;

    SeleniumBrowserSession(WebDriver driver, Duration settleTimeout) {
        this.driver = driver;
        this.settleTimeout = settleTimeout;
    }

    @Override
    public void navigate(String url) {
        driver.get(url);
        new WebDriverWait(driver, settleTimeout).until(d ->
                "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
    }

    @Override
    public String currentUrl() {
        return driver.getCurrentUrl();
    }

    @Override
    public String title() {
        return driver.getTitle();
    }

    @Override
    public String visibleText() {
        try {
            return driver.findElement(By.tagName("body")).getText();
        } catch (NoSuchElementException e) {
            return "";
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Browser did not shut down cleanly: {}", e.getMessage());
        }
    }
}
