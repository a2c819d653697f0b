package com.docverify.service.impl;

import com.docverify.exception.DocVerifyException;
import com.docverify.model.EnvironmentContext;
import com.docverify.service.api.BrowserSession;
import com.docverify.service.api.BrowserSessionFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Starts headless Chrome and signs it in by writing the UI's persisted auth state into local storage, the same
 * record the login page stores after a successful sign-in.
 */
@Service
@Slf4j
public class SeleniumBrowserSessionFactory implements BrowserSessionFactory {

    private final ObjectMapper objectMapper;

    @Value("${docverify.ui.headless:true}")
    private boolean headless;

    @Value("${docverify.ui.page-load-timeout-seconds:30}")
    private int pageLoadTimeoutSeconds;

    @Value("${docverify.ui.auth-storage-key:breeze-auth}")
    private String authStorageKey;

    public SeleniumBrowserSessionFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public BrowserSession open(String uiBaseUrl, EnvironmentContext environment) {
        WebDriver driver = startDriver();
        try {
            Duration timeout = Duration.ofSeconds(pageLoadTimeoutSeconds);
            driver.manage().timeouts().pageLoadTimeout(timeout);
            SeleniumBrowserSession session = new SeleniumBrowserSession(driver, timeout);

            // Local storage is per origin, so the UI must be loaded before it can be written.
            session.navigate(TargetUrls.join(uiBaseUrl, "/login"));
            ((JavascriptExecutor) driver).executeScript(
                    "window.localStorage.setItem(arguments[0], arguments[1]);",
                    authStorageKey, authState(environment));
            log.debug("Browser signed in as {}", environment.get(EnvironmentContext.ADMIN_EMAIL).orElse("<unknown>"));
            return session;
        } catch (WebDriverException | DocVerifyException e) {
            quietly(driver);
            throw new DocVerifyException("Could not sign the browser in to " + uiBaseUrl + ": " + e.getMessage(), e);
        }
    }

    private WebDriver startDriver() {
        ChromeOptions options = new ChromeOptions();
        if (headless) {
            options.addArguments("--headless=new");
        }
        options.addArguments("--no-sandbox", "--disable-dev-shm-usage", "--window-size=1440,900");
        try {
            return new ChromeDriver(options);
        } catch (WebDriverException e) {
            throw new DocVerifyException("Could not start Chrome: " + e.getMessage(), e);
        }
    }

    String authState(EnvironmentContext environment) {
        String email = environment.get(EnvironmentContext.ADMIN_EMAIL).orElse("");
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("email", email);
        user.put("name", "Doc Verify Admin");

        Map<String, Object> state = new LinkedHashMap<>();
        state.put("user", user);
        state.put("tokens", Map.of("accessToken", environment.get(EnvironmentContext.AUTH_TOKEN).orElse("")));
        state.put("isAuthenticated", true);

        Map<String, Object> persisted = new LinkedHashMap<>();
        persisted.put("state", state);
        persisted.put("version", 0);
        try {
            return objectMapper.writeValueAsString(persisted);
        } catch (JsonProcessingException e) {
            throw new DocVerifyException("Could not serialize browser auth state", e);
        }
    }

    private static void quietly(WebDriver driver) {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Browser did not shut down cleanly: {}", e.getMessage());
        }
    }
}
