package com.docverify.service.api;

/**
 * A live browser shared by all ui assertions of a run. Each assertion navigates fresh; cookies and local storage
 * persist between them.
 */
public interface BrowserSession extends AutoCloseable {

    void navigate(String url);

    String currentUrl();

    String title();

    /**
     * @return The rendered, visible text of the current page.
     */
    String visibleText();

    /**
     * Shuts the browser down. Never throws checked exceptions.
     */
    @Override
    void close();
}
