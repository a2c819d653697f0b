package com.docverify.service.api;

import com.docverify.model.EnvironmentContext;

public interface BrowserSessionFactory {

    /**
     * Starts a browser and signs it in to the UI with the run's credentials.
     *
     * @param uiBaseUrl   The UI base URL.
     * @param environment Holds the auth token.
     * @return An open session. The caller must close it.
     */
    BrowserSession open(String uiBaseUrl, EnvironmentContext environment);
}
