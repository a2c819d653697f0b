package com.docverify.service.api;

import com.docverify.model.AssertionManifest;
import com.docverify.model.RunOptions;
import com.docverify.model.RunReport;

public interface AssertionRunner {

    /**
     * Executes the selected assertions of a manifest one at a time, in manifest order.
     *
     * @param manifest The manifest, not modified.
     * @param options  Targets, environment context and filters.
     * @return The aggregated report. Never throws because of a single assertion.
     */
    RunReport run(AssertionManifest manifest, RunOptions options);
}
