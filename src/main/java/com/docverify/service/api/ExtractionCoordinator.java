package com.docverify.service.api;

import com.docverify.model.AssertionManifest;
import java.util.List;

public interface ExtractionCoordinator {

    /**
     * Derives assertions for every page, reusing prior results for pages whose content hash is unchanged when
     * running incrementally. A page whose extraction fails is recorded with no assertions; the run continues.
     *
     * @param pages         Page sources in documentation order.
     * @param priorManifest The manifest from the previous run, or {@code null}.
     * @param incremental   Reuse unchanged pages from {@code priorManifest}.
     * @return A new manifest stamped now, for the caller to persist.
     */
    AssertionManifest extract(List<String> pages, AssertionManifest priorManifest, boolean incremental);

    /**
     * Same as {@link #extract(List, AssertionManifest, boolean)}, restricted to pages whose source contains
     * {@code pageFilter}. Pages outside the filter keep their prior entry as-is.
     */
    AssertionManifest extract(List<String> pages, AssertionManifest priorManifest, boolean incremental, String pageFilter);
}
