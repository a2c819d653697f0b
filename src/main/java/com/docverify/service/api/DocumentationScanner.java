package com.docverify.service.api;

import java.util.List;

public interface DocumentationScanner {

    /**
     * Enumerates documentation pages, directory by directory in the given order and by file name within a
     * directory. Recomputed on every call; stable as long as the files do not change.
     *
     * @param scopeDirs Directories relative to the documentation root.
     * @return Page sources relative to the documentation root, e.g. "agents/intro.mdx".
     */
    List<String> listPages(List<String> scopeDirs);

    /**
     * @param source A page source as returned by {@link #listPages(List)}.
     * @return The raw page text.
     */
    String readPage(String source);
}
