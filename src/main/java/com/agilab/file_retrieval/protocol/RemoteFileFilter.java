package com.agilab.file_retrieval.protocol;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.apache.commons.lang3.StringUtils;

public final class RemoteFileFilter {

    private RemoteFileFilter() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean matches(String fileName, ListingRequest request) {
        return matchesPattern(fileName, request.filenamePattern())
                && matchesExtension(fileName, request.fileExtension());
    }

    public static boolean matchesPattern(String fileName, String pattern) {
        if (StringUtils.isBlank(pattern) || "*".equals(pattern)) {
            return true;
        }
        return FilenameUtils.wildcardMatch(fileName, pattern, IOCase.INSENSITIVE);
    }

    public static boolean matchesExtension(String fileName, String extension) {
        if (StringUtils.isBlank(extension)) {
            return true;
        }
        return FilenameUtils.getExtension(fileName).equalsIgnoreCase(StringUtils.removeStart(extension.trim(), "."));
    }

    /**
     * Joins URL or path segments with exactly one slash between them.
     */
    public static String join(String base, String path) {
        if (StringUtils.isBlank(path)) {
            return base;
        }
        return StringUtils.removeEnd(base, "/") + "/" + StringUtils.removeStart(path, "/");
    }
}
