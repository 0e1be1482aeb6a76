package com.linlay.agentsview.parser;

import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Project labels for sessions. Claude encodes the working directory of a session as a
 * dash-joined path ({@code /Users/wesm/code/my-app} becomes {@code -Users-wesm-code-my-app});
 * decoding it is a best-effort heuristic driven by the marker and prefix tables below.
 */
public final class ProjectIdentity {

    private static final List<String> PROJECT_MARKERS = List.of(
            "code", "projects", "repos", "src", "work", "dev"
    );
    private static final Set<String> SYSTEM_DIRS = Set.of(
            "users", "home", "var", "tmp", "private"
    );
    private static final List<String> REPARSE_PREFIXES = List.of(
            "_Users", "_home", "_private", "_tmp", "_var"
    );
    private static final List<String> REPARSE_FRAGMENTS = List.of(
            "_var_folders_", "_var_tmp_"
    );

    private ProjectIdentity() {
    }

    public static String projectName(String dirName) {
        if (!StringUtils.hasLength(dirName)) {
            return "";
        }
        if (!dirName.startsWith("-")) {
            return normalize(dirName);
        }

        String[] parts = dirName.split("-", -1);

        // markers are tried in list order; for each, the first occurrence with a non-empty rest wins
        for (String marker : PROJECT_MARKERS) {
            for (int i = 0; i < parts.length - 1; i++) {
                if (!marker.equalsIgnoreCase(parts[i])) {
                    continue;
                }
                String rest = String.join("-", Arrays.asList(parts).subList(i + 1, parts.length));
                if (!rest.isEmpty()) {
                    return normalize(rest);
                }
            }
        }

        for (int i = parts.length - 1; i >= 0; i--) {
            String part = parts[i];
            if (!part.isEmpty() && !SYSTEM_DIRS.contains(part.toLowerCase(Locale.ROOT))) {
                return normalize(part);
            }
        }
        return normalize(dirName);
    }

    /**
     * Project label from a working directory path: its last segment, normalized.
     */
    public static String projectFromCwd(String cwd) {
        if (!StringUtils.hasText(cwd)) {
            return "";
        }
        String trimmed = cwd.trim().replace('\\', '/');
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        String name = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        if (name.isEmpty() || ".".equals(name) || "..".equals(name)) {
            return "";
        }
        return normalize(name);
    }

    /**
     * A stored project that still looks like an encoded path was written by an older
     * decoder and should be derived again.
     */
    public static boolean needsProjectReparse(String project) {
        if (project == null) {
            return false;
        }
        for (String prefix : REPARSE_PREFIXES) {
            if (project.startsWith(prefix)) {
                return true;
            }
        }
        for (String fragment : REPARSE_FRAGMENTS) {
            if (project.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Stored values win over derived ones unless they are empty or need reparse, so manual
     * corrections survive a resync.
     */
    public static String resolveProject(String storedProject, String derivedProject) {
        if (StringUtils.hasText(storedProject) && !needsProjectReparse(storedProject)) {
            return storedProject;
        }
        return derivedProject == null ? "" : derivedProject;
    }

    private static String normalize(String value) {
        return value.replace('-', '_');
    }
}
