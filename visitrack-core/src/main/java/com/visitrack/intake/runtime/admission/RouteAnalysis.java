/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.runtime.admission;

import com.visitrack.intake.api.model.PathSuspicion;
import com.visitrack.intake.api.model.RouteCategory;
import com.visitrack.intake.api.model.RouteInfo;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Describes paths for reporting: dynamic segments are collapsed, the path is
 * put into a site section, and probing patterns are flagged.
 *
 * <p>None of this affects admission. Thread-safe.
 */
public final class RouteAnalysis {

    public static final int MAX_SEGMENTS = 10;

    /** Checked when no explicit categories are requested. */
    public static final Set<PathSuspicion> DEFAULT_SUSPICIONS =
            EnumSet.of(PathSuspicion.SECURITY_SCAN, PathSuspicion.BOT_BEHAVIOR, PathSuspicion.MALFORMED);

    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");
    private static final Pattern UUID = Pattern.compile("^[0-9a-fA-F]{8}(-[0-9a-fA-F]{4}){3}-[0-9a-fA-F]{12}$");
    // Slugs like "a1b2c3d4e5": long, and at least one digit
    private static final Pattern TOKEN_ID = Pattern.compile("^(?=[A-Za-z_-]*\\d)[A-Za-z0-9_-]{8,}$");
    private static final Pattern EXTENSION = Pattern.compile("^[A-Za-z][A-Za-z0-9]{0,4}$");

    private static final Map<RouteCategory, List<String>> CATEGORY_PREFIXES = new LinkedHashMap<>();

    static {
        CATEGORY_PREFIXES.put(RouteCategory.ADMIN, List.of("/admin/"));
        CATEGORY_PREFIXES.put(RouteCategory.API, List.of("/api/"));
        CATEGORY_PREFIXES.put(RouteCategory.AUTH, List.of("/auth/", "/login", "/logout", "/register"));
        CATEGORY_PREFIXES.put(RouteCategory.DASHBOARD, List.of("/dashboard"));
        CATEGORY_PREFIXES.put(RouteCategory.DOCS, List.of("/docs/", "/documentation"));
        CATEGORY_PREFIXES.put(RouteCategory.USER, List.of("/users/", "/profile"));
    }

    private static final List<Pattern> SECURITY_SCAN = List.of(
            Pattern.compile("\\.\\./"),
            Pattern.compile("/admin"),
            Pattern.compile("/wp-admin"),
            Pattern.compile("\\.php$"),
            Pattern.compile("/config"),
            Pattern.compile("/env"),
            Pattern.compile("/\\.git"),
            Pattern.compile("/backup"),
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("union.*select", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> BOT_BEHAVIOR = List.of(
            Pattern.compile("/crawl"),
            Pattern.compile("/spider"),
            Pattern.compile("/bot"),
            Pattern.compile("/sitemap"),
            Pattern.compile("/feed"),
            Pattern.compile("/rss"));

    private static final List<String> ERROR_PRONE = List.of(
            "/undefined", "/null", "[object", "/error", "/404", "/500");

    private final int maxPathLength;

    public RouteAnalysis(int maxPathLength) {
        this.maxPathLength = maxPathLength;
    }

    public static String normalizeDynamicPath(String path) {
        return normalizeDynamicPath(path, false);
    }

    /**
     * Replaces numeric, UUID and token-like segments with {@code :id}, and
     * file names with {@code :file} (or {@code :file.ext} when extensions are
     * kept). The query string is dropped and at most {@value #MAX_SEGMENTS}
     * segments are kept.
     */
    public static String normalizeDynamicPath(String path, boolean preserveExtensions) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        StringBuilder normalized = new StringBuilder(path.length());
        int segments = 0;
        for (String segment : stripQuery(path).split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (segments++ == MAX_SEGMENTS) {
                break;
            }
            normalized.append('/').append(normalizeSegment(segment, preserveExtensions));
        }
        return normalized.length() == 0 ? "/" : normalized.toString();
    }

    private static String normalizeSegment(String segment, boolean preserveExtensions) {
        if (isIdentifier(segment)) {
            return ":id";
        }
        int dot = segment.indexOf('.');
        if (dot > 0 && dot < segment.length() - 1) {
            String extension = segment.substring(dot + 1);
            if (EXTENSION.matcher(extension).matches()) {
                return preserveExtensions ? ":file." + extension : ":file";
            }
        }
        return segment;
    }

    private static boolean isIdentifier(String segment) {
        return NUMERIC.matcher(segment).matches()
                || UUID.matcher(segment).matches()
                || TOKEN_ID.matcher(segment).matches();
    }

    /**
     * First section whose prefix the path starts with, {@link RouteCategory#OTHER} otherwise.
     */
    public static RouteCategory classifyRoute(String path) {
        if (path == null) {
            return RouteCategory.OTHER;
        }
        String bare = stripQuery(path);
        for (Map.Entry<RouteCategory, List<String>> entry : CATEGORY_PREFIXES.entrySet()) {
            for (String prefix : entry.getValue()) {
                if (bare.startsWith(prefix)) {
                    return entry.getKey();
                }
            }
        }
        return RouteCategory.OTHER;
    }

    public Set<PathSuspicion> suspicions(String path) {
        return suspicions(path, DEFAULT_SUSPICIONS);
    }

    public Set<PathSuspicion> suspicions(String path, Set<PathSuspicion> categories) {
        Set<PathSuspicion> found = EnumSet.noneOf(PathSuspicion.class);
        if (path == null) {
            return found;
        }
        for (PathSuspicion category : categories) {
            if (isSuspicious(category, path)) {
                found.add(category);
            }
        }
        return found;
    }

    private boolean isSuspicious(PathSuspicion category, String path) {
        return switch (category) {
            case SECURITY_SCAN -> anyFind(SECURITY_SCAN, path);
            case BOT_BEHAVIOR -> anyFind(BOT_BEHAVIOR, path);
            case MALFORMED -> isMalformed(path);
            case ERROR_PRONE -> ERROR_PRONE.stream().anyMatch(path::contains);
        };
    }

    private boolean isMalformed(String path) {
        return path.contains("//")
                || path.indexOf(' ') >= 0
                || path.indexOf('\n') >= 0
                || path.indexOf('\t') >= 0
                || path.length() > maxPathLength
                || path.indexOf('\uFFFD') >= 0
                || !StandardCharsets.UTF_8.newEncoder().canEncode(path);
    }

    private static boolean anyFind(List<Pattern> patterns, String path) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }

    public SuspiciousPathReport detectSuspiciousPaths(Collection<String> paths) {
        return detectSuspiciousPaths(paths, DEFAULT_SUSPICIONS);
    }

    /**
     * Flags every path that falls into one of the given categories. Null
     * entries are skipped and not counted.
     */
    public SuspiciousPathReport detectSuspiciousPaths(Collection<String> paths, Set<PathSuspicion> categories) {
        Map<String, Set<PathSuspicion>> details = new LinkedHashMap<>();
        int total = 0;
        int suspicious = 0;
        if (paths != null) {
            for (String path : paths) {
                if (path == null) {
                    continue;
                }
                total++;
                Set<PathSuspicion> found = suspicions(path, categories);
                if (!found.isEmpty()) {
                    suspicious++;
                    details.put(path, found);
                }
            }
        }
        return SuspiciousPathReport.of(total, suspicious, details);
    }

    public RouteInfo describe(String path) {
        return new RouteInfo(normalizeDynamicPath(path), classifyRoute(path), suspicions(path));
    }

    private static String stripQuery(String path) {
        int cut = path.indexOf('?');
        int fragment = path.indexOf('#');
        if (fragment >= 0 && (cut < 0 || fragment < cut)) {
            cut = fragment;
        }
        return cut >= 0 ? path.substring(0, cut) : path;
    }
}
