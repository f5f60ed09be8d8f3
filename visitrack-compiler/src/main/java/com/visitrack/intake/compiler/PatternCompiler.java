/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.compiler;

import com.visitrack.intake.api.config.RoutePatternDefinition;
import com.visitrack.intake.runtime.model.CompiledRule;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns a configured route pattern into a {@link CompiledRule}.
 *
 * <p>Pattern forms, checked in this order:
 * <ol>
 *   <li>{@code re:<regex>} or a pattern starting with {@code ^}: a raw regular
 *       expression, matched against the whole path</li>
 *   <li>a pattern containing any of {@code [ ] ( ) { } | + $}: an anchored
 *       regular expression in which {@code *} and {@code ?} keep their glob
 *       meaning and {@code .} is literal, e.g. {@code /users/[0-9]+}</li>
 *   <li>{@code *suffix}: path ends with {@code suffix}</li>
 *   <li>{@code prefix*}: path starts with {@code prefix}</li>
 *   <li>any other pattern containing {@code *} or {@code ?}: a glob, where
 *       {@code *} matches any run of characters and {@code ?} exactly one</li>
 *   <li>anything else: exact path</li>
 * </ol>
 *
 * <p>Plain glob conversion quotes every literal segment before the wildcards are
 * substituted, so {@code .} in {@code /v1.0/*} stays literal.
 * A regex that does not compile degrades to an exact match on the raw string.
 */
public final class PatternCompiler {
    private static final Logger logger = Logger.getLogger(PatternCompiler.class.getName());

    static final String REGEX_PREFIX = "re:";
    static final String REGEX_METACHARACTERS = "[](){}|+$";

    public CompiledRule compile(RoutePatternDefinition definition) {
        return compile(definition.pattern(), definition.methods());
    }

    public CompiledRule compile(String rawPattern, List<String> methods) {
        String pattern = rawPattern == null ? "" : rawPattern.trim();
        Set<String> methodSet = normalizeMethods(methods);

        if (pattern.startsWith(REGEX_PREFIX)) {
            return compileRegex(pattern, pattern.substring(REGEX_PREFIX.length()), methodSet);
        }
        if (pattern.startsWith("^")) {
            return compileRegex(pattern, pattern, methodSet);
        }
        if (hasRegexMetacharacter(pattern)) {
            return compileRegex(pattern, metaGlobToRegex(pattern), methodSet);
        }

        if (pattern.length() > 1 && pattern.startsWith("*") && !hasWildcard(pattern.substring(1))) {
            return CompiledRule.suffix(pattern.substring(1), methodSet);
        }
        if (pattern.endsWith("*") && !hasWildcard(pattern.substring(0, pattern.length() - 1))) {
            return CompiledRule.prefix(pattern.substring(0, pattern.length() - 1), methodSet);
        }
        if (hasWildcard(pattern)) {
            return CompiledRule.regex(pattern, Pattern.compile(globToRegex(pattern)), methodSet);
        }
        return CompiledRule.exact(pattern, methodSet);
    }

    /**
     * Converts a glob to an anchored regex, quoting literal runs first.
     */
    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 16).append('^');
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                flushLiteral(regex, literal);
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flushLiteral(regex, literal);
        return regex.append('$').toString();
    }

    /**
     * Converts a pattern mixing regex syntax and glob wildcards to an anchored
     * regex. Backslash escapes are copied as they are.
     */
    static String metaGlobToRegex(String pattern) {
        StringBuilder regex = new StringBuilder(pattern.length() + 16).append('^');
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()) {
                regex.append(c).append(pattern.charAt(++i));
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '.') {
                regex.append("\\.");
            } else {
                regex.append(c);
            }
        }
        return regex.append('$').toString();
    }

    private static void flushLiteral(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    private static CompiledRule compileRegex(String source, String expression, Set<String> methods) {
        try {
            return CompiledRule.regex(source, Pattern.compile(expression), methods);
        } catch (PatternSyntaxException e) {
            logger.warning("Invalid route regex '" + source + "', falling back to exact match: "
                    + e.getDescription());
            return CompiledRule.exact(source, methods);
        }
    }

    private static boolean hasRegexMetacharacter(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            if (REGEX_METACHARACTERS.indexOf(pattern.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasWildcard(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
    }

    private static Set<String> normalizeMethods(List<String> methods) {
        if (methods == null || methods.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String method : methods) {
            if (method != null && !method.isBlank()) {
                normalized.add(method.trim().toUpperCase(Locale.ROOT));
            }
        }
        return normalized;
    }
}
