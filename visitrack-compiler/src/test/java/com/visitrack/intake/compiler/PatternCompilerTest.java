package com.visitrack.intake.compiler;

import com.visitrack.intake.runtime.model.CompiledRule;
import com.visitrack.intake.runtime.model.CompiledRule.MatchKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternCompilerTest {

    private final PatternCompiler compiler = new PatternCompiler();

    private CompiledRule compile(String pattern) {
        return compiler.compile(pattern, List.of());
    }

    @ParameterizedTest
    @CsvSource({
            "/admin/users, EXACT",
            "/admin/*, PREFIX",
            "*.php, SUFFIX",
            "/api/*/items, REGEX",
            "/page?, REGEX",
            "^/v[0-9]+/.*, REGEX",
            "/users/[0-9]+, REGEX",
            "*.(php|asp), REGEX",
            "re:/files/.+\\.zip, REGEX"
    })
    void shouldPickMatchKind(String pattern, MatchKind expected) {
        assertThat(compile(pattern).kind()).isEqualTo(expected);
    }

    @Test
    void prefixAndSuffixStripTheWildcard() {
        CompiledRule prefix = compile("/admin/*");
        CompiledRule suffix = compile("*.php");

        assertThat(prefix.pattern()).isEqualTo("/admin/");
        assertThat(prefix.matches("/admin/settings", "GET")).isTrue();
        assertThat(prefix.matches("/administrator", "GET")).isFalse();
        assertThat(suffix.matches("/wp-login.php", "GET")).isTrue();
        assertThat(suffix.matches("/php", "GET")).isFalse();
    }

    @Test
    void loneWildcardMatchesEverything() {
        CompiledRule all = compile("*");

        assertThat(all.matches("/", "GET")).isTrue();
        assertThat(all.matches("/anything/at/all", "POST")).isTrue();
    }

    @Test
    @DisplayName("Glob conversion quotes dots before substituting wildcards")
    void shouldEscapeLiteralsBeforeWildcards() {
        CompiledRule rule = compile("/api/v1.0/*/report");

        assertThat(rule.kind()).isEqualTo(MatchKind.REGEX);
        assertThat(rule.matches("/api/v1.0/acme/report", "GET")).isTrue();
        assertThat(rule.matches("/api/v1x0/acme/report", "GET")).isFalse();
    }

    @Test
    void questionMarkMatchesExactlyOneCharacter() {
        CompiledRule rule = compile("/page?/edit*");

        assertThat(rule.matches("/page1/edit", "GET")).isTrue();
        assertThat(rule.matches("/page12/edit", "GET")).isFalse();
        assertThat(rule.matches("/page/edit", "GET")).isFalse();
    }

    @Test
    void globRegexIsAnchored() {
        assertThat(PatternCompiler.globToRegex("/a/*")).startsWith("^").endsWith("$");
        assertThat(compile("/a/*/b").matches("/x/a/1/b", "GET")).isFalse();
    }

    @Test
    void rawRegexMustMatchWholePath() {
        CompiledRule rule = compile("re:/files/.+\\.zip");

        assertThat(rule.matches("/files/archive.zip", "GET")).isTrue();
        assertThat(rule.matches("/files/archive.zip.bak", "GET")).isFalse();
    }

    @Test
    @DisplayName("An invalid raw regex degrades to an exact match on the raw string")
    void shouldDegradeInvalidRegexToExact() {
        CompiledRule rule = compile("^/broken[");

        assertThat(rule.kind()).isEqualTo(MatchKind.EXACT);
        assertThat(rule.matches("^/broken[", "GET")).isTrue();
        assertThat(rule.matches("/broken", "GET")).isFalse();
    }

    @Test
    void characterClassWithoutWildcardsIsRegex() {
        CompiledRule rule = compile("/users/[0-9]+");

        assertThat(rule.kind()).isEqualTo(MatchKind.REGEX);
        assertThat(rule.matches("/users/42", "GET")).isTrue();
        assertThat(rule.matches("/users/abc", "GET")).isFalse();
        assertThat(rule.matches("/users/42/edit", "GET")).isFalse();
    }

    @Test
    void alternationWithoutWildcardsIsRegex() {
        CompiledRule rule = compile("/api/(v1|v2)/status");

        assertThat(rule.matches("/api/v2/status", "GET")).isTrue();
        assertThat(rule.matches("/api/v1/status", "GET")).isTrue();
        assertThat(rule.matches("/api/v3/status", "GET")).isFalse();
    }

    @Test
    @DisplayName("In a regex-style pattern dots are literal and wildcards keep their glob meaning")
    void regexStylePatternKeepsGlobWildcards() {
        CompiledRule rule = compile("/files/(docs|media)/*.pdf");

        assertThat(PatternCompiler.metaGlobToRegex("/a.(b|c)/*")).isEqualTo("^/a\\.(b|c)/.*$");
        assertThat(rule.matches("/files/docs/q3/report.pdf", "GET")).isTrue();
        assertThat(rule.matches("/files/media/reportxpdf", "GET")).isFalse();
        assertThat(rule.matches("/files/other/report.pdf", "GET")).isFalse();
    }

    @Test
    void escapedCharactersAreCopiedVerbatim() {
        CompiledRule rule = compile("/v\\d+/items");

        assertThat(rule.matches("/v2/items", "GET")).isTrue();
        assertThat(rule.matches("/vd/items", "GET")).isFalse();
    }

    @Test
    void invalidRegexStylePatternDegradesToExact() {
        CompiledRule rule = compile("/broken(group");

        assertThat(rule.kind()).isEqualTo(MatchKind.EXACT);
        assertThat(rule.matches("/broken(group", "GET")).isTrue();
    }

    @Test
    void methodRestrictionIsUpperCased() {
        CompiledRule rule = compiler.compile("/api/*", List.of("post", " Put "));

        assertThat(rule.methods()).containsExactlyInAnyOrder("POST", "PUT");
        assertThat(rule.matches("/api/orders", "POST")).isTrue();
        assertThat(rule.matches("/api/orders", "GET")).isFalse();
    }
}
