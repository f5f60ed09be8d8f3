package com.visitrack.intake.runtime.bot;

import com.visitrack.intake.api.model.BotSignal;
import com.visitrack.intake.api.model.BotType;
import com.visitrack.intake.api.model.ClassificationResult;
import com.visitrack.intake.api.model.RequestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BotClassifierTest {

    private final BotClassifier classifier = new BotClassifier();

    private static RequestContext withAgent(String userAgent) {
        return RequestContext.builder().path("/").header("User-Agent", userAgent).build();
    }

    @Test
    void googlebotIsSearchEngine() {
        ClassificationResult result = classifier.classify(withAgent(
                "Mozilla/5.0 (compatible; Googlebot/2.1; +http://www.google.com/bot.html)"));

        assertThat(result.bot()).isTrue();
        assertThat(result.botType()).isEqualTo(BotType.SEARCH_ENGINE);
        assertThat(result.botName()).isEqualTo("Googlebot");
        assertThat(result.confidence()).isBetween(0.8, 0.99);
        assertThat(result.signals()).containsExactly(BotSignal.USER_AGENT);
    }

    @ParameterizedTest
    @CsvSource({
            "Googlebot/2.1, SEARCH_ENGINE, Googlebot",
            "Mozilla/5.0 (compatible; bingbot/2.0), SEARCH_ENGINE, Bingbot",
            "Mozilla/5.0 (compatible; Yahoo! Slurp), SEARCH_ENGINE, Yahoo Slurp",
            "DuckDuckBot/1.1, SEARCH_ENGINE, DuckDuckBot",
            "Baiduspider/2.0, SEARCH_ENGINE, Baiduspider",
            "YandexBot/3.0, SEARCH_ENGINE, YandexBot",
            "facebookexternalhit/1.1, SOCIAL_MEDIA, Facebook",
            "Twitterbot/1.0, SOCIAL_MEDIA, Twitter",
            "LinkedInBot/1.0, SOCIAL_MEDIA, LinkedIn",
            "Slackbot-LinkExpanding 1.0, SOCIAL_MEDIA, Slack",
            "Mozilla/5.0 (compatible; Discordbot/2.0), SOCIAL_MEDIA, Discord",
            "TelegramBot/1.0, SOCIAL_MEDIA, Telegram",
            "Mozilla/5.0 (compatible; AhrefsBot/7.0), SEO, AhrefsBot",
            "Mozilla/5.0 (compatible; SemrushBot/7~bl), SEO, SemrushBot",
            "Mozilla/5.0 (compatible; MJ12bot/v1.4.8), SEO, MJ12bot",
            "Mozilla/5.0 (compatible; DotBot/1.2), SEO, DotBot",
            "Mozilla/5.0 (compatible; UptimeRobot/2.0), MONITORING, UptimeRobot",
            "Pingdom.com_bot_version_1.4, MONITORING, Pingdom",
            "Mozilla/5.0 (compatible; Nessus), SECURITY, Nessus",
            "Mozilla/5.0 (compatible; Nmap Scripting Engine), SECURITY, Nmap",
            "masscan/1.3, SECURITY, Masscan",
            "my-custom-bot, UNKNOWN_BOT, Generic Bot",
            "SomeCrawler/1.0, UNKNOWN_BOT, Crawler",
            "Web spider 0.1, UNKNOWN_BOT, Spider",
            "acme-scraper, UNKNOWN_BOT, Scraper"
    })
    void signatureTableEntriesAreRecognized(String userAgent, BotType type, String name) {
        ClassificationResult result = classifier.classify(withAgent(userAgent));

        assertThat(result.bot()).isTrue();
        assertThat(result.botType()).isEqualTo(type);
        assertThat(result.botName()).isEqualTo(name);
        assertThat(result.confidence()).isGreaterThanOrEqualTo(0.8);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_2) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.2 Safari/605.1.15",
            "Mozilla/5.0 (X11; Linux x86_64; rv:121.0) Gecko/20100101 Firefox/121.0",
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_2 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Mobile/15E148",
            "Mozilla/5.0 (Linux; Android 14; Pixel 8) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.6099.144 Mobile Safari/537.36"
    })
    void modernBrowsersAreHuman(String userAgent) {
        ClassificationResult result = classifier.classify(withAgent(userAgent));

        assertThat(result.bot()).isFalse();
        assertThat(result.botType()).isEqualTo(BotType.HUMAN);
        assertThat(result.botName()).isNull();
        assertThat(result.confidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    @DisplayName("Generic pattern needs a word boundary after 'bot'")
    void botInsideWordIsNotGeneric() {
        assertThat(classifier.classify(withAgent("Botanical Garden Browser/1.0")).bot()).isFalse();
    }

    @Test
    void missingUserAgentIsNotEvidence() {
        ClassificationResult result = classifier.classify(RequestContext.builder().path("/").build());

        assertThat(result.bot()).isFalse();
    }

    @Test
    void crawlerNetworkAloneMarksUnknownBot() {
        RequestContext context = RequestContext.builder()
                .header("User-Agent", "Mozilla/5.0 (Windows NT 10.0) Chrome/120.0")
                .remoteAddress("66.249.66.1")
                .build();

        ClassificationResult result = classifier.classify(context);

        assertThat(result.bot()).isTrue();
        assertThat(result.botType()).isEqualTo(BotType.UNKNOWN_BOT);
        assertThat(result.botName()).isNull();
        assertThat(result.confidence()).isCloseTo(0.8, within(1e-9));
        assertThat(result.signals()).containsExactly(BotSignal.ADDRESS);
    }

    @Test
    void highRequestFrequencyMarksBot() {
        RequestContext context = RequestContext.builder().requestFrequency(61).build();

        ClassificationResult result = classifier.classify(context);

        assertThat(result.bot()).isTrue();
        assertThat(result.confidence()).isCloseTo(0.7, within(1e-9));
        assertThat(classifier.classify(RequestContext.builder().requestFrequency(60).build()).bot()).isFalse();
    }

    @Test
    void allSignalsAreCappedAtMaximumConfidence() {
        RequestContext context = RequestContext.builder()
                .header("User-Agent", "Googlebot/2.1")
                .remoteAddress("66.249.66.1")
                .requestFrequency(500)
                .build();

        ClassificationResult result = classifier.classify(context);

        assertThat(result.botName()).isEqualTo("Googlebot");
        assertThat(result.confidence()).isEqualTo(ClassificationResult.MAX_CONFIDENCE);
        assertThat(result.signals()).containsExactly(BotSignal.USER_AGENT, BotSignal.ADDRESS, BotSignal.FREQUENCY);
    }
}
