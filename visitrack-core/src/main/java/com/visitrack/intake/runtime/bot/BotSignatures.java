package com.visitrack.intake.runtime.bot;

import com.visitrack.intake.api.model.BotType;

import java.util.List;
import java.util.Optional;

/**
 * Ordered user-agent signature table. Named agents come before the generic
 * patterns so that the most specific entry wins.
 */
public final class BotSignatures {

    public static final List<BotSignature> DEFAULT = List.of(
            BotSignature.of("googlebot", BotType.SEARCH_ENGINE, "Googlebot"),
            BotSignature.of("bingbot", BotType.SEARCH_ENGINE, "Bingbot"),
            BotSignature.of("slurp", BotType.SEARCH_ENGINE, "Yahoo Slurp"),
            BotSignature.of("duckduckbot", BotType.SEARCH_ENGINE, "DuckDuckBot"),
            BotSignature.of("baiduspider", BotType.SEARCH_ENGINE, "Baiduspider"),
            BotSignature.of("yandexbot", BotType.SEARCH_ENGINE, "YandexBot"),

            BotSignature.of("facebookexternalhit", BotType.SOCIAL_MEDIA, "Facebook"),
            BotSignature.of("twitterbot", BotType.SOCIAL_MEDIA, "Twitter"),
            BotSignature.of("linkedinbot", BotType.SOCIAL_MEDIA, "LinkedIn"),
            BotSignature.of("slackbot", BotType.SOCIAL_MEDIA, "Slack"),
            BotSignature.of("discordbot", BotType.SOCIAL_MEDIA, "Discord"),
            BotSignature.of("telegrambot", BotType.SOCIAL_MEDIA, "Telegram"),

            BotSignature.of("ahrefsbot", BotType.SEO, "AhrefsBot"),
            BotSignature.of("semrushbot", BotType.SEO, "SemrushBot"),
            BotSignature.of("mj12bot", BotType.SEO, "MJ12bot"),
            BotSignature.of("dotbot", BotType.SEO, "DotBot"),
            BotSignature.of("uptimerobot", BotType.MONITORING, "UptimeRobot"),
            BotSignature.of("pingdom", BotType.MONITORING, "Pingdom"),

            BotSignature.of("nessus", BotType.SECURITY, "Nessus"),
            BotSignature.of("nmap", BotType.SECURITY, "Nmap"),
            BotSignature.of("masscan", BotType.SECURITY, "Masscan"),

            BotSignature.of("bot\\b", BotType.UNKNOWN_BOT, "Generic Bot"),
            BotSignature.of("crawler", BotType.UNKNOWN_BOT, "Crawler"),
            BotSignature.of("spider", BotType.UNKNOWN_BOT, "Spider"),
            BotSignature.of("scraper", BotType.UNKNOWN_BOT, "Scraper")
    );

    private BotSignatures() {
    }

    /**
     * First signature matching the user agent; empty for a null or blank agent.
     */
    public static Optional<BotSignature> match(List<BotSignature> signatures, String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return Optional.empty();
        }
        for (BotSignature signature : signatures) {
            if (signature.matches(userAgent)) {
                return Optional.of(signature);
            }
        }
        return Optional.empty();
    }
}
