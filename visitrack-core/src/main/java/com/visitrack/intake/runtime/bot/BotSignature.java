package com.visitrack.intake.runtime.bot;

import com.visitrack.intake.api.model.BotType;

import java.util.regex.Pattern;

/**
 * One user-agent pattern with the bot it identifies.
 */
public record BotSignature(Pattern pattern, BotType type, String name) {

    static BotSignature of(String regex, BotType type, String name) {
        return new BotSignature(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), type, name);
    }

    public boolean matches(String userAgent) {
        return pattern.matcher(userAgent).find();
    }
}
