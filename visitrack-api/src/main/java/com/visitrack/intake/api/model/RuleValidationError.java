package com.visitrack.intake.api.model;

/**
 * A problem found in one configured route rule.
 *
 * @param list    {@code include_only} or {@code exclude}
 * @param index   position of the entry in its list
 * @param pattern raw pattern, may be null
 * @param message what is wrong
 */
public record RuleValidationError(String list, int index, String pattern, String message) {

    @Override
    public String toString() {
        return list + "[" + index + "] '" + pattern + "': " + message;
    }
}
