package com.visitrack.intake.runtime.geo;

import java.util.Map;
import java.util.Optional;

/**
 * Display names and representative timezones for common countries.
 */
final class CountryCatalog {

    private record Entry(String name, String timezone) {
    }

    private static final Map<String, Entry> ENTRIES = Map.ofEntries(
            Map.entry("US", new Entry("United States", "America/New_York")),
            Map.entry("CA", new Entry("Canada", "America/Toronto")),
            Map.entry("BR", new Entry("Brazil", "America/Sao_Paulo")),
            Map.entry("GB", new Entry("United Kingdom", "Europe/London")),
            Map.entry("DE", new Entry("Germany", "Europe/Berlin")),
            Map.entry("FR", new Entry("France", "Europe/Paris")),
            Map.entry("NL", new Entry("Netherlands", "Europe/Amsterdam")),
            Map.entry("CH", new Entry("Switzerland", "Europe/Zurich")),
            Map.entry("JP", new Entry("Japan", "Asia/Tokyo")),
            Map.entry("SG", new Entry("Singapore", "Asia/Singapore")),
            Map.entry("AU", new Entry("Australia", "Australia/Sydney"))
    );

    private CountryCatalog() {
    }

    static Optional<String> name(String countryCode) {
        Entry entry = countryCode == null ? null : ENTRIES.get(countryCode);
        return entry == null ? Optional.empty() : Optional.of(entry.name());
    }

    static Optional<String> timezone(String countryCode) {
        Entry entry = countryCode == null ? null : ENTRIES.get(countryCode);
        return entry == null ? Optional.empty() : Optional.of(entry.timezone());
    }
}
