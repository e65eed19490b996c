package com.lml.reservation.application.rules;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ticketing.rules.* 설정.
 * 구역 키는 대소문자 구분 없이 본다 (yml 키 정규화 때문에).
 */
@ConfigurationProperties(prefix = "ticketing.rules")
public record RulesProperties(
        @DefaultValue("8") int maxSeats,
        Map<String, Integer> minAgeBySection,
        @DefaultValue Alternatives alternatives
) {

    public RulesProperties {
        minAgeBySection = minAgeBySection == null ? Map.of()
                : minAgeBySection.entrySet().stream()
                        .collect(Collectors.toUnmodifiableMap(
                                e -> e.getKey().toUpperCase(Locale.ROOT), Map.Entry::getValue));
    }

    public record Alternatives(@DefaultValue("3") int maxSuggestions) {
    }

    public static RulesProperties defaults() {
        return new RulesProperties(8, Map.of(), new Alternatives(3));
    }

    public Integer minAgeFor(String sectionId) {
        return sectionId == null ? null : minAgeBySection.get(sectionId.toUpperCase(Locale.ROOT));
    }

    public boolean admits(String sectionId, Integer customerAge) {
        Integer minAge = minAgeFor(sectionId);
        return minAge == null || (customerAge != null && customerAge >= minAge);
    }
}
