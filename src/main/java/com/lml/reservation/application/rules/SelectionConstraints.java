package com.lml.reservation.application.rules;

import java.util.Set;

/**
 * 고객 쪽 제약. 둘 다 없으면 제한 없음.
 *
 * @param customerAge       나이 제한 구역 판단용
 * @param allowedSectionIds 비어 있으면 모든 구역 허용
 */
public record SelectionConstraints(Integer customerAge, Set<String> allowedSectionIds) {

    public static SelectionConstraints none() {
        return new SelectionConstraints(null, Set.of());
    }

    public SelectionConstraints {
        allowedSectionIds = allowedSectionIds == null ? Set.of() : Set.copyOf(allowedSectionIds);
    }

    public boolean allowsSection(String sectionId) {
        return allowedSectionIds.isEmpty() || allowedSectionIds.contains(sectionId);
    }
}
