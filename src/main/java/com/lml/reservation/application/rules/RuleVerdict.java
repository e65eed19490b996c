package com.lml.reservation.application.rules;

import java.util.List;

public record RuleVerdict(RejectReason rejectReason, String message, List<String> warnings) {

    private static final RuleVerdict PASS = new RuleVerdict(null, null, List.of());

    public static RuleVerdict pass() {
        return PASS;
    }

    public static RuleVerdict warn(List<String> warnings) {
        return warnings.isEmpty() ? PASS : new RuleVerdict(null, null, List.copyOf(warnings));
    }

    public static RuleVerdict reject(RejectReason reason, String message) {
        return new RuleVerdict(reason, message, List.of());
    }

    public boolean rejected() {
        return rejectReason != null;
    }
}
