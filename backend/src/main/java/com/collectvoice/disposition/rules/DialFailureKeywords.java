package com.collectvoice.disposition.rules;

import java.util.List;
import java.util.Locale;

public record DialFailureKeywords(
        List<String> busy,
        List<String> noAnswer,
        List<String> failed
) {

    public DialFailureKeywords {
        busy = normalize(busy);
        noAnswer = normalize(noAnswer);
        failed = normalize(failed);
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().map(value -> value.toLowerCase(Locale.ROOT)).toList();
    }
}
