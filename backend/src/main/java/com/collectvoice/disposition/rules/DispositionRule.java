package com.collectvoice.disposition.rules;

import com.collectvoice.disposition.model.Disposition;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

public record DispositionRule(
        int priority,
        String name,
        RuleMatch match,
        List<String> keywords,
        Integer moreThanWords,
        Double maxDurationSeconds,
        Disposition disposition,
        Disposition datedDisposition
) {

    public DispositionRule {
        Objects.requireNonNull(match, "match must not be null");
        Objects.requireNonNull(disposition, "disposition must not be null");
        keywords = keywords == null
                ? List.of()
                : keywords.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT)).toList();
        if ((match == RuleMatch.ANY_KEYWORD || match == RuleMatch.ALL_KEYWORDS) && keywords.isEmpty()) {
            throw new IllegalArgumentException("Rule " + name + " needs at least one keyword");
        }
        if (match == RuleMatch.SHORT_CALL && maxDurationSeconds == null) {
            throw new IllegalArgumentException("Rule " + name + " needs maxDurationSeconds");
        }
        if (match == RuleMatch.WORD_COUNT && moreThanWords == null) {
            throw new IllegalArgumentException("Rule " + name + " needs moreThanWords");
        }
    }
}
