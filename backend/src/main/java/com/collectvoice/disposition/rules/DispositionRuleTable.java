package com.collectvoice.disposition.rules;

import com.collectvoice.disposition.model.Disposition;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

public record DispositionRuleTable(
        List<String> datePatterns,
        List<DispositionRule> rules,
        Disposition fallback,
        DialFailureKeywords dialFailure
) {

    public DispositionRuleTable {
        Objects.requireNonNull(fallback, "fallback must not be null");
        datePatterns = datePatterns == null ? List.of() : List.copyOf(datePatterns);
        rules = rules == null
                ? List.of()
                : rules.stream().sorted(Comparator.comparingInt(DispositionRule::priority)).toList();
        dialFailure = dialFailure == null ? new DialFailureKeywords(null, null, null) : dialFailure;
    }

    @JsonIgnore
    public List<Pattern> compiledDatePatterns() {
        return datePatterns.stream()
                .map(pattern -> Pattern.compile(pattern, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public static DispositionRuleTable load(InputStream inputStream, ObjectMapper objectMapper) {
        try {
            DispositionRuleTable table = objectMapper.readValue(inputStream, DispositionRuleTable.class);
            if (table.rules().isEmpty()) {
                throw new IllegalStateException("Disposition rule table has no rules");
            }
            return table;
        } catch (IOException exception) {
            throw new IllegalStateException("Unable to read disposition rule table", exception);
        }
    }
}
