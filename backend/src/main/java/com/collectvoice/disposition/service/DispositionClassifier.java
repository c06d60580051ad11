package com.collectvoice.disposition.service;

import com.collectvoice.disposition.model.Disposition;
import com.collectvoice.disposition.model.Speaker;
import com.collectvoice.disposition.model.TranscriptItem;
import com.collectvoice.disposition.rules.DialFailureKeywords;
import com.collectvoice.disposition.rules.DispositionRule;
import com.collectvoice.disposition.rules.DispositionRuleTable;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class DispositionClassifier {

    private final DispositionRuleTable table;
    private final List<Pattern> datePatterns;

    public DispositionClassifier(DispositionRuleTable table) {
        this.table = table;
        this.datePatterns = table.compiledDatePatterns();
    }

    public Disposition classify(List<TranscriptItem> transcript, double callDurationSeconds) {
        String customerText = customerText(transcript);
        int words = wordCount(customerText);

        for (DispositionRule rule : table.rules()) {
            if (matches(rule, customerText, words, callDurationSeconds)) {
                if (rule.datedDisposition() != null && containsDate(customerText)) {
                    return rule.datedDisposition();
                }
                return rule.disposition();
            }
        }
        return table.fallback();
    }

    public Optional<Disposition> dispositionForDialFailure(String rawStatus) {
        if (rawStatus == null || rawStatus.isBlank()) {
            return Optional.empty();
        }
        String status = rawStatus.toLowerCase(Locale.ROOT);
        DialFailureKeywords keywords = table.dialFailure();
        if (containsAny(status, keywords.busy())) {
            return Optional.of(Disposition.BUSY);
        }
        if (containsAny(status, keywords.noAnswer())) {
            return Optional.of(Disposition.NO_ANSWER);
        }
        if (containsAny(status, keywords.failed())) {
            return Optional.of(Disposition.FAILED);
        }
        return Optional.empty();
    }

    private boolean matches(DispositionRule rule, String text, int words, double duration) {
        return switch (rule.match()) {
            case SHORT_CALL -> duration > 0 && duration < rule.maxDurationSeconds();
            case SILENT -> text.isBlank();
            case ANY_KEYWORD -> containsAny(text, rule.keywords()) && hasMoreWords(rule, words);
            case ALL_KEYWORDS -> rule.keywords().stream().allMatch(text::contains) && hasMoreWords(rule, words);
            case WORD_COUNT -> hasMoreWords(rule, words);
        };
    }

    private boolean hasMoreWords(DispositionRule rule, int words) {
        return rule.moreThanWords() == null || words > rule.moreThanWords();
    }

    private boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private boolean containsDate(String text) {
        for (Pattern pattern : datePatterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private String customerText(List<TranscriptItem> transcript) {
        if (transcript == null) {
            return "";
        }
        return transcript.stream()
                .filter(item -> item.speaker() == Speaker.CUSTOMER)
                .map(item -> item.text().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    private int wordCount(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return trimmed.split("\\s+").length;
    }
}
