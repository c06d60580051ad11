package com.collectvoice.disposition.rules;

public enum RuleMatch {
    SHORT_CALL,
    SILENT,
    ANY_KEYWORD,
    ALL_KEYWORDS,
    WORD_COUNT
}
