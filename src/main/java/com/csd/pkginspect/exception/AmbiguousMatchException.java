package com.csd.pkginspect.exception;

/**
 * No fuzzy candidate cleared the match threshold. Callers see it as a {@link NotFoundException};
 * the best-scoring candidate, if any, is kept as a suggestion.
 */
public class AmbiguousMatchException extends NotFoundException {

    private final String query;
    private final String suggestion;

    public AmbiguousMatchException(String query, String suggestion, String message) {
        super(suggestion == null ? message : message + " Did you mean '" + suggestion + "'?");
        this.query = query;
        this.suggestion = suggestion;
    }

    public String getQuery() {
        return query;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
