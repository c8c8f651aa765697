package com.csd.pkginspect.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ComparisonResult {
    private String packageName;
    private String field;
    private RuntimeVersion runtimeA;
    private RuntimeVersion runtimeB;
    private Object valueA;
    private Object valueB;
    private ComparisonOperator operator;  // null when only the pair was requested
    private Boolean outcome;              // null when no operator was given
}
