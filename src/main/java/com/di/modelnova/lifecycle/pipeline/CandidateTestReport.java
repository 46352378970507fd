package com.di.modelnova.lifecycle.pipeline;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class CandidateTestReport {
    boolean passed;
    /** Check name to outcome, in the order the checks ran. */
    Map<String, Boolean> checks;
    List<String> problems;
}
