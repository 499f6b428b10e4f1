package com.hirepanel.core.service;

import com.hirepanel.core.model.EvaluationReport;

import java.util.List;

/**
 * Outcome of evaluating several candidates. Each entry either carries a report or the
 * reason that candidate could not be evaluated.
 */
public record BatchResult(
    int total,
    int successful,
    int failed,
    List<Entry> evaluations
) {

    public BatchResult {
        evaluations = List.copyOf(evaluations);
    }

    public static BatchResult of(List<Entry> entries) {
        int successful = (int) entries.stream().filter(Entry::success).count();
        return new BatchResult(entries.size(), successful, entries.size() - successful, entries);
    }

    /**
     * @param candidateName candidate as submitted
     * @param report        the evaluation, or null when it failed
     * @param error         why the evaluation failed, or null on success
     */
    public record Entry(String candidateName, EvaluationReport report, String error) {

        public static Entry succeeded(String candidateName, EvaluationReport report) {
            return new Entry(candidateName, report, null);
        }

        public static Entry failed(String candidateName, String error) {
            return new Entry(candidateName, null, error);
        }

        public boolean success() {
            return report != null;
        }
    }
}
