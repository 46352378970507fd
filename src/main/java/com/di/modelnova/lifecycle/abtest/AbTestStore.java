package com.di.modelnova.lifecycle.abtest;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface AbTestStore {

    void save(AbTest test);

    Optional<AbTest> findById(String testId);

    /**
     * Atomically replaces the test with {@code change.apply(current)}. Returns the stored result, or empty when
     * the test does not exist.
     */
    Optional<AbTest> update(String testId, UnaryOperator<AbTest> change);

    List<AbTest> findByStatus(AbTestStatus status);

    /** Newest first. */
    List<AbTest> findRecent(int limit);
}
