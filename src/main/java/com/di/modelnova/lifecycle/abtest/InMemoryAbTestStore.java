package com.di.modelnova.lifecycle.abtest;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(name = "modelnova.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryAbTestStore implements AbTestStore {

    private final Map<String, AbTest> byId = new ConcurrentHashMap<>();

    @Override
    public void save(AbTest test) {
        if (test == null || test.getTestId() == null) return;
        byId.put(test.getTestId(), test);
    }

    @Override
    public Optional<AbTest> findById(String testId) {
        return testId == null ? Optional.empty() : Optional.ofNullable(byId.get(testId));
    }

    @Override
    public Optional<AbTest> update(String testId, UnaryOperator<AbTest> change) {
        if (testId == null) return Optional.empty();
        return Optional.ofNullable(byId.computeIfPresent(testId, (id, current) -> change.apply(current)));
    }

    @Override
    public List<AbTest> findByStatus(AbTestStatus status) {
        return byId.values().stream()
                .filter(t -> t.getStatus() == status)
                .sorted(Comparator.comparing(AbTest::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<AbTest> findRecent(int limit) {
        return byId.values().stream()
                .sorted(Comparator.comparing(AbTest::getCreatedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }
}
