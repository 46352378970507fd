package com.di.modelnova.lifecycle.backend;

import com.di.modelnova.config.LifecycleProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks: a location, enough records, a usable and unique column set. Datasets that could not be
 * inspected only get the location check.
 */
@Component
public class BasicDatasetValidator implements DatasetValidator {

    private final LifecycleProperties props;

    public BasicDatasetValidator(LifecycleProperties props) {
        this.props = props;
    }

    @Override
    public DataValidationReport validate(DatasetHandle dataset) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();

        boolean hasLocation = dataset != null && dataset.getLocation() != null && !dataset.getLocation().isBlank();
        checks.put("location", hasLocation);
        if (!hasLocation) {
            problems.add("dataset has no location");
            return DataValidationReport.builder().passed(false).checks(checks).problems(problems).build();
        }

        if (dataset.isInspected()) {
            long min = props.getPipeline().getMinTrainingRecords();
            boolean enough = dataset.getRecordCount() >= min;
            checks.put("record_count", enough);
            if (!enough) {
                problems.add("dataset has " + dataset.getRecordCount() + " records, need at least " + min);
            }

            List<String> columns = dataset.getColumns() != null ? dataset.getColumns() : List.of();
            boolean hasColumns = columns.size() >= 2 && columns.stream().noneMatch(String::isBlank);
            checks.put("columns_present", hasColumns);
            if (!hasColumns) {
                problems.add("dataset needs at least one feature and one label column");
            }

            Set<String> seen = new HashSet<>();
            List<String> duplicates = columns.stream().filter(c -> !seen.add(c)).collect(Collectors.toList());
            checks.put("columns_unique", duplicates.isEmpty());
            if (!duplicates.isEmpty()) {
                problems.add("duplicate columns: " + duplicates);
            }
        }
        return DataValidationReport.builder()
                .passed(problems.isEmpty())
                .checks(checks)
                .problems(problems)
                .build();
    }
}
