package com.di.modelnova.lifecycle.backend;

import com.di.modelnova.config.TrainingBackendProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Resolves the dataset location from {@code modelnova.training.data-path-template}. Local CSV files are inspected
 * (header columns, record count); URIs with a scheme such as {@code gs://} are handed to the backend as-is.
 */
@Slf4j
@Component
public class TemplateTrainingDataSource implements TrainingDataSource {

    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final Pattern REMOTE = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");

    private final TrainingBackendProperties props;
    private final Clock clock;

    public TemplateTrainingDataSource(TrainingBackendProperties props) {
        this(props, Clock.systemUTC());
    }

    TemplateTrainingDataSource(TrainingBackendProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    @Override
    public DatasetHandle acquire(String modelFamily) throws DatasetException {
        if (modelFamily == null || modelFamily.isBlank()) {
            throw new DatasetException("Model family is required to locate training data");
        }
        String date = LocalDate.now(clock.withZone(ZoneOffset.UTC)).format(DATE);
        String location = props.getDataPathTemplate()
                .replace("{family}", modelFamily)
                .replace("{date}", date);
        DatasetHandle.DatasetHandleBuilder handle = DatasetHandle.builder()
                .datasetId(modelFamily + "_" + date + "_" + UUID.randomUUID().toString().substring(0, 8))
                .modelFamily(modelFamily)
                .location(location)
                .acquiredAt(Instant.now(clock));
        if (REMOTE.matcher(location).matches() && !location.startsWith("file:")) {
            log.info("[PIPELINE] Remote dataset location, not inspected: {}", location);
            return handle.build();
        }
        Path path = Path.of(location.startsWith("file:") ? location.substring("file:".length()) : location);
        if (!Files.isRegularFile(path)) {
            throw new DatasetException("Training data not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null || header.isBlank()) {
                throw new DatasetException("Training data has no header: " + path);
            }
            List<String> columns = new ArrayList<>();
            Arrays.stream(header.split(",")).map(String::trim).forEach(columns::add);
            long records = reader.lines().filter(line -> !line.isBlank()).count();
            return handle.columns(columns).recordCount(records).build();
        } catch (IOException e) {
            throw new DatasetException("Training data unreadable: " + path + " -> " + e.getMessage(), e);
        }
    }
}
