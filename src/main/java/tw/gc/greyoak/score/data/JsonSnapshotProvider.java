package tw.gc.greyoak.score.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.greyoak.score.AppConstants;
import tw.gc.greyoak.score.config.ScoringConfig;
import tw.gc.greyoak.score.model.InstrumentSnapshot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code <data-dir>/<yyyy-MM-dd>.json}, a JSON array of snapshots.
 * Snapshots without an asOfDate take the file's date.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonSnapshotProvider implements SnapshotProvider {

    private static final TypeReference<List<InstrumentSnapshot>> SNAPSHOT_LIST = new TypeReference<>() { };

    private final ObjectMapper objectMapper;
    private final ScoringConfig config;

    @Override
    public List<InstrumentSnapshot> loadUniverse(LocalDate date) {
        Path file = snapshotFile(date);
        if (!Files.isRegularFile(file)) {
            log.warn("⚠️ No snapshot file for {} at {}", date, file.toAbsolutePath());
            return List.of();
        }
        try {
            List<InstrumentSnapshot> snapshots = objectMapper.readValue(file.toFile(), SNAPSHOT_LIST);
            List<InstrumentSnapshot> dated = new ArrayList<>(snapshots.size());
            for (InstrumentSnapshot snapshot : snapshots) {
                dated.add(snapshot.getAsOfDate() == null ? snapshot.toBuilder().asOfDate(date).build() : snapshot);
            }
            log.info("📂 Loaded {} snapshots for {}", dated.size(), date);
            return dated;
        } catch (IOException e) {
            log.warn("⚠️ Unreadable snapshot file {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Unreadable snapshot file " + file, e);
        }
    }

    Path snapshotFile(LocalDate date) {
        return Path.of(config.getDataDir()).resolve(date + AppConstants.SNAPSHOT_FILE_SUFFIX);
    }
}
