/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.TrackedAlertType;
import villagecompute.weatheralerts.exceptions.StateStoreException;

/**
 * Persists the last-notified alert snapshot to a local JSON file between poll cycles.
 *
 * <p>
 * The file holds a JSON array of {@link TrackedAlertType}. Each save replaces the whole snapshot: the new content is
 * written to a sibling temp file and moved over the target, so a crash mid-write leaves the previous snapshot intact.
 *
 * <p>
 * Neither {@link #load()} nor {@link #save(List)} throws. A missing, empty or corrupt file loads as an empty snapshot
 * (the next cycle then re-notifies every active alert); a failed save is logged and the previous file stays in place.
 */
@ApplicationScoped
public class AlertStateStore {

    private static final Logger LOG = Logger.getLogger(AlertStateStore.class);

    private static final TypeReference<List<TrackedAlertType>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final String stateFile;

    @Inject
    public AlertStateStore(ObjectMapper objectMapper, @ConfigProperty(
            name = "weather-alerts.state-file",
            defaultValue = "last_alerts.json") String stateFile) {
        this.objectMapper = objectMapper;
        this.stateFile = stateFile;
    }

    /**
     * Loads the last saved snapshot.
     *
     * @return tracked alerts, empty when no usable snapshot exists
     */
    public List<TrackedAlertType> load() {
        try {
            return readSnapshot();
        } catch (StateStoreException e) {
            LOG.warnf(e, "Could not read alert state from %s, starting from empty state", stateFile);
            return List.of();
        }
    }

    /**
     * Replaces the saved snapshot. Entries without an id are dropped and duplicate ids keep the last entry.
     *
     * @param alerts
     *            snapshot to persist
     */
    public void save(List<TrackedAlertType> alerts) {
        try {
            writeSnapshot(alerts);
            LOG.debugf("Saved %d tracked alerts to %s", alerts.size(), stateFile);
        } catch (StateStoreException e) {
            LOG.errorf(e, "Failed to save alert state to %s", stateFile);
        }
    }

    List<TrackedAlertType> readSnapshot() {
        Path path = path();
        if (!Files.exists(path)) {
            LOG.debugf("No alert state file at %s", path);
            return List.of();
        }

        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read state file " + path, e);
        }
        if (content.isBlank()) {
            return List.of();
        }

        List<TrackedAlertType> entries;
        try {
            entries = objectMapper.readValue(content, SNAPSHOT_TYPE);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("State file " + path + " is not a valid alert snapshot", e);
        }
        if (entries == null) {
            return List.of();
        }
        return entries.stream().filter(e -> e != null && e.id() != null).toList();
    }

    void writeSnapshot(List<TrackedAlertType> alerts) {
        Map<String, TrackedAlertType> byId = new LinkedHashMap<>();
        for (TrackedAlertType alert : alerts) {
            if (alert != null && alert.id() != null) {
                byId.put(alert.id(), alert);
            }
        }

        Path target = path().toAbsolutePath();
        Path temp = null;
        try {
            byte[] payload = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(new ArrayList<>(byId.values()));
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            Files.write(temp, payload);
            move(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StateStoreException("Failed to write state file " + target, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.debugf("Could not remove temp state file %s: %s", temp, e.getMessage());
        }
    }

    private Path path() {
        return Path.of(stateFile);
    }
}
