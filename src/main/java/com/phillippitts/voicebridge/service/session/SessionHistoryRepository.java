package com.phillippitts.voicebridge.service.session;

import com.phillippitts.voicebridge.config.properties.BridgeProperties;
import com.phillippitts.voicebridge.domain.Speaker;
import com.phillippitts.voicebridge.domain.Turn;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Filesystem cache of session histories, one JSON document per session.
 *
 * <p>Layout of {@code <history-dir>/<session-id>.json}:
 * <pre>
 * {
 *   "session_id": "3f9a01bc",
 *   "history": [
 *     {"speaker": "user", "text": "bonjour", "at": "2024-05-01T10:00:00Z"},
 *     {"speaker": "assistant", "text": "Bonjour !", "at": "2024-05-01T10:00:02Z"}
 *   ]
 * }
 * </pre>
 *
 * <p>The cache is diagnostic only: read and write failures are logged and never fail a turn.
 */
@Component
public class SessionHistoryRepository {

    private static final Logger LOG = LogManager.getLogger(SessionHistoryRepository.class);

    private final Path directory;

    @Autowired
    public SessionHistoryRepository(BridgeProperties props) {
        this(Path.of(props.getHistoryDir()));
    }

    public SessionHistoryRepository(Path directory) {
        this.directory = directory;
    }

    /**
     * Loads a cached history.
     *
     * @return cached turns, or an empty list when there is no readable cache for {@code sessionId}
     */
    public List<Turn> load(String sessionId) {
        Path file = fileFor(sessionId);
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            JSONObject doc = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            JSONArray entries = doc.optJSONArray("history");
            if (entries == null) {
                return List.of();
            }
            List<Turn> turns = new ArrayList<>(entries.length());
            for (int i = 0; i < entries.length(); i++) {
                JSONObject entry = entries.getJSONObject(i);
                turns.add(new Turn(
                        Speaker.valueOf(entry.getString("speaker").toUpperCase(Locale.ROOT)),
                        entry.optString("text", ""),
                        Instant.parse(entry.getString("at"))));
            }
            LOG.debug("Restored {} history entries for session {}", turns.size(), sessionId);
            return turns;
        } catch (IOException | JSONException | DateTimeParseException | IllegalArgumentException e) {
            LOG.warn("Ignoring unreadable history cache {}: {}", file, e.toString());
            return List.of();
        }
    }

    /**
     * Replaces the cached history of {@code sessionId}.
     */
    public void save(String sessionId, List<Turn> history) {
        JSONArray entries = new JSONArray();
        for (Turn turn : history) {
            entries.put(new JSONObject()
                    .put("speaker", turn.speaker().name().toLowerCase(Locale.ROOT))
                    .put("text", turn.text())
                    .put("at", turn.at().toString()));
        }
        JSONObject doc = new JSONObject()
                .put("session_id", sessionId)
                .put("history", entries);

        Path file = fileFor(sessionId);
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, sessionId, ".tmp");
            Files.writeString(tmp, doc.toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            LOG.warn("Failed to cache history for session {} in {}: {}", sessionId, directory, e.toString());
            deleteTemp(tmp);
        }
    }

    private static void deleteTemp(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Failed to remove temporary history file {}: {}", tmp, e.toString());
        }
    }

    public void delete(String sessionId) {
        try {
            Files.deleteIfExists(fileFor(sessionId));
        } catch (IOException e) {
            LOG.warn("Failed to delete history cache of session {}: {}", sessionId, e.toString());
        }
    }

    Path fileFor(String sessionId) {
        if (!SessionStore.isValidId(sessionId)) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return directory.resolve(sessionId + ".json");
    }
}
