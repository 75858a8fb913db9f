package com.scriptohio.orchestrator.store;

import com.scriptohio.orchestrator.config.OrchestratorProperties;
import com.scriptohio.orchestrator.model.SessionSummary;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Repository
public class JsonlSessionSummaryStore implements SessionSummaryStore {

    static final String FILE_NAME = "session-summaries.jsonl";

    private final JsonlRecordLog<SessionSummary> records;
    private Set<String> storedSessionIds;

    @Autowired
    public JsonlSessionSummaryStore(OrchestratorProperties properties) {
        this(Paths.get(properties.getMemory().getDataPath()));
    }

    public JsonlSessionSummaryStore(Path dataDir) {
        this.records = new JsonlRecordLog<>(dataDir.resolve(FILE_NAME), SessionSummary.class);
    }

    @Override
    public synchronized boolean save(SessionSummary summary) throws IOException {
        Set<String> known = storedSessionIds();
        if (known.contains(summary.getSessionId())) {
            return false;
        }
        records.append(summary);
        known.add(summary.getSessionId());
        return true;
    }

    @Override
    public synchronized List<SessionSummary> loadAll() throws IOException {
        List<SessionSummary> summaries = records.readAll();
        Set<String> seen = new HashSet<>();
        // a crash between append and index update can leave duplicates behind
        summaries.removeIf(summary -> !seen.add(summary.getSessionId()));
        storedSessionIds = seen;
        return summaries;
    }

    private Set<String> storedSessionIds() throws IOException {
        if (storedSessionIds == null) {
            loadAll();
        }
        return storedSessionIds;
    }
}
