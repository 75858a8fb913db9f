package com.scriptohio.orchestrator.store;

import com.scriptohio.orchestrator.config.OrchestratorProperties;
import com.scriptohio.orchestrator.model.KnowledgeItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

@Repository
public class JsonlKnowledgeStore implements KnowledgeStore {

    static final String FILE_NAME = "knowledge.jsonl";

    private final JsonlRecordLog<KnowledgeItem> records;

    @Autowired
    public JsonlKnowledgeStore(OrchestratorProperties properties) {
        this(Paths.get(properties.getCollaboration().getDataPath()));
    }

    public JsonlKnowledgeStore(Path dataDir) {
        this.records = new JsonlRecordLog<>(dataDir.resolve(FILE_NAME), KnowledgeItem.class);
    }

    @Override
    public void append(KnowledgeItem item) throws IOException {
        records.append(item);
    }

    @Override
    public List<KnowledgeItem> loadAll() throws IOException {
        return records.readAll();
    }
}
