package com.scriptohio.orchestrator.store;

import com.scriptohio.orchestrator.model.KnowledgeItem;

import java.io.IOException;
import java.util.List;

public interface KnowledgeStore {

    void append(KnowledgeItem item) throws IOException;

    List<KnowledgeItem> loadAll() throws IOException;
}
