package com.scriptohio.orchestrator.store;

import com.scriptohio.orchestrator.model.SessionSummary;

import java.io.IOException;
import java.util.List;

public interface SessionSummaryStore {

    // false when the session id is already stored
    boolean save(SessionSummary summary) throws IOException;

    List<SessionSummary> loadAll() throws IOException;
}
