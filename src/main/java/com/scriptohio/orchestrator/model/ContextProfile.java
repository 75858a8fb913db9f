package com.scriptohio.orchestrator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
public class ContextProfile {
    private String role;
    private double tokenBudgetFraction;
    private String dataScope;

    // highest priority first
    private List<String> focusAreas = new ArrayList<>();

    private List<String> notebooks = new ArrayList<>();
    private List<String> models = new ArrayList<>();
    private List<String> features = new ArrayList<>();

    public Set<String> visibleResources() {
        Set<String> visible = new HashSet<>(notebooks);
        visible.addAll(models);
        visible.addAll(features);
        return visible;
    }

    public boolean isVisible(ContextResource resource) {
        return (resource.getFocusArea() != null && focusAreas.contains(resource.getFocusArea()))
            || visibleResources().contains(resource.getId());
    }

    // resources visible only by id sort after every focus area
    public int priorityOf(ContextResource resource) {
        int index = resource.getFocusArea() == null ? -1 : focusAreas.indexOf(resource.getFocusArea());
        return index < 0 ? focusAreas.size() : index;
    }
}
