package com.scriptohio.orchestrator.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.scriptohio.orchestrator.config.OrchestratorProperties;
import com.scriptohio.orchestrator.model.ContextProfile;
import com.scriptohio.orchestrator.model.ContextResource;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class ContextProfileLoader {

    static final String RESTRICTED_ROLE = "restricted";
    static final double RESTRICTED_FRACTION = 0.25;

    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper;
    private final Map<String, ContextProfile> profiles = new ConcurrentHashMap<>();
    private volatile List<ContextResource> catalog = List.of();

    private String profilesLocation;
    private String catalogLocation;

    public ContextProfileLoader(ResourceLoader resourceLoader, OrchestratorProperties properties) {
        this.resourceLoader = resourceLoader;
        this.profilesLocation = properties.getContext().getProfilesLocation();
        this.catalogLocation = properties.getContext().getCatalogLocation();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void setProfilesLocation(String location) {
        this.profilesLocation = location;
    }

    public void setCatalogLocation(String location) {
        this.catalogLocation = location;
    }

    @PostConstruct
    public void load() {
        profiles.clear();
        ProfileFile profileFile = read(profilesLocation, ProfileFile.class);
        if (profileFile != null && profileFile.getProfiles() != null) {
            for (ContextProfile profile : profileFile.getProfiles()) {
                if (isValid(profile)) {
                    profiles.put(profile.getRole(), profile);
                    log.info("Loaded context profile {} (budget fraction {})",
                        profile.getRole(), profile.getTokenBudgetFraction());
                }
            }
        }

        CatalogFile catalogFile = read(catalogLocation, CatalogFile.class);
        catalog = catalogFile == null || catalogFile.getResources() == null
            ? List.of()
            : List.copyOf(catalogFile.getResources());
        log.info("Context catalog holds {} resources", catalog.size());
    }

    public Optional<ContextProfile> profile(String role) {
        return role == null ? Optional.empty() : Optional.ofNullable(profiles.get(role));
    }

    // smallest budget fraction; an empty profile when none are loaded
    public ContextProfile mostRestrictive() {
        return profiles.values().stream()
            .min(Comparator.comparingDouble(ContextProfile::getTokenBudgetFraction)
                .thenComparing(ContextProfile::getRole))
            .orElseGet(ContextProfileLoader::restricted);
    }

    public List<ContextProfile> profiles() {
        return new ArrayList<>(profiles.values());
    }

    public List<ContextResource> catalog() {
        return catalog;
    }

    private <T> T read(String location, Class<T> type) {
        if (location == null || location.isBlank()) {
            return null;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Context file not found: {}", location);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            return yamlMapper.readValue(in, type);
        } catch (IOException e) {
            log.error("Failed to load {}: {}", location, e.getMessage());
            return null;
        }
    }

    private static boolean isValid(ContextProfile profile) {
        if (profile.getRole() == null || profile.getRole().isBlank()) {
            log.warn("Skipping context profile without a role");
            return false;
        }
        double fraction = profile.getTokenBudgetFraction();
        if (fraction <= 0 || fraction > 1) {
            log.warn("Skipping context profile {}: budget fraction {} outside (0, 1]", profile.getRole(), fraction);
            return false;
        }
        return true;
    }

    private static ContextProfile restricted() {
        ContextProfile profile = new ContextProfile();
        profile.setRole(RESTRICTED_ROLE);
        profile.setTokenBudgetFraction(RESTRICTED_FRACTION);
        profile.setDataScope("none");
        return profile;
    }

    @Data
    static class ProfileFile {
        private List<ContextProfile> profiles = new ArrayList<>();
    }

    @Data
    static class CatalogFile {
        private List<ContextResource> resources = new ArrayList<>();
    }
}
