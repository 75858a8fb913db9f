package com.scriptohio.orchestrator.config;

import com.scriptohio.orchestrator.agent.AgentTypes;
import com.scriptohio.orchestrator.agent.AgentUnavailableException;
import com.scriptohio.orchestrator.agent.InsightGeneratorAgent;
import com.scriptohio.orchestrator.agent.LearningNavigatorAgent;
import com.scriptohio.orchestrator.agent.ModelEngineAgent;
import com.scriptohio.orchestrator.agent.QualityAssuranceAgent;
import com.scriptohio.orchestrator.agent.SportsDataAgent;
import com.scriptohio.orchestrator.client.PredictionClient;
import com.scriptohio.orchestrator.client.SportsDataClient;
import com.scriptohio.orchestrator.service.CapabilityRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class AgentConfiguration {

    @Bean
    public CapabilityRegistry capabilityRegistry(OrchestratorProperties properties,
                                                 SportsDataClient sportsDataClient,
                                                 ObjectProvider<PredictionClient> predictionClient) {
        CapabilityRegistry registry = new CapabilityRegistry();
        PredictionClient predictions = predictionClient.getIfAvailable();
        if (predictions == null) {
            log.warn("No PredictionClient configured, model capabilities will be unavailable");
        }

        registry.register(AgentTypes.LEARNING_NAVIGATOR, LearningNavigatorAgent::new);
        registry.register(AgentTypes.INSIGHT_GENERATOR, InsightGeneratorAgent::new);
        registry.register(AgentTypes.MODEL_ENGINE, id -> new ModelEngineAgent(id, predictions));
        registry.register(AgentTypes.SPORTS_DATA, id -> new SportsDataAgent(id, sportsDataClient));
        registry.register(AgentTypes.QUALITY_ASSURANCE, QualityAssuranceAgent::new);

        for (OrchestratorProperties.AgentInstance instance : instances(properties)) {
            try {
                registry.create(instance.getType(), instance.getId());
            } catch (AgentUnavailableException | IllegalArgumentException e) {
                log.warn("Agent {} of type {} not started: {}", instance.getId(), instance.getType(), e.getMessage());
            }
        }

        registry.freeze();
        return registry;
    }

    // one instance per built-in type when none are configured
    static List<OrchestratorProperties.AgentInstance> instances(OrchestratorProperties properties) {
        if (!properties.getAgents().isEmpty()) {
            return properties.getAgents();
        }
        List<OrchestratorProperties.AgentInstance> defaults = new ArrayList<>();
        for (String type : List.of(AgentTypes.LEARNING_NAVIGATOR, AgentTypes.INSIGHT_GENERATOR,
            AgentTypes.MODEL_ENGINE, AgentTypes.SPORTS_DATA, AgentTypes.QUALITY_ASSURANCE)) {
            OrchestratorProperties.AgentInstance instance = new OrchestratorProperties.AgentInstance();
            instance.setType(type);
            instance.setId(type + "-1");
            defaults.add(instance);
        }
        return defaults;
    }
}
