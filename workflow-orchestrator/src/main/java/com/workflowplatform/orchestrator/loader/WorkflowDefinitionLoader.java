package com.workflowplatform.orchestrator.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflowplatform.common.exception.ConfigurationException;
import com.workflowplatform.common.model.Workflow;
import com.workflowplatform.common.validation.WorkflowValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads workflow definitions authored as JSON and validates them before they reach the executor.
 * Every method either returns a valid {@link Workflow} or throws {@link ConfigurationException}.
 */
@Component
public class WorkflowDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDefinitionLoader.class);

    private final ObjectMapper objectMapper;
    private final WorkflowValidator validator;

    public WorkflowDefinitionLoader(ObjectMapper objectMapper, WorkflowValidator validator) {
        this.objectMapper = objectMapper;
        this.validator    = validator;
    }

    public Workflow load(String json) {
        Workflow workflow;
        try {
            workflow = objectMapper.readValue(json, Workflow.class);
        } catch (JsonProcessingException e) {
            throw unreadable(e);
        }
        return validated(workflow);
    }

    public Workflow load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return validated(objectMapper.readValue(in, Workflow.class));
        } catch (JsonProcessingException e) {
            throw unreadable(e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read workflow definition " + path, e);
        }
    }

    public Workflow load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return validated(objectMapper.readValue(in, Workflow.class));
        } catch (JsonProcessingException e) {
            throw unreadable(e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read workflow definition " + resource.getDescription(), e);
        }
    }

    private Workflow validated(Workflow workflow) {
        validator.requireValid(workflow);
        log.info("Workflow definition loaded. workflowId={} name={} stages={}",
            workflow.id(), workflow.name(), workflow.stages().size());
        return workflow;
    }

    private static ConfigurationException unreadable(JsonProcessingException e) {
        log.warn("Workflow definition rejected. reason={}", e.getOriginalMessage());
        return new ConfigurationException("Unreadable workflow definition: " + e.getOriginalMessage());
    }
}
