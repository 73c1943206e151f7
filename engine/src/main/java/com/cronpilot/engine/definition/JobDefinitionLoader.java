package com.cronpilot.engine.definition;

import com.cronpilot.engine.model.JobDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Reads job definition files (YAML or JSON) and turns them into validated
 * {@link JobDefinition}s.
 *
 * The format is picked from the file extension: .yaml / .yml are YAML,
 * everything else is JSON. Unknown keys are ignored; type mismatches are
 * reported as field errors like any other validation failure.
 */
@Component
public class JobDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(JobDefinitionLoader.class);

    public enum Format { JSON, YAML }

    private final ObjectMapper json = configure(new ObjectMapper());
    private final ObjectMapper yaml = configure(new ObjectMapper(new YAMLFactory()));

    private final JobDefinitionValidator validator;

    public JobDefinitionLoader(JobDefinitionValidator validator) {
        this.validator = validator;
    }

    /**
     * @throws JobValidationException if the file cannot be parsed or fails validation
     * @throws UncheckedIOException   if the file cannot be read
     */
    public JobDefinition load(Path file) {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read job file " + file, e);
        }
        JobDefinition job = parse(content, formatOf(file));
        log.info("Loaded job '{}' from {}", job.getId(), file);
        return job;
    }

    public JobDefinition parse(String content, Format format) {
        return validator.validate(read(content, format));
    }

    /** Parse without validating. */
    public JobSpec read(String content, Format format) {
        ObjectMapper mapper = format == Format.YAML ? yaml : json;
        try {
            JobSpec spec = mapper.readValue(content, JobSpec.class);
            if (spec == null) {
                throw new JobValidationException("$", "job definition is empty");
            }
            return spec;
        } catch (JsonMappingException e) {
            throw new JobValidationException(fieldPath(e), e.getOriginalMessage());
        } catch (JsonProcessingException e) {
            throw new JobValidationException("$", "malformed " + format.name().toLowerCase(Locale.ROOT)
                    + ": " + e.getOriginalMessage());
        }
    }

    static Format formatOf(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? Format.YAML : Format.JSON;
    }

    private static String fieldPath(JsonMappingException e) {
        if (e.getPath().isEmpty()) {
            return "$";
        }
        return e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."))
                .replace(".[", "[");
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
