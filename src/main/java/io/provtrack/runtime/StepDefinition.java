package io.provtrack.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.provtrack.model.Plan;
import io.provtrack.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A step as written in a JSON step file: the command and its slots. Inputs
 * and outputs are paths relative to the repository root; {@code removes}
 * lists paths the step deletes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepDefinition(
        String name,
        String command,
        String description,
        List<String> keywords,
        List<Integer> successCodes,
        List<Slot> inputs,
        List<Slot> outputs,
        List<Slot> parameters,
        List<String> removes
) {
    public StepDefinition {
        if (keywords == null) keywords = List.of();
        if (successCodes == null) successCodes = List.of();
        if (inputs == null) inputs = List.of();
        if (outputs == null) outputs = List.of();
        if (parameters == null) parameters = List.of();
        if (removes == null) removes = List.of();
    }

    public static StepDefinition read(Path file) {
        try {
            return Jsons.mapper().readValue(file.toFile(), StepDefinition.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read step file: " + file + ": " + e.getMessage(), e);
        }
    }

    public Plan toPlan() {
        Plan.Builder builder = Plan.builder()
                .name(name)
                .command(command)
                .description(description)
                .successCodes(successCodes);
        keywords.forEach(builder::keyword);
        for (Slot slot : inputs) {
            builder.input(slot.value(), slot.prefix(), slot.position());
        }
        for (Slot slot : outputs) {
            builder.output(slot.value(), slot.prefix(), slot.position(), Boolean.TRUE.equals(slot.createFolder()));
        }
        for (Slot slot : parameters) {
            builder.parameter(slot.value(), slot.prefix(), slot.position());
        }
        return builder.build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Slot(String value, String prefix, Integer position, Boolean createFolder) {
        public static Slot at(String value, Integer position) {
            return new Slot(value, null, position, null);
        }
    }
}
