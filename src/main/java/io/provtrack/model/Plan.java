package io.provtrack.model;

import io.provtrack.persistence.PersistentObject;
import io.provtrack.persistence.PersistentType;
import io.provtrack.persistence.StateReader;
import io.provtrack.persistence.StateWriter;
import io.provtrack.util.Hashing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A reusable command-line step: the command plus ordered input, output and
 * parameter slots. Plans are immutable once built; the only changes allowed
 * are {@link #invalidate(Instant)} and deriving a new plan.
 */
public final class Plan extends PersistentObject {
    public static final int MAX_GENERATED_NAME_LENGTH = 25;
    private static final String ID_PREFIX = "/plans/";

    private String id;
    private String name;
    private String command;
    private String description;
    private List<String> keywords = new ArrayList<>();
    private List<Integer> successCodes = new ArrayList<>(List.of(0));
    private List<CommandInput> inputs = new ArrayList<>();
    private List<CommandOutput> outputs = new ArrayList<>();
    private List<CommandParameter> parameters = new ArrayList<>();
    private Instant invalidatedAt;
    private String derivedFrom;

    Plan() {
    }

    private Plan(Builder builder) {
        this.id = builder.id != null ? builder.id : generateId();
        this.command = builder.command;
        this.description = builder.description;
        this.keywords = new ArrayList<>(builder.keywords);
        this.successCodes = builder.successCodes.isEmpty() ? new ArrayList<>(List.of(0)) : new ArrayList<>(builder.successCodes);
        for (SlotSpec spec : builder.slots) {
            String slotId = CommandSlot.generateId(id, spec.kind(), spec.position());
            switch (spec.kind()) {
                case INPUT -> inputs.add(new CommandInput(slotId, spec.name(), null, spec.value(), spec.prefix(), spec.position()));
                case OUTPUT -> outputs.add(new CommandOutput(slotId, spec.name(), null, spec.value(), spec.prefix(),
                        spec.position(), spec.createFolder()));
                case PARAMETER -> parameters.add(new CommandParameter(slotId, spec.name(), null, spec.value(), spec.prefix(),
                        spec.position()));
            }
        }
        this.derivedFrom = builder.derivedFrom;
        this.name = builder.name == null || builder.name.isBlank() ? defaultName() : builder.name;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static String generateId() {
        return ID_PREFIX + UUID.randomUUID();
    }

    @Override
    public PersistentType type() {
        return ModelType.PLAN;
    }

    @Override
    protected String naturalId() {
        return id;
    }

    public String id() {
        activate();
        return id;
    }

    public String name() {
        activate();
        return name;
    }

    public String command() {
        activate();
        return command;
    }

    public String description() {
        activate();
        return description;
    }

    public List<String> keywords() {
        activate();
        return Collections.unmodifiableList(keywords);
    }

    public List<Integer> successCodes() {
        activate();
        return Collections.unmodifiableList(successCodes);
    }

    public List<CommandInput> inputs() {
        activate();
        return Collections.unmodifiableList(inputs);
    }

    public List<CommandOutput> outputs() {
        activate();
        return Collections.unmodifiableList(outputs);
    }

    public List<CommandParameter> parameters() {
        activate();
        return Collections.unmodifiableList(parameters);
    }

    public Instant invalidatedAt() {
        activate();
        return invalidatedAt;
    }

    public boolean isInvalidated() {
        return invalidatedAt() != null;
    }

    public String derivedFrom() {
        activate();
        return derivedFrom;
    }

    public void invalidate(Instant at) {
        Objects.requireNonNull(at, "at");
        changed();
        invalidatedAt = at;
    }

    /**
     * True when both plans would run the same command over the same paths:
     * equal command, equal success codes, and equal sets of input patterns,
     * output patterns and (position, prefix, value) parameters.
     */
    public boolean isSimilarTo(Plan other) {
        if (other == this) {
            return true;
        }
        return Objects.equals(command(), other.command())
                && new HashSet<>(successCodes()).equals(new HashSet<>(other.successCodes()))
                && inputPatterns(this).equals(inputPatterns(other))
                && outputPatterns(this).equals(outputPatterns(other))
                && parameterKeys(this).equals(parameterKeys(other));
    }

    public List<String> toArgv() {
        activate();
        List<CommandSlot> positioned = new ArrayList<>();
        positioned.addAll(inputs);
        positioned.addAll(outputs);
        positioned.addAll(parameters);
        positioned.removeIf(slot -> slot.position() == null);
        positioned.sort(Comparator.comparing(CommandSlot::position));

        List<String> argv = new ArrayList<>();
        if (command != null && !command.isBlank()) {
            for (String part : command.split(" ")) {
                if (!part.isEmpty()) {
                    argv.add(part);
                }
            }
        }
        for (CommandSlot slot : positioned) {
            argv.addAll(slot.toArgv());
        }
        return argv;
    }

    /**
     * Gives a plan that has never been stored a fresh identifier, keeping
     * everything else. Used when another plan already owns the identifier.
     */
    public void assignNewId() {
        if (database() != null) {
            throw new IllegalStateException("Cannot re-identify a stored plan: " + id);
        }
        String oldId = id;
        String newId = generateId();
        id = newId;
        inputs = rebase(inputs, oldId, newId);
        outputs = rebase(outputs, oldId, newId);
        parameters = rebase(parameters, oldId, newId);
        resetOid();
    }

    /** A copy of this plan under a new identifier that records where it came from. */
    public Plan derive() {
        activate();
        Plan copy = new Plan();
        copy.id = generateId();
        copy.name = name;
        copy.command = command;
        copy.description = description;
        copy.keywords = new ArrayList<>(keywords);
        copy.successCodes = new ArrayList<>(successCodes);
        copy.inputs = rebase(inputs, id, copy.id);
        copy.outputs = rebase(outputs, id, copy.id);
        copy.parameters = rebase(parameters, id, copy.id);
        copy.derivedFrom = id;
        return copy;
    }

    @Override
    protected void writeState(StateWriter out) {
        out.string("id", id)
                .string("name", name)
                .string("command", command)
                .string("description", description)
                .strings("keywords", keywords)
                .integers("success_codes", successCodes)
                .embeddedList("inputs", inputs)
                .embeddedList("outputs", outputs)
                .embeddedList("parameters", parameters)
                .instant("invalidated_at", invalidatedAt)
                .string("derived_from", derivedFrom);
    }

    @Override
    protected void readState(StateReader in) {
        id = in.string("id");
        name = in.string("name");
        command = in.string("command");
        description = in.string("description");
        keywords = in.strings("keywords");
        successCodes = in.has("success_codes") ? in.integers("success_codes") : new ArrayList<>(List.of(0));
        inputs = in.embeddedList("inputs", CommandInput::read);
        outputs = in.embeddedList("outputs", CommandOutput::read);
        parameters = in.embeddedList("parameters", CommandParameter::read);
        invalidatedAt = in.instant("invalidated_at");
        derivedFrom = in.string("derived_from");
    }

    @Override
    public String toString() {
        String value = name();
        return value != null ? value : super.toString();
    }

    private String defaultName() {
        String joined = String.join("-", toArgv());
        if (joined.isBlank()) {
            return Hashing.randomHex(16).substring(0, MAX_GENERATED_NAME_LENGTH);
        }
        String safe = secureFilename(joined);
        int randLength = 5;
        int keep = Math.min(safe.length(), MAX_GENERATED_NAME_LENGTH - randLength - 1);
        return safe.substring(0, keep) + "-" + Hashing.randomHex(3).substring(0, randLength);
    }

    private static String secureFilename(String raw) {
        String value = raw.replace('/', '_').replace('\\', '_').replace(' ', '_');
        value = value.replaceAll("[^A-Za-z0-9_.-]", "");
        value = value.replaceAll("^[._]+|[._]+$", "");
        return value.isEmpty() ? "plan" : value;
    }

    @SuppressWarnings("unchecked")
    private static <T extends CommandSlot> List<T> rebase(List<T> slots, String oldId, String newId) {
        List<T> out = new ArrayList<>(slots.size());
        for (T slot : slots) {
            out.add((T) slot.rebase(oldId, newId));
        }
        return out;
    }

    private static Set<String> inputPatterns(Plan plan) {
        Set<String> out = new HashSet<>();
        for (CommandInput input : plan.inputs()) {
            out.add(input.consumes());
        }
        return out;
    }

    private static Set<String> outputPatterns(Plan plan) {
        Set<String> out = new HashSet<>();
        for (CommandOutput output : plan.outputs()) {
            out.add(output.produces());
        }
        return out;
    }

    private static Set<List<Object>> parameterKeys(Plan plan) {
        Set<List<Object>> out = new HashSet<>();
        for (CommandParameter parameter : plan.parameters()) {
            out.add(Arrays.asList(parameter.position(), parameter.prefix(), parameter.defaultValue()));
        }
        return out;
    }

    private record SlotSpec(SlotKind kind, String name, String value, String prefix, Integer position, boolean createFolder) {
    }

    public static final class Builder {
        private String id;
        private String name;
        private String command;
        private String description;
        private String derivedFrom;
        private final List<String> keywords = new ArrayList<>();
        private final List<Integer> successCodes = new ArrayList<>();
        private final List<SlotSpec> slots = new ArrayList<>();

        private Builder() {
        }

        public Builder id(String value) {
            this.id = value;
            return this;
        }

        public Builder name(String value) {
            this.name = value;
            return this;
        }

        public Builder command(String value) {
            this.command = value;
            return this;
        }

        public Builder description(String value) {
            this.description = value;
            return this;
        }

        public Builder derivedFrom(String value) {
            this.derivedFrom = value;
            return this;
        }

        public Builder keyword(String value) {
            keywords.add(value);
            return this;
        }

        public Builder successCodes(List<Integer> values) {
            successCodes.clear();
            if (values != null) {
                successCodes.addAll(values);
            }
            return this;
        }

        public Builder input(String path, String prefix, Integer position) {
            slots.add(new SlotSpec(SlotKind.INPUT, null, requirePath(path), prefix, position, false));
            return this;
        }

        public Builder input(String path) {
            return input(path, null, null);
        }

        public Builder output(String path, String prefix, Integer position, boolean createFolder) {
            slots.add(new SlotSpec(SlotKind.OUTPUT, null, requirePath(path), prefix, position, createFolder));
            return this;
        }

        public Builder output(String path) {
            return output(path, null, null, false);
        }

        public Builder parameter(String value, String prefix, Integer position) {
            slots.add(new SlotSpec(SlotKind.PARAMETER, null, value, prefix, position, false));
            return this;
        }

        public Plan build() {
            if ((command == null || command.isBlank()) && slots.isEmpty()) {
                throw new IllegalArgumentException("plan needs a command or at least one slot");
            }
            return new Plan(this);
        }

        private static String requirePath(String path) {
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("slot path cannot be empty");
            }
            return path;
        }
    }
}
