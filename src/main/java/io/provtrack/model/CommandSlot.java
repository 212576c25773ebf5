package io.provtrack.model;

import io.provtrack.persistence.Embeddable;
import io.provtrack.persistence.StateReader;
import io.provtrack.persistence.StateWriter;
import io.provtrack.util.Hashing;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One argument slot of a {@link Plan}: an input path, an output path or a
 * plain parameter. Slots are embedded in the plan record.
 */
public abstract class CommandSlot implements Embeddable {
    private final String id;
    private final String name;
    private final String description;
    private final String defaultValue;
    private final String prefix;
    private final Integer position;

    protected CommandSlot(String id, String name, String description, String defaultValue, String prefix, Integer position) {
        this.id = Objects.requireNonNull(id, "slot id");
        this.description = description;
        this.defaultValue = defaultValue;
        this.prefix = prefix;
        this.position = position;
        this.name = name == null || name.isBlank() ? defaultName(prefix, position) : name;
    }

    public abstract SlotKind kind();

    /** Same slot, re-identified under another plan id. */
    abstract CommandSlot rebase(String oldPlanId, String newPlanId);

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String defaultValue() {
        return defaultValue;
    }

    public String prefix() {
        return prefix;
    }

    public Integer position() {
        return position;
    }

    public List<String> toArgv() {
        String value = defaultValue == null ? "" : defaultValue;
        if (value.contains(" ")) {
            value = "\"" + value + "\"";
        }
        if (prefix != null && !prefix.isEmpty()) {
            if (prefix.endsWith(" ")) {
                return List.of(prefix.substring(0, prefix.length() - 1), value);
            }
            return List.of(prefix + value);
        }
        return List.of(value);
    }

    @Override
    public String embeddedType() {
        return getClass().getSimpleName();
    }

    @Override
    public void writeTo(StateWriter out) {
        out.string("id", id)
                .string("name", name)
                .string("description", description)
                .string("default_value", defaultValue)
                .string("prefix", prefix)
                .integer("position", position);
    }

    static String generateId(String planId, SlotKind kind, Integer position) {
        String postfix = position != null ? String.valueOf(position) : Hashing.randomHex(16);
        return planId + "/" + kind.idSegment() + "/" + postfix;
    }

    static String rebaseId(String id, String oldPlanId, String newPlanId) {
        if (id.startsWith(oldPlanId)) {
            return newPlanId + id.substring(oldPlanId.length());
        }
        return id;
    }

    static String[] readCommon(StateReader in) {
        return new String[]{
                in.string("id"),
                in.string("name"),
                in.string("description"),
                in.string("default_value"),
                in.string("prefix")
        };
    }

    private String defaultName(String slotPrefix, Integer slotPosition) {
        String base = kind().defaultName();
        if (slotPrefix != null && !slotPrefix.isBlank()) {
            String slug = slotPrefix.strip().replaceAll("^[-=]+|[-=]+$", "")
                    .toLowerCase(Locale.ROOT)
                    .replaceAll("[^a-z0-9_]+", "-");
            if (!slug.isBlank()) {
                base = slug;
            }
        }
        String suffix = slotPosition != null ? String.valueOf(slotPosition) : Hashing.randomHex(3).substring(0, 5);
        return base + "-" + suffix;
    }

    @Override
    public String toString() {
        return kind().defaultName() + "(" + defaultValue + ")";
    }
}
