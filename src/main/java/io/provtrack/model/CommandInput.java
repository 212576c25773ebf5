package io.provtrack.model;

import io.provtrack.persistence.StateReader;

/** An input slot; its default value is the path pattern the plan consumes. */
public final class CommandInput extends CommandSlot {

    public CommandInput(String id, String name, String description, String path, String prefix, Integer position) {
        super(id, name, description, path, prefix, position);
    }

    public String consumes() {
        return defaultValue();
    }

    @Override
    public SlotKind kind() {
        return SlotKind.INPUT;
    }

    @Override
    CommandInput rebase(String oldPlanId, String newPlanId) {
        return new CommandInput(rebaseId(id(), oldPlanId, newPlanId), name(), description(), defaultValue(), prefix(), position());
    }

    static CommandInput read(StateReader in) {
        String[] common = readCommon(in);
        return new CommandInput(common[0], common[1], common[2], common[3], common[4], in.integer("position"));
    }
}
