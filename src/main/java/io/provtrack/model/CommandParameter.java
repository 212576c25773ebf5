package io.provtrack.model;

import io.provtrack.persistence.StateReader;

/** An argument that is neither an input nor an output path. */
public final class CommandParameter extends CommandSlot {

    public CommandParameter(String id, String name, String description, String value, String prefix, Integer position) {
        super(id, name, description, value, prefix, position);
    }

    @Override
    public SlotKind kind() {
        return SlotKind.PARAMETER;
    }

    @Override
    CommandParameter rebase(String oldPlanId, String newPlanId) {
        return new CommandParameter(rebaseId(id(), oldPlanId, newPlanId), name(), description(), defaultValue(), prefix(), position());
    }

    static CommandParameter read(StateReader in) {
        String[] common = readCommon(in);
        return new CommandParameter(common[0], common[1], common[2], common[3], common[4], in.integer("position"));
    }
}
