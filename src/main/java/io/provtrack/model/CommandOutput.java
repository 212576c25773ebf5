package io.provtrack.model;

import io.provtrack.persistence.StateReader;
import io.provtrack.persistence.StateWriter;

/** An output slot; its default value is the path pattern the plan produces. */
public final class CommandOutput extends CommandSlot {
    private final boolean createFolder;

    public CommandOutput(
            String id,
            String name,
            String description,
            String path,
            String prefix,
            Integer position,
            boolean createFolder
    ) {
        super(id, name, description, path, prefix, position);
        this.createFolder = createFolder;
    }

    public String produces() {
        return defaultValue();
    }

    public boolean createFolder() {
        return createFolder;
    }

    @Override
    public SlotKind kind() {
        return SlotKind.OUTPUT;
    }

    @Override
    public void writeTo(StateWriter out) {
        super.writeTo(out);
        out.bool("create_folder", createFolder);
    }

    @Override
    CommandOutput rebase(String oldPlanId, String newPlanId) {
        return new CommandOutput(rebaseId(id(), oldPlanId, newPlanId), name(), description(), defaultValue(), prefix(),
                position(), createFolder);
    }

    static CommandOutput read(StateReader in) {
        String[] common = readCommon(in);
        return new CommandOutput(common[0], common[1], common[2], common[3], common[4], in.integer("position"),
                in.bool("create_folder", false));
    }
}
