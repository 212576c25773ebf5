package io.provtrack.persistence;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns dirty objects into records. One writer lives for one commit and
 * remembers what it already wrote, so an object reachable from several dirty
 * roots is written once.
 *
 * <p>The walk uses an explicit stack: nested objects that are {@code NEW} or
 * {@code MODIFIED} are pushed, everything else is only referenced. Cycles
 * between dirty objects terminate because a written oid is never revisited.
 */
final class ObjectWriter {
    private final Database database;
    private final Map<String, PersistentObject> written = new LinkedHashMap<>();

    ObjectWriter(Database database) {
        this.database = database;
    }

    List<Record> serialize(PersistentObject root) {
        if (root.database() != database) {
            throw new IllegalStateException("Object is not associated with this database: " + root);
        }
        List<Record> out = new ArrayList<>();
        Deque<PersistentObject> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            PersistentObject object = stack.pop();
            if (object.oid() == null) {
                database.add(object);
            }
            if (written.containsKey(object.oid())) {
                continue;
            }
            written.put(object.oid(), object);

            ObjectNode data = JsonNodeFactory.instance.objectNode();
            data.put(Record.TYPE_KEY, object.type().typeName());
            data.put(Record.OID_KEY, object.oid());
            object.writeState(new StateWriter(data, nested -> referenceTo(nested, stack)));
            out.add(new Record(object.oid(), object.type().typeName(), data));
        }
        return out;
    }

    boolean hasWritten(String oid) {
        return written.containsKey(oid);
    }

    Collection<PersistentObject> written() {
        return written.values();
    }

    private ObjectNode referenceTo(PersistentObject nested, Deque<PersistentObject> stack) {
        if (nested.database() == null) {
            database.add(nested);
        } else if (nested.database() != database) {
            throw new ObjectAlreadyOwnedException(nested);
        }
        if (nested.isDirty() && !written.containsKey(nested.oid())) {
            stack.push(nested);
        }
        ObjectNode stub = JsonNodeFactory.instance.objectNode();
        stub.put(Record.TYPE_KEY, nested.type().typeName());
        stub.put(Record.OID_KEY, nested.oid());
        stub.put(Record.REFERENCE_KEY, true);
        return stub;
    }
}
