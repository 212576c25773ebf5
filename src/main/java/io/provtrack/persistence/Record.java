package io.provtrack.persistence;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The durable form of one object: its type tag, its oid and a payload in which
 * nested persistent objects appear only as reference stubs.
 */
public record Record(String oid, String type, ObjectNode data) {
    public static final String TYPE_KEY = "@type";
    public static final String OID_KEY = "@oid";
    public static final String REFERENCE_KEY = "@reference";
    public static final String VALUE_KEY = "@value";
    public static final String DATETIME_TYPE = "datetime";
}
