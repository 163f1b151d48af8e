/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


import io.docvalue.model.FieldMask;
import io.docvalue.model.FieldPath;
import io.docvalue.model.ObjectValue;
import io.docvalue.model.ServerTimestamps;
import io.docvalue.values.FieldValue;
import io.docvalue.values.StringValue;
import io.docvalue.values.TimestampValue;

/**
 * Edits a document field by field, applies a sparse patch to it and
 * inspects the result.
 * <p>
 * To run:
 * <pre>
 *   java -cp .:docvalue-core.jar:jackson-core.jar SparsePatchExample
 * </pre>
 */
public class SparsePatchExample {

    public static void main(String[] args) throws Exception {

        /* Start from a JSON document */
        ObjectValue doc = ObjectValue.fromJson(
            "{\"title\": \"Draft\", " +
            "\"author\": {\"name\": \"Tracy\", \"email\": \"t@example.com\"}," +
            " \"tags\": [\"a\", \"b\"]}");
        System.out.println("Initial document: " + doc.toJson());

        /* Single field edits */
        doc.set(FieldPath.fromDotSeparated("author.name"),
                new StringValue("Tracy Smith"));
        doc.set(FieldPath.fromDotSeparated("stats.views"),
                new StringValue("none yet"));
        doc.delete(FieldPath.fromDotSeparated("author.email"));
        System.out.println("After edits: " + doc.toJson());
        System.out.println("Fields: " + doc.toFieldMask());

        /*
         * A patch names the fields it touches. Fields in the mask that the
         * patch does not carry are deleted; everything else is left alone.
         */
        TimestampValue writeTime = TimestampValue.now();
        ObjectValue patch = new ObjectValue();
        patch.set(FieldPath.of("title"), new StringValue("Published"));
        patch.set(FieldPath.of("updated"),
                  ServerTimestamps.create(writeTime, null));
        FieldMask mask = FieldMask.of(FieldPath.of("title"),
                                      FieldPath.of("updated"),
                                      FieldPath.of("stats", "views"));
        doc.setAll(mask, patch);
        System.out.println("After patch: " + doc.toJson());

        /* The pending timestamp shows its local write time until resolved */
        FieldValue updated = doc.get(FieldPath.of("updated"));
        if (ServerTimestamps.isServerTimestamp(updated)) {
            System.out.println("Update time pending, local estimate: " +
                ServerTimestamps.getLocalWriteTime(updated)
                .asTimestamp().toIsoString());
        }

        /* Empty parents are kept */
        System.out.println("stats: " +
                           doc.get(FieldPath.of("stats")).toJson());
        System.out.println("Canonical form: " + doc);
    }
}
