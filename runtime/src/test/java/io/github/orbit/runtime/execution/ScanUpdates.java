package io.github.orbit.runtime.execution;

import io.github.orbit.protocol.api.ScanStatus;
import org.bson.Document;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/** Reads back the partial scan updates issued through {@code MongoTemplate.updateFirst}. */
final class ScanUpdates {

    private ScanUpdates() {}

    static Document setFields(Update update) {
        return (Document) update.getUpdateObject().get("$set");
    }

    static ScanStatus statusOf(Update update) {
        return (ScanStatus) setFields(update).get("status");
    }

    static String scanIdOf(Query query) {
        return (String) query.getQueryObject().get("_id");
    }
}
