package tech.tokenstore.store;

import org.bson.Document;
import org.bson.types.Binary;

import java.time.Instant;
import java.util.Date;

/**
 * Canonical stored form of a grant.
 *
 * <p>For an authorization code the id is the (encoded) code itself. For an
 * access/refresh grant it is a generated TSID unrelated to the token strings.
 */
record BasicRecord(Object id, byte[] payload, Instant expiresAt) {

    Document toDocument() {
        return new Document(RecordFields.ID, id)
            .append(RecordFields.PAYLOAD, new Binary(payload))
            .append(RecordFields.EXPIRES_AT, Date.from(expiresAt));
    }

    static BasicRecord fromDocument(Document doc) {
        Object raw = doc.get(RecordFields.PAYLOAD);
        byte[] payload;
        if (raw instanceof Binary binary) {
            payload = binary.getData();
        } else if (raw instanceof byte[] bytes) {
            payload = bytes;
        } else {
            payload = null;
        }
        Date expiresAt = doc.getDate(RecordFields.EXPIRES_AT);
        return new BasicRecord(doc.get(RecordFields.ID), payload,
            expiresAt != null ? expiresAt.toInstant() : null);
    }
}
