package tech.tokenstore.store;

import org.bson.Document;

import java.time.Instant;
import java.util.Date;

/**
 * Maps an access or refresh token to the basic record that owns it.
 * The reference is by value only; the target may already be gone.
 */
record IndexRecord(Object id, String basicId, Instant expiresAt) {

    Document toDocument() {
        return new Document(RecordFields.ID, id)
            .append(RecordFields.BASIC_ID, basicId)
            .append(RecordFields.EXPIRES_AT, Date.from(expiresAt));
    }

    static IndexRecord fromDocument(Document doc) {
        Date expiresAt = doc.getDate(RecordFields.EXPIRES_AT);
        return new IndexRecord(doc.get(RecordFields.ID), doc.getString(RecordFields.BASIC_ID),
            expiresAt != null ? expiresAt.toInstant() : null);
    }
}
