package tech.tokenstore.store;

/**
 * Field names shared by basic and index records.
 */
final class RecordFields {

    static final String ID = "_id";
    static final String PAYLOAD = "payload";
    static final String BASIC_ID = "basicId";
    static final String EXPIRES_AT = "expiresAt";

    private RecordFields() {
    }
}
