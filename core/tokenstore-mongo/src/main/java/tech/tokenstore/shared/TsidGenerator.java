package tech.tokenstore.shared;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Centralized TSID generation for primary record ids.
 * TSID (Time-Sorted ID) provides:
 * - Time-sortable (creation order preserved)
 * - Compact 13 character string form
 * - No coordination needed between store instances
 */
public class TsidGenerator {

    /**
     * Generate a new TSID in its canonical string form.
     */
    public static String generate() {
        return TsidCreator.getTsid().toString();
    }

    private TsidGenerator() {
        // Utility class
    }
}
