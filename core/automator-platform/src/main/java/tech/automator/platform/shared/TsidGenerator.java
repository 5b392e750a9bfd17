package tech.automator.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Identifier generation for every stored entity.
 * TSIDs are time-sortable, so default index order follows creation order.
 */
public class TsidGenerator {

    /**
     * Generate a new TSID in its 13-character Crockford base32 form.
     */
    public static String generate() {
        return TsidCreator.getTsid().toString();
    }

    private TsidGenerator() {
    }
}
