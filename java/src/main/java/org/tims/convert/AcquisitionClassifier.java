package org.tims.convert;

import org.tims.core.AcquisitionMode;
import org.tims.core.Schema;
import org.tims.source.FrameInfo;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the acquisition mode of a frame from its scan mode and MS/MS type codes.
 * <p>
 * The lookup table is keyed by (schema, scan mode, MS/MS type); either code may be
 * a wildcard. An exact entry wins over a scan-mode wildcard, which wins over an
 * MS/MS-type wildcard. Pairs without an entry are administrative or calibration
 * frames and classify to nothing.
 */
public class AcquisitionClassifier {
    static final int ANY = -1;

    private static final Map<Key, AcquisitionMode> LC_TABLE = new HashMap<>();
    private static final Map<Key, AcquisitionMode> MALDI_TABLE = new HashMap<>();

    static {
        for (int scanMode : new int[]{0, 1, 2, 3, 4, 9, 10}) {
            LC_TABLE.put(new Key(Schema.TDF, scanMode, 0), AcquisitionMode.MS1);
        }
        LC_TABLE.put(new Key(Schema.TDF, 8, 0), AcquisitionMode.DDA_PASEF_PRECURSOR);
        LC_TABLE.put(new Key(Schema.TDF, 8, 8), AcquisitionMode.DDA_PASEF_PRODUCT);
        LC_TABLE.put(new Key(Schema.TDF, 9, 9), AcquisitionMode.DIA_PASEF);
        LC_TABLE.put(new Key(Schema.TDF, 10, 10), AcquisitionMode.PRM_PASEF);
        LC_TABLE.put(new Key(Schema.TDF, 4, 2), AcquisitionMode.BBCID);
        LC_TABLE.put(new Key(Schema.TDF, 3, 2), AcquisitionMode.ISCID);
        LC_TABLE.put(new Key(Schema.TDF, 2, 2), AcquisitionMode.MRM);

        for (int scanMode = 0; scanMode <= 4; scanMode++) {
            LC_TABLE.put(new Key(Schema.TSF, scanMode, 0), AcquisitionMode.MS1);
        }
        LC_TABLE.put(new Key(Schema.TSF, 1, 2), AcquisitionMode.AUTO_MSMS);
        LC_TABLE.put(new Key(Schema.TSF, 4, 2), AcquisitionMode.BBCID);
        LC_TABLE.put(new Key(Schema.TSF, 3, 2), AcquisitionMode.ISCID);
        LC_TABLE.put(new Key(Schema.TSF, 2, 2), AcquisitionMode.MRM);

        // BAF carries the mode in the acquisition key only
        LC_TABLE.put(new Key(Schema.BAF, 0, ANY), AcquisitionMode.MS1);
        LC_TABLE.put(new Key(Schema.BAF, 2, ANY), AcquisitionMode.AUTO_MSMS);
        LC_TABLE.put(new Key(Schema.BAF, 4, ANY), AcquisitionMode.ISCID);
        LC_TABLE.put(new Key(Schema.BAF, 5, ANY), AcquisitionMode.BBCID);

        for (Schema schema : new Schema[]{Schema.TDF, Schema.TSF}) {
            MALDI_TABLE.put(new Key(schema, ANY, 0), AcquisitionMode.MALDI_MS1);
            for (int msmsType : new int[]{2, 8, 9, 10}) {
                MALDI_TABLE.put(new Key(schema, ANY, msmsType), AcquisitionMode.MALDI_MS2);
            }
        }
    }

    private final Schema schema;
    private final Map<Key, AcquisitionMode> table;

    public AcquisitionClassifier(Schema schema, boolean maldi) {
        this.schema = schema;
        this.table = maldi ? MALDI_TABLE : LC_TABLE;
    }

    public Optional<AcquisitionMode> classify(FrameInfo frame) {
        return classify(frame.getScanMode(), frame.getMsmsType());
    }

    public Optional<AcquisitionMode> classify(int scanMode, int msmsType) {
        AcquisitionMode mode = table.get(new Key(schema, scanMode, msmsType));
        if (mode == null) {
            mode = table.get(new Key(schema, ANY, msmsType));
        }
        if (mode == null) {
            mode = table.get(new Key(schema, scanMode, ANY));
        }
        return Optional.ofNullable(mode);
    }

    /**
     * MS1-type frames start a new processing window.
     */
    public boolean isWindowBoundary(FrameInfo frame) {
        return classify(frame).map(m -> m.getMsLevel() == 1 && !m.isMaldi()).orElse(false);
    }

    private static final class Key {
        private final Schema schema;
        private final int scanMode;
        private final int msmsType;

        Key(Schema schema, int scanMode, int msmsType) {
            this.schema = schema;
            this.scanMode = scanMode;
            this.msmsType = msmsType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return schema == other.schema && scanMode == other.scanMode && msmsType == other.msmsType;
        }

        @Override
        public int hashCode() {
            return Objects.hash(schema, scanMode, msmsType);
        }
    }
}
