package org.tims.convert;

import org.tims.convert.mode.ModeHandlers;
import org.tims.core.AcquisitionMode;
import org.tims.source.FrameInfo;

import java.util.List;
import java.util.Optional;

/**
 * Number of spectra a run declares before streaming, from metadata only.
 * <p>
 * Every frame counts what its mode handler could emit at most, so the declared
 * count is never below the number of spectra actually written.
 */
public class SpectrumCounter {
    private final ConversionContext context;

    public SpectrumCounter(ConversionContext context) {
        this.context = context;
    }

    public int count(List<Integer> frameIds) {
        int total = 0;
        for (int id : frameIds) {
            total += count(context.getSource().getFrame(id));
        }
        return total;
    }

    public int count(FrameInfo frame) {
        Optional<AcquisitionMode> mode = context.getClassifier().classify(frame);
        if (!mode.isPresent()) {
            return 0;
        }
        return ModeHandlers.forMode(mode.get()).expectedCount(frame, context);
    }
}
