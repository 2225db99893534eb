package org.tims.convert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tims.convert.mode.ModeHandlers;
import org.tims.core.AcquisitionMode;
import org.tims.core.FrameWindow;
import org.tims.core.Spectrum;
import org.tims.io.RunMetadata;
import org.tims.io.SpectrumSink;
import org.tims.source.AcquisitionSourceException;
import org.tims.source.FrameInfo;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Streams the spectra of an acquisition into a sink, one frame window at a time.
 * <p>
 * Each window is classified, extracted, built and linked completely before any of
 * its spectra reach the sink. Scan numbers start at 1 and increase by one per
 * emitted spectrum: parents before their products, windows in frame order. The
 * count declared before streaming is reconciled with the emitted count when the
 * sink is finished.
 * <p>
 * A serializer runs once. {@link #abort()} may be called from another thread and
 * takes effect before the next window.
 */
public class StreamingSerializer {
    private static final Logger LOG = LoggerFactory.getLogger(StreamingSerializer.class);

    public enum State {
        INIT,
        METADATA_WRITTEN,
        STREAMING,
        FINALIZED,
        ABORTED
    }

    private final ConversionContext context;
    private final SpectrumSink sink;
    private final Path output;
    private final PrecursorLinker linker = new PrecursorLinker();

    private volatile boolean abortRequested;
    private volatile State state = State.INIT;
    private int nextScanNumber = 1;

    public StreamingSerializer(ConversionContext context, SpectrumSink sink, Path output) {
        this.context = context;
        this.sink = sink;
        this.output = output;
    }

    /**
     * Requests the run to stop before its next frame window.
     */
    public void abort() {
        abortRequested = true;
    }

    public State getState() {
        return state;
    }

    /**
     * Converts the given frames, which must be in ascending order.
     */
    public ConversionSummary run(RunMetadata metadata, List<Integer> frameIds) throws ConversionException {
        if (state != State.INIT) {
            throw new IllegalStateException("Serializer already ran, state " + state);
        }

        FrameWindow current = null;
        try {
            List<FrameWindow> windows = context.isMaldi()
                ? FrameWindowPlanner.perFrame(frameIds)
                : FrameWindowPlanner.plan(frameIds, id -> context.getClassifier()
                    .isWindowBoundary(context.getSource().getFrame(id)));
            List<List<FrameWindow>> chunks = FrameWindowPlanner.chunk(windows, context.getOptions().getChunkSize());

            LOG.info("Calculating number of spectra...");
            int declared = new SpectrumCounter(context).count(frameIds);

            sink.writeMetadata(metadata);
            state = State.METADATA_WRITTEN;
            sink.beginSpectrumList(declared);
            state = State.STREAMING;

            int position = 0;
            for (List<FrameWindow> chunk : chunks) {
                LOG.info("Parsing and writing frame {}...", chunk.get(0).getStart());
                for (FrameWindow window : chunk) {
                    if (abortRequested) {
                        throw new ConversionException("Conversion aborted before frame window " + window);
                    }
                    current = window;
                    List<Integer> frames = new ArrayList<>();
                    while (position < frameIds.size() && frameIds.get(position) < window.getStop()) {
                        frames.add(frameIds.get(position++));
                    }
                    emit(linker.link(processWindow(frames)));
                }
            }

            int emitted = nextScanNumber - 1;
            if (emitted > declared) {
                LOG.warn("Emitted {} spectra but declared only {}", emitted, declared);
            }
            boolean corrected = sink.finish(emitted);
            state = State.FINALIZED;
            if (corrected) {
                LOG.info("Updated spectrum count from {} to {}", declared, emitted);
            }
            LOG.info("Finished writing {} spectra to {}", emitted, output);
            return new ConversionSummary(output, declared, emitted, corrected);
        } catch (ConversionException e) {
            fail();
            throw e;
        } catch (AcquisitionSourceException e) {
            fail();
            throw new ConversionException("Acquisition source failed in frame window " + current
                + ": " + e.getMessage(), e);
        } catch (UnsupportedOperationException e) {
            fail();
            throw new ConversionException("Unsupported acquisition in frame window " + current
                + ": " + e.getMessage(), e);
        } catch (IOException e) {
            fail();
            throw new ConversionException("Could not write " + output + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            fail();
            throw new ConversionException("Conversion failed in frame window " + current
                + ": " + e, e);
        }
    }

    /**
     * Builds every spectrum of one window into a fresh accumulator.
     */
    WindowAccumulator processWindow(List<Integer> frames) {
        WindowAccumulator accumulator = new WindowAccumulator();
        for (int id : frames) {
            FrameInfo frame = context.getSource().getFrame(id);
            Optional<AcquisitionMode> mode = context.getClassifier().classify(frame);
            if (!mode.isPresent()) {
                LOG.debug("Skipping frame {} with scan mode {} and MS/MS type {}",
                    id, frame.getScanMode(), frame.getMsmsType());
                continue;
            }
            ModeHandlers.forMode(mode.get()).process(frame, context, accumulator);
        }
        return accumulator;
    }

    private void emit(List<EmissionGroup> groups) throws IOException {
        for (EmissionGroup group : groups) {
            int headScan = nextScanNumber++;
            sink.writeSpectrum(group.getHead().withEmission(headScan, null));
            for (Spectrum product : group.getLinkedProducts()) {
                sink.writeSpectrum(product.withEmission(nextScanNumber++, headScan));
            }
        }
    }

    private void fail() {
        state = State.ABORTED;
        sink.abort();
    }
}
