package org.tims.convert;

import org.tims.core.FrameWindow;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Splits an acquisition into frame windows and groups the windows into chunks.
 */
public final class FrameWindowPlanner {

    private FrameWindowPlanner() {
    }

    /**
     * Windows that start at every boundary frame. The first window starts at the
     * first frame and the last one ends after the last frame, so together the
     * windows cover every frame id. Without any boundary every frame is its own window.
     *
     * @param frameIds ascending frame ids
     */
    public static List<FrameWindow> plan(List<Integer> frameIds, IntPredicate isBoundary) {
        List<FrameWindow> windows = new ArrayList<>();
        if (frameIds.isEmpty()) {
            return windows;
        }
        List<Integer> starts = new ArrayList<>();
        for (int id : frameIds) {
            if (isBoundary.test(id)) {
                starts.add(id);
            }
        }
        if (starts.isEmpty()) {
            return perFrame(frameIds);
        }
        int first = frameIds.get(0);
        if (starts.get(0) != first) {
            starts.add(0, first);
        }
        int end = frameIds.get(frameIds.size() - 1) + 1;
        for (int i = 0; i < starts.size(); i++) {
            int stop = i + 1 < starts.size() ? starts.get(i + 1) : end;
            windows.add(new FrameWindow(starts.get(i), stop));
        }
        return windows;
    }

    /**
     * One window per frame.
     */
    public static List<FrameWindow> perFrame(List<Integer> frameIds) {
        List<FrameWindow> windows = new ArrayList<>(frameIds.size());
        for (int id : frameIds) {
            windows.add(new FrameWindow(id, id + 1));
        }
        return windows;
    }

    /**
     * Groups windows into chunks of {@code chunkSize}: first every full chunk, then
     * one final partial chunk with the remaining windows, if any.
     */
    public static List<List<FrameWindow>> chunk(List<FrameWindow> windows, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size must be at least 1, got " + chunkSize);
        }
        List<List<FrameWindow>> chunks = new ArrayList<>();
        int fullChunks = windows.size() / chunkSize;
        for (int c = 0; c < fullChunks; c++) {
            chunks.add(new ArrayList<>(windows.subList(c * chunkSize, (c + 1) * chunkSize)));
        }
        int remainder = windows.size() % chunkSize;
        if (remainder > 0) {
            chunks.add(new ArrayList<>(windows.subList(windows.size() - remainder, windows.size())));
        }
        return chunks;
    }
}
