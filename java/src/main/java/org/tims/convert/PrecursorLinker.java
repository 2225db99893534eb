package org.tims.convert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tims.core.Spectrum;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Associates the products of a frame window with their parent spectra.
 * <p>
 * Each parent forms a group with the products whose parent frame is its frame,
 * in the order they were built. Standalone spectra and products without a parent
 * in the window form groups of their own. Groups are ordered by frame id; groups
 * of the same frame keep their build order.
 */
public class PrecursorLinker {
    private static final Logger LOG = LoggerFactory.getLogger(PrecursorLinker.class);

    public List<EmissionGroup> link(WindowAccumulator window) {
        Map<Integer, Spectrum> parentsByFrame = new LinkedHashMap<>();
        Map<Integer, List<Spectrum>> childrenByFrame = new LinkedHashMap<>();
        List<Spectrum> unlinked = new ArrayList<>(window.getStandalone());

        for (Spectrum parent : window.getParents()) {
            if (parentsByFrame.putIfAbsent(parent.getFrame(), parent) != null) {
                // two parents for one frame cannot share products
                unlinked.add(parent);
            }
        }
        for (Spectrum product : window.getProducts()) {
            Integer parentFrame = product.getParentFrame();
            if (parentFrame != null && parentsByFrame.containsKey(parentFrame)) {
                childrenByFrame.computeIfAbsent(parentFrame, k -> new ArrayList<>()).add(product);
            } else {
                LOG.debug("No parent spectrum for product of frame {}, emitting standalone", product.getFrame());
                unlinked.add(product);
            }
        }

        List<EmissionGroup> groups = new ArrayList<>();
        for (Map.Entry<Integer, Spectrum> entry : parentsByFrame.entrySet()) {
            groups.add(new EmissionGroup(entry.getValue(),
                childrenByFrame.getOrDefault(entry.getKey(), new ArrayList<>())));
        }
        for (Spectrum spectrum : unlinked) {
            groups.add(new EmissionGroup(spectrum, new ArrayList<>()));
        }
        // List.sort is stable
        groups.sort(Comparator.comparingInt(EmissionGroup::getSortFrame));
        return groups;
    }
}
