package org.tims.convert;

import org.tims.core.Spectrum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Spectra built while processing one frame window, held until the window is linked
 * and emitted. A new accumulator is created for every window.
 */
public class WindowAccumulator {
    private final List<Spectrum> parents = new ArrayList<>();
    private final List<Spectrum> products = new ArrayList<>();
    private final List<Spectrum> standalone = new ArrayList<>();

    /** An MS1 spectrum that products may link to. */
    public void addParent(Spectrum spectrum) {
        parents.add(spectrum);
    }

    /** An MS2 spectrum that names its parent frame. */
    public void addProduct(Spectrum spectrum) {
        if (spectrum.getParentFrame() == null) {
            standalone.add(spectrum);
        } else {
            products.add(spectrum);
        }
    }

    /** A spectrum emitted on its own, without parent linkage. */
    public void addStandalone(Spectrum spectrum) {
        standalone.add(spectrum);
    }

    public List<Spectrum> getParents() {
        return Collections.unmodifiableList(parents);
    }

    public List<Spectrum> getProducts() {
        return Collections.unmodifiableList(products);
    }

    public List<Spectrum> getStandalone() {
        return Collections.unmodifiableList(standalone);
    }

    public int size() {
        return parents.size() + products.size() + standalone.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
