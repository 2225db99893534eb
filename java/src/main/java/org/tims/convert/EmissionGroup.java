package org.tims.convert;

import org.tims.core.Spectrum;

import java.util.Collections;
import java.util.List;

/**
 * A spectrum together with the products that reference it, emitted consecutively.
 */
public final class EmissionGroup {
    private final Spectrum head;
    private final List<Spectrum> linkedProducts;

    public EmissionGroup(Spectrum head, List<Spectrum> linkedProducts) {
        this.head = head;
        this.linkedProducts = Collections.unmodifiableList(linkedProducts);
    }

    public Spectrum getHead() {
        return head;
    }

    public List<Spectrum> getLinkedProducts() {
        return linkedProducts;
    }

    public int size() {
        return 1 + linkedProducts.size();
    }

    int getSortFrame() {
        return head.getFrame();
    }
}
