package dao.tron.anchor.model;

import java.util.List;

/**
 * Sibling path from a leaf up to its batch root, bottom-up.
 */
public record InclusionProof(int leafIndex, int leafCount, List<Step> steps) {

    public enum Side { LEFT, RIGHT }

    /**
     * @param sibling hash to combine with the running value
     * @param side    which side of the running value the sibling sits on
     */
    public record Step(byte[] sibling, Side side) {}
}
