package dao.tron.anchor.service;

import dao.tron.anchor.model.InclusionProof;
import dao.tron.anchor.util.HexUtil;
import org.bouncycastle.jcajce.provider.digest.SHA256;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Merkle aggregation over an ordered list of 32-byte digests.
 *
 * Tree shape, which external verifiers must reproduce bit for bit:
 * - leaves are the digests themselves, in submission order (no leaf hashing);
 * - a parent is SHA-256(left || right), positional, pairs are NOT sorted;
 * - an odd trailing node on any level is paired with itself;
 * - a single-leaf tree has the leaf as its root.
 *
 * Stateless and deterministic; the reconciler relies on recomputing identical roots.
 */
@Service
public class MerkleTreeService {

    public byte[] computeRoot(List<byte[]> leaves) {
        List<List<byte[]>> layers = buildLayers(leaves);
        return layers.get(layers.size() - 1).get(0).clone();
    }

    /**
     * Root over hex digests, returned as hex.
     */
    public String computeRootHex(List<String> hexLeaves) {
        return HexUtil.toHex(computeRoot(toBytes(hexLeaves)));
    }

    /**
     * Build the inclusion proof for the leaf at index.
     * Steps are bottom-up; a leaf paired with itself gets its own hash as sibling.
     */
    public InclusionProof buildProof(List<byte[]> leaves, int index) {
        List<List<byte[]>> layers = buildLayers(leaves);
        if (index < 0 || index >= leaves.size()) {
            throw new IndexOutOfBoundsException("Invalid leaf index: " + index);
        }

        List<InclusionProof.Step> steps = new ArrayList<>();
        int idx = index;
        for (int layerIdx = 0; layerIdx < layers.size() - 1; layerIdx++) {
            List<byte[]> layer = layers.get(layerIdx);
            if (idx % 2 == 0) {
                byte[] sibling = idx + 1 < layer.size() ? layer.get(idx + 1) : layer.get(idx);
                steps.add(new InclusionProof.Step(sibling.clone(), InclusionProof.Side.RIGHT));
            } else {
                steps.add(new InclusionProof.Step(layer.get(idx - 1).clone(), InclusionProof.Side.LEFT));
            }
            idx = idx / 2;
        }
        return new InclusionProof(index, leaves.size(), List.copyOf(steps));
    }

    public InclusionProof buildProofHex(List<String> hexLeaves, int index) {
        return buildProof(toBytes(hexLeaves), index);
    }

    /**
     * Fold the proof over the leaf and compare with the expected root.
     */
    public static boolean verify(byte[] leaf, InclusionProof proof, byte[] root) {
        if (leaf == null || leaf.length != HexUtil.DIGEST_LENGTH || proof == null || root == null) {
            return false;
        }
        byte[] current = leaf;
        for (InclusionProof.Step step : proof.steps()) {
            current = step.side() == InclusionProof.Side.LEFT
                    ? hashPair(step.sibling(), current)
                    : hashPair(current, step.sibling());
        }
        return Arrays.equals(current, root);
    }

    private static List<List<byte[]>> buildLayers(List<byte[]> leaves) {
        if (leaves == null || leaves.isEmpty()) {
            throw new IllegalArgumentException("No leaves");
        }

        List<byte[]> current = new ArrayList<>(leaves.size());
        for (byte[] leaf : leaves) {
            if (leaf == null || leaf.length != HexUtil.DIGEST_LENGTH) {
                throw new IllegalArgumentException("Each leaf must be 32 bytes");
            }
            current.add(leaf.clone());
        }

        List<List<byte[]>> layers = new ArrayList<>();
        layers.add(current);
        while (current.size() > 1) {
            List<byte[]> next = new ArrayList<>((current.size() + 1) / 2);
            for (int i = 0; i < current.size(); i += 2) {
                byte[] left = current.get(i);
                byte[] right = i + 1 < current.size() ? current.get(i + 1) : left;
                next.add(hashPair(left, right));
            }
            layers.add(next);
            current = next;
        }
        return layers;
    }

    private static byte[] hashPair(byte[] left, byte[] right) {
        if (left == null || right == null || left.length != 32 || right.length != 32) {
            throw new IllegalArgumentException("hashPair requires two 32-byte inputs");
        }
        SHA256.Digest digest = new SHA256.Digest();
        digest.update(left, 0, left.length);
        digest.update(right, 0, right.length);
        return digest.digest();
    }

    private static List<byte[]> toBytes(List<String> hexLeaves) {
        if (hexLeaves == null) {
            throw new IllegalArgumentException("No leaves");
        }
        List<byte[]> leaves = new ArrayList<>(hexLeaves.size());
        for (String hex : hexLeaves) {
            leaves.add(HexUtil.digestBytes(hex));
        }
        return leaves;
    }
}
