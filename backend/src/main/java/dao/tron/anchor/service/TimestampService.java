package dao.tron.anchor.service;

import dao.tron.anchor.config.AnchorProperties;
import dao.tron.anchor.exception.CollectionsDisabledException;
import dao.tron.anchor.exception.IntegrityException;
import dao.tron.anchor.model.AnchorBatch;
import dao.tron.anchor.model.CollectionResult;
import dao.tron.anchor.model.DigestRecord;
import dao.tron.anchor.model.InclusionProof;
import dao.tron.anchor.model.LookupResult;
import dao.tron.anchor.model.PutResult;
import dao.tron.anchor.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operations the network front door calls: store digests, report their status and
 * proofs, list collection windows.
 */
@Slf4j
@Service
public class TimestampService {

    private final DigestStore digestStore;
    private final AnchorStore anchorStore;
    private final MerkleTreeService merkleTreeService;
    private final AnchorProperties props;

    public TimestampService(DigestStore digestStore,
                            AnchorStore anchorStore,
                            MerkleTreeService merkleTreeService,
                            AnchorProperties props) {
        this.digestStore = digestStore;
        this.anchorStore = anchorStore;
        this.merkleTreeService = merkleTreeService;
        this.props = props;
    }

    public PutResult put(byte[] digest) {
        return digestStore.put(digest);
    }

    public List<PutResult> put(List<byte[]> digests) {
        List<PutResult> results = new ArrayList<>(digests.size());
        for (byte[] digest : digests) {
            results.add(digestStore.put(digest));
        }
        long created = results.stream().filter(r -> !r.alreadyExists()).count();
        log.debug("Stored {} new digest(s) of {} submitted", created, digests.size());
        return results;
    }

    /**
     * Status of a digest. For an anchored digest the inclusion proof is rebuilt
     * from the batch's stored members.
     */
    public LookupResult lookup(byte[] digest) {
        Optional<DigestRecord> found = digestStore.lookup(digest);
        if (found.isEmpty()) {
            return LookupResult.notFound(HexUtil.digestHex(digest));
        }
        DigestRecord record = found.get();
        if (record.isPending()) {
            return LookupResult.pending(record);
        }

        AnchorBatch batch = anchorStore.getBatch(record.getAnchorMerkle());
        int index = batch.getHashes().indexOf(record.getDigest());
        if (index < 0) {
            throw new IntegrityException("Digest " + record.getDigest() + " points at batch "
                    + batch.getMerkle() + " which does not list it");
        }
        InclusionProof proof = merkleTreeService.buildProofHex(batch.getHashes(), index);
        return LookupResult.anchored(record, batch, proof);
    }

    /**
     * Digests received in each requested collection window, in request order.
     */
    public List<CollectionResult> getTimestamps(List<Long> collectionTimestamps) {
        if (!props.isEnableCollections()) {
            throw new CollectionsDisabledException("Collection queries are disabled (anchor.enable-collections=false)");
        }

        Map<Long, List<DigestRecord>> byWindow = new LinkedHashMap<>();
        for (Long ts : collectionTimestamps) {
            byWindow.put(ts, new ArrayList<>());
        }
        for (DigestRecord record : digestStore.inCollections(byWindow.keySet())) {
            byWindow.get(record.getCollectionTimestamp()).add(record);
        }

        List<CollectionResult> results = new ArrayList<>(byWindow.size());
        byWindow.forEach((ts, records) -> {
            List<String> digests = new ArrayList<>(records.size());
            List<String> roots = new ArrayList<>(records.size());
            for (DigestRecord record : records) {
                digests.add(record.getDigest());
                roots.add(record.getAnchorMerkle());
            }
            results.add(new CollectionResult(ts, digests, roots));
        });
        return results;
    }

    public Optional<AnchorBatch> lastAnchor() {
        return anchorStore.lastAnchor();
    }
}
