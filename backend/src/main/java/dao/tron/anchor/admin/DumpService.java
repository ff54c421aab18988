package dao.tron.anchor.admin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.tron.anchor.exception.CorruptBatchException;
import dao.tron.anchor.exception.DuplicateRootException;
import dao.tron.anchor.exception.IntegrityException;
import dao.tron.anchor.model.AnchorBatch;
import dao.tron.anchor.model.DigestRecord;
import dao.tron.anchor.service.AnchorStore;
import dao.tron.anchor.service.DigestStore;
import dao.tron.anchor.service.FlushEngine;
import dao.tron.anchor.service.MerkleTreeService;
import dao.tron.anchor.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Export and re-import of all digests and batches.
 *
 * The JSON form is one {@link DumpEntry} per line, batches first. Restore accepts
 * only that form, into an empty store, and re-derives every root before writing.
 */
@Slf4j
@Service
public class DumpService {

    public record RestoreSummary(int batches, int digests) {}

    private final AnchorStore anchorStore;
    private final DigestStore digestStore;
    private final MerkleTreeService merkleTreeService;
    private final FlushEngine flushEngine;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public DumpService(AnchorStore anchorStore,
                       DigestStore digestStore,
                       MerkleTreeService merkleTreeService,
                       FlushEngine flushEngine,
                       PlatformTransactionManager transactionManager,
                       ObjectMapper objectMapper) {
        this.anchorStore = anchorStore;
        this.digestStore = digestStore;
        this.merkleTreeService = merkleTreeService;
        this.flushEngine = flushEngine;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
    }

    public void dump(Writer writer, boolean human) throws IOException {
        List<AnchorBatch> batches = anchorStore.all();
        List<DigestRecord> digests = digestStore.all();
        if (human) {
            dumpHuman(writer, batches, digests);
        } else {
            for (AnchorBatch batch : batches) {
                writeLine(writer, DumpEntry.of(batch));
            }
            for (DigestRecord digest : digests) {
                writeLine(writer, DumpEntry.of(digest));
            }
        }
        writer.flush();
        log.info("Dumped {} batch(es) and {} digest(s)", batches.size(), digests.size());
    }

    /**
     * Re-import a JSON dump. Nothing is written unless the whole dump validates.
     *
     * @param target description of the destination, for the log only
     */
    public RestoreSummary restore(Reader reader, boolean verbose, String target) throws IOException {
        Map<String, DumpEntry> batches = new LinkedHashMap<>();
        List<DumpEntry> digests = new ArrayList<>();
        readEntries(reader, batches, digests);
        validate(batches, digests, verbose);

        log.info("Restoring {} batch(es) and {} digest(s) into {}", batches.size(), digests.size(), target);
        return flushEngine.runExclusive(() -> transactionTemplate.execute(status -> {
            if (anchorStore.count() != 0 || digestStore.count() != 0) {
                throw new IntegrityException("Restore target " + target + " is not empty");
            }
            for (DumpEntry entry : batches.values()) {
                anchorStore.importBatch(toBatch(entry));
            }
            for (DumpEntry entry : digests) {
                digestStore.importRecord(entry.digest(), entry.merkle(),
                        entry.submittedAt(), entry.collectionTimestamp());
            }
            return new RestoreSummary(batches.size(), digests.size());
        }));
    }

    private void readEntries(Reader reader, Map<String, DumpEntry> batches, List<DumpEntry> digests) throws IOException {
        BufferedReader lines = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        String line;
        int lineNo = 0;
        while ((line = lines.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) continue;

            DumpEntry entry;
            try {
                entry = objectMapper.readValue(line, DumpEntry.class);
            } catch (JsonProcessingException e) {
                throw new IntegrityException("Line " + lineNo + ": not a dump entry: " + e.getOriginalMessage(), e);
            }

            if (DumpEntry.KIND_BATCH.equals(entry.kind())) {
                if (batches.putIfAbsent(entry.merkle(), entry) != null) {
                    throw new DuplicateRootException("Line " + lineNo + ": batch " + entry.merkle() + " appears twice");
                }
            } else if (DumpEntry.KIND_DIGEST.equals(entry.kind())) {
                digests.add(entry);
            } else {
                throw new IntegrityException("Line " + lineNo + ": unknown entry kind " + entry.kind());
            }
        }
    }

    private void validate(Map<String, DumpEntry> batches, List<DumpEntry> digests, boolean verbose) {
        for (DumpEntry batch : batches.values()) {
            if (batch.status() == null || batch.flushTimestamp() == null || batch.hashes() == null) {
                throw new IntegrityException("Batch " + batch.merkle() + " is missing status, flush time or members");
            }
            String recomputed;
            try {
                recomputed = merkleTreeService.computeRootHex(batch.hashes());
            } catch (IllegalArgumentException e) {
                throw new CorruptBatchException("Batch " + batch.merkle() + " has unreadable members: " + e.getMessage(), e);
            }
            if (!recomputed.equals(batch.merkle())) {
                throw new CorruptBatchException("Batch " + batch.merkle() + " members hash to " + recomputed);
            }
            if (verbose) {
                log.info("Batch {} verified ({} members, {})", batch.merkle(), batch.hashes().size(), batch.status());
            }
        }

        Set<String> seen = new HashSet<>();
        Map<String, Set<String>> pointing = new LinkedHashMap<>();
        for (DumpEntry digest : digests) {
            try {
                HexUtil.digestBytes(digest.digest());
            } catch (IllegalArgumentException e) {
                throw new IntegrityException("Invalid digest " + digest.digest(), e);
            }
            if (digest.submittedAt() == null || digest.collectionTimestamp() == null) {
                throw new IntegrityException("Digest " + digest.digest() + " is missing its submission times");
            }
            if (!seen.add(digest.digest())) {
                throw new IntegrityException("Digest " + digest.digest() + " appears twice");
            }
            if (digest.merkle() != null) {
                DumpEntry batch = batches.get(digest.merkle());
                if (batch == null || !batch.hashes().contains(digest.digest())) {
                    throw new IntegrityException("Digest " + digest.digest() + " references batch "
                            + digest.merkle() + " which does not list it");
                }
                pointing.computeIfAbsent(digest.merkle(), k -> new HashSet<>()).add(digest.digest());
            }
        }

        for (DumpEntry batch : batches.values()) {
            Set<String> members = pointing.getOrDefault(batch.merkle(), Set.of());
            for (String hash : batch.hashes()) {
                if (!members.contains(hash)) {
                    throw new IntegrityException("Batch " + batch.merkle() + " lists digest " + hash
                            + " with no matching digest entry");
                }
            }
        }
    }

    private static AnchorBatch toBatch(DumpEntry entry) {
        return AnchorBatch.builder()
                .merkle(entry.merkle())
                .hashes(new ArrayList<>(entry.hashes()))
                .status(entry.status())
                .txHash(entry.txHash())
                .blockHeight(entry.blockHeight())
                .chainTimestamp(entry.chainTimestamp())
                .flushTimestamp(entry.flushTimestamp())
                .submittedAt(entry.submittedAt())
                .failureReason(entry.failureReason())
                .build();
    }

    private void writeLine(Writer writer, DumpEntry entry) throws IOException {
        writer.write(objectMapper.writeValueAsString(entry));
        writer.write('\n');
    }

    private static void dumpHuman(Writer writer, List<AnchorBatch> batches, List<DigestRecord> digests) throws IOException {
        for (AnchorBatch batch : batches) {
            writer.write(String.format("Batch       %s%n", batch.getMerkle()));
            writer.write(String.format("  Status    %s%n", batch.getStatus()));
            writer.write(String.format("  Flushed   %s%n", Instant.ofEpochSecond(batch.getFlushTimestamp())));
            writer.write(String.format("  Tx        %s%n", batch.getTxHash() == null ? "-" : batch.getTxHash()));
            if (batch.getBlockHeight() != null) {
                writer.write(String.format("  Height    %d%n", batch.getBlockHeight()));
                writer.write(String.format("  Chain     %s%n", Instant.ofEpochSecond(batch.getChainTimestamp())));
            }
            if (batch.getFailureReason() != null) {
                writer.write(String.format("  Failure   %s%n", batch.getFailureReason()));
            }
            writer.write(String.format("  Members   %d%n", batch.memberCount()));
            for (String hash : batch.getHashes()) {
                writer.write(String.format("    %s%n", hash));
            }
        }

        List<DigestRecord> pending = digests.stream().filter(DigestRecord::isPending).toList();
        writer.write(String.format("Pending     %d%n", pending.size()));
        for (DigestRecord record : pending) {
            writer.write(String.format("    %s  collected %s%n",
                    record.getDigest(), Instant.ofEpochSecond(record.getCollectionTimestamp())));
        }
    }
}
