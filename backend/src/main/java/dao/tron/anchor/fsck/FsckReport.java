package dao.tron.anchor.fsck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FsckReport {

    public record Finding(FindingType type, String subject, String detail) {}

    private final List<Finding> findings = new ArrayList<>();
    private int batchesChecked;
    private int digestsChecked;

    void add(FindingType type, String subject, String detail) {
        findings.add(new Finding(type, subject, detail));
    }

    void batchChecked(int members) {
        batchesChecked++;
        digestsChecked += members;
    }

    public List<Finding> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    public List<Finding> findings(FindingType type) {
        return findings.stream().filter(f -> f.type() == type).toList();
    }

    public int getBatchesChecked() {
        return batchesChecked;
    }

    public int getDigestsChecked() {
        return digestsChecked;
    }

    /**
     * True when nothing needs operator attention.
     */
    public boolean isClean() {
        return findings.stream().noneMatch(f -> f.type().isAnomaly());
    }

    @Override
    public String toString() {
        long anomalies = findings.stream().filter(f -> f.type().isAnomaly()).count();
        return "FsckReport{batches=" + batchesChecked + ", digests=" + digestsChecked
                + ", findings=" + findings.size() + ", anomalies=" + anomalies + "}";
    }
}
