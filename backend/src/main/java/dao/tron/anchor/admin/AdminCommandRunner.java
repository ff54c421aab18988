package dao.tron.anchor.admin;

import dao.tron.anchor.exception.AnchorException;
import dao.tron.anchor.fsck.FsckOptions;
import dao.tron.anchor.fsck.FsckReport;
import dao.tron.anchor.fsck.FsckService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Administrative one-shot commands:
 * --dump=FILE|- [--human], --restore=FILE [--verbose], --fsck [--verbose] [--verify-confirmed].
 *
 * Exit codes: 0 success, 1 fsck found anomalies, 2 the command failed.
 */
@Slf4j
@Component
public class AdminCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String DUMP = "dump";
    static final String RESTORE = "restore";
    static final String FSCK = "fsck";
    static final String HUMAN = "human";
    static final String VERBOSE = "verbose";
    static final String VERIFY_CONFIRMED = "verify-confirmed";

    private static final List<String> COMMANDS = List.of(DUMP, RESTORE, FSCK);

    private final DumpService dumpService;
    private final FsckService fsckService;
    private final String datasourceUrl;

    private int exitCode;

    public AdminCommandRunner(DumpService dumpService,
                              FsckService fsckService,
                              @Value("${spring.datasource.url:}") String datasourceUrl) {
        this.dumpService = dumpService;
        this.fsckService = fsckService;
        this.datasourceUrl = datasourceUrl;
    }

    /**
     * True when the raw arguments name an admin command, checked before the context starts.
     */
    public static boolean isAdminInvocation(String... args) {
        return Arrays.stream(args).anyMatch(arg -> COMMANDS.stream()
                .anyMatch(cmd -> arg.equals("--" + cmd) || arg.startsWith("--" + cmd + "=")));
    }

    @Override
    public void run(ApplicationArguments args) {
        long commands = COMMANDS.stream().filter(args::containsOption).count();
        if (commands == 0) {
            return;
        }
        if (commands > 1) {
            log.error("Only one of --dump, --restore, --fsck may be given");
            exitCode = 2;
            return;
        }

        boolean verbose = args.containsOption(VERBOSE);
        try {
            if (args.containsOption(DUMP)) {
                dump(single(args, DUMP), args.containsOption(HUMAN));
            } else if (args.containsOption(RESTORE)) {
                restore(single(args, RESTORE), verbose);
            } else {
                FsckReport report = fsckService.fsck(new FsckOptions(verbose, args.containsOption(VERIFY_CONFIRMED)));
                exitCode = report.isClean() ? 0 : 1;
            }
        } catch (IOException | AnchorException | IllegalArgumentException e) {
            log.error("Admin command failed: {}", e.getMessage(), e);
            exitCode = 2;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void dump(String target, boolean human) throws IOException {
        if ("-".equals(target)) {
            Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
            dumpService.dump(out, human);
            return;
        }
        try (Writer out = Files.newBufferedWriter(Path.of(target), StandardCharsets.UTF_8)) {
            dumpService.dump(out, human);
        }
        log.info("Dump written to {}", target);
    }

    private void restore(String source, boolean verbose) throws IOException {
        String target = datasourceUrl.isBlank() ? "configured datasource" : datasourceUrl;
        try (Reader in = Files.newBufferedReader(Path.of(source), StandardCharsets.UTF_8)) {
            DumpService.RestoreSummary summary = dumpService.restore(in, verbose, target);
            log.info("Restored {} batch(es) and {} digest(s) from {}", summary.batches(), summary.digests(), source);
        }
    }

    private static String single(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.size() != 1 || values.get(0).isBlank()) {
            throw new IllegalArgumentException("--" + option + " needs exactly one value");
        }
        return values.get(0);
    }
}
