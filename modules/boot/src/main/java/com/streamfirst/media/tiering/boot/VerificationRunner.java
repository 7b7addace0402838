package com.streamfirst.media.tiering.boot;

import com.streamfirst.media.tiering.application.RemoteVerificationService;
import com.streamfirst.media.tiering.application.VerificationOptions;
import com.streamfirst.media.tiering.domain.MediaAsset;
import com.streamfirst.media.tiering.domain.VerificationReport;
import com.streamfirst.media.tiering.domain.VerificationRunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.List;
import java.util.Optional;

/**
 * Command line front end for the remote verification job.
 *
 * <pre>
 * verify [--dry-run] [--only-unverified] [--batch-size=N] [--limit=N]
 * report
 * </pre>
 *
 * Without a command nothing runs.
 */
@Slf4j
@RequiredArgsConstructor
public class VerificationRunner implements ApplicationRunner {

    static final String VERIFY = "verify";
    static final String REPORT = "report";

    private final RemoteVerificationService verificationService;

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            log.debug("No command given");
            return;
        }
        switch (commands.get(0)) {
            case VERIFY -> verify(args);
            case REPORT -> report();
            default -> throw new IllegalArgumentException(
                    "Unknown command '" + commands.get(0) + "', expected " + VERIFY + " or " + REPORT);
        }
    }

    VerificationRunResult verify(ApplicationArguments args) {
        VerificationOptions.VerificationOptionsBuilder options = VerificationOptions.builder()
                .dryRun(args.containsOption("dry-run"))
                .onlyUnverified(args.containsOption("only-unverified"));
        intOption(args, "batch-size").ifPresent(options::batchSize);
        intOption(args, "limit").ifPresent(options::limit);

        VerificationRunResult result = verificationService.verify(options.build());
        log.info("Verification {}: checked={}, present={}, missing={}, errors={}, duration={}",
                result.dryRun() ? "dry run" : "run", result.totalChecked(), result.present(),
                result.missing(), result.errors(), result.duration());
        return result;
    }

    VerificationReport report() {
        VerificationReport report = verificationService.report();
        log.info("Active rows: {}", report.active());
        log.info("  unchecked: {} ({}%)", report.unchecked(), String.format("%.1f", report.percent(report.unchecked())));
        log.info("  present:   {} ({}%)", report.present(), String.format("%.1f", report.percent(report.present())));
        log.info("  missing:   {} ({}%)", report.missing(), String.format("%.1f", report.percent(report.missing())));
        report.missingByOrigin().forEach((origin, count) -> log.info("  missing from {}: {}", origin, count));
        for (MediaAsset asset : report.recentMissing()) {
            log.info("  recently missing: {} {}", asset.getId(), asset.getRelativePath());
        }
        return report;
    }

    private static Optional<Integer> intOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(values.get(0)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number: " + values.get(0), e);
        }
    }
}
