package com.elime.cli;

import com.elime.service.CommandOutcome;
import com.elime.service.EyeCollectionService;
import com.elime.service.InvalidConfigurationException;
import com.elime.service.OperatorPrompt;
import com.elime.service.PhotoImportService;
import com.elime.service.RenderService;
import com.elime.service.ResourceMissingException;
import com.elime.service.StoreCorruptionException;
import com.elime.service.TidyService;
import com.elime.service.correction.EyeDisplay;
import com.elime.ui.OverlayPainter;
import com.elime.ui.SwingEyeDisplay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.function.Function;

/**
 * Command line entry: {@code elime <pre|add|check|tidy|render> [beginWith] [--elime.key=value ...]}.
 *
 * Exit status is 0 when the command finished, was cancelled by the operator
 * or stopped on a configuration problem; 1 on a fatal store, resource, I/O or
 * geometry failure; 2 on bad usage.
 */
@Component
@ConditionalOnProperty(prefix = "elime.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ElimeCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ElimeCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: elime <pre|add|check [beginWith]|tidy|render> [--elime.<key>=<value> ...]";

    private final PhotoImportService importService;
    private final EyeCollectionService collectionService;
    private final TidyService tidyService;
    private final RenderService renderService;
    private final OperatorPrompt prompt;
    private final OverlayPainter painter;

    private int exitCode = EXIT_OK;

    public ElimeCommandRunner(PhotoImportService importService, EyeCollectionService collectionService,
                              TidyService tidyService, RenderService renderService, OperatorPrompt prompt,
                              OverlayPainter painter) {
        this.importService = importService;
        this.collectionService = collectionService;
        this.tidyService = tidyService;
        this.renderService = renderService;
        this.prompt = prompt;
        this.painter = painter;
    }

    @Override
    public void run(ApplicationArguments arguments) {
        List<String> args = arguments.getNonOptionArgs();
        if (args.isEmpty()) {
            log.error(USAGE);
            exitCode = EXIT_USAGE;
            return;
        }
        String command = args.get(0);
        String beginWith = args.size() > 1 ? args.get(1) : null;

        try {
            CommandOutcome outcome = switch (command) {
                case "pre" -> importService.importPhotos();
                case "add" -> withDisplay(collectionService::add);
                case "check" -> withDisplay(display -> collectionService.check(display, beginWith));
                case "tidy" -> tidyService.tidy(prompt);
                case "render" -> withDisplay(renderService::render);
                default -> null;
            };
            if (outcome == null) {
                log.error("Unknown command '{}'", command);
                log.error(USAGE);
                exitCode = EXIT_USAGE;
                return;
            }
            if (outcome.cancelled()) {
                log.info("{} cancelled by operator; {} photos were already saved", command, outcome.processed());
            }
            exitCode = EXIT_OK;
        } catch (InvalidConfigurationException e) {
            log.error("Configuration error, nothing done. {}", e.getMessage());
            exitCode = EXIT_OK;
        } catch (StoreCorruptionException | ResourceMissingException e) {
            log.error("{}", e.getMessage());
            exitCode = EXIT_FATAL;
        } catch (UncheckedIOException e) {
            log.error("{}", e.getMessage(), e);
            exitCode = EXIT_FATAL;
        } catch (IllegalArgumentException e) {
            log.error("Cannot {}: {}", command, e.getMessage());
            exitCode = EXIT_FATAL;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    protected EyeDisplay createDisplay() {
        return new SwingEyeDisplay(painter);
    }

    private CommandOutcome withDisplay(Function<EyeDisplay, CommandOutcome> command) {
        try (EyeDisplay display = createDisplay()) {
            return command.apply(display);
        }
    }
}
