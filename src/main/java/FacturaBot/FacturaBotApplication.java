package FacturaBot;

import FacturaBot.parser.InvoiceFileProcessor;
import FacturaBot.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point: every argument is a file (.txt OCR output or a PDF with a
 * text layer) to run through the extraction pipeline.
 */
@SpringBootApplication
public class FacturaBotApplication {

    private static final Logger log = LoggerFactory.getLogger(FacturaBotApplication.class);

    public static void main(String[] args) {
        runBatch(application(), args);
    }

    static SpringApplication application() {
        SpringApplication app = new SpringApplication(FacturaBotApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        return app;
    }

    /** Processes every file argument and closes the context afterwards. */
    static List<ParseResult> runBatch(SpringApplication app, String[] args) {
        List<Path> files = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .map(Path::of)
                .toList();

        try (ConfigurableApplicationContext context = app.run(args)) {
            if (files.isEmpty()) {
                log.info("Usage: facturabot <invoice.txt|invoice.pdf>...");
                return List.of();
            }

            InvoiceFileProcessor processor = context.getBean(InvoiceFileProcessor.class);
            List<ParseResult> results = processor.process(files);
            for (ParseResult result : results) {
                if (result.success()) {
                    log.info("{} -> {} {}", result.source(), result.result().getCategory().key(),
                            result.result().fieldMap());
                } else {
                    log.warn("{} -> failed: {}", result.source(), result.error());
                }
            }
            return results;
        }
    }
}
