package FacturaBot.parser;

import FacturaBot.model.ExtractionResult;
import FacturaBot.model.RawDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the pipeline over a list of files, one result per file. An unreadable file
 * produces a failed {@link ParseResult} and does not stop the batch.
 */
@Service
public class InvoiceFileProcessor {

    private static final Logger log = LoggerFactory.getLogger(InvoiceFileProcessor.class);

    private final DocumentTextLoader loader;
    private final InvoiceParser parser;

    public InvoiceFileProcessor(DocumentTextLoader loader, InvoiceParser parser) {
        this.loader = loader;
        this.parser = parser;
    }

    public List<ParseResult> process(List<Path> files) {
        List<ParseResult> results = new ArrayList<>(files.size());
        for (Path file : files) {
            results.add(process(file));
        }
        long ok = results.stream().filter(ParseResult::success).count();
        log.info("Processed {} files, {} succeeded", results.size(), ok);
        return results;
    }

    public ParseResult process(Path file) {
        try {
            RawDocument document = loader.load(file);
            ExtractionResult result = parser.parse(document);
            log.info("{}: {}", file.getFileName(), result);
            return ParseResult.success(file.toString(), result);
        } catch (DocumentLoadException e) {
            log.warn("Skipping {}: {}", file, e.getMessage());
            return ParseResult.failure(file.toString(), e.getMessage());
        }
    }
}
