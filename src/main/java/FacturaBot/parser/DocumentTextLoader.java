package FacturaBot.parser;

import FacturaBot.model.RawDocument;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/* Carga el texto OCR de un archivo.
 * PDF: capa de texto con Apache PDFBox. Todo lo demás se lee como UTF-8.
 */
@Service
public class DocumentTextLoader {

    public RawDocument load(Path file) throws DocumentLoadException {
        if (!Files.isRegularFile(file)) {
            throw new DocumentLoadException("Not a file: " + file);
        }
        try {
            String text = isPdf(file) ? pdfText(file) : Files.readString(file, StandardCharsets.UTF_8);
            return new RawDocument(text, file.toString());
        } catch (IOException e) {
            throw new DocumentLoadException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private static String pdfText(Path file) throws IOException {
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            return new PDFTextStripper().getText(doc);
        }
    }

    private static boolean isPdf(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(".pdf");
    }
}
