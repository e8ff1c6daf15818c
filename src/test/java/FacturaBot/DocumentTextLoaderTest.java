package FacturaBot;

import FacturaBot.model.RawDocument;
import FacturaBot.parser.DocumentLoadException;
import FacturaBot.parser.DocumentTextLoader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTextLoaderTest {

    @TempDir
    Path tempDir;

    private final DocumentTextLoader loader = new DocumentTextLoader();

    @Test
    @DisplayName("TXT: Se lee como UTF-8 y guarda la ruta de origen")
    void testTextFile() throws Exception {
        Path file = tempDir.resolve("ticket.txt");
        Files.writeString(file, "Estación de Peaje\nImporte: 200.00", StandardCharsets.UTF_8);

        RawDocument document = loader.load(file);

        assertEquals("Estación de Peaje\nImporte: 200.00", document.text());
        assertEquals(file.toString(), document.source().orElseThrow());
    }

    @Test
    @DisplayName("PDF: Capa de texto extraída con PDFBox")
    void testPdfFile() throws Exception {
        // Arrange
        Path file = tempDir.resolve("factura.pdf");
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage();
            doc.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
                content.beginText();
                content.setFont(PDType1Font.HELVETICA, 12);
                content.newLineAtOffset(50, 700);
                content.showText("RNC: 131092659");
                content.endText();
            }
            doc.save(file.toFile());
        }

        // Act
        RawDocument document = loader.load(file);

        // Assert
        assertTrue(document.text().contains("RNC: 131092659"), document.text());
    }

    @Test
    @DisplayName("ERROR: Archivo inexistente o PDF dañado → DocumentLoadException")
    void testUnreadable() throws IOException {
        Path broken = tempDir.resolve("broken.pdf");
        Files.writeString(broken, "this is not a pdf");

        assertThrows(DocumentLoadException.class, () -> loader.load(tempDir.resolve("missing.txt")));
        assertThrows(DocumentLoadException.class, () -> loader.load(broken));
    }
}
