package FacturaBot;

import FacturaBot.model.DocumentCategory;
import FacturaBot.model.ExtractionMethod;
import FacturaBot.model.ExtractionResult;
import FacturaBot.model.RawDocument;
import FacturaBot.parser.InvoiceParser;
import FacturaBot.training.TrainingExample;
import FacturaBot.training.TrainingRecorder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@Tag("integration")
class InvoicePipelineIntegrationTest {

    @Autowired
    private InvoiceParser invoiceParser;

    @MockitoBean
    private TrainingRecorder trainingRecorder;

    @Test
    @DisplayName("PIPELINE: Contexto Spring completo procesa un ticket de peaje")
    void testCompletePipelineFlow() {
        // 1. ARRANGE
        RawDocument document = new RawDocument(InvoiceClassifierTest.TOLL_TICKET, "peaje-guaraguao.txt");

        // 2. ACT
        ExtractionResult result = invoiceParser.parse(document);

        // 3. ASSERT
        assertEquals(DocumentCategory.TOLL, result.getCategory());
        assertEquals(ExtractionMethod.HYBRID, result.getMethod());
        assertEquals(new BigDecimal("200.00"), result.fieldMap().get("total"));
        assertEquals("131092659", result.fieldMap().get("rnc"));
        assertEquals("1701-000001", result.fieldMap().get("numero_factura"));
        assertFalse(result.fieldMap().containsKey("ncf"));

        ArgumentCaptor<TrainingExample> captor = ArgumentCaptor.forClass(TrainingExample.class);
        verify(trainingRecorder).record(captor.capture());
        assertEquals(DocumentCategory.TOLL, captor.getValue().category());
    }

    @Test
    @DisplayName("PIPELINE: Texto basura nunca lanza excepción")
    void testGarbageInput() {
        ExtractionResult result = assertDoesNotThrow(() -> invoiceParser.parse("%%%\n\u0000\t@@ 1/1/1 ,,, .00"));

        assertNotNull(result.getCategory());
        assertNotNull(result.getQualityBand());
    }
}
