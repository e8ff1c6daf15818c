package FacturaBot;

import FacturaBot.model.CanonicalField;
import FacturaBot.model.DocumentCategory;
import FacturaBot.model.FieldCandidate;
import FacturaBot.model.FieldValue;
import FacturaBot.validation.FieldValidator;
import FacturaBot.validation.ValidatedFields;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class FieldValidatorTest {

    private final FieldValidator validator = new FieldValidator();

    // ==========================================
    // Montos
    // ==========================================

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "RD$ 1,180.00 | 1180.00",
            "150.0        | 150.00",
            "1.234,56     | 1234.56",
            "1.234        | 1234.00",
            "1.234.567,89 | 1234567.89",
            "1,500        | 1500.00",
            "12,50        | 12.50",
            "US$ 99       | 99.00",
            "0            | 0.00"
    })
    @DisplayName("MONTO: Normaliza a dos decimales")
    void testMoney_Normalized(String raw, String expected) {
        Optional<FieldValue> value = validator.validate(CanonicalField.TOTAL, raw);

        assertEquals(new FieldValue.Money(new BigDecimal(expected)), value.orElseThrow());
        assertEquals(2, ((BigDecimal) value.get().output()).scale());
    }

    @Test
    @DisplayName("MONTO: Negativo, enorme o ilegible se rechaza")
    void testMoney_Rejected() {
        assertTrue(validator.validate(CanonicalField.TOTAL, "-5.00").isEmpty());
        assertTrue(validator.validate(CanonicalField.TOTAL, "10000000.01").isEmpty());
        assertTrue(validator.validate(CanonicalField.TOTAL, "N/A").isEmpty());
        assertTrue(validator.validate(CanonicalField.TOTAL, "1.2.3").isEmpty());
    }

    @Test
    @DisplayName("MONTO: Más de dos decimales se rechaza en vez de redondear")
    void testMoney_TooManyFractionDigits() {
        assertTrue(validator.validate(CanonicalField.TOTAL, "12.3456").isEmpty());
        assertTrue(validator.validate(CanonicalField.TOTAL, "1,2345").isEmpty());
        assertTrue(validator.validate(CanonicalField.TOTAL, "99.999").isPresent(), "grouped thousands, not decimals");
    }

    // ==========================================
    // Fechas
    // ==========================================

    @ParameterizedTest
    @CsvSource({
            "08/10/2025, 2025-10-08",
            "8-10-2025,  2025-10-08",
            "2024-03-15, 2024-03-15",
            "15/03/24,   2024-03-15",
            "01/01/45,   1945-01-01"
    })
    @DisplayName("FECHA: Formatos aceptados y corrección de siglo")
    void testDate_Formats(String raw, String iso) {
        FieldValue value = validator.validate(CanonicalField.FECHA, raw).orElseThrow();

        assertEquals(new FieldValue.CalendarDate(LocalDate.parse(iso)), value);
    }

    @Test
    @DisplayName("FECHA: Salida dd/MM/yyyy que vuelve a leerse igual")
    void testDate_RoundTrip() {
        FieldValue value = validator.validate(CanonicalField.FECHA, "5/3/2024").orElseThrow();
        String printed = (String) value.output();

        assertEquals("05/03/2024", printed);
        assertEquals(value, validator.validate(CanonicalField.FECHA, printed).orElseThrow());
    }

    @Test
    @DisplayName("FECHA: Ilegible se conserva tal cual como texto")
    void testDate_UnparseableKept() {
        assertEquals(new FieldValue.FreeText("31/02/2024"),
                validator.validate(CanonicalField.FECHA, "31/02/2024").orElseThrow());
        assertEquals(new FieldValue.FreeText("3 de mayo"),
                validator.validate(CanonicalField.FECHA, " 3 de mayo ").orElseThrow());
    }

    // ==========================================
    // Identificadores, NCF, texto
    // ==========================================

    @Test
    @DisplayName("RNC: 9 u 11 dígitos se normalizan; otro largo pasa sin cambios")
    void testIdentifier() {
        assertEquals(new FieldValue.Identifier("131092659"),
                validator.validate(CanonicalField.RNC, "131-09265-9").orElseThrow());
        assertEquals(new FieldValue.Identifier("40212345678"),
                validator.validate(CanonicalField.RNC, "402-1234567-8").orElseThrow());
        assertEquals(new FieldValue.Identifier("12-34"),
                validator.validate(CanonicalField.RNC, " 12-34 ").orElseThrow());
        assertTrue(validator.validate(CanonicalField.RNC, "  ").isEmpty());
    }

    @Test
    @DisplayName("NCF: Solo formatos conocidos")
    void testFiscalDocumentNumber() {
        assertEquals(new FieldValue.Identifier("B0100000123"),
                validator.validate(CanonicalField.NCF, "b01-0000-0123").orElseThrow());
        assertEquals(new FieldValue.Identifier("E310000000123"),
                validator.validate(CanonicalField.NCF, "E310000000123").orElseThrow());
        assertTrue(validator.validate(CanonicalField.NCF, "X0100000123").isEmpty());
        assertTrue(validator.validate(CanonicalField.NCF, "B01").isEmpty());
    }

    @Test
    @DisplayName("TEXTO: Espacios colapsados y mínimo dos caracteres")
    void testFreeText() {
        assertEquals(new FieldValue.FreeText("Caribe SRL"),
                validator.validate(CanonicalField.RAZON_SOCIAL, "  Caribe \t  SRL ").orElseThrow());
        assertTrue(validator.validate(CanonicalField.RAZON_SOCIAL, " X ").isEmpty());
    }

    // ==========================================
    // Etapa completa
    // ==========================================

    private static Map<CanonicalField, FieldCandidate> merged(Object... pairs) {
        Map<CanonicalField, FieldCandidate> map = new EnumMap<>(CanonicalField.class);
        for (int i = 0; i < pairs.length; i += 2) {
            CanonicalField field = (CanonicalField) pairs[i];
            map.put(field, FieldCandidate.pattern(field, (String) pairs[i + 1], 0));
        }
        return map;
    }

    @Test
    @DisplayName("PEAJE: NCF nunca llega a la salida")
    void testToll_NcfDropped() {
        List<String> diagnostics = new ArrayList<>();

        ValidatedFields result = validator.validateAll(
                merged(CanonicalField.NCF, "B0100000123", CanonicalField.TOTAL, "200.00"),
                DocumentCategory.TOLL, diagnostics);

        assertFalse(result.values().containsKey(CanonicalField.NCF));
        assertTrue(result.values().containsKey(CanonicalField.TOTAL));
        assertTrue(diagnostics.stream().anyMatch(d -> d.contains("ncf")));
    }

    @Test
    @DisplayName("CATEGORÍA: Campo fuera de la lista permitida se descarta")
    void testAllowlist() {
        List<String> diagnostics = new ArrayList<>();

        ValidatedFields result = validator.validateAll(
                merged(CanonicalField.VEHICULO, "LIVIANO", CanonicalField.DESCUENTO, "10.00"),
                DocumentCategory.SIMPLE, diagnostics);

        assertTrue(result.values().isEmpty());
        assertEquals(2, diagnostics.size());
    }

    @Test
    @DisplayName("RECHAZO: Valor rechazado se descarta con diagnóstico")
    void testRejectionDropsField() {
        List<String> diagnostics = new ArrayList<>();

        ValidatedFields result = validator.validateAll(
                merged(CanonicalField.TOTAL, "-3.00"), DocumentCategory.GENERIC, diagnostics);

        assertTrue(result.values().isEmpty());
        assertEquals(1, diagnostics.size());
    }

    @Test
    @DisplayName("EXCEPCIÓN: Error interno conserva el valor crudo")
    void testValidatorExceptionKeepsRawValue() {
        // Arrange
        FieldValidator failing = spy(new FieldValidator());
        doThrow(new IllegalStateException("boom")).when(failing).validate(eq(CanonicalField.TOTAL), eq("200.00"));
        List<String> diagnostics = new ArrayList<>();

        // Act
        ValidatedFields result = failing.validateAll(
                merged(CanonicalField.TOTAL, "200.00"), DocumentCategory.GENERIC, diagnostics);

        // Assert
        assertEquals(new FieldValue.FreeText("200.00"), result.values().get(CanonicalField.TOTAL));
        assertTrue(result.keptRaw().contains(CanonicalField.TOTAL));
        assertEquals(0, result.passedCount());
        assertTrue(diagnostics.get(0).contains("boom"));
    }

    @Test
    @DisplayName("COHERENCIA: Subtotal + ITBIS ≠ total solo genera diagnóstico")
    void testAmountCoherence() {
        List<String> diagnostics = new ArrayList<>();

        ValidatedFields result = validator.validateAll(merged(
                        CanonicalField.SUBTOTAL, "1000.00",
                        CanonicalField.ITBIS, "180.00",
                        CanonicalField.TOTAL, "1200.00"),
                DocumentCategory.DOMESTIC_FISCAL, diagnostics);

        assertEquals(3, result.values().size());
        assertEquals(1, diagnostics.size());
        assertTrue(diagnostics.get(0).startsWith("amounts do not add up"));
    }
}
