package FacturaBot.parser;

import FacturaBot.model.ExtractionResult;

/**
 * Resultado de procesar un archivo.
 * Contiene el resultado de extracción, un indicador de éxito y el mensaje de error (si lo hay).
 */
public record ParseResult(String source, ExtractionResult result, boolean success, String error) {

    public static ParseResult success(String source, ExtractionResult result) {
        return new ParseResult(source, result, true, null);
    }

    public static ParseResult failure(String source, String error) {
        return new ParseResult(source, null, false, error);
    }
}
