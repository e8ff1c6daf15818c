package FacturaBot.extract;

import FacturaBot.model.CanonicalField;
import FacturaBot.model.FieldCandidate;
import FacturaBot.nlp.EntityRecognizer;
import FacturaBot.nlp.RecognizedEntity;
import FacturaBot.support.AmountText;
import FacturaBot.support.FallbackLadder;
import FacturaBot.support.TextFolding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
Extracción heurística: entidades (si hay servicio NLP) + ventanas de líneas.

Heuristic extraction in two passes:
 1. entity pass, only when a recognizer is available;
 2. line/window pass, always.
Entity candidates come first in the returned list, so window candidates win
on the same field during merging.
*/
@Service
public class HeuristicExtractor {

    private static final Logger log = LoggerFactory.getLogger(HeuristicExtractor.class);

    static final int WINDOW_LINES = 3;

    private static final Pattern MONEY_TOKEN = Pattern.compile("(?<![\\d,.])(?:\\d{1,3}(?:[.,]\\d{3})+|\\d+)[.,]\\d{2}(?!\\d)");
    private static final Pattern DATE_TOKEN = Pattern.compile("(?<!\\d)\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4}(?!\\d)");
    private static final Pattern RNC_TOKEN = Pattern.compile("(?<![\\d-])(\\d{11}|\\d{9})(?![\\d-])");
    private static final Pattern NCF_TOKEN = Pattern.compile("(?i)\\b([a-k]\\d{10}(?:\\d{2,3})?)\\b");
    private static final Pattern NUMERIC = Pattern.compile("[\\d.,\\-]*\\d[\\d.,\\-]*");

    static final int DATE_BEFORE = 50;
    static final int DATE_AFTER = 30;
    private static final List<Map.Entry<String, CanonicalField>> DATE_KEYWORDS = List.of(
            Map.entry("vencim", CanonicalField.FECHA_VENCIMIENTO),
            Map.entry("emision", CanonicalField.FECHA_EMISION));

    private static final List<String> PARTY_KEYWORDS =
            List.of("razon social", "emisor", "proveedor", "compania", "company", "nombre");
    private static final List<String> OTHER_FIELD_KEYWORDS =
            List.of("rnc", "ncf", "fecha", "total", "subtotal", "itbis", "factura", "telefono", "tel");

    private final EntityRecognizer recognizer;
    private final FallbackLadder<String, List<FieldCandidate>> entityPass;

    public HeuristicExtractor(EntityRecognizer recognizer) {
        this.recognizer = recognizer;
        this.entityPass = FallbackLadder.<String, List<FieldCandidate>>forStage("entity-pass")
                .attempt("entity-recognition", this::fromEntities)
                .orElse(text -> List.of());
    }

    public List<FieldCandidate> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<FieldCandidate> candidates = new ArrayList<>(entityPass.run(text));
        candidates.addAll(fromWindows(text));
        log.debug("Heuristic pass produced {} candidates", candidates.size());
        return candidates;
    }

    // =====================
    // Entity pass
    // =====================

    private Optional<List<FieldCandidate>> fromEntities(String text) {
        if (!recognizer.isAvailable()) {
            return Optional.empty();
        }
        List<FieldCandidate> out = new ArrayList<>();
        boolean dateSeen = false;

        for (RecognizedEntity ent : recognizer.recognize(text)) {
            String value = ent.text().trim();
            boolean numeric = NUMERIC.matcher(value).matches();

            if ((ent.isLabel("MONEY") || ent.isLabel("CARDINAL")) && numeric) {
                Optional<String> byHead = fieldFromHead(ent.head());
                if (byHead.isPresent()) {
                    out.add(FieldCandidate.heuristic(byHead.get(), value, ent.start()));
                    continue;
                }
            }

            if (ent.isLabel("MONEY") && value.length() > 3) {
                out.add(FieldCandidate.heuristic("monto_detectado", value, ent.start()));
            } else if (ent.isLabel("DATE") && !dateSeen) {
                out.add(FieldCandidate.heuristic("fecha_detectada", value, ent.start()));
                dateSeen = true;
            } else if (ent.isLabel("ORG") && value.length() > 3) {
                out.add(FieldCandidate.heuristic("empresa_detectada", value, ent.start()));
            } else if (ent.isLabel("CARDINAL") && numeric && value.length() > 5) {
                out.add(FieldCandidate.heuristic("numero_documento", value, ent.start()));
            }
        }
        return Optional.of(out);
    }

    private static Optional<String> fieldFromHead(String head) {
        String h = TextFolding.fold(head);
        if (h.contains("subtotal")) return Optional.of(CanonicalField.SUBTOTAL.key());
        if (h.contains("itbis") || h.contains("impuesto")) return Optional.of(CanonicalField.ITBIS.key());
        if (h.contains("total")) return Optional.of(CanonicalField.TOTAL.key());
        return Optional.empty();
    }

    // =====================
    // Window pass
    // =====================

    List<FieldCandidate> fromWindows(String text) {
        String[] lines = text.split("\n", -1);
        int[] offsets = new int[lines.length];
        String[] folded = new String[lines.length];
        int pos = 0;
        for (int i = 0; i < lines.length; i++) {
            offsets[i] = pos;
            folded[i] = TextFolding.fold(lines[i]);
            pos += lines[i].length() + 1;
        }

        List<FieldCandidate> out = new ArrayList<>();
        identifiers(lines, folded, offsets, out);
        amounts(lines, folded, offsets, out);
        dates(text, out);
        partyName(lines, folded, offsets, out);
        return out;
    }

    private void identifiers(String[] lines, String[] folded, int[] offsets, List<FieldCandidate> out) {
        boolean rncFound = false;
        boolean ncfFound = false;
        for (int i = 0; i < lines.length && !(rncFound && ncfFound); i++) {
            if (!rncFound && folded[i].contains("rnc")) {
                Matcher m = RNC_TOKEN.matcher(lines[i]);
                if (m.find()) {
                    out.add(FieldCandidate.heuristic(CanonicalField.RNC.key(), m.group(1), offsets[i] + m.start(1)));
                    rncFound = true;
                }
            }
            if (!ncfFound && (folded[i].contains("ncf") || folded[i].contains("comprobante"))) {
                Matcher m = NCF_TOKEN.matcher(lines[i]);
                if (m.find()) {
                    out.add(FieldCandidate.heuristic(CanonicalField.NCF.key(), m.group(1).toUpperCase(),
                            offsets[i] + m.start(1)));
                    ncfFound = true;
                }
            }
        }
    }

    private void amounts(String[] lines, String[] folded, int[] offsets, List<FieldCandidate> out) {
        // own-line labels beat labels borrowed from the surrounding window
        Map<CanonicalField, FieldCandidate> ownLine = new EnumMap<>(CanonicalField.class);
        Map<CanonicalField, FieldCandidate> window = new EnumMap<>(CanonicalField.class);

        for (int i = 0; i < lines.length; i++) {
            Matcher m = MONEY_TOKEN.matcher(lines[i]);
            while (m.find()) {
                Optional<String> value = AmountText.normalize(m.group());
                if (value.isEmpty()) {
                    continue;
                }
                FieldCandidate token = FieldCandidate.heuristic("", value.get(), offsets[i] + m.start());
                Optional<CanonicalField> own = amountLabel(folded[i]);
                if (own.isPresent()) {
                    keep(ownLine, own.get(), token);
                    continue;
                }
                amountLabel(windowText(folded, i)).ifPresent(field -> keep(window, field, token));
            }
        }

        Map<CanonicalField, FieldCandidate> chosen = new LinkedHashMap<>(window);
        chosen.putAll(ownLine);
        out.addAll(chosen.values());
    }

    private static void keep(Map<CanonicalField, FieldCandidate> target, CanonicalField field, FieldCandidate token) {
        FieldCandidate labelled = FieldCandidate.heuristic(field.key(), token.rawValue(), token.offset());
        FieldCandidate current = target.get(field);
        if (current == null) {
            target.put(field, labelled);
        } else if (field == CanonicalField.TOTAL && amount(labelled).compareTo(amount(current)) > 0) {
            target.put(field, labelled);
        }
    }

    private static BigDecimal amount(FieldCandidate candidate) {
        return new BigDecimal(candidate.rawValue());
    }

    private static Optional<CanonicalField> amountLabel(String foldedText) {
        if (foldedText.contains("subtotal") || foldedText.contains("sub-total") || foldedText.contains("sub total")) {
            return Optional.of(CanonicalField.SUBTOTAL);
        }
        if (foldedText.contains("itbis") || foldedText.contains("impuesto")) {
            return Optional.of(CanonicalField.ITBIS);
        }
        if (foldedText.contains("total")) {
            return Optional.of(CanonicalField.TOTAL);
        }
        return Optional.empty();
    }

    private static String windowText(String[] folded, int index) {
        int from = Math.max(0, index - WINDOW_LINES);
        int to = Math.min(folded.length, index + WINDOW_LINES + 1);
        return String.join(" ", List.of(folded).subList(from, to));
    }

    private void dates(String text, List<FieldCandidate> out) {
        Map<CanonicalField, FieldCandidate> first = new EnumMap<>(CanonicalField.class);
        Matcher m = DATE_TOKEN.matcher(text);
        while (m.find()) {
            int lineStart = text.lastIndexOf('\n', m.start() - 1) + 1;
            int lineEnd = text.indexOf('\n', m.end());
            String ownLine = TextFolding.fold(text.substring(lineStart, lineEnd < 0 ? text.length() : lineEnd));

            CanonicalField field = dateLabel(ownLine).orElseGet(() -> nearestDateLabel(text, m.start(), m.end()));
            first.putIfAbsent(field, FieldCandidate.heuristic(field.key(), m.group(), m.start()));
        }
        out.addAll(first.values());
    }

    private static Optional<CanonicalField> dateLabel(String foldedLine) {
        if (foldedLine.contains("vencim")) return Optional.of(CanonicalField.FECHA_VENCIMIENTO);
        if (foldedLine.contains("emision")) return Optional.of(CanonicalField.FECHA_EMISION);
        if (foldedLine.contains("fecha")) return Optional.of(CanonicalField.FECHA);
        return Optional.empty();
    }

    // unlabelled line: closest keyword within DATE_BEFORE / DATE_AFTER characters
    private static CanonicalField nearestDateLabel(String text, int start, int end) {
        int from = Math.max(0, start - DATE_BEFORE);
        String before = TextFolding.fold(text.substring(from, start));
        String after = TextFolding.fold(text.substring(end, Math.min(text.length(), end + DATE_AFTER)));

        CanonicalField best = CanonicalField.FECHA;
        int bestDistance = Integer.MAX_VALUE;
        for (Map.Entry<String, CanonicalField> keyword : DATE_KEYWORDS) {
            int b = before.lastIndexOf(keyword.getKey());
            if (b >= 0 && before.length() - b < bestDistance) {
                bestDistance = before.length() - b;
                best = keyword.getValue();
            }
            int a = after.indexOf(keyword.getKey());
            if (a >= 0 && a < bestDistance) {
                bestDistance = a;
                best = keyword.getValue();
            }
        }
        return best;
    }

    private void partyName(String[] lines, String[] folded, int[] offsets, List<FieldCandidate> out) {
        for (int i = 0; i < lines.length; i++) {
            if (PARTY_KEYWORDS.stream().noneMatch(folded[i]::contains)) {
                continue;
            }
            int colon = lines[i].indexOf(':');
            if (colon >= 0) {
                String after = lines[i].substring(colon + 1).trim();
                if (after.length() >= 2) {
                    if (!looksLikeName(after)) {
                        continue;
                    }
                    out.add(FieldCandidate.heuristic(CanonicalField.RAZON_SOCIAL.key(), after,
                            offsets[i] + lines[i].indexOf(after, colon)));
                    return;
                }
            }
            for (int j = i + 1; j < lines.length; j++) {
                String next = lines[j].trim();
                if (next.isEmpty()) {
                    continue;
                }
                if (looksLikeName(next)) {
                    out.add(FieldCandidate.heuristic(CanonicalField.RAZON_SOCIAL.key(), next,
                            offsets[j] + lines[j].indexOf(next)));
                }
                return;
            }
            return;
        }
    }

    // no leading digit, no other field label
    private static boolean looksLikeName(String candidate) {
        if (Character.isDigit(candidate.charAt(0))) {
            return false;
        }
        String f = TextFolding.fold(candidate);
        return OTHER_FIELD_KEYWORDS.stream().noneMatch(keyword -> TextFolding.containsWord(f, keyword));
    }
}
