package FacturaBot.nlp;

/**
 * Named entity returned by the recognition service.
 *
 * @param label entity label (MONEY, DATE, ORG, CARDINAL, ...)
 * @param text  surface text
 * @param start character offset in the submitted text, -1 when unknown
 * @param head  text of the syntactic head of the entity's root token, may be empty
 */
public record RecognizedEntity(String label, String text, int start, String head) {

    public RecognizedEntity {
        label = label == null ? "" : label.toUpperCase();
        text = text == null ? "" : text;
        head = head == null ? "" : head;
    }

    public boolean isLabel(String wanted) {
        return label.equals(wanted);
    }
}
