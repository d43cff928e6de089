package de.jwiegmann.trainingdata.control.extraction;

import java.util.Locale;

public final class ContentTypes {

    public static final String PDF = "application/pdf";
    public static final String PLAIN_TEXT = "text/plain";

    private static final String OCTET_STREAM = "application/octet-stream";

    private ContentTypes() {
    }

    /**
     * Normalisiert den deklarierten Typ (ohne Parameter, lower case). Für generische oder fehlende Angaben
     * wird über die Dateiendung aufgelöst.
     */
    public static String resolve(String declared, String filename) {
        String type = declared == null ? "" : declared.toLowerCase(Locale.ROOT);
        int semicolon = type.indexOf(';');
        if (semicolon >= 0) {
            type = type.substring(0, semicolon);
        }
        type = type.trim();

        if (!type.isEmpty() && !type.equals(OCTET_STREAM)) {
            return type;
        }

        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(".pdf")) return PDF;
        if (name.endsWith(".txt")) return PLAIN_TEXT;
        return type.isEmpty() ? OCTET_STREAM : type;
    }
}
