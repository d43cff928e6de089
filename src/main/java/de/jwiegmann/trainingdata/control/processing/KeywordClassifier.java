package de.jwiegmann.trainingdata.control.processing;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Einfache Stichwort-Klassifikation: Pflichten sind Critical, Empfehlungen oder lange Passagen Important, Rest Standard.
 */
@Component
public class KeywordClassifier implements Classifier {

    public static final String CRITICAL = "Critical";
    public static final String IMPORTANT = "Important";
    public static final String STANDARD = "Standard";

    private static final List<String> CRITICAL_KEYWORDS = List.of("must", "shall", "required");
    private static final List<String> IMPORTANT_KEYWORDS = List.of("should", "recommend");
    private static final int IMPORTANT_MIN_LENGTH = 100;

    @Override
    public String classify(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (CRITICAL_KEYWORDS.stream().anyMatch(lower::contains)) {
            return CRITICAL;
        }
        if (IMPORTANT_KEYWORDS.stream().anyMatch(lower::contains) || text.length() > IMPORTANT_MIN_LENGTH) {
            return IMPORTANT;
        }
        return STANDARD;
    }
}
