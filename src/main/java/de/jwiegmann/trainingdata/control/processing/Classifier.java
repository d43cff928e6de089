package de.jwiegmann.trainingdata.control.processing;

/**
 * Ordnet einem Textfenster ein Klassen-Label zu.
 */
public interface Classifier {

    String classify(String text);
}
