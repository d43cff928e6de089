package de.jwiegmann.trainingdata.entity;

/**
 * Einheit, in der chunkSize und overlap gemessen werden.
 */
public enum ChunkUnit {
    CHARACTER,
    TOKEN   // whitespace-getrennte Tokens
}
