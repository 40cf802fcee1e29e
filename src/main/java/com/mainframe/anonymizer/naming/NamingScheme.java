package com.mainframe.anonymizer.naming;

/**
 * Naming schemes selectable for a batch.
 */
public enum NamingScheme {
    NUMERIC(null),
    ANIMALS(Vocabulary.ANIMALS),
    FOOD(Vocabulary.FOOD),
    FANTASY(Vocabulary.FANTASY),
    CORPORATE(Vocabulary.CORPORATE);

    private final Vocabulary vocabulary;

    NamingScheme(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * The word lists of this scheme, or null for {@link #NUMERIC}.
     */
    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public NamingStrategy createStrategy() {
        return vocabulary == null ? new CounterNamingStrategy() : new VocabularyNamingStrategy(vocabulary);
    }
}
