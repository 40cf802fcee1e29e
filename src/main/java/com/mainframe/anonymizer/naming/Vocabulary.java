package com.mainframe.anonymizer.naming;

import java.util.List;

/**
 * Word lists for the vocabulary naming schemes.
 */
public enum Vocabulary {
    ANIMALS(
            List.of("FLUFFY", "GRUMPY", "SNEAKY", "WOBBLY", "DIZZY", "SLEEPY", "JUMPY", "FUZZY",
                    "CHUNKY", "SPEEDY", "MIGHTY", "CLEVER", "SWIFT", "BRAVE", "SILLY"),
            List.of("LLAMA", "PENGUIN", "WOMBAT", "PLATYPUS", "BADGER", "OTTER", "SLOTH", "KOALA",
                    "LEMUR", "PANDA", "FERRET", "MARMOT", "BEAVER", "FALCON", "TOUCAN")),
    FOOD(
            List.of("SPICY", "CRISPY", "SOGGY", "CHUNKY", "TANGY", "ZESTY", "GOOEY", "CRUNCHY",
                    "SAVORY", "SIZZLY", "SMOKY", "CHEESY", "FRESH", "TOASTY", "SAUCY"),
            List.of("TACO", "WAFFLE", "NOODLE", "PICKLE", "MUFFIN", "PRETZEL", "BURRITO", "DUMPLING",
                    "PANCAKE", "NACHO", "BAGEL", "DONUT", "BISCUIT", "CRUMPET", "CHURRO")),
    FANTASY(
            List.of("SNEAKY", "ANCIENT", "MIGHTY", "SLEEPY", "GRUMPY", "MYSTIC", "SHADOW", "FIERCE",
                    "CLEVER", "NOBLE", "ARCANE", "GOLDEN", "SILVER", "WILD", "COSMIC"),
            List.of("DRAGON", "GOBLIN", "UNICORN", "TROLL", "PHOENIX", "WIZARD", "SPHINX", "GRIFFIN",
                    "OGRE", "FAIRY", "KRAKEN", "HYDRA", "CENTAUR", "CYCLOPS", "CHIMERA")),
    CORPORATE(
            List.of("AGILE", "SYNERGY", "PIVOT", "DISRUPT", "LEVERAGE", "SCALABLE", "ROBUST", "DYNAMIC",
                    "HOLISTIC", "LEAN", "PROACTIVE", "NIMBLE", "OPTIMAL", "ALIGNED", "ELASTIC"),
            List.of("PARADIGM", "BANDWIDTH", "SILO", "ROADMAP", "STAKEHOLDER", "TOUCHPOINT", "PIPELINE",
                    "MINDSHARE", "VERTICAL", "METRICS", "SYNERGY", "ECOSYSTEM", "PLATFORM", "FRAMEWORK",
                    "CHANNEL"));

    private final List<String> adjectives;
    private final List<String> nouns;

    Vocabulary(List<String> adjectives, List<String> nouns) {
        this.adjectives = adjectives;
        this.nouns = nouns;
    }

    public List<String> getAdjectives() {
        return adjectives;
    }

    public List<String> getNouns() {
        return nouns;
    }
}
