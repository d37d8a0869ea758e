package com.talentscout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class EmailConfidence {
    public final int score;
    public final Level level;
    public final Type type;

    public enum Level {
        HIGH("high"),
        MEDIUM("medium"),
        LOW("low");

        private final String label;

        Level(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public enum Type {
        PERSONAL("personal"),
        WORK("work"),
        GENERIC("generic"),
        MAILING_LIST("mailing_list");

        private final String label;

        Type(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
