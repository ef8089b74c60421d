package com.herzen.prereq.graph;

import java.util.Arrays;
import java.util.Optional;

public enum CampusLocation {
    MAIN("main", '1'),
    SATELLITE_A("satellite-a", '3'),
    SATELLITE_B("satellite-b", '5');

    private final String code;
    private final char suffix;

    CampusLocation(String code, char suffix) {
        this.code = code;
        this.suffix = suffix;
    }

    public char suffix() {
        return suffix;
    }

    public static Optional<CampusLocation> fromCode(String code) {
        return Arrays.stream(values()).filter(l -> l.code.equals(code)).findFirst();
    }
}
