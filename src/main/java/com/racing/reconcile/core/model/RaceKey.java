package com.racing.reconcile.core.model;

/**
 * Natural key of a race: the championship year and the round within it.
 */
public record RaceKey(int year, int round) implements Comparable<RaceKey> {

    /**
     * Parses {@code "2023/1"} or {@code "2023-1"}. Returns {@code null} for anything else.
     */
    public static RaceKey parse(String text) {
        if (text == null) {
            return null;
        }
        String[] parts = text.trim().split("[/-]");
        if (parts.length != 2) {
            return null;
        }
        try {
            return new RaceKey(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public int compareTo(RaceKey other) {
        int byYear = Integer.compare(year, other.year);
        return byYear != 0 ? byYear : Integer.compare(round, other.round);
    }

    @Override
    public String toString() {
        return year + "/" + round;
    }
}
