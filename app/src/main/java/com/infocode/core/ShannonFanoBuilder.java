package com.infocode.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-down Shannon-Fano code construction.
 *
 * Symbols are ranked by count (ties keep first-seen order) and the ranked
 * list is split recursively. A group is cut just after the first symbol at
 * which the running weight reaches half the group's weight; the left part
 * gets bit 0, the right part bit 1.
 */
public class ShannonFanoBuilder implements CodeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ShannonFanoBuilder.class);

    /**
     * @throws InvalidInputException if the table is empty
     */
    @Override
    public <S> Codec<S> build(FrequencyTable<S> frequencies) {
        if (frequencies.isEmpty()) {
            throw new InvalidInputException("Cannot build a Shannon-Fano code from an empty frequency table");
        }

        Map<S, StringBuilder> paths = new LinkedHashMap<>();
        for (S symbol : frequencies.symbols()) {
            paths.put(symbol, new StringBuilder());
        }

        List<S> ranked = frequencies.ranked();
        if (ranked.size() == 1) {
            // Single symbol: use 1-bit code
            paths.get(ranked.get(0)).append('0');
        } else {
            split(ranked, frequencies, paths);
        }

        Map<S, CodeWord> codes = new LinkedHashMap<>();
        for (Map.Entry<S, StringBuilder> entry : paths.entrySet()) {
            codes.put(entry.getKey(), CodeWord.of(entry.getValue().toString()));
        }
        return new Codec<>(codes);
    }

    private static <S> void split(List<S> group, FrequencyTable<S> frequencies, Map<S, StringBuilder> paths) {
        if (group.size() <= 1) {
            return;
        }

        int cut = cutIndex(group, frequencies);
        List<S> left = group.subList(0, cut);
        List<S> right = group.subList(cut, group.size());
        logger.trace("Split {} symbols into {} | {}", group.size(), left.size(), right.size());

        for (S symbol : left) {
            paths.get(symbol).append('0');
        }
        for (S symbol : right) {
            paths.get(symbol).append('1');
        }

        split(left, frequencies, paths);
        split(right, frequencies, paths);
    }

    /**
     * Index one past the first symbol at which the running weight reaches half
     * of the group total. For a descending group of two or more positive
     * weights this is always between 1 and size - 1.
     */
    static <S> int cutIndex(List<S> group, FrequencyTable<S> frequencies) {
        long total = 0;
        for (S symbol : group) {
            total += frequencies.count(symbol);
        }

        long accumulated = 0;
        for (int i = 0; i < group.size(); i++) {
            accumulated += frequencies.count(group.get(i));
            if (2 * accumulated >= total) {
                return i + 1;
            }
        }
        return group.size();
    }

    @Override
    public String getName() {
        return "Shannon-Fano";
    }
}
